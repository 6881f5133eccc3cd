package com.platform.planner.mapping;

import com.platform.planner.settings.SettingTag;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Everything needed to compile settings for one remote version: the
 * definitions of its generation with patches applied, the collation rules
 * and the payload fix-ups. Selected once from the {@link VersionTable}.
 */
public record SettingsProfile(
    ProtocolVersion version,
    ProtocolVersion generation,
    Map<SettingTag, MapNode.Mapping> definitions,
    List<CollationRule> collations,
    List<DtoPostProcessor> postProcessors
) {
    
    public SettingsProfile {
        definitions = Collections.unmodifiableMap(definitions.isEmpty()
            ? new EnumMap<>(SettingTag.class)
            : new EnumMap<>(definitions));
        collations = List.copyOf(collations);
        postProcessors = List.copyOf(postProcessors);
    }
    
    public boolean requiresCollation() {
        return !collations.isEmpty();
    }
    
    public boolean supports(SettingTag tag) {
        return definitions.containsKey(tag);
    }
}
