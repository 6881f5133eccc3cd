package com.platform.planner.mapping;

import com.platform.planner.settings.SettingTag;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Version table entry. A base generation carries a complete set of
 * definitions; a patch overrides some definitions of the generation below it.
 */
public final class ProtocolGeneration {
    
    private final ProtocolVersion minimum;
    private final Map<SettingTag, MapNode.Mapping> definitions;
    private final boolean patch;
    private final List<CollationRule> collations;
    private final List<DtoPostProcessor> postProcessors;
    
    private ProtocolGeneration(ProtocolVersion minimum, Map<SettingTag, MapNode.Mapping> definitions, boolean patch,
                               List<CollationRule> collations, List<DtoPostProcessor> postProcessors) {
        this.minimum = minimum;
        this.definitions = Collections.unmodifiableMap(new EnumMap<>(definitions));
        this.patch = patch;
        this.collations = List.copyOf(collations);
        this.postProcessors = List.copyOf(postProcessors);
    }
    
    public static ProtocolGeneration base(ProtocolVersion minimum, Map<SettingTag, MapNode.Mapping> definitions) {
        return new ProtocolGeneration(minimum, definitions, false, List.of(), List.of());
    }
    
    public static ProtocolGeneration patch(ProtocolVersion minimum, Map<SettingTag, MapNode.Mapping> definitions) {
        return new ProtocolGeneration(minimum, definitions, true, List.of(), List.of());
    }
    
    public ProtocolGeneration withCollation(List<CollationRule> rules) {
        List<CollationRule> merged = new ArrayList<>(collations);
        merged.addAll(rules);
        return new ProtocolGeneration(minimum, definitions, patch, merged, postProcessors);
    }
    
    public ProtocolGeneration withPostProcessor(DtoPostProcessor postProcessor) {
        List<DtoPostProcessor> merged = new ArrayList<>(postProcessors);
        merged.add(postProcessor);
        return new ProtocolGeneration(minimum, definitions, patch, collations, merged);
    }
    
    public ProtocolVersion getMinimum() {
        return minimum;
    }
    
    public Map<SettingTag, MapNode.Mapping> getDefinitions() {
        return definitions;
    }
    
    public boolean isPatch() {
        return patch;
    }
    
    public List<CollationRule> getCollations() {
        return collations;
    }
    
    public List<DtoPostProcessor> getPostProcessors() {
        return postProcessors;
    }
}
