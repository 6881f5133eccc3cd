package com.platform.planner.mapping;

import com.platform.planner.error.ErrorCode;
import com.platform.planner.error.SettingsCompilationException;
import com.platform.planner.settings.SettingEntry;
import com.platform.planner.settings.SettingTag;
import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MappingEngineTest {
    
    private final MappingEngine engine = new MappingEngine();
    
    private static SettingsProfile profile(Map<SettingTag, Map<String, ?>> definitions) {
        Map<SettingTag, MapNode.Mapping> parsed = new EnumMap<>(SettingTag.class);
        definitions.forEach((tag, definition) -> parsed.put(tag, MapDefinitions.mapping(definition)));
        ProtocolVersion version = ProtocolVersion.of(1, 0);
        return new SettingsProfile(version, version, parsed, List.of(), List.of());
    }
    
    @Test
    void outputIsCanonicalAndDeterministic() {
        SettingsProfile profile = profile(Map.of(
            SettingTag.NAME, Map.of("zeta", "$value", "alpha", Map.of("b", 2, "a", 1))));
        List<SettingEntry> settings = List.of(SettingEntry.of(SettingTag.NAME, Map.of("value", "plan")));
        
        String first = engine.compile(profile, settings).toJson();
        String second = engine.compile(profile, settings).toJson();
        
        assertThat(first).isEqualTo(second).isEqualTo("{\"alpha\":{\"a\":1,\"b\":2},\"zeta\":\"plan\"}");
    }
    
    @Test
    void scalarsOverwriteAndObjectsMerge() {
        SettingsProfile profile = profile(Map.of(
            SettingTag.NAME, Map.of("displayName", "$value", "config", Map.of("name", "$value")),
            SettingTag.TYPE, Map.of("displayName", "$value", "config", Map.of("type", "$value"))));
        
        WireDto dto = engine.compile(profile, List.of(
            SettingEntry.of(SettingTag.NAME, Map.of("value", "first")),
            SettingEntry.of(SettingTag.TYPE, Map.of("value", "second"))));
        
        assertThat(dto.toJson()).isEqualTo("{\"config\":{\"name\":\"first\",\"type\":\"second\"},\"displayName\":\"second\"}");
    }
    
    @Test
    void listsAccumulateInSettingOrder() {
        SettingsProfile profile = profile(Map.of(
            SettingTag.REMOVE_ENTITY, Map.of("topology", Map.of("removeList", List.of(Map.of("uuid", "$target"))))));
        
        WireDto dto = engine.compile(profile, List.of(
            SettingEntry.of(SettingTag.REMOVE_ENTITY, Map.of("target", "vm-2")),
            SettingEntry.of(SettingTag.REMOVE_ENTITY, Map.of("target", "vm-1"))));
        
        assertThat(dto.toJson()).isEqualTo("{\"topology\":{\"removeList\":[{\"uuid\":\"vm-2\"},{\"uuid\":\"vm-1\"}]}}");
    }
    
    @Test
    void groupByRendersOncePerMember() {
        SettingsProfile profile = profile(Map.of(
            SettingTag.SCOPE, Map.of("scope[ids]", List.of(Map.of("uuid", "$value", "kind", "$kind")))));
        
        WireDto dto = engine.compile(profile, List.of(
            SettingEntry.of(SettingTag.SCOPE, Map.of("ids", List.of("A", "B"), "kind", "Cluster"))));
        
        assertThat(dto.toJson()).isEqualTo(
            "{\"scope\":[{\"kind\":\"Cluster\",\"uuid\":\"A\"},{\"kind\":\"Cluster\",\"uuid\":\"B\"}]}");
    }
    
    @Test
    void groupByMapMembersOverlayTheSettingFields() {
        SettingsProfile profile = profile(Map.of(
            SettingTag.MAX_UTILIZATION, Map.of("targets[ids]", List.of(Map.of("uuid", "$uuid", "util", "$util")))));
        
        WireDto dto = engine.compile(profile, List.of(SettingEntry.of(SettingTag.MAX_UTILIZATION, Map.of(
            "util", 70,
            "ids", List.of(Map.of("uuid", "a"), Map.of("uuid", "b", "util", 90))))));
        
        assertThat(dto.toJson()).isEqualTo("{\"targets\":[{\"util\":70,\"uuid\":\"a\"},{\"util\":90,\"uuid\":\"b\"}]}");
    }
    
    @Test
    void emptyGroupRendersEmptyList() {
        SettingsProfile profile = profile(Map.of(SettingTag.SCOPE, Map.of("scope[scope]", List.of(Map.of("uuid", "$value")))));
        
        WireDto dto = engine.compile(profile, List.of(SettingEntry.of(SettingTag.SCOPE, Map.of("scope", List.of()))));
        
        assertThat(dto.toJson()).isEqualTo("{\"scope\":[]}");
    }
    
    @Test
    void booleanTranslation() {
        SettingsProfile profile = profile(Map.of(SettingTag.RESIZE, Map.of("value", "@value:ENABLED;DISABLED")));
        
        assertThat(engine.compile(profile, List.of(SettingEntry.of(SettingTag.RESIZE, Map.of("value", true)))).get("value"))
            .isEqualTo("ENABLED");
        assertThat(engine.compile(profile, List.of(SettingEntry.of(SettingTag.RESIZE, Map.of("value", false)))).get("value"))
            .isEqualTo("DISABLED");
    }
    
    @Test
    void pairTranslation() {
        SettingsProfile profile = profile(Map.of(SettingTag.TYPE, Map.of("mode", "@value:fast=FAST;slow=SLOW")));
        
        WireDto dto = engine.compile(profile, List.of(SettingEntry.of(SettingTag.TYPE, Map.of("value", "slow"))));
        
        assertThat(dto.get("mode")).isEqualTo("SLOW");
    }
    
    @Test
    void untranslatableValueFails() {
        SettingsProfile profile = profile(Map.of(SettingTag.RESIZE, Map.of("value", "@value:ENABLED;DISABLED")));
        
        assertThatThrownBy(() -> engine.compile(profile,
                List.of(SettingEntry.of(SettingTag.RESIZE, Map.of("value", "maybe")))))
            .isInstanceOf(SettingsCompilationException.class)
            .satisfies(e -> {
                SettingsCompilationException error = (SettingsCompilationException) e;
                assertThat(error.getErrorCode()).isEqualTo(ErrorCode.VALUE_MAP_INVALID);
                assertThat(error.getTag()).isEqualTo(SettingTag.RESIZE);
            });
    }
    
    @Test
    void missingSubstitutionFieldFails() {
        SettingsProfile profile = profile(Map.of(SettingTag.DESIRED_STATE, Map.of("center", "$center", "band", "$diameter")));
        
        assertThatThrownBy(() -> engine.compile(profile,
                List.of(SettingEntry.of(SettingTag.DESIRED_STATE, Map.of("center", 70)))))
            .isInstanceOf(SettingsCompilationException.class)
            .satisfies(e -> {
                SettingsCompilationException error = (SettingsCompilationException) e;
                assertThat(error.getErrorCode()).isEqualTo(ErrorCode.SUBSTITUTION_UNRESOLVED);
                assertThat(error.getField()).isEqualTo("diameter");
            });
    }
    
    @Test
    void unmappedTagFails() {
        SettingsProfile profile = profile(Map.of(SettingTag.NAME, Map.of("displayName", "$value")));
        
        assertThatThrownBy(() -> engine.compile(profile,
                List.of(SettingEntry.of(SettingTag.RELIEVE_PRESSURE, Map.of()))))
            .isInstanceOf(SettingsCompilationException.class)
            .extracting(e -> ((SettingsCompilationException) e).getErrorCode())
            .isEqualTo(ErrorCode.SETTING_NOT_MAPPED);
    }
    
    @Test
    void substitutedValuesAreCopied() {
        SettingsProfile profile = profile(Map.of(SettingTag.PROJECTION, Map.of("projectionDays", "$list")));
        SettingEntry entry = SettingEntry.of(SettingTag.PROJECTION, Map.of("list", List.of(0, 7)));
        
        WireDto dto = engine.compile(profile, List.of(entry));
        WireDto changed = dto.transform(content -> content.put("projectionDays", List.of()));
        
        assertThat(dto.get("projectionDays")).isEqualTo(List.of(0, 7));
        assertThat(changed.get("projectionDays")).isEqualTo(List.of());
        assertThat(entry.get("list")).isEqualTo(List.of(0, 7));
    }
    
    @Test
    void malformedDefinitionsAreRejected() {
        assertThatThrownBy(() -> MapDefinitions.mapping(Map.of("scope[ids]", "$value")))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ValueMap.parse("ENABLED"))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> MapDefinitions.parse("@value"))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
