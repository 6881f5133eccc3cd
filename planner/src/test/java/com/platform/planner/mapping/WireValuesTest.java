package com.platform.planner.mapping;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class WireValuesTest {
    
    @Test
    void copiesNestedValuesWithSortedKeys() {
        List<Object> targets = new ArrayList<>(List.of(Map.of("uuid", "a")));
        Map<Object, Object> source = new LinkedHashMap<>();
        source.put("type", "ADDED");
        source.put("targets", targets);
        source.put(7, "day");
        
        Map<String, Object> copy = WireValues.copyOf(source);
        targets.add(Map.of("uuid", "b"));
        
        assertThat(copy).containsOnlyKeys("7", "targets", "type");
        assertThat(copy.keySet()).containsExactly("7", "targets", "type");
        assertThat(copy.get("targets")).isEqualTo(List.of(Map.of("uuid", "a")));
    }
    
    @Test
    void scalarsAreReturnedAsIs() {
        assertThat(WireValues.deepCopy("ENABLED")).isEqualTo("ENABLED");
        assertThat(WireValues.deepCopy(null)).isNull();
    }
}
