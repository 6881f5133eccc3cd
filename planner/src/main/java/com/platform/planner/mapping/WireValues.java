package com.platform.planner.mapping;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Typed copies of the map and list values that make up a wire payload.
 */
public final class WireValues {
    
    private WireValues() {
    }
    
    /**
     * Copies a JSON-like object, keys in sorted order. Nested maps and lists
     * are copied too.
     */
    public static Map<String, Object> copyOf(Map<?, ?> map) {
        Map<String, Object> copy = new TreeMap<>();
        map.forEach((key, value) -> copy.put(String.valueOf(key), deepCopy(value)));
        return copy;
    }
    
    public static List<Object> copyOf(List<?> list) {
        List<Object> copy = new ArrayList<>(list.size());
        list.forEach(item -> copy.add(deepCopy(item)));
        return copy;
    }
    
    public static Object deepCopy(Object value) {
        if (value instanceof Map<?, ?> map) {
            return copyOf(map);
        }
        if (value instanceof List<?> list) {
            return copyOf(list);
        }
        return value;
    }
}
