package com.platform.planner.settings;

import java.util.List;
import java.util.Map;

/**
 * Path into nested setting fields, e.g. {@code target.uuid} resolves
 * {@code fields["target"]["uuid"]}.
 */
public record FieldPath(List<String> keys) {
    
    /**
     * Marker for a path that does not exist in the fields.
     */
    public static final Object MISSING = new Object() {
        @Override
        public String toString() {
            return "<missing>";
        }
    };
    
    public FieldPath {
        if (keys == null || keys.isEmpty()) {
            throw new IllegalArgumentException("Field path requires at least one key");
        }
        keys = List.copyOf(keys);
    }
    
    public static FieldPath of(String... keys) {
        return new FieldPath(List.of(keys));
    }
    
    Object resolve(Map<String, Object> fields) {
        Object current = fields;
        for (String key : keys) {
            if (!(current instanceof Map<?, ?> map) || !map.containsKey(key)) {
                return MISSING;
            }
            current = map.get(key);
        }
        return current;
    }
    
    @Override
    public String toString() {
        return String.join(".", keys);
    }
}
