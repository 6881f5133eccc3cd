package com.platform.planner.settings;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Conjunction of field-path equality checks used to select registry entries.
 * An empty filter matches every entry.
 */
public final class SettingFilter {
    
    private static final SettingFilter ANY = new SettingFilter(Map.of());
    
    private final Map<FieldPath, Object> expected;
    
    private SettingFilter(Map<FieldPath, Object> expected) {
        this.expected = expected;
    }
    
    public static SettingFilter any() {
        return ANY;
    }
    
    public static SettingFilter where(String field, Object value) {
        return ANY.and(FieldPath.of(field), value);
    }
    
    public static SettingFilter where(FieldPath path, Object value) {
        return ANY.and(path, value);
    }
    
    public SettingFilter and(FieldPath path, Object value) {
        Map<FieldPath, Object> next = new LinkedHashMap<>(expected);
        next.put(path, value);
        return new SettingFilter(Collections.unmodifiableMap(next));
    }
    
    public boolean isEmpty() {
        return expected.isEmpty();
    }
    
    /**
     * Returns true when every expected value equals the entry's value at the path.
     */
    public boolean matches(SettingEntry entry) {
        for (Map.Entry<FieldPath, Object> check : expected.entrySet()) {
            Object actual = entry.resolve(check.getKey());
            if (actual == FieldPath.MISSING || !Objects.equals(actual, check.getValue())) {
                return false;
            }
        }
        return true;
    }
    
    @Override
    public String toString() {
        return expected.toString();
    }
}
