package com.platform.planner.settings;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One abstract setting: a tag plus its named field values. Field values are
 * strings, numbers, booleans, or nested lists and maps of those.
 */
public final class SettingEntry {
    
    private final SettingTag tag;
    private final Map<String, Object> fields;
    
    public SettingEntry(SettingTag tag, Map<String, ?> fields) {
        this.tag = Objects.requireNonNull(tag, "tag");
        this.fields = new LinkedHashMap<>();
        if (fields != null) {
            fields.forEach((k, v) -> this.fields.put(k, copyValue(v)));
        }
    }
    
    public static SettingEntry of(SettingTag tag, Map<String, ?> fields) {
        return new SettingEntry(tag, fields);
    }
    
    public SettingTag getTag() {
        return tag;
    }
    
    /**
     * Read-only view of the entry's fields.
     */
    public Map<String, Object> getFields() {
        return Collections.unmodifiableMap(fields);
    }
    
    public Object get(String field) {
        return fields.get(field);
    }
    
    /**
     * Resolves a nested field path, or returns {@link FieldPath#MISSING}.
     */
    public Object resolve(FieldPath path) {
        return path.resolve(fields);
    }
    
    void merge(Map<String, ?> values) {
        values.forEach((k, v) -> fields.put(k, copyValue(v)));
    }
    
    /**
     * Deep copy so later registry mutation cannot leak into compiled output.
     */
    public SettingEntry copy() {
        return new SettingEntry(tag, fields);
    }
    
    static Object copyValue(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            map.forEach((key, item) -> copy.put(String.valueOf(key), copyValue(item)));
            return copy;
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            for (Object item : list) {
                copy.add(copyValue(item));
            }
            return copy;
        }
        return value;
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SettingEntry other)) {
            return false;
        }
        return tag == other.tag && fields.equals(other.fields);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(tag, fields);
    }
    
    @Override
    public String toString() {
        return tag + fields.toString();
    }
}
