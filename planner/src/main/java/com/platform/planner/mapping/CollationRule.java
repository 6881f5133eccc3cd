package com.platform.planner.mapping;

import com.platform.planner.settings.SettingTag;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Describes how same-tag settings fold into one entry for legacy protocols.
 *
 * @param tag    setting kind to fold
 * @param groups group label to the fields accumulated under it
 * @param policy which value survives for fields outside every group
 */
public record CollationRule(SettingTag tag, Map<String, List<String>> groups, FieldPolicy policy) {
    
    public CollationRule {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        groups.forEach((label, fields) -> copy.put(label, List.copyOf(fields)));
        groups = Collections.unmodifiableMap(copy);
        policy = policy != null ? policy : FieldPolicy.KEEP_FIRST;
    }
    
    public static CollationRule of(SettingTag tag, String label, List<String> fields, FieldPolicy policy) {
        return new CollationRule(tag, Map.of(label, fields), policy);
    }
    
    /**
     * Group label of a field, or null when the field is not groupable.
     */
    public String labelOf(String field) {
        for (Map.Entry<String, List<String>> group : groups.entrySet()) {
            if (group.getValue().contains(field)) {
                return group.getKey();
            }
        }
        return null;
    }
    
    public enum FieldPolicy {
        KEEP_FIRST,
        KEEP_LAST
    }
}
