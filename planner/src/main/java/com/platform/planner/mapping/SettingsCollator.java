package com.platform.planner.mapping;

import com.platform.planner.settings.SettingEntry;
import com.platform.planner.settings.SettingTag;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Folds every setting of a collated tag into a single entry placed where the
 * first one appeared. Groupable fields accumulate, one object per folded
 * entry, in a list under the group label; other fields follow the rule's
 * {@link CollationRule.FieldPolicy}.
 */
public class SettingsCollator {
    
    public List<SettingEntry> collate(List<SettingEntry> settings, List<CollationRule> rules) {
        if (rules.isEmpty()) {
            return settings;
        }
        
        Map<SettingTag, CollationRule> byTag = new EnumMap<>(SettingTag.class);
        for (CollationRule rule : rules) {
            byTag.put(rule.tag(), rule);
        }
        
        List<SettingEntry> collated = new ArrayList<>();
        Set<SettingTag> processed = EnumSet.noneOf(SettingTag.class);
        
        for (int i = 0; i < settings.size(); i++) {
            SettingEntry entry = settings.get(i);
            CollationRule rule = byTag.get(entry.getTag());
            
            if (rule == null) {
                collated.add(entry);
                continue;
            }
            if (!processed.add(entry.getTag())) {
                continue;
            }
            
            collated.add(fold(settings.subList(i, settings.size()), rule));
        }
        
        return collated;
    }
    
    private SettingEntry fold(List<SettingEntry> settings, CollationRule rule) {
        Map<String, Object> folded = new LinkedHashMap<>();
        Map<String, List<Object>> grouped = new LinkedHashMap<>();
        
        for (SettingEntry entry : settings) {
            if (entry.getTag() != rule.tag()) {
                continue;
            }
            
            Map<String, Map<String, Object>> groupsOfEntry = new LinkedHashMap<>();
            for (Map.Entry<String, Object> field : entry.getFields().entrySet()) {
                String label = rule.labelOf(field.getKey());
                if (label != null) {
                    groupsOfEntry.computeIfAbsent(label, k -> new LinkedHashMap<>())
                        .put(field.getKey(), field.getValue());
                } else if (!folded.containsKey(field.getKey())
                        || rule.policy() == CollationRule.FieldPolicy.KEEP_LAST) {
                    folded.put(field.getKey(), field.getValue());
                }
            }
            
            groupsOfEntry.forEach((label, values) ->
                grouped.computeIfAbsent(label, k -> new ArrayList<>()).add(values));
        }
        
        folded.putAll(grouped);
        return SettingEntry.of(rule.tag(), folded);
    }
}
