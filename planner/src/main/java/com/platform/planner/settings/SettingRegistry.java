package com.platform.planner.settings;

import org.slf4j.Logger;
import org.slf4j.helpers.NOPLogger;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Ordered, mutable collection of abstract setting entries.
 * 
 * Entries are only ever appended, merged in place by {@link #update}, or
 * deleted by {@link #remove}. Not safe for concurrent mutation.
 */
public class SettingRegistry {
    
    private final List<SettingEntry> entries = new ArrayList<>();
    private final Logger log;
    
    public SettingRegistry() {
        this(NOPLogger.NOP_LOGGER);
    }
    
    public SettingRegistry(Logger log) {
        this.log = log != null ? log : NOPLogger.NOP_LOGGER;
    }
    
    /**
     * Appends a new entry unconditionally.
     */
    public void add(SettingTag tag, Map<String, ?> fields) {
        entries.add(new SettingEntry(tag, fields));
        log.debug("Added setting {} {}", tag, fields);
    }
    
    /**
     * Merges {@code fields} into every entry of {@code tag} matched by the
     * filter, or appends a new entry when none matched.
     * 
     * @return number of entries updated, 0 when a new entry was appended
     */
    public int update(SettingTag tag, Map<String, ?> fields, SettingFilter filter) {
        SettingFilter effective = filter != null ? filter : SettingFilter.any();
        int updated = 0;
        
        for (SettingEntry entry : entries) {
            if (entry.getTag() == tag && effective.matches(entry)) {
                entry.merge(fields);
                updated++;
            }
        }
        
        if (updated == 0) {
            add(tag, fields);
        } else {
            log.debug("Updated {} {} setting(s) matching {}", updated, tag, effective);
        }
        return updated;
    }
    
    public int update(SettingTag tag, Map<String, ?> fields) {
        return update(tag, fields, SettingFilter.any());
    }
    
    /**
     * Deletes every entry of {@code tag} matched by the filter; with no
     * filter, every entry of the tag.
     * 
     * @return number of entries removed
     */
    public int remove(SettingTag tag, SettingFilter filter) {
        SettingFilter effective = filter != null ? filter : SettingFilter.any();
        int removed = 0;
        
        Iterator<SettingEntry> it = entries.iterator();
        while (it.hasNext()) {
            SettingEntry entry = it.next();
            if (entry.getTag() == tag && effective.matches(entry)) {
                it.remove();
                removed++;
            }
        }
        
        log.debug("Removed {} {} setting(s) matching {}", removed, tag, effective);
        return removed;
    }
    
    public int remove(SettingTag tag) {
        return remove(tag, SettingFilter.any());
    }
    
    /**
     * Deep copy of the entries in registry order.
     */
    public List<SettingEntry> entries() {
        List<SettingEntry> copy = new ArrayList<>(entries.size());
        for (SettingEntry entry : entries) {
            copy.add(entry.copy());
        }
        return copy;
    }
    
    public List<SettingEntry> entries(SettingTag tag) {
        List<SettingEntry> matching = new ArrayList<>();
        for (SettingEntry entry : entries) {
            if (entry.getTag() == tag) {
                matching.add(entry.copy());
            }
        }
        return matching;
    }
    
    public int size() {
        return entries.size();
    }
    
    public boolean isEmpty() {
        return entries.isEmpty();
    }
}
