package com.platform.planner.mapping;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Value translation table.
 * 
 * Either a list of equality pairs ({@code on=ENABLED;off=DISABLED}), matched
 * on the string form of the value, or a single boolean pair
 * ({@code ENABLED;DISABLED}) chosen by a boolean value.
 */
public final class ValueMap {
    
    private final String definition;
    private final Map<String, String> pairs;
    private final String whenTrue;
    private final String whenFalse;
    
    private ValueMap(String definition, Map<String, String> pairs, String whenTrue, String whenFalse) {
        this.definition = definition;
        this.pairs = pairs;
        this.whenTrue = whenTrue;
        this.whenFalse = whenFalse;
    }
    
    /**
     * Parses a table definition.
     *
     * @throws IllegalArgumentException if the definition is malformed
     */
    public static ValueMap parse(String definition) {
        if (definition == null || definition.isEmpty()) {
            throw new IllegalArgumentException("Empty value map");
        }
        String[] parts = definition.split(";", -1);
        
        if (definition.contains("=")) {
            Map<String, String> pairs = new LinkedHashMap<>();
            for (String part : parts) {
                String[] pair = part.split("=", -1);
                if (pair.length != 2) {
                    throw new IllegalArgumentException("Malformed value map pair '" + part + "' in " + definition);
                }
                pairs.put(pair[0], pair[1]);
            }
            return new ValueMap(definition, pairs, null, null);
        }
        
        if (parts.length != 2) {
            throw new IllegalArgumentException("Boolean value map requires exactly two values: " + definition);
        }
        return new ValueMap(definition, null, parts[0], parts[1]);
    }
    
    public boolean isBooleanPair() {
        return pairs == null;
    }
    
    /**
     * Translates a value, or returns empty when the table has no entry for it.
     */
    public Optional<String> translate(Object value) {
        if (isBooleanPair()) {
            if (value instanceof Boolean flag) {
                return Optional.of(flag ? whenTrue : whenFalse);
            }
            return Optional.empty();
        }
        if (value == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(pairs.get(String.valueOf(value)));
    }
    
    @Override
    public String toString() {
        return definition;
    }
}
