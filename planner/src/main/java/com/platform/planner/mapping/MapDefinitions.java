package com.platform.planner.mapping;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds map definition trees from a compact literal form:
 * <ul>
 *   <li>{@code "$name"} substitutes the setting field {@code name}</li>
 *   <li>{@code "@name:table"} translates the field through a {@link ValueMap}</li>
 *   <li>a key suffixed {@code [group]} holding a list renders its templates
 *       once per element of the field {@code group}</li>
 *   <li>maps nest, lists hold item templates, anything else is a literal</li>
 * </ul>
 */
public final class MapDefinitions {
    
    private MapDefinitions() {
    }
    
    /**
     * Parses a definition whose root is an object.
     */
    public static MapNode.Mapping mapping(Map<String, ?> definition) {
        return (MapNode.Mapping) parse(definition);
    }
    
    public static MapNode parse(Object definition) {
        if (definition instanceof Map<?, ?> map) {
            Map<String, MapNode> fields = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                String key = String.valueOf(entry.getKey());
                Object value = entry.getValue();
                
                int open = key.indexOf('[');
                if (open >= 0) {
                    int close = key.indexOf(']', open);
                    if (close < 0 || !(value instanceof List<?>)) {
                        throw new IllegalArgumentException("Group-by key must be 'name[group]' on a list: " + key);
                    }
                    String group = key.substring(open + 1, close);
                    fields.put(key.substring(0, open), new MapNode.ListTemplate(group, parseItems((List<?>) value)));
                } else {
                    fields.put(key, parse(value));
                }
            }
            return new MapNode.Mapping(fields);
        }
        
        if (definition instanceof List<?> list) {
            return new MapNode.ListTemplate(null, parseItems(list));
        }
        
        if (definition instanceof String text && text.length() > 1) {
            if (text.charAt(0) == '$') {
                return new MapNode.Substitution(text.substring(1));
            }
            if (text.charAt(0) == '@') {
                int colon = text.indexOf(':');
                if (colon < 0) {
                    throw new IllegalArgumentException("Translation requires '@field:table': " + text);
                }
                return new MapNode.Translation(text.substring(1, colon), ValueMap.parse(text.substring(colon + 1)));
            }
        }
        
        return new MapNode.Literal(definition);
    }
    
    private static List<MapNode> parseItems(List<?> items) {
        List<MapNode> nodes = new ArrayList<>(items.size());
        for (Object item : items) {
            nodes.add(parse(item));
        }
        return nodes;
    }
}
