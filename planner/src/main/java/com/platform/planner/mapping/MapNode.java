package com.platform.planner.mapping;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Node of a map definition tree. A definition describes how one setting tag
 * renders into wire fields for a protocol generation.
 *
 * @see MapDefinitions#parse(Object)
 */
public interface MapNode {
    
    /**
     * Copies a literal value verbatim.
     */
    record Literal(Object value) implements MapNode {
    }
    
    /**
     * {@code $field}: replaced by the setting's field value.
     */
    record Substitution(String field) implements MapNode {
    }
    
    /**
     * {@code @field:table}: the setting's field value translated through a value map.
     */
    record Translation(String field, ValueMap valueMap) implements MapNode {
    }
    
    /**
     * Nested object; merged into any object already rendered at the same key.
     */
    record Mapping(Map<String, MapNode> fields) implements MapNode {
        public Mapping {
            fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        }
    }
    
    /**
     * List of item templates. With a group label, every template is rendered
     * once per element of the named group field. Rendered lists accumulate
     * across settings.
     */
    record ListTemplate(String group, List<MapNode> items) implements MapNode {
        public ListTemplate {
            items = List.copyOf(items);
        }
        
        public boolean isGrouped() {
            return group != null;
        }
    }
}
