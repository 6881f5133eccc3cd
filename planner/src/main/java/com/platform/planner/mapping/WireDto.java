package com.platform.planner.mapping;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.platform.planner.error.ErrorCode;
import com.platform.planner.error.SettingsCompilationException;

import java.util.Collections;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Version-specific JSON payload produced by settings compilation. Keys are
 * kept sorted so serialization is canonical.
 */
public final class WireDto {
    
    private static final ObjectMapper CANONICAL = new ObjectMapper()
        .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);
    
    private final Map<String, Object> content;
    
    WireDto(Map<String, Object> content) {
        this.content = content;
    }
    
    /**
     * Read-only view of the payload.
     */
    public Map<String, Object> getContent() {
        return Collections.unmodifiableMap(content);
    }
    
    public Object get(String key) {
        return content.get(key);
    }
    
    /**
     * Returns a modified deep copy; this instance is left untouched.
     */
    public WireDto transform(Consumer<Map<String, Object>> change) {
        Map<String, Object> copy = WireValues.copyOf(content);
        change.accept(copy);
        return new WireDto(copy);
    }
    
    public String toJson() {
        return toJson(false);
    }
    
    public String toJson(boolean indent) {
        try {
            return indent
                ? CANONICAL.writerWithDefaultPrettyPrinter().writeValueAsString(content)
                : CANONICAL.writeValueAsString(content);
        } catch (JsonProcessingException e) {
            throw new SettingsCompilationException(ErrorCode.SERIALIZATION_ERROR, null, null,
                "Unable to serialize wire payload: " + e.getOriginalMessage(), e);
        }
    }
    
    @Override
    public boolean equals(Object o) {
        return o instanceof WireDto other && content.equals(other.content);
    }
    
    @Override
    public int hashCode() {
        return content.hashCode();
    }
    
    @Override
    public String toString() {
        return toJson();
    }
}
