package com.platform.planner.mapping;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Generation-specific fix-up applied to a rendered payload.
 */
@FunctionalInterface
public interface DtoPostProcessor {
    
    void process(Map<String, Object> dto);
    
    /**
     * Legacy protocols call an addition spread over several projection days
     * {@code ADD_REPEAT} instead of {@code ADDED}.
     */
    DtoPostProcessor REPEATED_ADDITIONS = dto -> {
        if (!(dto.get("changes") instanceof List<?> changes)) {
            return;
        }
        List<Object> rewritten = new ArrayList<>(changes.size());
        for (Object change : changes) {
            if (change instanceof Map<?, ?> map
                    && "ADDED".equals(map.get("type"))
                    && map.get("projectionDays") instanceof List<?> days
                    && days.size() > 1) {
                Map<String, Object> repeated = WireValues.copyOf(map);
                repeated.put("type", "ADD_REPEAT");
                rewritten.add(repeated);
            } else {
                rewritten.add(change);
            }
        }
        dto.put("changes", rewritten);
    };
}
