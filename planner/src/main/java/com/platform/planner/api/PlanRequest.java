package com.platform.planner.api;

import com.platform.planner.spec.AutomationSetting;
import com.platform.planner.spec.ConstraintCommodity;
import com.platform.planner.spec.EntityAction;
import com.platform.planner.spec.PlanType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Plan submission request.
 */
@Data
public class PlanRequest {
    
    private String name;
    
    private PlanType type = PlanType.CUSTOM;
    
    private List<String> scope = new ArrayList<>();
    
    /**
     * Protocol version to compile for, the remote version when absent.
     */
    private String version;
    
    @Valid
    private List<EntityChange> entities = new ArrayList<>();
    
    private Map<AutomationSetting, Object> automation = new EnumMap<>(AutomationSetting.class);
    
    @Valid
    private List<UtilizationChange> maxUtilization = new ArrayList<>();
    
    @Valid
    private List<UtilizationChange> utilization = new ArrayList<>();
    
    /**
     * Historical baseline date as Unix time in seconds or milliseconds.
     */
    private Long historicalBaseline;
    
    @Valid
    private PeakBaseline peakBaseline;
    
    private Boolean addHistorical;
    
    private Boolean includeReserved;
    
    @Valid
    private ConstraintRemoval removeConstraints;
    
    @Valid
    private PressureRelief relievePressure;
    
    @Valid
    private RunOverrides run = new RunOverrides();
    
    @Data
    public static class EntityChange {
        @NotNull
        private EntityAction action;
        
        @NotEmpty
        private List<String> targets;
        
        private List<Integer> projection;
        
        @Min(1)
        private Integer count;
        
        /**
         * Replacement template or migration destination.
         */
        private String newTarget;
    }
    
    @Data
    public static class UtilizationChange {
        @NotEmpty
        private List<String> targets;
        
        @Min(0)
        @Max(100)
        private int value;
        
        private int projection;
        
        /**
         * Commodity type, only used by 5.9 services.
         */
        private String type;
    }
    
    @Data
    public static class PeakBaseline {
        @NotEmpty
        private List<String> targets;
        
        @NotNull
        private Long epoch;
    }
    
    /**
     * Without targets and commodity, all market constraints are ignored.
     */
    @Data
    public static class ConstraintRemoval {
        private List<String> targets;
        
        private ConstraintCommodity commodity;
        
        private int projection;
    }
    
    @Data
    public static class PressureRelief {
        @NotEmpty
        private List<String> sources;
        
        @NotEmpty
        private List<String> destinations;
        
        private int projection;
    }
    
    @Data
    public static class RunOverrides {
        @Min(0)
        private Integer timeoutMinutes;
        
        @Min(0)
        private Integer pollIntervalSeconds;
        
        @Min(1)
        private Integer maxAttempts;
        
        private String baseMarket;
        
        private String marketName;
    }
}
