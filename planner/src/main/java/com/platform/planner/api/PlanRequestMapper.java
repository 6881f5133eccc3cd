package com.platform.planner.api;

import com.platform.planner.mapping.ProtocolVersion;
import com.platform.planner.plan.PlanRunOptions;
import com.platform.planner.spec.AutomationSetting;
import com.platform.planner.spec.PlanSpec;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Turns plan requests into plan specs and run options.
 */
@Component
public class PlanRequestMapper {
    
    public PlanSpec toSpec(PlanRequest request) {
        ProtocolVersion version = request.getVersion() != null ? ProtocolVersion.parse(request.getVersion()) : null;
        PlanSpec spec = new PlanSpec(request.getName(), request.getType(), request.getScope(), version);
        
        for (PlanRequest.EntityChange change : orEmpty(request.getEntities())) {
            spec.changeEntity(change.getAction(), change.getTargets(), change.getProjection(),
                change.getCount(), change.getNewTarget());
        }
        
        for (Map.Entry<AutomationSetting, Object> setting : orEmpty(request.getAutomation()).entrySet()) {
            spec.changeAutomationSetting(setting.getKey(), setting.getValue());
        }
        
        for (PlanRequest.UtilizationChange change : orEmpty(request.getMaxUtilization())) {
            spec.changeMaxUtilization(change.getTargets(), change.getType(), change.getValue(), change.getProjection());
        }
        
        for (PlanRequest.UtilizationChange change : orEmpty(request.getUtilization())) {
            spec.changeUtilization(change.getTargets(), change.getValue(), change.getProjection());
        }
        
        if (request.getHistoricalBaseline() != null) {
            spec.setHistoricalBaseline(request.getHistoricalBaseline());
        }
        if (request.getPeakBaseline() != null) {
            spec.setPeakBaseline(request.getPeakBaseline().getTargets(), request.getPeakBaseline().getEpoch());
        }
        if (request.getAddHistorical() != null) {
            spec.addHistorical(request.getAddHistorical());
        }
        if (request.getIncludeReserved() != null) {
            spec.includeReserved(request.getIncludeReserved());
        }
        
        PlanRequest.ConstraintRemoval constraints = request.getRemoveConstraints();
        if (constraints != null) {
            spec.removeConstraints(constraints.getTargets(), constraints.getCommodity(), constraints.getProjection());
        }
        
        PlanRequest.PressureRelief relief = request.getRelievePressure();
        if (relief != null) {
            spec.relievePressure(relief.getSources(), relief.getDestinations(), relief.getProjection());
        }
        
        return spec;
    }
    
    public PlanRunOptions toOptions(PlanRequest request, PlanRunOptions defaults) {
        PlanRequest.RunOverrides run = request.getRun();
        if (run == null) {
            return defaults;
        }
        
        PlanRunOptions.PlanRunOptionsBuilder builder = defaults.toBuilder();
        if (run.getTimeoutMinutes() != null) {
            builder.timeout(Duration.ofMinutes(run.getTimeoutMinutes()));
        }
        if (run.getPollIntervalSeconds() != null) {
            builder.pollInterval(Duration.ofSeconds(run.getPollIntervalSeconds()));
        }
        if (run.getMaxAttempts() != null) {
            builder.maxAttempts(run.getMaxAttempts());
        }
        if (run.getBaseMarket() != null) {
            builder.baseMarket(run.getBaseMarket());
        }
        return builder.build();
    }
    
    // an explicit JSON null means no changes of that kind
    private static <T> List<T> orEmpty(List<T> values) {
        return values != null ? values : List.of();
    }
    
    private static <K, V> Map<K, V> orEmpty(Map<K, V> values) {
        return values != null ? values : Map.of();
    }
}
