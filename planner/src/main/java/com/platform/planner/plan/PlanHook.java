package com.platform.planner.plan;

/**
 * Callback run around a synchronous plan run.
 */
@FunctionalInterface
public interface PlanHook {
    
    void apply(Plan plan);
}
