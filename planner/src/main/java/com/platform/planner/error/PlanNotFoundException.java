package com.platform.planner.error;

/**
 * Raised when a plan handle is not known to the plan service.
 */
public class PlanNotFoundException extends PlannerException {
    
    public PlanNotFoundException(String planId) {
        super(ErrorCode.PLAN_NOT_FOUND, "Plan not found: " + planId);
    }
}
