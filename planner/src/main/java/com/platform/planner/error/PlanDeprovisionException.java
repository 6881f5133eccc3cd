package com.platform.planner.error;

/**
 * Raised when the market or scenario of a plan could not be removed.
 */
public class PlanDeprovisionException extends PlanException {
    
    public PlanDeprovisionException(String message) {
        super(ErrorCode.PLAN_DEPROVISION_FAILED, message);
    }
    
    public PlanDeprovisionException(String message, Throwable cause) {
        super(ErrorCode.PLAN_DEPROVISION_FAILED, message, cause);
    }
}
