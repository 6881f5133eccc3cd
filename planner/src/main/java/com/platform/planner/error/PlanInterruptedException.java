package com.platform.planner.error;

/**
 * Raised when the thread supervising a plan is interrupted while waiting.
 */
public class PlanInterruptedException extends PlannerException {
    
    public PlanInterruptedException(String message, InterruptedException cause) {
        super(ErrorCode.PLAN_INTERRUPTED, message, cause);
    }
}
