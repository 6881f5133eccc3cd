package com.platform.planner.error;

/**
 * Base plan-domain error. Plan runs are retried from scratch when one of
 * these escapes an attempt.
 */
public class PlanException extends PlannerException {
    
    public PlanException(String message) {
        super(ErrorCode.PLAN_ERROR, message);
    }
    
    public PlanException(String message, Throwable cause) {
        super(ErrorCode.PLAN_ERROR, message, cause);
    }
    
    protected PlanException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }
    
    protected PlanException(ErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }
}
