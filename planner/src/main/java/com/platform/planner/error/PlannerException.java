package com.platform.planner.error;

/**
 * Base exception for all planner exceptions.
 * Carries an ErrorCode for standardized error handling.
 */
public abstract class PlannerException extends RuntimeException {
    
    private final ErrorCode errorCode;
    
    protected PlannerException(ErrorCode errorCode) {
        super(errorCode.getDefaultMessage());
        this.errorCode = errorCode;
    }
    
    protected PlannerException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
    
    protected PlannerException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
    
    public ErrorCode getErrorCode() {
        return errorCode;
    }
    
    public boolean isFatal() {
        return errorCode.isFatal();
    }
}
