package com.platform.planner.error;

/**
 * Exception for invalid plan specification input.
 */
public class PlanSpecValidationException extends PlannerException {
    
    private final String field;
    private final Object rejectedValue;
    
    public PlanSpecValidationException(String message) {
        super(ErrorCode.INVALID_PLAN_SPEC, message);
        this.field = null;
        this.rejectedValue = null;
    }
    
    public PlanSpecValidationException(String field, String message) {
        super(ErrorCode.MISSING_REQUIRED_FIELD, 
            String.format("Invalid value for field '%s': %s", field, message));
        this.field = field;
        this.rejectedValue = null;
    }
    
    public PlanSpecValidationException(String field, Object rejectedValue, String message) {
        super(ErrorCode.INVALID_FIELD_VALUE, 
            String.format("Invalid value '%s' for field '%s': %s", rejectedValue, field, message));
        this.field = field;
        this.rejectedValue = rejectedValue;
    }
    
    public String getField() {
        return field;
    }
    
    public Object getRejectedValue() {
        return rejectedValue;
    }
}
