package com.platform.planner.error;

/**
 * Standardized error codes for the capacity planner.
 * 
 * Format: PL-{CATEGORY}{NUMBER}
 * Categories:
 * - 1xx: Plan specification errors
 * - 2xx: Settings compilation errors
 * - 3xx: Remote service errors
 * - 4xx: Plan lifecycle errors
 * - 5xx: Market errors
 * - 9xx: Internal errors
 */
public enum ErrorCode {
    
    // ==================== Spec Errors (1xx) ====================
    
    INVALID_PLAN_SPEC("PL-100", "Invalid plan specification", ErrorCategory.FATAL),
    MISSING_REQUIRED_FIELD("PL-101", "Missing required field", ErrorCategory.FATAL),
    INVALID_FIELD_VALUE("PL-102", "Invalid field value", ErrorCategory.FATAL),
    INVALID_REQUEST("PL-103", "Invalid request", ErrorCategory.FATAL),
    
    // ==================== Compilation Errors (2xx) ====================
    
    VERSION_UNSUPPORTED("PL-200", "No settings map for version", ErrorCategory.FATAL),
    VERSION_UNKNOWN("PL-201", "Unable to map settings to an unknown version", ErrorCategory.FATAL),
    SETTING_NOT_MAPPED("PL-202", "Setting has no map definition for version", ErrorCategory.FATAL),
    SUBSTITUTION_UNRESOLVED("PL-203", "Setting field not resolvable", ErrorCategory.FATAL),
    VALUE_MAP_INVALID("PL-204", "Value not resolvable for the given value map", ErrorCategory.FATAL),
    
    // ==================== Remote Errors (3xx) ====================
    
    REMOTE_CLIENT_ERROR("PL-300", "Remote service rejected the request", ErrorCategory.FATAL),
    REMOTE_SERVER_ERROR("PL-301", "Remote service error", ErrorCategory.RECOVERABLE),
    REMOTE_BAD_GATEWAY("PL-302", "Remote service gateway error", ErrorCategory.RECOVERABLE),
    REMOTE_UNREACHABLE("PL-303", "Remote service unreachable", ErrorCategory.FATAL),
    REMOTE_RESPONSE_INVALID("PL-304", "Remote service response could not be read", ErrorCategory.FATAL),
    
    // ==================== Plan Errors (4xx) ====================
    
    PLAN_ERROR("PL-400", "Plan error", ErrorCategory.RECOVERABLE),
    PLAN_RUN_FAILURE("PL-401", "Plan failed to properly initialize", ErrorCategory.RECOVERABLE),
    PLAN_EXECUTION_EXCEEDED("PL-402", "Plan execution time exceeded maximum allowed", ErrorCategory.RECOVERABLE),
    PLAN_DEPROVISION_FAILED("PL-403", "Error removing the plan", ErrorCategory.RECOVERABLE),
    PLAN_RETRY_EXHAUSTED("PL-404", "Retry limit reached", ErrorCategory.FATAL),
    PLAN_STOP_FAILED("PL-405", "Error stopping plan", ErrorCategory.FATAL),
    PLAN_INTERRUPTED("PL-406", "Plan supervision interrupted", ErrorCategory.FATAL),
    PLAN_NOT_FOUND("PL-407", "Plan not found", ErrorCategory.RECOVERABLE),
    
    // ==================== Market Errors (5xx) ====================
    
    MARKET_PROTECTED("PL-500", "Attempting to modify a system market", ErrorCategory.FATAL),
    MARKET_NOT_INITIALIZED("PL-501", "Market does not exist", ErrorCategory.FATAL),
    
    // ==================== Internal Errors (9xx) ====================
    
    INTERNAL_ERROR("PL-900", "Internal server error", ErrorCategory.FATAL),
    SERIALIZATION_ERROR("PL-903", "Serialization error", ErrorCategory.FATAL);
    
    private final String code;
    private final String defaultMessage;
    private final ErrorCategory category;
    
    ErrorCode(String code, String defaultMessage, ErrorCategory category) {
        this.code = code;
        this.defaultMessage = defaultMessage;
        this.category = category;
    }
    
    public String getCode() {
        return code;
    }
    
    public String getDefaultMessage() {
        return defaultMessage;
    }
    
    public ErrorCategory getCategory() {
        return category;
    }
    
    public boolean isFatal() {
        return category == ErrorCategory.FATAL;
    }
    
    public boolean isRecoverable() {
        return category == ErrorCategory.RECOVERABLE;
    }
    
    /**
     * Error category for distinguishing fatal vs recoverable errors.
     */
    public enum ErrorCategory {
        /**
         * A fresh plan attempt may succeed.
         */
        RECOVERABLE,
        
        /**
         * Retrying with the same input cannot succeed.
         */
        FATAL
    }
}
