package com.platform.planner.error;

/**
 * Consolidated failure after every plan attempt failed. The last attempt's
 * error is the cause.
 */
public class PlanRetryExhaustedException extends PlannerException {
    
    private final int attempts;
    
    public PlanRetryExhaustedException(int attempts, Throwable lastFailure) {
        super(ErrorCode.PLAN_RETRY_EXHAUSTED,
            String.format("Retry limit reached after %d attempts. Last error: %s", attempts, lastFailure.getMessage()),
            lastFailure);
        this.attempts = attempts;
    }
    
    public int getAttempts() {
        return attempts;
    }
}
