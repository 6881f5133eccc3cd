package com.platform.planner.error;

import java.time.Duration;

/**
 * Raised when a plan runs past its configured timeout. A stop request has
 * already been issued when this is thrown.
 */
public class PlanExecutionExceededException extends PlanException {
    
    private final Duration timeout;
    
    public PlanExecutionExceededException(Duration timeout, Object marketState) {
        super(ErrorCode.PLAN_EXECUTION_EXCEEDED, String.format(
            "Plan execution time exceeded maximum allowed (%d minutes), market state: %s",
            timeout.toMinutes(), marketState));
        this.timeout = timeout;
    }
    
    public Duration getTimeout() {
        return timeout;
    }
}
