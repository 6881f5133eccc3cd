package com.platform.planner.error;

/**
 * Fatal failure while stopping a market. Not retried.
 */
public class PlanStopException extends PlannerException {
    
    private final String marketId;
    
    public PlanStopException(String marketId, String message) {
        super(ErrorCode.PLAN_STOP_FAILED, message);
        this.marketId = marketId;
    }
    
    public PlanStopException(String marketId, String message, Throwable cause) {
        super(ErrorCode.PLAN_STOP_FAILED, message, cause);
        this.marketId = marketId;
    }
    
    public static PlanStopException serverError(String marketId, Throwable cause) {
        return new PlanStopException(marketId,
            String.format("Server error stopping plan market %s", marketId), cause);
    }
    
    public static PlanStopException abortTimeout(String marketId, long abortTimeoutSeconds) {
        return new PlanStopException(marketId,
            String.format("Market %s did not stop within %d seconds", marketId, abortTimeoutSeconds));
    }
    
    public String getMarketId() {
        return marketId;
    }
}
