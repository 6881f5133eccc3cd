package com.platform.planner.error;

/**
 * Raised when a submitted market never leaves its initial created state.
 */
public class PlanRunFailureException extends PlanException {
    
    private final String marketId;
    private final String scenarioId;
    
    public PlanRunFailureException(String marketId, String scenarioId) {
        super(ErrorCode.PLAN_RUN_FAILURE, String.format(
            "Plan failed to properly initialize. Check the remote service logs for more details. Market ID: [%s], Scenario ID: [%s]",
            marketId, scenarioId));
        this.marketId = marketId;
        this.scenarioId = scenarioId;
    }
    
    public String getMarketId() {
        return marketId;
    }
    
    public String getScenarioId() {
        return scenarioId;
    }
}
