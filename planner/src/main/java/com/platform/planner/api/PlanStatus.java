package com.platform.planner.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.platform.planner.plan.PlanState;
import com.platform.planner.remote.MarketState;
import lombok.Builder;
import lombok.Value;

/**
 * Snapshot of a managed plan.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PlanStatus {
    String id;
    String scenarioName;
    PlanState planState;
    MarketState marketState;
    String scenarioId;
    String marketId;
    String marketName;
    int attempts;
    Long durationSeconds;
    Boolean unplacedEntities;
    String errorCode;
    String errorMessage;
}
