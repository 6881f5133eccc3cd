package com.platform.planner.plan;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Local lifecycle of a plan run.
 */
public enum PlanState {
    NEW,
    SCENARIO_CREATED,
    MARKET_CREATED,
    RUNNING,
    /** Stop requested, waiting for the market to stop. */
    ABORTING,
    SUCCEEDED,
    STOPPED,
    FAILED,
    DELETED;
    
    // Valid state transitions (from -> to). A fresh run may start from any
    // settled state and creates a new scenario.
    private static final Map<PlanState, Set<PlanState>> ALLOWED_TRANSITIONS = Map.of(
        NEW, EnumSet.of(SCENARIO_CREATED, FAILED),
        SCENARIO_CREATED, EnumSet.of(MARKET_CREATED, FAILED),
        MARKET_CREATED, EnumSet.of(RUNNING, FAILED),
        RUNNING, EnumSet.of(SUCCEEDED, STOPPED, ABORTING, FAILED, DELETED),
        ABORTING, EnumSet.of(STOPPED, SUCCEEDED, FAILED, DELETED),
        SUCCEEDED, EnumSet.of(SCENARIO_CREATED, ABORTING, FAILED, DELETED),
        STOPPED, EnumSet.of(SCENARIO_CREATED, FAILED, DELETED),
        FAILED, EnumSet.of(SCENARIO_CREATED, ABORTING, STOPPED, SUCCEEDED, DELETED),
        DELETED, EnumSet.of(SCENARIO_CREATED)
    );
    
    public boolean canTransitionTo(PlanState target) {
        return ALLOWED_TRANSITIONS.getOrDefault(this, Set.of()).contains(target);
    }
    
    public boolean isTerminal() {
        return this == SUCCEEDED || this == STOPPED || this == FAILED || this == DELETED;
    }
}
