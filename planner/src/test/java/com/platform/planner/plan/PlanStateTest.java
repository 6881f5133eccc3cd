package com.platform.planner.plan;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PlanStateTest {
    
    @Test
    void runProgressesThroughCreation() {
        assertThat(PlanState.NEW.canTransitionTo(PlanState.SCENARIO_CREATED)).isTrue();
        assertThat(PlanState.SCENARIO_CREATED.canTransitionTo(PlanState.MARKET_CREATED)).isTrue();
        assertThat(PlanState.MARKET_CREATED.canTransitionTo(PlanState.RUNNING)).isTrue();
        assertThat(PlanState.NEW.canTransitionTo(PlanState.RUNNING)).isFalse();
    }
    
    @Test
    void failedAndStoppedPlansMayBeRetried() {
        assertThat(PlanState.FAILED.canTransitionTo(PlanState.SCENARIO_CREATED)).isTrue();
        assertThat(PlanState.STOPPED.canTransitionTo(PlanState.SCENARIO_CREATED)).isTrue();
        assertThat(PlanState.DELETED.canTransitionTo(PlanState.RUNNING)).isFalse();
    }
    
    @Test
    void terminalStates() {
        assertThat(PlanState.SUCCEEDED.isTerminal()).isTrue();
        assertThat(PlanState.DELETED.isTerminal()).isTrue();
        assertThat(PlanState.ABORTING.isTerminal()).isFalse();
        assertThat(PlanState.RUNNING.isTerminal()).isFalse();
    }
}
