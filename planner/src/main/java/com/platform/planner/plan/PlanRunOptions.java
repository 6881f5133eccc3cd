package com.platform.planner.plan;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Duration;
import java.util.Set;

/**
 * Options governing how a plan is supervised.
 */
@Value
@Builder(toBuilder = true)
public class PlanRunOptions {
    
    /**
     * Maximum run time of one attempt, zero disables the timeout.
     */
    @Builder.Default
    Duration timeout = Duration.ZERO;
    
    /**
     * Fixed status polling interval, zero selects the adaptive interval.
     */
    @Builder.Default
    Duration pollInterval = Duration.ZERO;
    
    @Builder.Default
    Duration abortTimeout = Duration.ofMinutes(5);
    
    @Builder.Default
    Duration abortPollInterval = Duration.ofSeconds(5);
    
    @Builder.Default
    int maxAttempts = 3;
    
    @Builder.Default
    String baseMarket = "Market";
    
    /**
     * Delete the market and scenario of a failed attempt before the next one.
     */
    @Builder.Default
    boolean cleanupAbandonedAttempts = false;
    
    /**
     * System markets that may never be deleted.
     */
    @Singular
    Set<String> protectedMarkets;
    
    public static PlanRunOptions defaults() {
        return builder()
            .protectedMarket("Market")
            .protectedMarket("Market_Default")
            .build();
    }
    
    public boolean hasTimeout() {
        return timeout != null && !timeout.isZero() && !timeout.isNegative();
    }
    
    public boolean hasFixedPollInterval() {
        return pollInterval != null && !pollInterval.isZero() && !pollInterval.isNegative();
    }
}
