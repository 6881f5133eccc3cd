package com.platform.planner.time;

import java.time.Duration;
import java.time.Instant;

/**
 * Time source and blocking sleep used to supervise plan runs.
 */
public interface PlanClock {
    
    /**
     * Wall clock time, used for timestamps and generated names.
     */
    Instant now();
    
    /**
     * Monotonic time in nanoseconds, used for elapsed time.
     */
    long nanoTime();
    
    /**
     * Blocks the calling thread for the given duration.
     */
    void sleep(Duration duration) throws InterruptedException;
}
