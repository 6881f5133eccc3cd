package com.platform.planner.time;

import java.time.Duration;
import java.time.Instant;

/**
 * {@link PlanClock} backed by the system clock and {@link Thread#sleep}.
 */
public final class SystemPlanClock implements PlanClock {
    
    public static final SystemPlanClock INSTANCE = new SystemPlanClock();
    
    private SystemPlanClock() {
    }
    
    @Override
    public Instant now() {
        return Instant.now();
    }
    
    @Override
    public long nanoTime() {
        return System.nanoTime();
    }
    
    @Override
    public void sleep(Duration duration) throws InterruptedException {
        if (!duration.isNegative() && !duration.isZero()) {
            Thread.sleep(duration.toMillis());
        }
    }
}
