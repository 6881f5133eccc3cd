package com.platform.planner.plan;

import java.time.Duration;

/**
 * Status polling intervals.
 */
public final class PollIntervals {
    
    static final Duration FLAT_INTERVAL = Duration.ofSeconds(60);
    static final Duration FLAT_AFTER = Duration.ofSeconds(600);
    static final long STEP_SECONDS = 5;
    
    private PollIntervals() {
    }
    
    /**
     * Interval growing with run time: a twelfth of the elapsed time rounded
     * up to the next multiple of 5 seconds (at least 5), and a flat minute
     * once the plan has run for ten minutes.
     */
    public static Duration adaptive(Duration elapsed) {
        if (elapsed.compareTo(FLAT_AFTER) >= 0) {
            return FLAT_INTERVAL;
        }
        long twelfth = (long) Math.ceil(elapsed.toMillis() / 1000.0 / 12.0);
        long rounded = ((twelfth + STEP_SECONDS - 1) / STEP_SECONDS) * STEP_SECONDS;
        return Duration.ofSeconds(Math.max(STEP_SECONDS, rounded));
    }
    
    /**
     * Abort polling never waits longer than the abort timeout itself.
     */
    public static Duration abortPoll(Duration abortTimeout, Duration abortPollInterval) {
        return abortTimeout.compareTo(abortPollInterval) < 0 ? abortTimeout : abortPollInterval;
    }
}
