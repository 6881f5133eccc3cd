package com.platform.planner.remote;

/**
 * States a remote market reports.
 */
public enum MarketState {
    /** Plan scope is being copied. */
    COPYING,
    CREATED,
    DELETING,
    READY_TO_START,
    RUNNING,
    STOPPED,
    SUCCEEDED,
    /** Stopped manually by a user. */
    USER_STOPPED;
    
    /**
     * Parses a reported state by name.
     *
     * @return the state, or null if the name is not recognized
     */
    public static MarketState fromName(String name) {
        if (name == null) {
            return null;
        }
        try {
            return valueOf(name.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
    
    public boolean isStopped() {
        return this == STOPPED || this == USER_STOPPED;
    }
    
    /**
     * Whether the market has finished, successfully or not.
     */
    public boolean isTerminal() {
        return this == SUCCEEDED || isStopped();
    }
}
