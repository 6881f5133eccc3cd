package com.platform.planner.settings;

/**
 * Closed set of abstract setting kinds a plan can carry. Every tag must
 * have a map definition in a protocol generation to be submitted to it.
 */
public enum SettingTag {
    NAME,
    TYPE,
    SCOPE,
    PROJECTION,
    
    DESIRED_STATE,
    HISTORICAL_BASELINE,
    PEAK_BASELINE,
    ADD_HISTORICAL,
    INCLUDE_RESERVED,
    MAX_UTILIZATION,
    UTILIZATION,
    
    PROVISION_HOST,
    SUSPEND_HOST,
    PROVISION_STORAGE,
    SUSPEND_STORAGE,
    RESIZE,
    
    OS_MIGRATION,
    CONSTRAINT,
    
    ADD_ENTITY,
    MIGRATE_ENTITY,
    REMOVE_ENTITY,
    REPLACE_ENTITY,
    RELIEVE_PRESSURE
}
