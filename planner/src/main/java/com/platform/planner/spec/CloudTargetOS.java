package com.platform.planner.spec;

/**
 * OS migration setting keys selecting the target OS for a source OS.
 */
public enum CloudTargetOS {
    LINUX("linuxTargetOs"),
    RHEL("rhelTargetOs"),
    SLES("slesTargetOs"),
    WINDOWS("windowsTargetOs");
    
    private final String value;
    
    CloudTargetOS(String value) {
        this.value = value;
    }
    
    public String getValue() {
        return value;
    }
}
