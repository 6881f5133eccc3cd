package com.platform.planner.error;

import com.platform.planner.settings.SettingTag;

/**
 * Raised when a plan's settings cannot be rendered into the wire shape of
 * the target protocol version. Never retried: the same input always fails.
 */
public class SettingsCompilationException extends PlannerException {
    
    private final SettingTag tag;
    private final String field;
    
    public SettingsCompilationException(ErrorCode errorCode, SettingTag tag, String field, String message) {
        super(errorCode, message);
        this.tag = tag;
        this.field = field;
    }
    
    public SettingsCompilationException(ErrorCode errorCode, SettingTag tag, String field, String message, Throwable cause) {
        super(errorCode, message, cause);
        this.tag = tag;
        this.field = field;
    }
    
    public static SettingsCompilationException unknownVersion() {
        return new SettingsCompilationException(
            ErrorCode.VERSION_UNKNOWN,
            null,
            null,
            "Unable to map settings to an unknown version"
        );
    }
    
    public static SettingsCompilationException unsupportedVersion(Object version) {
        return new SettingsCompilationException(
            ErrorCode.VERSION_UNSUPPORTED,
            null,
            null,
            String.format("No settings map for version: %s", version)
        );
    }
    
    public static SettingsCompilationException notMapped(SettingTag tag, Object version) {
        return new SettingsCompilationException(
            ErrorCode.SETTING_NOT_MAPPED,
            tag,
            null,
            String.format("Setting %s is not supported by version %s", tag, version)
        );
    }
    
    public static SettingsCompilationException unresolved(SettingTag tag, String field) {
        return new SettingsCompilationException(
            ErrorCode.SUBSTITUTION_UNRESOLVED,
            tag,
            field,
            String.format("Setting %s is missing field '%s'", tag, field)
        );
    }
    
    public static SettingsCompilationException invalidValueMap(SettingTag tag, String field, String reason) {
        return new SettingsCompilationException(
            ErrorCode.VALUE_MAP_INVALID,
            tag,
            field,
            String.format("Setting %s field '%s': %s", tag, field, reason)
        );
    }
    
    public SettingTag getTag() {
        return tag;
    }
    
    public String getField() {
        return field;
    }
}
