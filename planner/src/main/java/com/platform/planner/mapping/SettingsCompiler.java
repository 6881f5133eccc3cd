package com.platform.planner.mapping;

import com.platform.planner.settings.SettingEntry;

import java.util.List;

/**
 * Compiles settings for a remote version using a version table.
 */
public class SettingsCompiler {
    
    private static final SettingsCompiler STANDARD = new SettingsCompiler(SettingsMaps.standardTable(), new MappingEngine());
    
    private final VersionTable versionTable;
    private final MappingEngine engine;
    
    public SettingsCompiler(VersionTable versionTable, MappingEngine engine) {
        this.versionTable = versionTable;
        this.engine = engine;
    }
    
    public static SettingsCompiler standard() {
        return STANDARD;
    }
    
    public SettingsProfile profileFor(ProtocolVersion version) {
        return versionTable.select(version);
    }
    
    public WireDto compile(ProtocolVersion version, List<SettingEntry> settings) {
        return engine.compile(profileFor(version), settings);
    }
    
    public WireDto compile(SettingsProfile profile, List<SettingEntry> settings) {
        return engine.compile(profile, settings);
    }
    
    public VersionTable getVersionTable() {
        return versionTable;
    }
}
