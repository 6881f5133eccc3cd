package com.platform.planner.mapping;

import com.platform.planner.settings.SettingTag;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static com.platform.planner.mapping.CollationRule.FieldPolicy.KEEP_LAST;

/**
 * Scenario map definitions of every supported protocol generation.
 * 
 * Objects repeated across settings are merged, lists are appended. The 6.1
 * and 7.21 definitions apply additively; 5.9 is a separate wire shape.
 */
public final class SettingsMaps {
    
    public static final ProtocolVersion LEGACY = ProtocolVersion.of(5, 9, 0);
    public static final ProtocolVersion MODERN = ProtocolVersion.of(6, 1, 0);
    public static final ProtocolVersion ENUMERATED_AUTOMATION = ProtocolVersion.of(7, 21, 0);
    
    private static final VersionTable STANDARD = new VersionTable(List.of(
        ProtocolGeneration.base(LEGACY, legacy())
            .withCollation(legacyCollations())
            .withPostProcessor(DtoPostProcessor.REPEATED_ADDITIONS),
        ProtocolGeneration.base(MODERN, modern()),
        ProtocolGeneration.patch(ENUMERATED_AUTOMATION, enumeratedAutomation())
    ));
    
    private SettingsMaps() {
    }
    
    public static VersionTable standardTable() {
        return STANDARD;
    }
    
    // 5.9.x: everything is a typed entry of a single changes list
    static Map<SettingTag, MapNode.Mapping> legacy() {
        Map<SettingTag, MapNode.Mapping> m = new EnumMap<>(SettingTag.class);
        
        define(m, SettingTag.NAME, Map.of("displayName", "$value"));
        define(m, SettingTag.TYPE, Map.of("type", "$value"));
        define(m, SettingTag.SCOPE, changes(Map.of("type", "SCOPE", "scope[scope]", List.of(Map.of("uuid", "$value")))));
        define(m, SettingTag.PROJECTION, changes(Map.of("type", "PROJECTION_PERIODS", "projectionDays", "$list")));
        define(m, SettingTag.DESIRED_STATE, changes(Map.of(
            "type", "SET", "projectionDays", List.of(0), "center", "$center", "diameter", "$diameter")));
        define(m, SettingTag.HISTORICAL_BASELINE, changes(Map.of("type", "SET_HIST_BASELINE", "value", "$value")));
        define(m, SettingTag.PEAK_BASELINE, changes(Map.of(
            "type", "SET_PEAK_BASELINE", "value", "$value", "targets[ids]", List.of(Map.of("uuid", "$uuid")))));
        define(m, SettingTag.ADD_HISTORICAL, changes(Map.of("type", "ADD_HIST", "enable", "$value")));
        define(m, SettingTag.INCLUDE_RESERVED, changes(Map.of("type", "INCLUDE_RESERVED", "enable", "$value")));
        define(m, SettingTag.MAX_UTILIZATION, changes(Map.of(
            "type", "SET_MAX_UTILIZATION", "maxUtilType", "$type", "value", "$util",
            "targets[ids]", List.of(Map.of("uuid", "$uuid")))));
        define(m, SettingTag.UTILIZATION, changes(Map.of(
            "type", "SET_USED", "value", "$util", "projectionDays", List.of("$projection"),
            "targets[ids]", List.of(Map.of("uuid", "$uuid")))));
        
        define(m, SettingTag.PROVISION_HOST, legacyAction("provision", "PhysicalMachine"));
        define(m, SettingTag.SUSPEND_HOST, legacyAction("suspend", "PhysicalMachine"));
        define(m, SettingTag.PROVISION_STORAGE, legacyAction("provision", "Storage"));
        define(m, SettingTag.SUSPEND_STORAGE, legacyAction("suspend", "Storage"));
        define(m, SettingTag.RESIZE, changes(Map.of(
            "type", "$type", "name", "resize", "enable", "$value", "description", "$desc")));
        
        define(m, SettingTag.CONSTRAINT, changes(Map.of(
            "type", "CONSTRAINTCHANGED", "projectionDays", List.of("$projection"), "name", "$name",
            "enable", "$value", "targets", List.of(Map.of("uuid", "$uuid")))));
        
        define(m, SettingTag.ADD_ENTITY, changes(Map.of(
            "type", "ADDED", "projectionDays", "$projection", "targets", List.of(Map.of("uuid", "$target")))));
        define(m, SettingTag.MIGRATE_ENTITY, changes(Map.of(
            "type", "MIGRATION", "projectionDays", List.of("$projection"),
            "targets", List.of(Map.of("uuid", "$source"), Map.of("uuid", "$destination")))));
        define(m, SettingTag.REMOVE_ENTITY, changes(Map.of(
            "type", "REMOVED", "projectionDays", List.of("$projection"), "targets", List.of(Map.of("uuid", "$target")))));
        define(m, SettingTag.REPLACE_ENTITY, changes(Map.of(
            "type", "REPLACED", "projectionDays", List.of("$projection"),
            "targets", List.of(Map.of("uuid", "$target"), Map.of("uuid", "$template")))));
        
        return m;
    }
    
    static List<CollationRule> legacyCollations() {
        return List.of(
            CollationRule.of(SettingTag.MAX_UTILIZATION, "ids", List.of("uuid"), KEEP_LAST),
            CollationRule.of(SettingTag.UTILIZATION, "ids", List.of("uuid"), KEEP_LAST),
            CollationRule.of(SettingTag.PEAK_BASELINE, "ids", List.of("uuid"), KEEP_LAST)
        );
    }
    
    // 6.1.x+: settings are split across typed change sections
    static Map<SettingTag, MapNode.Mapping> modern() {
        Map<SettingTag, MapNode.Mapping> m = new EnumMap<>(SettingTag.class);
        
        define(m, SettingTag.NAME, Map.of("displayName", "$value"));
        define(m, SettingTag.TYPE, Map.of("type", "$value"));
        define(m, SettingTag.SCOPE, Map.of("scope[scope]", List.of(Map.of("uuid", "$value"))));
        define(m, SettingTag.PROJECTION, Map.of("projectionDays", "$list"));
        
        define(m, SettingTag.DESIRED_STATE, automation(List.of(
            Map.of("uuid", "utilTarget", "value", "$center"),
            Map.of("uuid", "targetBand", "value", "$diameter"))));
        define(m, SettingTag.PROVISION_HOST, automation(List.of(automationToggle("$uuid", "$value", "PhysicalMachine"))));
        define(m, SettingTag.SUSPEND_HOST, automation(List.of(automationToggle("$uuid", "$value", "PhysicalMachine"))));
        define(m, SettingTag.PROVISION_STORAGE, automation(List.of(automationToggle("$uuid", "$value", "Storage"))));
        define(m, SettingTag.SUSPEND_STORAGE, automation(List.of(automationToggle("$uuid", "$value", "Storage"))));
        define(m, SettingTag.RESIZE, automation(List.of(automationToggle("$uuid", "$value", "VirtualMachine"))));
        
        define(m, SettingTag.OS_MIGRATION, Map.of("configChanges", Map.of(
            "osMigrationSettingsList", List.of(Map.of("uuid", "$uuid", "value", "$value")))));
        define(m, SettingTag.CONSTRAINT, Map.of("configChanges", Map.of(
            "removeConstraintList", List.of(Map.of(
                "projectionDay", "$projection", "constraintType", "$name", "target", Map.of("uuid", "$uuid"))))));
        
        define(m, SettingTag.HISTORICAL_BASELINE, Map.of("loadChanges", Map.of("baselineDate", "$date")));
        define(m, SettingTag.PEAK_BASELINE, Map.of("loadChanges", Map.of(
            "peakBaselineList", List.of(Map.of("date", "$date", "target", Map.of("uuid", "$uuid"))))));
        define(m, SettingTag.MAX_UTILIZATION, Map.of("loadChanges", Map.of(
            "maxUtilizationList", List.of(Map.of(
                "maxPercentage", "$util", "projectionDay", "$projection", "target", Map.of("uuid", "$uuid"))))));
        define(m, SettingTag.UTILIZATION, Map.of("loadChanges", Map.of(
            "utilizationList", List.of(Map.of(
                "percentage", "$util", "projectionDay", "$projection", "target", Map.of("uuid", "$uuid"))))));
        
        define(m, SettingTag.ADD_HISTORICAL, Map.of("timebasedTopologyChanges", Map.of("addHistoryVMs", "$value")));
        define(m, SettingTag.INCLUDE_RESERVED, Map.of("timebasedTopologyChanges", Map.of("includeReservation", "$value")));
        
        define(m, SettingTag.ADD_ENTITY, topology("addList", Map.of(
            "count", "$count", "projectionDays", "$projection", "target", Map.of("uuid", "$target"))));
        define(m, SettingTag.MIGRATE_ENTITY, topology("migrateList", Map.of(
            "projectionDay", "$projection", "source", Map.of("uuid", "$source"),
            "destination", Map.of("uuid", "$destination"))));
        define(m, SettingTag.REMOVE_ENTITY, topology("removeList", Map.of(
            "projectionDay", "$projection", "target", Map.of("uuid", "$target"))));
        define(m, SettingTag.REPLACE_ENTITY, topology("replaceList", Map.of(
            "projectionDay", "$projection", "target", Map.of("uuid", "$target"),
            "template", Map.of("uuid", "$template"))));
        define(m, SettingTag.RELIEVE_PRESSURE, topology("relievePressureList", Map.of(
            "projectionDay", "$projection",
            "sources[source]", List.of(Map.of("uuid", "$value")),
            "destinations[destination]", List.of(Map.of("uuid", "$value")))));
        
        return m;
    }
    
    // 7.21.x+: automation toggles are named actions with enumerated values
    static Map<SettingTag, MapNode.Mapping> enumeratedAutomation() {
        Map<SettingTag, MapNode.Mapping> m = new EnumMap<>(SettingTag.class);
        String enabled = "@value:ENABLED;DISABLED";
        
        define(m, SettingTag.PROVISION_HOST, automation(List.of(automationToggle("provision", enabled, "PhysicalMachine"))));
        define(m, SettingTag.SUSPEND_HOST, automation(List.of(automationToggle("suspend", enabled, "PhysicalMachine"))));
        define(m, SettingTag.PROVISION_STORAGE, automation(List.of(automationToggle("provision", enabled, "Storage"))));
        define(m, SettingTag.SUSPEND_STORAGE, automation(List.of(automationToggle("suspend", enabled, "Storage"))));
        define(m, SettingTag.RESIZE, automation(List.of(automationToggle("resize", enabled, "VirtualMachine"))));
        
        return m;
    }
    
    private static void define(Map<SettingTag, MapNode.Mapping> target, SettingTag tag, Map<String, ?> definition) {
        target.put(tag, MapDefinitions.mapping(definition));
    }
    
    private static Map<String, Object> changes(Map<String, ?> change) {
        return Map.of("changes", List.of(change));
    }
    
    private static Map<String, Object> legacyAction(String action, String entityType) {
        return changes(Map.of("type", "SET_ACTION_SETTING", "name", action, "value", entityType, "enable", "$value"));
    }
    
    private static Map<String, Object> automation(List<Map<String, ?>> settings) {
        return Map.of("configChanges", Map.of("automationSettingList", settings));
    }
    
    private static Map<String, ?> automationToggle(String uuid, String value, String entityType) {
        return Map.of("uuid", uuid, "value", value, "entityType", entityType);
    }
    
    private static Map<String, Object> topology(String list, Map<String, ?> change) {
        return Map.of("topologyChanges", Map.of(list, List.of(change)));
    }
}
