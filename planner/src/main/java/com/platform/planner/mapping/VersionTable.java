package com.platform.planner.mapping;

import com.platform.planner.error.SettingsCompilationException;
import com.platform.planner.settings.SettingTag;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Ordered list of protocol generations. Selecting a version picks the
 * highest base generation not above it, then applies every patch between
 * that generation and the version in ascending order.
 */
public final class VersionTable {
    
    private final List<ProtocolGeneration> generations;
    
    public VersionTable(List<ProtocolGeneration> generations) {
        List<ProtocolGeneration> sorted = new ArrayList<>(generations);
        sorted.sort(Comparator.comparing(ProtocolGeneration::getMinimum));
        this.generations = List.copyOf(sorted);
    }
    
    /**
     * @throws SettingsCompilationException if the version predates every generation
     */
    public SettingsProfile select(ProtocolVersion version) {
        if (version == null) {
            throw SettingsCompilationException.unknownVersion();
        }
        
        ProtocolGeneration base = null;
        for (ProtocolGeneration generation : generations) {
            if (!generation.isPatch() && version.isAtLeast(generation.getMinimum())) {
                base = generation;
            }
        }
        if (base == null) {
            throw SettingsCompilationException.unsupportedVersion(version);
        }
        
        Map<SettingTag, MapNode.Mapping> definitions = new EnumMap<>(SettingTag.class);
        definitions.putAll(base.getDefinitions());
        List<CollationRule> collations = new ArrayList<>(base.getCollations());
        List<DtoPostProcessor> postProcessors = new ArrayList<>(base.getPostProcessors());
        
        for (ProtocolGeneration patch : generations) {
            if (patch.isPatch()
                    && patch.getMinimum().compareTo(base.getMinimum()) > 0
                    && version.isAtLeast(patch.getMinimum())) {
                definitions.putAll(patch.getDefinitions());
                collations.addAll(patch.getCollations());
                postProcessors.addAll(patch.getPostProcessors());
            }
        }
        
        return new SettingsProfile(version, base.getMinimum(), definitions, collations, postProcessors);
    }
    
    /**
     * Oldest version any generation supports.
     */
    public ProtocolVersion minimumSupported() {
        return generations.stream()
            .filter(g -> !g.isPatch())
            .map(ProtocolGeneration::getMinimum)
            .findFirst()
            .orElseThrow(() -> new IllegalStateException("Version table has no base generation"));
    }
    
    public List<ProtocolGeneration> getGenerations() {
        return generations;
    }
}
