package com.platform.planner.plan;

import com.platform.planner.mapping.ProtocolVersion;
import com.platform.planner.mapping.WireDto;
import com.platform.planner.remote.RemoteModels.ScenarioInfo;
import com.platform.planner.remote.RemoteService;

/**
 * How a scenario creation request is addressed, selected once per plan
 * from the protocol version.
 */
public enum ScenarioRequestStrategy {
    
    /**
     * Up to and including 5.9.0: the scenario name is part of the path.
     */
    NAMED_PATH {
        @Override
        public ScenarioInfo createScenario(RemoteService remote, String name, WireDto dto) {
            return remote.createNamedScenario(name, dto);
        }
    },
    
    /**
     * 5.9.1 and later: generic path, the name travels in the DTO.
     */
    GENERIC_PATH {
        @Override
        public ScenarioInfo createScenario(RemoteService remote, String name, WireDto dto) {
            return remote.createScenario(dto);
        }
    };
    
    static final ProtocolVersion GENERIC_PATH_SINCE = ProtocolVersion.of(5, 9, 1);
    
    public abstract ScenarioInfo createScenario(RemoteService remote, String name, WireDto dto);
    
    public static ScenarioRequestStrategy forVersion(ProtocolVersion version) {
        return version.isAtLeast(GENERIC_PATH_SINCE) ? GENERIC_PATH : NAMED_PATH;
    }
}
