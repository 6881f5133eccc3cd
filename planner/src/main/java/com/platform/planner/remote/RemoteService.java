package com.platform.planner.remote;

import com.fasterxml.jackson.databind.JsonNode;
import com.platform.planner.error.RemoteServiceException;
import com.platform.planner.mapping.ProtocolVersion;
import com.platform.planner.mapping.WireDto;
import com.platform.planner.remote.RemoteModels.EntityInfo;
import com.platform.planner.remote.RemoteModels.MarketInfo;
import com.platform.planner.remote.RemoteModels.ScenarioInfo;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Handle on the remote analysis service.
 * 
 * Every call may throw {@link RemoteServiceException}, classified by HTTP
 * status into client errors, server errors and bad gateway.
 */
public interface RemoteService {
    
    /**
     * Protocol version the service is currently running.
     */
    ProtocolVersion reportedProtocolVersion();
    
    String currentUsername();
    
    /**
     * Creates a scenario on the generic scenarios path. The display name is
     * carried by the DTO.
     */
    ScenarioInfo createScenario(WireDto dto);
    
    /**
     * Creates a scenario addressed by name, as older services expect.
     */
    ScenarioInfo createNamedScenario(String name, WireDto dto);
    
    /**
     * Creates a plan market applying a scenario to a base market.
     *
     * @param params query parameters, including the plan market name
     */
    MarketInfo createMarket(String baseMarket, String scenarioId, Map<String, Object> params);
    
    MarketInfo getMarket(String marketId);
    
    void stopMarket(String marketId);
    
    boolean deleteMarket(String marketId);
    
    boolean deleteScenario(String scenarioId);
    
    Optional<EntityInfo> findEntity(String uuid);
    
    /**
     * UUIDs of every cluster in a market.
     */
    List<String> findClusterIds(String market);
    
    JsonNode getMarketStats(String marketId);
}
