package com.platform.planner.remote;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.platform.planner.mapping.ProtocolVersion;
import com.platform.planner.mapping.WireDto;
import com.platform.planner.remote.RemoteModels.EntityInfo;
import com.platform.planner.remote.RemoteModels.MarketInfo;
import com.platform.planner.remote.RemoteModels.ScenarioInfo;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory remote service with scripted market states.
 *
 * Every creation hands out a fresh id ({@code scenario-1}, {@code market-1},
 * ...). {@link #getMarket} pops the next scripted state of the market and
 * keeps repeating the last one.
 */
public class FakeRemoteService implements RemoteService {
    
    private final ProtocolVersion version;
    private final List<String> calls = new ArrayList<>();
    private final List<WireDto> scenarioDtos = new ArrayList<>();
    private final List<String> createdScenarios = new ArrayList<>();
    private final List<String> createdMarkets = new ArrayList<>();
    private final List<Map<String, Object>> marketParams = new ArrayList<>();
    private final Map<String, Deque<String>> scripts = new HashMap<>();
    private final Map<String, String> currentStates = new HashMap<>();
    private final Map<String, EntityInfo> entities = new LinkedHashMap<>();
    private final List<String> clusters = new ArrayList<>();
    private final Deque<RuntimeException> createMarketFailures = new ArrayDeque<>();
    
    private String createdState = "READY_TO_START";
    private String defaultState = "RUNNING";
    private String marketDisplayName;
    private RuntimeException stopFailure;
    private RuntimeException deleteFailure;
    private boolean deleteMarketResult = true;
    private boolean deleteScenarioResult = true;
    private int scenarioCounter;
    private int marketCounter;
    
    public FakeRemoteService(ProtocolVersion version) {
        this.version = version;
    }
    
    // ==================== Scripting ====================
    
    public FakeRemoteService script(String marketId, String... states) {
        scripts.put(marketId, new ArrayDeque<>(List.of(states)));
        return this;
    }
    
    public FakeRemoteService createdState(String state) {
        this.createdState = state;
        return this;
    }
    
    public FakeRemoteService defaultState(String state) {
        this.defaultState = state;
        return this;
    }
    
    public FakeRemoteService marketDisplayName(String name) {
        this.marketDisplayName = name;
        return this;
    }
    
    /**
     * Fails the next market creations, one failure per call.
     */
    public FakeRemoteService failCreateMarket(RuntimeException... failures) {
        createMarketFailures.addAll(List.of(failures));
        return this;
    }
    
    public FakeRemoteService failStop(RuntimeException failure) {
        this.stopFailure = failure;
        return this;
    }
    
    public FakeRemoteService failDelete(RuntimeException failure) {
        this.deleteFailure = failure;
        return this;
    }
    
    public FakeRemoteService deleteResults(boolean market, boolean scenario) {
        this.deleteMarketResult = market;
        this.deleteScenarioResult = scenario;
        return this;
    }
    
    public FakeRemoteService entity(String uuid, String displayName, String className) {
        entities.put(uuid, new EntityInfo(uuid, displayName, className));
        return this;
    }
    
    public FakeRemoteService cluster(String uuid) {
        clusters.add(uuid);
        return this;
    }
    
    // ==================== RemoteService ====================
    
    @Override
    public ProtocolVersion reportedProtocolVersion() {
        calls.add("reportedProtocolVersion");
        return version;
    }
    
    @Override
    public String currentUsername() {
        calls.add("currentUsername");
        return "planner";
    }
    
    @Override
    public ScenarioInfo createScenario(WireDto dto) {
        calls.add("createScenario");
        return newScenario(dto);
    }
    
    @Override
    public ScenarioInfo createNamedScenario(String name, WireDto dto) {
        calls.add("createNamedScenario:" + name);
        return newScenario(dto);
    }
    
    private ScenarioInfo newScenario(WireDto dto) {
        scenarioDtos.add(dto);
        String id = "scenario-" + (++scenarioCounter);
        createdScenarios.add(id);
        return new ScenarioInfo(id, String.valueOf(dto.get("displayName")));
    }
    
    @Override
    public MarketInfo createMarket(String baseMarket, String scenarioId, Map<String, Object> params) {
        calls.add("createMarket:" + baseMarket + ":" + scenarioId);
        marketParams.add(new LinkedHashMap<>(params));
        if (!createMarketFailures.isEmpty()) {
            throw createMarketFailures.poll();
        }
        String id = "market-" + (++marketCounter);
        createdMarkets.add(id);
        currentStates.put(id, createdState);
        String name = marketDisplayName != null ? marketDisplayName : String.valueOf(params.get("plan_market_name"));
        return new MarketInfo(id, name, createdState);
    }
    
    @Override
    public MarketInfo getMarket(String marketId) {
        calls.add("getMarket:" + marketId);
        Deque<String> script = scripts.get(marketId);
        String state;
        if (script != null && !script.isEmpty()) {
            state = script.size() > 1 ? script.poll() : script.peek();
        } else {
            state = defaultState;
        }
        currentStates.put(marketId, state);
        return new MarketInfo(marketId, marketDisplayName, state);
    }
    
    @Override
    public void stopMarket(String marketId) {
        calls.add("stopMarket:" + marketId);
        if (stopFailure != null) {
            throw stopFailure;
        }
    }
    
    @Override
    public boolean deleteMarket(String marketId) {
        calls.add("deleteMarket:" + marketId);
        if (deleteFailure != null) {
            throw deleteFailure;
        }
        return deleteMarketResult;
    }
    
    @Override
    public boolean deleteScenario(String scenarioId) {
        calls.add("deleteScenario:" + scenarioId);
        if (deleteFailure != null) {
            throw deleteFailure;
        }
        return deleteScenarioResult;
    }
    
    @Override
    public Optional<EntityInfo> findEntity(String uuid) {
        calls.add("findEntity:" + uuid);
        return Optional.ofNullable(entities.get(uuid));
    }
    
    @Override
    public List<String> findClusterIds(String market) {
        calls.add("findClusterIds:" + market);
        return new ArrayList<>(clusters);
    }
    
    @Override
    public JsonNode getMarketStats(String marketId) {
        calls.add("getMarketStats:" + marketId);
        return JsonNodeFactory.instance.objectNode().put("uuid", marketId);
    }
    
    // ==================== Recorded ====================
    
    public List<String> getCalls() {
        return new ArrayList<>(calls);
    }
    
    public long count(String prefix) {
        return calls.stream().filter(call -> call.startsWith(prefix)).count();
    }
    
    public List<WireDto> getScenarioDtos() {
        return scenarioDtos;
    }
    
    public List<String> getCreatedScenarios() {
        return createdScenarios;
    }
    
    public List<String> getCreatedMarkets() {
        return createdMarkets;
    }
    
    public List<Map<String, Object>> getMarketParams() {
        return marketParams;
    }
}
