package com.platform.planner.plan;

import com.fasterxml.jackson.databind.JsonNode;
import com.platform.planner.error.InvalidMarketException;
import com.platform.planner.error.PlanDeprovisionException;
import com.platform.planner.error.PlanException;
import com.platform.planner.error.PlanExecutionExceededException;
import com.platform.planner.error.PlanInterruptedException;
import com.platform.planner.error.PlanRunFailureException;
import com.platform.planner.error.PlanStopException;
import com.platform.planner.error.RemoteServiceException;
import com.platform.planner.error.SettingsCompilationException;
import com.platform.planner.mapping.ProtocolVersion;
import com.platform.planner.mapping.SettingsCompiler;
import com.platform.planner.mapping.SettingsMaps;
import com.platform.planner.mapping.SettingsProfile;
import com.platform.planner.mapping.WireDto;
import com.platform.planner.mapping.WireValues;
import com.platform.planner.remote.MarketState;
import com.platform.planner.remote.RemoteModels.MarketInfo;
import com.platform.planner.remote.RemoteModels.ScenarioInfo;
import com.platform.planner.remote.RemoteService;
import com.platform.planner.spec.PlanSpec;
import com.platform.planner.time.PlanClock;
import com.platform.planner.time.SystemPlanClock;
import lombok.Builder;
import org.slf4j.Logger;
import org.slf4j.helpers.NOPLogger;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * A plan run against the remote analysis service.
 *
 * {@link #run()} compiles the plan spec for the remote protocol version, creates
 * a scenario and a market bound to it, then polls the market until it
 * reaches a terminal state, times out, or fails. The whole create-and-poll
 * sequence is retried from scratch under {@link PlanRetryEngine}.
 *
 * A plan is driven by one thread. {@link #stop()} may be called from a
 * second thread while the run is polling, and run state is read from other
 * threads, so every field the run writes is volatile.
 */
public class Plan {

    static final ProtocolVersion MINIMUM_VERSION = SettingsMaps.LEGACY;
    static final ProtocolVersion SCOPE_ENRICHMENT_FROM = ProtocolVersion.of(7, 21, 0);
    static final ProtocolVersion SCOPE_ENRICHMENT_UNTIL = ProtocolVersion.of(7, 21, 5);

    private final RemoteService remote;
    private final PlanSpec spec;
    private final PlanRunOptions options;
    private final PlanClock clock;
    private final Logger log;
    private final SettingsCompiler compiler;
    private final ProtocolVersion version;
    private final ScenarioRequestStrategy scenarioRequest;

    private volatile PlanState state = PlanState.NEW;
    private volatile boolean initialized;
    private volatile String scenarioId;
    private volatile String scenarioName;
    private volatile String marketId;
    private volatile String marketName;
    private volatile MarketState lastMarketState;
    private volatile MarketState result;

    private volatile Instant start;
    private volatile long startNanos;
    private volatile Duration scriptDuration;
    private volatile Duration serverDuration;
    private volatile Boolean unplacedEntities;
    private final AtomicInteger attempts = new AtomicInteger();

    private volatile PlanHook preHook;
    private volatile PlanHook postHook;

    /**
     * @param marketName plan market name, generated as {@code CUSTOM_{user}_{epochSeconds}} when null
     * @throws SettingsCompilationException if the protocol version is older than 5.9.0
     */
    @Builder
    public Plan(RemoteService remote, PlanSpec spec, PlanRunOptions options, PlanClock clock, Logger logger,
                SettingsCompiler compiler, String marketName) {
        this.remote = Objects.requireNonNull(remote, "remote");
        this.spec = Objects.requireNonNull(spec, "spec");
        this.options = options != null ? options : PlanRunOptions.defaults();
        this.clock = clock != null ? clock : SystemPlanClock.INSTANCE;
        this.log = logger != null ? logger : NOPLogger.NOP_LOGGER;
        this.compiler = compiler != null ? compiler : SettingsCompiler.standard();

        if (spec.getVersion() == null) {
            spec.setVersion(remote.reportedProtocolVersion());
        }
        this.version = spec.getVersion();
        if (version.isBefore(MINIMUM_VERSION)) {
            throw SettingsCompilationException.unsupportedVersion(version);
        }

        this.scenarioRequest = ScenarioRequestStrategy.forVersion(version);
        this.scenarioName = spec.getName();
        this.marketName = marketName != null ? marketName : generateMarketName();

        log.debug("Plan {} initialized for version {} ({})", this.marketName, version, scenarioRequest);
    }

    private String generateMarketName() {
        return String.format("CUSTOM_%s_%d", remote.currentUsername(), clock.now().getEpochSecond());
    }

    // ==================== Hooks ====================

    /**
     * Runs before the first attempt of {@link #run()}.
     */
    public void hookPre(PlanHook hook) {
        this.preHook = hook;
    }

    /**
     * Runs after {@link #run()} reached a terminal state.
     */
    public void hookPost(PlanHook hook) {
        this.postHook = hook;
    }

    // ==================== Lifecycle ====================

    /**
     * Runs the plan synchronously, retrying failed attempts.
     *
     * @return terminal market state
     */
    public MarketState run() {
        if (preHook != null) {
            preHook.apply(this);
        }

        PlanRetryEngine retryEngine = new PlanRetryEngine(options.getMaxAttempts(), log);
        MarketState outcome = retryEngine.execute("plan " + spec.getName(), () -> attempt(false));
        result = outcome;

        if (postHook != null) {
            postHook.apply(this);
        }
        return outcome;
    }

    /**
     * Creates the scenario and market and returns the current market state
     * without waiting. Polling, timeout, retry, duration tracking and hooks
     * do not apply.
     */
    public MarketState runAsync() {
        return attempt(true);
    }

    private MarketState attempt(boolean async) {
        int number = attempts.incrementAndGet();
        if (number > 1 && options.isCleanupAbandonedAttempts()) {
            discardAttempt();
        }

        try {
            resetRun();
            initScenario();
            initMarket();
            initialized = true;
            start = clock.now();
            startNanos = clock.nanoTime();
            transition(PlanState.RUNNING, "market " + marketId + " created");

            if (async) {
                return getState();
            }

            waitForPlan();
            syncServerData();
            scriptDuration = elapsed(startNanos);

            MarketState outcome = lastMarketState;
            transition(outcome == MarketState.SUCCEEDED ? PlanState.SUCCEEDED : PlanState.STOPPED,
                "market " + marketId + " " + outcome);
            return outcome;
        } catch (RuntimeException e) {
            transition(PlanState.FAILED, e.getMessage());
            throw e;
        }
    }

    private void resetRun() {
        scenarioId = null;
        marketId = null;
        initialized = false;
        lastMarketState = null;
        scriptDuration = null;
        serverDuration = null;
        unplacedEntities = null;
    }

    private void initScenario() {
        SettingsProfile profile = compiler.profileFor(version);
        WireDto dto = compiler.compile(profile, spec.settings());

        if (needsScopeEnrichment()) {
            dto = enrichScope(dto);
        }

        ScenarioInfo scenario = scenarioRequest.createScenario(remote, spec.getName(), dto);
        scenarioId = scenario.getUuid();
        scenarioName = scenario.getDisplayName();
        transition(PlanState.SCENARIO_CREATED, "scenario " + scenarioId);
    }

    private void initMarket() {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("plan_market_name", marketName);
        params.putAll(spec.getParams());

        MarketInfo market = remote.createMarket(options.getBaseMarket(), scenarioId, params);
        marketId = market.getUuid();
        if (market.getDisplayName() != null) {
            marketName = market.getDisplayName();
        }
        lastMarketState = market.marketState();
        transition(PlanState.MARKET_CREATED, "market " + marketId + " on " + options.getBaseMarket());
    }

    boolean needsScopeEnrichment() {
        return version.isAtLeast(SCOPE_ENRICHMENT_FROM) && version.isBefore(SCOPE_ENRICHMENT_UNTIL);
    }

    /**
     * Adds the display and class name of every scope entity, which services
     * in [7.21.0, 7.21.5) require.
     */
    private WireDto enrichScope(WireDto dto) {
        return dto.transform(content -> {
            Object scope = content.get("scope");
            if (!(scope instanceof List<?> entries)) {
                return;
            }
            List<Object> enriched = new ArrayList<>(entries.size());
            for (Object entry : entries) {
                if (!(entry instanceof Map<?, ?> fields)) {
                    enriched.add(entry);
                    continue;
                }
                Map<String, Object> item = WireValues.copyOf(fields);
                String uuid = String.valueOf(item.get("uuid"));
                remote.findEntity(uuid).ifPresentOrElse(entity -> {
                    item.put("displayName", entity.getDisplayName());
                    item.put("className", entity.getClassName());
                }, () -> log.warn("Scope entity {} not found, submitting without names", uuid));
                enriched.add(item);
            }
            content.put("scope", enriched);
        });
    }

    private void waitForPlan() {
        MarketState current = lastMarketState;

        while (current == null || !current.isTerminal()) {
            Duration elapsed = elapsed(startNanos);

            if (options.hasTimeout() && elapsed.compareTo(options.getTimeout()) >= 0) {
                abortOnTimeout();
                throw new PlanExecutionExceededException(options.getTimeout(), lastMarketState);
            }

            Duration wait = options.hasFixedPollInterval()
                ? options.getPollInterval()
                : PollIntervals.adaptive(elapsed);
            log.debug("Market {} is {}, polling again in {}s", marketId, current, wait.toSeconds());
            sleep(wait);

            current = getState();
            if (current == MarketState.CREATED) {
                // never started after a full wait: the remote plan is stuck
                throw new PlanRunFailureException(marketId, scenarioId);
            }
        }
    }

    /**
     * Stops the market after the run timeout fired. A bad gateway answer is
     * ignored, other server errors are fatal, and failing to observe the
     * stop in time is only logged.
     */
    private void abortOnTimeout() {
        log.warn("Plan {} exceeded its timeout of {} minutes, stopping market {}",
            spec.getName(), options.getTimeout().toMinutes(), marketId);
        transition(PlanState.ABORTING, "timeout");

        try {
            remote.stopMarket(marketId);
        } catch (RemoteServiceException e) {
            if (e.isBadGateway()) {
                log.warn("Stop of market {} answered with bad gateway, ignoring", marketId);
                return;
            }
            if (e.isServerError()) {
                throw PlanStopException.serverError(marketId, e);
            }
            throw new PlanException("Plan stop command error", e);
        }

        try {
            waitForStop();
        } catch (PlanStopException e) {
            log.warn("Market {} did not confirm the stop: {}", marketId, e.getMessage());
        }
    }

    /**
     * Stops the market and waits for it to reach a stopped or succeeded
     * state.
     *
     * @throws PlanStopException if the market did not stop within the abort timeout
     */
    public boolean stop() {
        if (marketId == null) {
            throw InvalidMarketException.notInitialized(marketName);
        }

        transition(PlanState.ABORTING, "stop requested");
        remote.stopMarket(marketId);
        waitForStop();

        if (startNanos != 0) {
            scriptDuration = elapsed(startNanos);
        }
        return true;
    }

    private void waitForStop() {
        Duration abortTimeout = options.getAbortTimeout();
        Duration poll = PollIntervals.abortPoll(abortTimeout, options.getAbortPollInterval());
        long begin = clock.nanoTime();

        while (true) {
            MarketState current = getState();
            if (current != null && current.isTerminal()) {
                transition(current == MarketState.SUCCEEDED ? PlanState.SUCCEEDED : PlanState.STOPPED,
                    "market " + marketId + " " + current);
                return;
            }
            if (elapsed(begin).compareTo(abortTimeout) >= 0) {
                throw PlanStopException.abortTimeout(marketId, abortTimeout.toSeconds());
            }
            sleep(poll);
        }
    }

    /**
     * Removes the market and, unless {@code keepScenario}, the scenario.
     *
     * @throws InvalidMarketException for a protected system market or a plan never run
     * @throws PlanDeprovisionException if either removal failed
     */
    public boolean delete(boolean keepScenario) {
        if (isSystem()) {
            throw InvalidMarketException.protectedMarket(marketName);
        }
        if (!initialized || marketId == null) {
            throw InvalidMarketException.notInitialized(marketName);
        }

        boolean marketRemoved;
        boolean scenarioRemoved;
        try {
            marketRemoved = remote.deleteMarket(marketId);
            scenarioRemoved = keepScenario || remote.deleteScenario(scenarioId);
        } catch (RemoteServiceException e) {
            throw new PlanDeprovisionException("Error removing plan market " + marketId, e);
        }

        if (!marketRemoved || !scenarioRemoved) {
            throw new PlanDeprovisionException(String.format(
                "Error removing plan: market %s removed=%s, scenario %s removed=%s",
                marketId, marketRemoved, scenarioId, scenarioRemoved));
        }

        initialized = false;
        transition(PlanState.DELETED, "deprovisioned");
        log.info("Deleted plan market {} (scenario kept: {})", marketId, keepScenario);
        return true;
    }

    public boolean delete() {
        return delete(false);
    }

    /**
     * Best effort removal of the resources of an abandoned attempt.
     */
    private void discardAttempt() {
        if (marketId != null) {
            try {
                remote.deleteMarket(marketId);
            } catch (RemoteServiceException e) {
                log.warn("Could not delete abandoned market {}: {}", marketId, e.getMessage());
            }
        }
        if (scenarioId != null) {
            try {
                remote.deleteScenario(scenarioId);
            } catch (RemoteServiceException e) {
                log.warn("Could not delete abandoned scenario {}: {}", scenarioId, e.getMessage());
            }
        }
    }

    private void syncServerData() {
        MarketInfo market = remote.getMarket(marketId);
        if (market.getDisplayName() != null) {
            marketName = market.getDisplayName();
        }
        unplacedEntities = market.getUnplacedEntities();
        serverDuration = market.serverDuration().orElse(null);
    }

    // ==================== State ====================

    /**
     * Queries the current market state.
     *
     * @return the state, or null if the plan was never run or the state is not recognized
     */
    public MarketState getState() {
        if (marketId == null) {
            return null;
        }
        MarketState current = remote.getMarket(marketId).marketState();
        lastMarketState = current;
        return current;
    }

    public boolean isState(MarketState expected) {
        return getState() == expected;
    }

    public boolean isComplete() {
        return isState(MarketState.SUCCEEDED);
    }

    public boolean isStopped() {
        return isState(MarketState.STOPPED);
    }

    public boolean isRunning() {
        return isState(MarketState.RUNNING);
    }

    public boolean isReady() {
        return isState(MarketState.READY_TO_START);
    }

    /**
     * Whether the market is a protected system market.
     */
    public boolean isSystem() {
        return options.getProtectedMarkets().contains(marketName);
    }

    public JsonNode getStats() {
        if (marketId == null) {
            throw InvalidMarketException.notInitialized(marketName);
        }
        return remote.getMarketStats(marketId);
    }

    private synchronized void transition(PlanState target, String reason) {
        PlanState previous = state;
        if (previous == target) {
            return;
        }
        if (!previous.canTransitionTo(target)) {
            log.warn("Invalid plan state transition rejected: {} -> {} ({})", previous, target, reason);
            return;
        }
        state = target;
        log.debug("Plan state transition: {} -> {} ({})", previous, target, reason);
    }

    private void sleep(Duration duration) {
        try {
            clock.sleep(duration);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PlanInterruptedException("Interrupted while supervising market " + marketId, e);
        }
    }

    private Duration elapsed(long sinceNanos) {
        return Duration.ofNanos(clock.nanoTime() - sinceNanos);
    }

    // ==================== Accessors ====================

    public PlanState getPlanState() {
        return state;
    }

    public boolean isInitialized() {
        return initialized;
    }

    public PlanSpec getSpec() {
        return spec;
    }

    public PlanRunOptions getOptions() {
        return options;
    }

    public ProtocolVersion getVersion() {
        return version;
    }

    public ScenarioRequestStrategy getScenarioRequest() {
        return scenarioRequest;
    }

    public String getScenarioId() {
        return scenarioId;
    }

    public String getScenarioName() {
        return scenarioName;
    }

    public String getMarketId() {
        return marketId;
    }

    public String getMarketName() {
        return marketName;
    }

    /**
     * Terminal state of the last synchronous run.
     */
    public MarketState getResult() {
        return result;
    }

    public MarketState getLastMarketState() {
        return lastMarketState;
    }

    public Instant getStart() {
        return start;
    }

    /**
     * Server reported run time when known, otherwise the locally measured one.
     */
    public Duration getDuration() {
        return serverDuration != null ? serverDuration : scriptDuration;
    }

    public Duration getServerDuration() {
        return serverDuration;
    }

    public Duration getScriptDuration() {
        return scriptDuration;
    }

    public Boolean getUnplacedEntities() {
        return unplacedEntities;
    }

    public int getAttempts() {
        return attempts.get();
    }
}
