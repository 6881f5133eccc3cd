package com.platform.planner.plan;

import com.fasterxml.jackson.databind.JsonNode;
import com.platform.planner.api.PlanRequest;
import com.platform.planner.api.PlanRequestMapper;
import com.platform.planner.api.PlanStatus;
import com.platform.planner.error.ErrorCode;
import com.platform.planner.error.PlanNotFoundException;
import com.platform.planner.error.PlannerException;
import com.platform.planner.error.SettingsCompilationException;
import com.platform.planner.mapping.SettingsCompiler;
import com.platform.planner.observability.LoggingConfig;
import com.platform.planner.observability.PlannerMetrics;
import com.platform.planner.remote.MarketState;
import com.platform.planner.remote.RemoteService;
import com.platform.planner.spec.PlanSpec;
import com.platform.planner.time.PlanClock;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

/**
 * Submits plans and keeps track of them while they run.
 */
@Slf4j
@Service
public class PlanService {

    private final RemoteService remote;
    private final PlanRequestMapper mapper;
    private final PlanRunOptions defaultOptions;
    private final PlanClock clock;
    private final SettingsCompiler compiler;
    private final PlannerMetrics metrics;
    private final Executor planExecutor;

    private final Map<String, ManagedPlan> plans = new ConcurrentHashMap<>();

    public PlanService(RemoteService remote, PlanRequestMapper mapper, PlanRunOptions defaultOptions,
                       PlanClock clock, SettingsCompiler compiler, PlannerMetrics metrics,
                       @Qualifier("planExecutor") Executor planExecutor) {
        this.remote = remote;
        this.mapper = mapper;
        this.defaultOptions = defaultOptions;
        this.clock = clock;
        this.compiler = compiler;
        this.metrics = metrics;
        this.planExecutor = planExecutor;
    }

    /**
     * Compiles the request for its target version without submitting it.
     */
    public String preview(PlanRequest request) {
        PlanSpec spec = mapper.toSpec(request);
        if (spec.getVersion() == null) {
            spec.setVersion(remote.reportedProtocolVersion());
        }
        try {
            return compiler.compile(spec.getVersion(), spec.settings()).toJson(true);
        } catch (SettingsCompilationException e) {
            metrics.recordCompilationFailure(e.getErrorCode());
            throw e;
        }
    }

    /**
     * Validates the request, then runs the plan in the background. Failures
     * of the background run are reported through the plan status.
     */
    public PlanStatus submit(PlanRequest request) {
        String id = UUID.randomUUID().toString();
        PlanSpec spec = mapper.toSpec(request);
        PlanRunOptions options = mapper.toOptions(request, defaultOptions);

        Plan plan = Plan.builder()
            .remote(remote)
            .spec(spec)
            .options(options)
            .clock(clock)
            .compiler(compiler)
            .logger(LoggerFactory.getLogger(Plan.class))
            .marketName(request.getRun() != null ? request.getRun().getMarketName() : null)
            .build();

        ManagedPlan managed = new ManagedPlan(id, plan);
        plans.put(id, managed);
        log.info("Submitting plan {} ({}) as {}", spec.getName(), spec.getType(), id);

        metrics.recordPlanStarted();
        CompletableFuture.runAsync(() -> execute(managed), planExecutor);
        return status(managed);
    }

    private void execute(ManagedPlan managed) {
        Plan plan = managed.plan;
        LoggingConfig.setPlanContext(managed.id, null);
        try {
            MarketState result = plan.run();
            LoggingConfig.setPlanContext(managed.id, plan.getMarketId());
            log.info("Plan {} finished: {}", managed.id, result);
            metrics.recordPlanFinished(String.valueOf(result), plan.getDuration());
        } catch (PlannerException e) {
            managed.error = e;
            log.error("Plan {} failed: [{}] {}", managed.id, e.getErrorCode().getCode(), e.getMessage());
            metrics.recordError(e.getErrorCode());
            if (e instanceof SettingsCompilationException) {
                metrics.recordCompilationFailure(e.getErrorCode());
            }
            metrics.recordPlanFinished(e.getErrorCode().name(), plan.getDuration());
        } catch (RuntimeException e) {
            managed.error = e;
            log.error("Plan {} failed unexpectedly", managed.id, e);
            metrics.recordError(ErrorCode.INTERNAL_ERROR);
            metrics.recordPlanFinished(ErrorCode.INTERNAL_ERROR.name(), plan.getDuration());
        } finally {
            metrics.recordRetries(plan.getAttempts() - 1);
            LoggingConfig.clearPlanContext();
        }
    }

    public PlanStatus get(String id) {
        return status(find(id));
    }

    public List<PlanStatus> list() {
        return plans.values().stream().map(this::status).toList();
    }

    public PlanStatus stop(String id) {
        ManagedPlan managed = find(id);
        log.info("Stopping plan {}", id);
        managed.plan.stop();
        return status(managed);
    }

    /**
     * Deprovisions the plan's remote resources and forgets the plan. A plan
     * that finished without ever creating a market has nothing to remove
     * remotely and is only forgotten.
     */
    public PlanStatus delete(String id, boolean keepScenario) {
        ManagedPlan managed = find(id);
        Plan plan = managed.plan;
        if (plan.getMarketId() == null && plan.getPlanState().isTerminal()) {
            plans.remove(id);
            log.info("Forgot plan {} ({}), no market was created", id, plan.getPlanState());
            return status(managed);
        }
        plan.delete(keepScenario);
        plans.remove(id);
        log.info("Deleted plan {}", id);
        return status(managed);
    }

    public JsonNode stats(String id) {
        return find(id).plan.getStats();
    }

    private ManagedPlan find(String id) {
        ManagedPlan managed = plans.get(id);
        if (managed == null) {
            throw new PlanNotFoundException(id);
        }
        return managed;
    }

    private PlanStatus status(ManagedPlan managed) {
        Plan plan = managed.plan;
        PlanStatus.PlanStatusBuilder builder = PlanStatus.builder()
            .id(managed.id)
            .scenarioName(plan.getSpec().getName())
            .planState(plan.getPlanState())
            .marketState(plan.getResult() != null ? plan.getResult() : plan.getLastMarketState())
            .scenarioId(plan.getScenarioId())
            .marketId(plan.getMarketId())
            .marketName(plan.getMarketName())
            .attempts(plan.getAttempts())
            .unplacedEntities(plan.getUnplacedEntities());

        if (plan.getDuration() != null) {
            builder.durationSeconds(plan.getDuration().toSeconds());
        }

        Throwable error = managed.error;
        if (error != null) {
            builder.errorMessage(error.getMessage());
            builder.errorCode(error instanceof PlannerException planner
                ? planner.getErrorCode().getCode()
                : ErrorCode.INTERNAL_ERROR.getCode());
        }
        return builder.build();
    }

    private static final class ManagedPlan {
        private final String id;
        private final Plan plan;
        private volatile Throwable error;

        private ManagedPlan(String id, Plan plan) {
            this.id = id;
            this.plan = plan;
        }
    }
}
