package com.platform.planner.observability;

import com.platform.planner.error.ErrorCode;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Planner metrics: plan outcomes, retries, compilation failures and run
 * durations.
 */
@Slf4j
@Component
public class PlannerMetrics {
    
    private final MeterRegistry meterRegistry;
    private final Map<String, Counter> counters = new ConcurrentHashMap<>();
    private final AtomicInteger activePlans = new AtomicInteger();
    private final Timer planDuration;
    
    public PlannerMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.planDuration = Timer.builder("planner.plan.duration")
            .description("Plan run time, server reported when available")
            .publishPercentiles(0.5, 0.95, 0.99)
            .register(meterRegistry);
        
        Gauge.builder("planner.plan.active", activePlans, AtomicInteger::get)
            .register(meterRegistry);
        
        log.info("Planner metrics initialized");
    }
    
    public void recordPlanStarted() {
        activePlans.incrementAndGet();
        incrementCounter("planner.plan.started");
    }
    
    /**
     * Record a finished plan run.
     *
     * @param outcome terminal market state, or the error code name on failure
     */
    public void recordPlanFinished(String outcome, Duration duration) {
        activePlans.decrementAndGet();
        incrementCounter("planner.plan.finished", "outcome", outcome);
        if (duration != null) {
            planDuration.record(duration);
        }
    }
    
    public void recordRetries(int retries) {
        if (retries > 0) {
            counter("planner.plan.retry").increment(retries);
        }
    }
    
    public void recordError(ErrorCode errorCode) {
        incrementCounter("planner.errors", "code", errorCode.getCode(), "category", errorCode.getCategory().name());
    }
    
    public void recordCompilationFailure(ErrorCode errorCode) {
        incrementCounter("planner.compilation.failure", "code", errorCode.getCode());
    }
    
    public int getActivePlans() {
        return activePlans.get();
    }
    
    private void incrementCounter(String name, String... tags) {
        counter(name, tags).increment();
    }
    
    private Counter counter(String name, String... tags) {
        String key = name + String.join(".", tags);
        return counters.computeIfAbsent(key, k ->
            Counter.builder(name)
                .tags(tags)
                .register(meterRegistry));
    }
}
