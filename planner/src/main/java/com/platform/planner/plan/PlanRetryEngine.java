package com.platform.planner.plan;

import com.platform.planner.error.PlanException;
import com.platform.planner.error.PlanRetryExhaustedException;
import com.platform.planner.error.RemoteServiceException;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.slf4j.Logger;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Bounded retry envelope around whole plan attempts.
 *
 * Server side transport errors and plan errors are retried immediately
 * with a fresh attempt. Compilation errors, client errors and fatal stop
 * failures propagate unchanged. Once every attempt failed a
 * {@link PlanRetryExhaustedException} carrying the last failure is thrown.
 */
public class PlanRetryEngine {

    private final int maxAttempts;
    private final Logger log;

    public PlanRetryEngine(int maxAttempts, Logger log) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1: " + maxAttempts);
        }
        this.maxAttempts = maxAttempts;
        this.log = log;
    }

    public <T> T execute(String operationName, Supplier<T> attempt) {
        Retry retry = Retry.of(operationName, RetryConfig.custom()
            .maxAttempts(maxAttempts)
            .waitDuration(Duration.ZERO)
            .retryOnException(PlanRetryEngine::isRetryable)
            .build());

        retry.getEventPublisher()
            .onRetry(event -> log.warn("{} failed (attempt {}/{}): {}",
                operationName, event.getNumberOfRetryAttempts(), maxAttempts, event.getLastThrowable().getMessage()))
            .onSuccess(event -> log.info("{} succeeded after {} attempts",
                operationName, event.getNumberOfRetryAttempts() + 1));

        try {
            return retry.executeSupplier(attempt);
        } catch (RuntimeException e) {
            if (!isRetryable(e)) {
                throw e;
            }
            log.error("{} failed after {} attempts", operationName, maxAttempts);
            throw new PlanRetryExhaustedException(maxAttempts, e);
        }
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    static boolean isRetryable(Throwable error) {
        if (error instanceof PlanException) {
            return true;
        }
        return error instanceof RemoteServiceException remote && remote.isServerError();
    }
}
