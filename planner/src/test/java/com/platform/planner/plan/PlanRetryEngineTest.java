package com.platform.planner.plan;

import com.platform.planner.error.PlanException;
import com.platform.planner.error.PlanRetryExhaustedException;
import com.platform.planner.error.PlanRunFailureException;
import com.platform.planner.error.PlanStopException;
import com.platform.planner.error.RemoteServiceException;
import com.platform.planner.error.SettingsCompilationException;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PlanRetryEngineTest {
    
    private final PlanRetryEngine engine = new PlanRetryEngine(3, LoggerFactory.getLogger(PlanRetryEngineTest.class));
    
    @Test
    void classifiesFailures() {
        assertThat(PlanRetryEngine.isRetryable(new PlanException("boom"))).isTrue();
        assertThat(PlanRetryEngine.isRetryable(new PlanRunFailureException("m", "s"))).isTrue();
        assertThat(PlanRetryEngine.isRetryable(RemoteServiceException.forStatus(503, "get market", ""))).isTrue();
        assertThat(PlanRetryEngine.isRetryable(RemoteServiceException.forStatus(502, "get market", ""))).isTrue();
        assertThat(PlanRetryEngine.isRetryable(RemoteServiceException.forStatus(404, "get market", ""))).isFalse();
        assertThat(PlanRetryEngine.isRetryable(PlanStopException.serverError("m", null))).isFalse();
        assertThat(PlanRetryEngine.isRetryable(SettingsCompilationException.unknownVersion())).isFalse();
        assertThat(PlanRetryEngine.isRetryable(new IllegalStateException())).isFalse();
    }
    
    @Test
    void retriesUntilSuccess() {
        AtomicInteger calls = new AtomicInteger();
        
        String result = engine.execute("flaky", () -> {
            if (calls.incrementAndGet() < 3) {
                throw new PlanException("not yet");
            }
            return "done";
        });
        
        assertThat(result).isEqualTo("done");
        assertThat(calls).hasValue(3);
    }
    
    @Test
    void exhaustionCarriesLastFailure() {
        AtomicInteger calls = new AtomicInteger();
        
        assertThatThrownBy(() -> engine.execute("always failing", () -> {
            throw new PlanException("attempt " + calls.incrementAndGet());
        }))
            .isInstanceOf(PlanRetryExhaustedException.class)
            .hasMessageContaining("3 attempts")
            .cause().hasMessage("attempt 3");
        assertThat(calls).hasValue(3);
    }
    
    @Test
    void nonRetryableFailuresPropagateImmediately() {
        AtomicInteger calls = new AtomicInteger();
        RemoteServiceException clientError = RemoteServiceException.forStatus(400, "create scenario", "bad");
        
        assertThatThrownBy(() -> engine.execute("rejected", () -> {
            calls.incrementAndGet();
            throw clientError;
        })).isSameAs(clientError);
        assertThat(calls).hasValue(1);
    }
    
    @Test
    void rejectsNonPositiveAttempts() {
        assertThatThrownBy(() -> new PlanRetryEngine(0, null)).isInstanceOf(IllegalArgumentException.class);
    }
}
