package com.platform.planner.config;

import com.platform.planner.mapping.SettingsCompiler;
import com.platform.planner.plan.PlanRunOptions;
import com.platform.planner.time.PlanClock;
import com.platform.planner.time.SystemPlanClock;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Duration;

/**
 * Beans shared by plan runs.
 */
@Slf4j
@Configuration
public class PlannerConfig {

    @Bean
    public PlanClock planClock() {
        return SystemPlanClock.INSTANCE;
    }

    @Bean
    public SettingsCompiler settingsCompiler() {
        return SettingsCompiler.standard();
    }

    @Bean
    public PlanRunOptions defaultRunOptions(PlannerProperties properties) {
        PlannerProperties.Run run = properties.getRun();
        PlanRunOptions options = PlanRunOptions.builder()
            .timeout(Duration.ofMinutes(run.getTimeoutMinutes()))
            .pollInterval(Duration.ofSeconds(run.getPollIntervalSeconds()))
            .abortTimeout(Duration.ofMinutes(run.getAbortTimeoutMinutes()))
            .abortPollInterval(Duration.ofSeconds(run.getAbortPollSeconds()))
            .maxAttempts(run.getMaxAttempts())
            .baseMarket(run.getBaseMarket())
            .cleanupAbandonedAttempts(run.isCleanupAbandonedAttempts())
            .protectedMarkets(properties.getProtectedMarkets())
            .build();

        log.info("Default plan options: timeout={}m, maxAttempts={}, baseMarket={}",
            run.getTimeoutMinutes(), run.getMaxAttempts(), run.getBaseMarket());
        return options;
    }

    /**
     * Each synchronous plan run occupies one thread for its whole lifetime.
     */
    @Bean(name = "planExecutor")
    public ThreadPoolTaskExecutor planExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(4);
        executor.setMaxPoolSize(16);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("plan-");
        executor.initialize();
        return executor;
    }
}
