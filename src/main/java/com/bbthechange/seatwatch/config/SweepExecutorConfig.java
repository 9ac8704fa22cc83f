package com.bbthechange.seatwatch.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Bounded worker pool for the per-section queries of a sweep.
 * Core and max size are both the configured parallelism, so at most that many
 * queries are in flight against the registration platform.
 */
@Configuration
public class SweepExecutorConfig {

    private static final Logger logger = LoggerFactory.getLogger(SweepExecutorConfig.class);

    @Bean(name = "sweepExecutor")
    public ThreadPoolTaskExecutor sweepExecutor(PollingProperties pollingProperties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(pollingProperties.getMaxParallelism());
        executor.setMaxPoolSize(pollingProperties.getMaxParallelism());
        executor.setThreadNamePrefix("seat-sweep-");

        // Let an in-progress sweep finish on shutdown
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);

        executor.initialize();

        logger.info("Sweep executor configured: maxParallelism={}", pollingProperties.getMaxParallelism());
        return executor;
    }
}
