package com.bbthechange.seatwatch.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Sweep worker settings.
 * seatwatch.polling.enabled, interval and initial-delay are read directly by
 * {@code @ConditionalOnProperty} and the {@code @Scheduled} placeholders.
 */
@Component
@ConfigurationProperties(prefix = "seatwatch.polling")
public class PollingProperties {

    private int maxParallelism = 4;

    public int getMaxParallelism() {
        return Math.max(1, maxParallelism);
    }

    public void setMaxParallelism(int maxParallelism) {
        this.maxParallelism = maxParallelism;
    }
}
