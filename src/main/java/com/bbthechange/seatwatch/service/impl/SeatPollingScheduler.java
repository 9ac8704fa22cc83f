package com.bbthechange.seatwatch.service.impl;

import com.bbthechange.seatwatch.service.SeatPollingService;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Periodic driver for seat sweeps.
 * Runs the first sweep after seatwatch.polling.initial-delay (immediately by default), then one sweep
 * every seatwatch.polling.interval measured from the end of the previous one, so sweeps never overlap.
 */
@Component
@ConditionalOnProperty(name = "seatwatch.polling.enabled", havingValue = "true", matchIfMissing = true)
public class SeatPollingScheduler {

    private static final Logger logger = LoggerFactory.getLogger(SeatPollingScheduler.class);

    private final SeatPollingService pollingService;
    private final AtomicBoolean stopped = new AtomicBoolean(false);

    public SeatPollingScheduler(SeatPollingService pollingService) {
        this.pollingService = pollingService;
    }

    @Scheduled(fixedDelayString = "${seatwatch.polling.interval:PT5M}",
            initialDelayString = "${seatwatch.polling.initial-delay:PT0S}")
    public void runScheduledSweep() {
        if (stopped.get()) {
            logger.debug("Seat polling stopped, skipping scheduled sweep");
            return;
        }

        try {
            pollingService.sweep();
        } catch (Exception e) {
            // Next scheduled sweep retries
            logger.error("Scheduled sweep failed", e);
        }
    }

    /**
     * Prevent further sweeps. A sweep already running is allowed to finish.
     */
    @PreDestroy
    public void stop() {
        if (stopped.compareAndSet(false, true)) {
            logger.info("Seat polling stopped");
        }
    }

    public boolean isStopped() {
        return stopped.get();
    }
}
