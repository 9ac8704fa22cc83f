package com.bbthechange.seatwatch.controller;

import com.bbthechange.seatwatch.dto.SweepResult;
import com.bbthechange.seatwatch.service.SeatPollingService;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;
import java.util.Optional;

/**
 * Internal controller for running a sweep on demand.
 */
@RestController
@RequestMapping("/internal/sweeps")
public class InternalSweepController {

    private static final Logger logger = LoggerFactory.getLogger(InternalSweepController.class);

    private final MeterRegistry meterRegistry;
    private final Optional<SeatPollingService> pollingService;

    public InternalSweepController(MeterRegistry meterRegistry, Optional<SeatPollingService> pollingService) {
        this.meterRegistry = meterRegistry;
        this.pollingService = pollingService;
    }

    /**
     * Run one sweep now and wait for it. Waits for a scheduled sweep that is already running.
     *
     * @return 200 OK with sweep statistics, or 503 if polling is not enabled
     */
    @PostMapping("/trigger")
    public ResponseEntity<Map<String, Object>> triggerSweep() {
        logger.info("Received trigger-sweep request");

        if (pollingService.isEmpty()) {
            logger.warn("Polling service not available - seatwatch.polling.enabled=false");
            return ResponseEntity.status(503).body(Map.of(
                    "error", "Polling service not enabled",
                    "hint", "Set seatwatch.polling.enabled=true to enable polling"
            ));
        }

        try {
            SweepResult result = pollingService.get().sweep();

            meterRegistry.counter("seatwatch_sweep_trigger_total", "status", "success").increment();

            return ResponseEntity.ok(Map.of(
                    "status", "completed",
                    "usersScanned", result.getUsersScanned(),
                    "itemsPolled", result.getItemsPolled(),
                    "itemsUpdated", result.getItemsUpdated(),
                    "itemsNotMatched", result.getItemsNotMatched(),
                    "itemsFailed", result.getItemsFailed(),
                    "notificationsSent", result.getNotificationsSent(),
                    "durationMs", result.getDurationMs()
            ));

        } catch (Exception e) {
            logger.error("Trigger sweep failed", e);
            meterRegistry.counter("seatwatch_sweep_trigger_total", "status", "error").increment();

            return ResponseEntity.internalServerError().body(Map.of(
                    "status", "error",
                    "error", e.getMessage() != null ? e.getMessage() : "Unknown error"
            ));
        }
    }
}
