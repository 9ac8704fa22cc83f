package com.bbthechange.seatwatch.service.impl;

import com.bbthechange.seatwatch.client.BannerRegistrationClient;
import com.bbthechange.seatwatch.dto.ItemPollResult;
import com.bbthechange.seatwatch.dto.SweepResult;
import com.bbthechange.seatwatch.dto.banner.SectionRecord;
import com.bbthechange.seatwatch.model.AvailabilityStatus;
import com.bbthechange.seatwatch.model.TrackedSection;
import com.bbthechange.seatwatch.repository.TrackedSectionRepository;
import com.bbthechange.seatwatch.service.SeatOpeningNotifier;
import com.bbthechange.seatwatch.service.SeatPollingService;
import com.bbthechange.seatwatch.service.SectionStatusEvaluator;
import com.bbthechange.seatwatch.util.SectionNumbers;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Implementation of SeatPollingService.
 * Queries every tracked section on the sweep executor and notifies on closed-to-open transitions.
 *
 * Only active when seatwatch.polling.enabled is true (the default).
 */
@Service
@ConditionalOnProperty(name = "seatwatch.polling.enabled", havingValue = "true", matchIfMissing = true)
public class SeatPollingServiceImpl implements SeatPollingService {

    private static final Logger logger = LoggerFactory.getLogger(SeatPollingServiceImpl.class);

    private final BannerRegistrationClient registrationClient;
    private final SectionStatusEvaluator statusEvaluator;
    private final TrackedSectionRepository repository;
    private final SeatOpeningNotifier notifier;
    private final MeterRegistry meterRegistry;
    private final Executor sweepExecutor;

    // Serializes sweeps from the scheduler and the manual trigger
    private final ReentrantLock sweepLock = new ReentrantLock(true);

    @Autowired
    public SeatPollingServiceImpl(
            BannerRegistrationClient registrationClient,
            SectionStatusEvaluator statusEvaluator,
            TrackedSectionRepository repository,
            SeatOpeningNotifier notifier,
            MeterRegistry meterRegistry,
            @Qualifier("sweepExecutor") Executor sweepExecutor) {
        this.registrationClient = registrationClient;
        this.statusEvaluator = statusEvaluator;
        this.repository = repository;
        this.notifier = notifier;
        this.meterRegistry = meterRegistry;
        this.sweepExecutor = sweepExecutor;

        meterRegistry.gauge("seatwatch_tracked_sections", repository, TrackedSectionRepository::countAll);
    }

    @Override
    public SweepResult sweep() {
        sweepLock.lock();
        try {
            return runSweep();
        } finally {
            sweepLock.unlock();
        }
    }

    private SweepResult runSweep() {
        Timer.Sample timer = Timer.start(meterRegistry);
        long startTime = System.currentTimeMillis();

        try {
            Map<String, List<TrackedSection>> trackedByUser = repository.snapshot();
            int itemCount = trackedByUser.values().stream().mapToInt(List::size).sum();

            if (itemCount == 0) {
                logger.debug("No tracked sections, skipping sweep");
                recordSweepMetrics(timer, "skipped");
                return SweepResult.nothingTracked(System.currentTimeMillis() - startTime);
            }

            logger.info("Starting sweep over {} tracked sections for {} users", itemCount, trackedByUser.size());

            List<CompletableFuture<ItemPollResult>> futures = new ArrayList<>(itemCount);
            for (Map.Entry<String, List<TrackedSection>> entry : trackedByUser.entrySet()) {
                String userId = entry.getKey();
                for (TrackedSection section : entry.getValue()) {
                    futures.add(submit(userId, section));
                }
            }

            // pollSection never completes exceptionally, so join does not throw
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

            Map<ItemPollResult.Outcome, Integer> counts = new EnumMap<>(ItemPollResult.Outcome.class);
            for (CompletableFuture<ItemPollResult> future : futures) {
                ItemPollResult result = future.join();
                counts.merge(result.getOutcome(), 1, Integer::sum);
                meterRegistry.counter("seatwatch_item_poll_total",
                        "outcome", result.getOutcome().name().toLowerCase()).increment();
            }

            int opened = counts.getOrDefault(ItemPollResult.Outcome.OPENED, 0);
            SweepResult result = SweepResult.completed(
                    trackedByUser.size(),
                    itemCount,
                    counts.getOrDefault(ItemPollResult.Outcome.UPDATED, 0) + opened,
                    counts.getOrDefault(ItemPollResult.Outcome.NOT_MATCHED, 0),
                    counts.getOrDefault(ItemPollResult.Outcome.FAILED, 0),
                    opened,
                    System.currentTimeMillis() - startTime
            );

            recordSweepMetrics(timer, "success");
            logger.info("Sweep completed: {}", result);
            return result;

        } catch (RuntimeException e) {
            recordSweepMetrics(timer, "error");
            logger.error("Sweep failed after {}ms", System.currentTimeMillis() - startTime, e);
            throw e;
        }
    }

    private CompletableFuture<ItemPollResult> submit(String userId, TrackedSection section) {
        try {
            return CompletableFuture.supplyAsync(() -> pollSection(userId, section), sweepExecutor);
        } catch (RejectedExecutionException e) {
            logger.warn("Sweep executor rejected CRN {} for user {}", section.getCrn(), userId);
            return CompletableFuture.completedFuture(ItemPollResult.failed(userId, section.getCrn(), e));
        }
    }

    /**
     * Poll one tracked section. Never throws; failures are returned as FAILED results.
     * Package-private for testing.
     */
    ItemPollResult pollSection(String userId, TrackedSection section) {
        String crn = section.getCrn();
        AvailabilityStatus status;
        try {
            List<SectionRecord> records = registrationClient.fetchSections(
                    section.getTerm(), section.getSubject(), section.getCourseNumber());

            Optional<SectionRecord> match = findMatch(records, section);
            if (match.isEmpty()) {
                logger.debug("No section {} with CRN {} in search results for {}",
                        section.getSection(), crn, section.getLabel());
                return ItemPollResult.notMatched(userId, crn);
            }

            status = statusEvaluator.evaluate(match.get());
        } catch (Exception e) {
            logger.debug("Query failed for CRN {} of user {}: {}", crn, userId, e.getMessage());
            return ItemPollResult.failed(userId, crn, e);
        }

        Optional<AvailabilityStatus> previous = repository.updateStatus(userId, crn, status);
        if (previous.isEmpty()) {
            logger.debug("CRN {} was removed by user {} during the sweep", crn, userId);
            return ItemPollResult.removed(userId, crn);
        }

        boolean becameOpen = status.open() && !previous.get().open();
        if (!becameOpen) {
            return ItemPollResult.updated(userId, crn, status);
        }

        notifyOpened(userId, section, status);
        return ItemPollResult.opened(userId, crn, status);
    }

    private Optional<SectionRecord> findMatch(List<SectionRecord> records, TrackedSection section) {
        return records.stream()
                .filter(record -> section.getCrn().equals(
                        record.getCourseReferenceNumber() == null ? "" : record.getCourseReferenceNumber().trim()))
                .filter(record -> section.getSection().equals(
                        SectionNumbers.normalizeSection(record.getSequenceNumber())))
                .findFirst();
    }

    private void notifyOpened(String userId, TrackedSection section, AvailabilityStatus status) {
        TrackedSection opened = new TrackedSection(section);
        opened.applyStatus(status);
        try {
            notifier.onBecameOpen(userId, opened);
            meterRegistry.counter("seatwatch_notifications_sent").increment();
            logger.info("Notified user {} that {} (CRN {}) opened with {} seats",
                    userId, opened.getLabel(), opened.getCrn(), status.availableSeats());
        } catch (Exception e) {
            logger.warn("Failed to notify user {} about CRN {}: {}", userId, opened.getCrn(), e.getMessage());
            meterRegistry.counter("seatwatch_notification_errors").increment();
        }
    }

    private void recordSweepMetrics(Timer.Sample timer, String status) {
        timer.stop(meterRegistry.timer("seatwatch_sweep_duration", "status", status));
        meterRegistry.counter("seatwatch_sweep_total", "status", status).increment();
    }
}
