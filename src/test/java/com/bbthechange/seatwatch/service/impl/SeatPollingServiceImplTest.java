package com.bbthechange.seatwatch.service.impl;

import com.bbthechange.seatwatch.client.BannerRegistrationClient;
import com.bbthechange.seatwatch.dto.ItemPollResult;
import com.bbthechange.seatwatch.dto.SweepResult;
import com.bbthechange.seatwatch.dto.banner.SectionRecord;
import com.bbthechange.seatwatch.exception.RegistrationQueryException;
import com.bbthechange.seatwatch.model.AvailabilityStatus;
import com.bbthechange.seatwatch.model.TrackedSection;
import com.bbthechange.seatwatch.repository.impl.InMemoryTrackedSectionRepository;
import com.bbthechange.seatwatch.service.SeatOpeningNotifier;
import com.bbthechange.seatwatch.service.SectionStatusEvaluator;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SeatPollingServiceImplTest {

    private static final String USER_ID = "chat-1001";
    private static final String OTHER_USER_ID = "chat-2002";

    @Mock
    private BannerRegistrationClient registrationClient;

    @Mock
    private SeatOpeningNotifier notifier;

    private InMemoryTrackedSectionRepository repository;
    private MeterRegistry meterRegistry;
    private SeatPollingServiceImpl pollingService;

    @BeforeEach
    void setUp() {
        repository = new InMemoryTrackedSectionRepository();
        meterRegistry = new SimpleMeterRegistry();
        // Same-thread executor keeps the sweep deterministic
        pollingService = new SeatPollingServiceImpl(
                registrationClient,
                new SectionStatusEvaluator(),
                repository,
                notifier,
                meterRegistry,
                Runnable::run
        );
    }

    private static SectionRecord record(String crn, String sequence, Boolean open, Integer seats) {
        return SectionRecord.builder()
                .courseReferenceNumber(crn)
                .sequenceNumber(sequence)
                .openSection(open)
                .seatsAvailable(seats)
                .build();
    }

    private static SectionRecord closedRecord() {
        return record("30577", "02", false, 0);
    }

    private static SectionRecord openRecord(int seats) {
        return record("30577", "02", true, seats);
    }

    @Nested
    @DisplayName("sweep")
    class SweepTests {

        @Test
        @DisplayName("should notify once when a tracked section opens")
        void sweep_ClosedThenOpen_NotifiesWithSeatCount() {
            // Given
            repository.add(USER_ID, "252", "ENGL", "214", "2", "30577");
            when(registrationClient.fetchSections("252", "ENGL", "214"))
                    .thenReturn(List.of(closedRecord()))
                    .thenReturn(List.of(openRecord(3)));

            // When - first sweep sees it closed
            SweepResult first = pollingService.sweep();

            // Then
            verifyNoInteractions(notifier);
            assertThat(repository.list(USER_ID).get(0).isOpen()).isFalse();
            assertThat(first.getItemsUpdated()).isEqualTo(1);
            assertThat(first.getNotificationsSent()).isZero();

            // When - second sweep sees it open
            SweepResult second = pollingService.sweep();

            // Then
            ArgumentCaptor<TrackedSection> captor = ArgumentCaptor.forClass(TrackedSection.class);
            verify(notifier).onBecameOpen(eq(USER_ID), captor.capture());
            TrackedSection notified = captor.getValue();
            assertThat(notified.getCrn()).isEqualTo("30577");
            assertThat(notified.getSubject()).isEqualTo("ENGL");
            assertThat(notified.getCourseNumber()).isEqualTo("214");
            assertThat(notified.getSection()).isEqualTo("02");
            assertThat(notified.getAvailableSeats()).isEqualTo(3);

            TrackedSection stored = repository.list(USER_ID).get(0);
            assertThat(stored.isOpen()).isTrue();
            assertThat(stored.getAvailableSeats()).isEqualTo(3);
            assertThat(second.getNotificationsSent()).isEqualTo(1);
        }

        @Test
        @DisplayName("should notify only on closed-to-open edges")
        void sweep_StatusSequence_NotifiesOnlyOnTransitionsToOpen() {
            // Given - Closed, Closed, Open, Open, Closed, Open
            repository.add(USER_ID, "252", "ENGL", "214", "02", "30577");
            when(registrationClient.fetchSections("252", "ENGL", "214"))
                    .thenReturn(List.of(closedRecord()))
                    .thenReturn(List.of(closedRecord()))
                    .thenReturn(List.of(openRecord(5)))
                    .thenReturn(List.of(openRecord(4)))
                    .thenReturn(List.of(closedRecord()))
                    .thenReturn(List.of(openRecord(1)));

            // When
            int[] notificationsAfterSweep = new int[6];
            for (int i = 0; i < 6; i++) {
                notificationsAfterSweep[i] = pollingService.sweep().getNotificationsSent();
            }

            // Then
            assertThat(notificationsAfterSweep).containsExactly(0, 0, 1, 0, 0, 1);
            verify(notifier, times(2)).onBecameOpen(eq(USER_ID), any(TrackedSection.class));
            assertThat(repository.list(USER_ID).get(0).getAvailableSeats()).isEqualTo(1);
        }

        @Test
        @DisplayName("should keep processing other items when one query fails")
        void sweep_OneQueryFails_OtherItemsStillProcessed() {
            // Given
            repository.add(USER_ID, "252", "MATH", "101", "01", "10001");
            repository.add(USER_ID, "252", "ENGL", "214", "02", "30577");
            repository.add(OTHER_USER_ID, "252", "ICS", "104", "05", "20002");
            repository.updateStatus(USER_ID, "10001",
                    new AvailabilityStatus(7, true, true));

            when(registrationClient.fetchSections("252", "MATH", "101"))
                    .thenThrow(RegistrationQueryException.timeout("section search"));
            when(registrationClient.fetchSections("252", "ENGL", "214"))
                    .thenReturn(List.of(openRecord(2)));
            when(registrationClient.fetchSections("252", "ICS", "104"))
                    .thenReturn(List.of(record("20002", "5", true, 9)));

            // When
            SweepResult result = pollingService.sweep();

            // Then
            assertThat(result.getItemsPolled()).isEqualTo(3);
            assertThat(result.getItemsFailed()).isEqualTo(1);
            assertThat(result.getItemsUpdated()).isEqualTo(2);
            assertThat(result.getUsersScanned()).isEqualTo(2);

            TrackedSection failed = repository.list(USER_ID).get(0);
            assertThat(failed.getAvailableSeats()).isEqualTo(7);
            assertThat(failed.isWaitingListOpen()).isTrue();
            assertThat(failed.isOpen()).isTrue();

            verify(notifier).onBecameOpen(eq(USER_ID), argThat(s -> s.getCrn().equals("30577")));
            verify(notifier).onBecameOpen(eq(OTHER_USER_ID), argThat(s -> s.getCrn().equals("20002")));
            verify(notifier, never()).onBecameOpen(anyString(), argThat(s -> s.getCrn().equals("10001")));
        }

        @Test
        @DisplayName("should skip items without a matching CRN and section")
        void sweep_NoMatchingRecord_LeavesStatusUnchanged() {
            // Given - CRN matches but section differs, section matches but CRN differs
            repository.add(USER_ID, "252", "ENGL", "214", "02", "30577");
            when(registrationClient.fetchSections("252", "ENGL", "214"))
                    .thenReturn(List.of(record("30577", "03", true, 4), record("30999", "02", true, 4)));

            // When
            SweepResult result = pollingService.sweep();

            // Then
            assertThat(result.getItemsNotMatched()).isEqualTo(1);
            assertThat(result.getItemsUpdated()).isZero();
            assertThat(repository.list(USER_ID).get(0).isOpen()).isFalse();
            verifyNoInteractions(notifier);
        }

        @Test
        @DisplayName("should treat an empty search result as not matched")
        void sweep_EmptySearch_NotMatched() {
            // Given
            repository.add(USER_ID, "252", "ENGL", "214", "02", "30577");
            when(registrationClient.fetchSections("252", "ENGL", "214")).thenReturn(List.of());

            // When
            SweepResult result = pollingService.sweep();

            // Then
            assertThat(result.getItemsNotMatched()).isEqualTo(1);
            assertThat(result.getItemsFailed()).isZero();
        }

        @Test
        @DisplayName("should skip the sweep when nothing is tracked")
        void sweep_NothingTracked_SkipsQueries() {
            // When
            SweepResult result = pollingService.sweep();

            // Then
            assertThat(result.getItemsPolled()).isZero();
            verifyNoInteractions(registrationClient);
            verifyNoInteractions(notifier);
            assertThat(meterRegistry.counter("seatwatch_sweep_total", "status", "skipped").count())
                    .isEqualTo(1.0);
        }

        @Test
        @DisplayName("should keep the stored status when the notifier fails")
        void sweep_NotifierThrows_StatusStillStored() {
            // Given
            repository.add(USER_ID, "252", "ENGL", "214", "02", "30577");
            repository.add(USER_ID, "252", "MATH", "101", "01", "10001");
            when(registrationClient.fetchSections("252", "ENGL", "214")).thenReturn(List.of(openRecord(3)));
            when(registrationClient.fetchSections("252", "MATH", "101"))
                    .thenReturn(List.of(record("10001", "1", true, 1)));
            lenient().doThrow(new IllegalStateException("chat unreachable"))
                    .when(notifier).onBecameOpen(eq(USER_ID), argThat(s -> s.getCrn().equals("30577")));

            // When
            pollingService.sweep();

            // Then
            assertThat(repository.list(USER_ID)).allMatch(TrackedSection::isOpen);
            verify(notifier, times(2)).onBecameOpen(eq(USER_ID), any(TrackedSection.class));
            assertThat(meterRegistry.counter("seatwatch_notification_errors").count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("should report the current number of tracked sections")
        void trackedSectionsGauge_FollowsStore() {
            // Given
            repository.add(USER_ID, "252", "ENGL", "214", "02", "30577");
            repository.add(OTHER_USER_ID, "252", "MATH", "101", "01", "10001");

            // Then
            assertThat(meterRegistry.get("seatwatch_tracked_sections").gauge().value()).isEqualTo(2.0);

            // When
            repository.remove(USER_ID, "30577");

            // Then
            assertThat(meterRegistry.get("seatwatch_tracked_sections").gauge().value()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("should record per-outcome metrics")
        void sweep_RecordsOutcomeCounters() {
            // Given
            repository.add(USER_ID, "252", "ENGL", "214", "02", "30577");
            when(registrationClient.fetchSections("252", "ENGL", "214")).thenReturn(List.of(openRecord(3)));

            // When
            pollingService.sweep();

            // Then
            assertThat(meterRegistry.counter("seatwatch_item_poll_total", "outcome", "opened").count())
                    .isEqualTo(1.0);
            assertThat(meterRegistry.counter("seatwatch_sweep_total", "status", "success").count())
                    .isEqualTo(1.0);
            assertThat(meterRegistry.get("seatwatch_tracked_sections").gauge().value()).isEqualTo(1.0);
        }
    }

    @Nested
    @DisplayName("sweep ordering")
    class SweepOrderingTests {

        @Test
        @DisplayName("should not start a second sweep until the running one returns")
        void sweep_CalledWhileSweepRuns_WaitsForRunningSweep() throws Exception {
            // Given
            repository.add(USER_ID, "252", "ENGL", "214", "2", "30577");
            CountDownLatch firstQueryStarted = new CountDownLatch(1);
            CountDownLatch releaseFirstQuery = new CountDownLatch(1);
            AtomicInteger queries = new AtomicInteger();
            AtomicBoolean secondQuerySawFirstUpdate = new AtomicBoolean(false);

            when(registrationClient.fetchSections("252", "ENGL", "214")).thenAnswer(invocation -> {
                if (queries.incrementAndGet() == 1) {
                    firstQueryStarted.countDown();
                    releaseFirstQuery.await(5, TimeUnit.SECONDS);
                } else {
                    // The first sweep stores its result before releasing the sweep
                    secondQuerySawFirstUpdate.set(repository.list(USER_ID).get(0).isOpen());
                }
                return List.of(openRecord(3));
            });

            ExecutorService callers = Executors.newFixedThreadPool(2);
            try {
                // When
                Future<SweepResult> first = callers.submit(() -> pollingService.sweep());
                assertThat(firstQueryStarted.await(5, TimeUnit.SECONDS)).isTrue();
                Future<SweepResult> second = callers.submit(() -> pollingService.sweep());

                Thread.sleep(200);
                assertThat(queries.get()).isEqualTo(1);
                assertThat(second).isNotDone();

                releaseFirstQuery.countDown();
                SweepResult firstResult = first.get(5, TimeUnit.SECONDS);
                SweepResult secondResult = second.get(5, TimeUnit.SECONDS);

                // Then
                assertThat(queries.get()).isEqualTo(2);
                assertThat(secondQuerySawFirstUpdate.get()).isTrue();
                assertThat(firstResult.getNotificationsSent()).isEqualTo(1);
                assertThat(secondResult.getNotificationsSent()).isZero();
                verify(notifier, times(1)).onBecameOpen(eq(USER_ID), any(TrackedSection.class));
            } finally {
                releaseFirstQuery.countDown();
                callers.shutdownNow();
            }
        }
    }

    @Nested
    @DisplayName("pollSection")
    class PollSectionTests {

        @Test
        @DisplayName("should not notify when the item is removed while its query runs")
        void pollSection_RemovedDuringQuery_ReturnsRemoved() {
            // Given
            TrackedSection section = repository.add(USER_ID, "252", "ENGL", "214", "02", "30577");
            when(registrationClient.fetchSections("252", "ENGL", "214")).thenAnswer(invocation -> {
                repository.remove(USER_ID, "30577");
                return List.of(openRecord(3));
            });

            // When
            ItemPollResult result = pollingService.pollSection(USER_ID, section);

            // Then
            assertThat(result.getOutcome()).isEqualTo(ItemPollResult.Outcome.REMOVED);
            assertThat(repository.list(USER_ID)).isEmpty();
            verifyNoInteractions(notifier);
        }

        @Test
        @DisplayName("should return FAILED carrying the query error")
        void pollSection_QueryFails_ReturnsFailed() {
            // Given
            TrackedSection section = repository.add(USER_ID, "252", "ENGL", "214", "02", "30577");
            RegistrationQueryException error = RegistrationQueryException.badStatus("term declaration", 502);
            when(registrationClient.fetchSections("252", "ENGL", "214")).thenThrow(error);

            // When
            ItemPollResult result = pollingService.pollSection(USER_ID, section);

            // Then
            assertThat(result.getOutcome()).isEqualTo(ItemPollResult.Outcome.FAILED);
            assertThat(result.getError()).isSameAs(error);
            assertThat(result.getStatus()).isNull();
        }

        @Test
        @DisplayName("should match records whose section number is not padded")
        void pollSection_UnpaddedSequenceNumber_Matches() {
            // Given
            TrackedSection section = repository.add(USER_ID, "252", "ENGL", "214", "02", "30577");
            when(registrationClient.fetchSections("252", "ENGL", "214"))
                    .thenReturn(List.of(record("30577", "2", false, 0)));

            // When
            ItemPollResult result = pollingService.pollSection(USER_ID, section);

            // Then
            assertThat(result.getOutcome()).isEqualTo(ItemPollResult.Outcome.UPDATED);
        }
    }
}
