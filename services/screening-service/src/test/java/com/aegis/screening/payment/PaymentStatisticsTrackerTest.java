package com.aegis.screening.payment;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@DisplayName("PaymentStatisticsTracker")
class PaymentStatisticsTrackerTest {

    @Test
    @DisplayName("Counts each terminal state separately")
    void countsByState() {
        PaymentStatisticsTracker tracker = new PaymentStatisticsTracker(10);

        tracker.record(PaymentScreeningStatus.CLEARED, Duration.ofMillis(10));
        tracker.record(PaymentScreeningStatus.CLEARED, Duration.ofMillis(20));
        tracker.record(PaymentScreeningStatus.REVIEW, Duration.ofMillis(30));
        tracker.record(PaymentScreeningStatus.BLOCKED, Duration.ofMillis(40));
        tracker.record(PaymentScreeningStatus.ERROR, Duration.ofMillis(50));

        StatisticsSnapshot snapshot = tracker.snapshot();
        assertThat(snapshot.getTotalProcessed()).isEqualTo(5);
        assertThat(snapshot.getCleared()).isEqualTo(2);
        assertThat(snapshot.getReview()).isEqualTo(1);
        assertThat(snapshot.getBlocked()).isEqualTo(1);
        assertThat(snapshot.getErrors()).isEqualTo(1);
        assertThat(snapshot.getAverageLatencyMillis()).isCloseTo(30.0, within(1e-9));
        assertThat(snapshot.getTimestamp()).isNotNull();
    }

    @Test
    @DisplayName("Oldest latency is evicted once the window is full")
    void evictsOldestLatency() {
        PaymentStatisticsTracker tracker = new PaymentStatisticsTracker(3);

        tracker.record(PaymentScreeningStatus.CLEARED, Duration.ofMillis(1000));
        tracker.record(PaymentScreeningStatus.CLEARED, Duration.ofMillis(10));
        tracker.record(PaymentScreeningStatus.CLEARED, Duration.ofMillis(20));
        tracker.record(PaymentScreeningStatus.CLEARED, Duration.ofMillis(30));

        StatisticsSnapshot snapshot = tracker.snapshot();
        assertThat(snapshot.getLatencySamples()).isEqualTo(3);
        assertThat(snapshot.getWindowCapacity()).isEqualTo(3);
        assertThat(snapshot.getAverageLatencyMillis()).isCloseTo(20.0, within(1e-9));
        assertThat(snapshot.getTotalProcessed()).isEqualTo(4);
    }

    @Test
    @DisplayName("Empty tracker reports zero average")
    void emptyTracker() {
        StatisticsSnapshot snapshot = new PaymentStatisticsTracker(5).snapshot();

        assertThat(snapshot.getTotalProcessed()).isZero();
        assertThat(snapshot.getAverageLatencyMillis()).isZero();
    }

    @ParameterizedTest
    @EnumSource(value = PaymentScreeningStatus.class, names = {"RECEIVED", "SCREENING"})
    @DisplayName("Non-terminal states are rejected")
    void rejectsNonTerminalStates(PaymentScreeningStatus status) {
        PaymentStatisticsTracker tracker = new PaymentStatisticsTracker(5);

        assertThatThrownBy(() -> tracker.record(status, Duration.ZERO))
            .isInstanceOf(IllegalArgumentException.class);
        assertThat(tracker.snapshot().getTotalProcessed()).isZero();
    }

    @Test
    @DisplayName("Concurrent updates lose nothing")
    void concurrentUpdatesAreConsistent() throws Exception {
        PaymentStatisticsTracker tracker = new PaymentStatisticsTracker(50);
        int threads = 8;
        int perThread = 1_000;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                PaymentScreeningStatus status = t % 2 == 0 ? PaymentScreeningStatus.CLEARED : PaymentScreeningStatus.ERROR;
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < perThread; i++) {
                        tracker.record(status, Duration.ofMillis(5));
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get();
            }
        } finally {
            pool.shutdownNow();
        }

        StatisticsSnapshot snapshot = tracker.snapshot();
        assertThat(snapshot.getTotalProcessed()).isEqualTo((long) threads * perThread);
        assertThat(snapshot.getCleared() + snapshot.getErrors()).isEqualTo(snapshot.getTotalProcessed());
        assertThat(snapshot.getLatencySamples()).isEqualTo(50);
        assertThat(snapshot.getAverageLatencyMillis()).isCloseTo(5.0, within(1e-9));
    }
}
