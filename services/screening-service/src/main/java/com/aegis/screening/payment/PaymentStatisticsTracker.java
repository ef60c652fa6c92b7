package com.aegis.screening.payment;

import com.aegis.common.concurrent.ConcurrencyUtils;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Running counters and a bounded latency window for payment screening.
 *
 * <p>All state lives behind one lock. Each call to {@link #record} moves
 * the total and exactly one per-state counter, and appends one latency,
 * evicting the oldest sample once the window is full.
 */
@Slf4j
public class PaymentStatisticsTracker {

    private final Lock lock = new ReentrantLock();
    private final int windowCapacity;
    private final Deque<Long> latencyWindowNanos;

    private long latencySumNanos;
    private long totalProcessed;
    private long cleared;
    private long review;
    private long blocked;
    private long errors;

    public PaymentStatisticsTracker(int windowCapacity) {
        if (windowCapacity < 1) {
            throw new IllegalArgumentException("windowCapacity must be positive");
        }
        this.windowCapacity = windowCapacity;
        this.latencyWindowNanos = new ArrayDeque<>(windowCapacity);
    }

    public void record(PaymentScreeningStatus status, Duration latency) {
        if (!status.isTerminal()) {
            throw new IllegalArgumentException("Only terminal states are counted, got " + status);
        }
        long nanos = Math.max(0L, latency.toNanos());
        ConcurrencyUtils.withLockVoid(lock, () -> {
            totalProcessed++;
            switch (status) {
                case CLEARED -> cleared++;
                case REVIEW -> review++;
                case BLOCKED -> blocked++;
                case ERROR -> errors++;
                default -> log.warn("Unexpected terminal status {}", status);
            }
            if (latencyWindowNanos.size() == windowCapacity) {
                latencySumNanos -= latencyWindowNanos.removeFirst();
            }
            latencyWindowNanos.addLast(nanos);
            latencySumNanos += nanos;
        });
    }

    public StatisticsSnapshot snapshot() {
        return ConcurrencyUtils.withLock(lock, () -> {
            int samples = latencyWindowNanos.size();
            double average = samples == 0 ? 0.0 : (latencySumNanos / (double) samples) / 1_000_000.0;
            return StatisticsSnapshot.builder()
                .timestamp(Instant.now())
                .totalProcessed(totalProcessed)
                .cleared(cleared)
                .review(review)
                .blocked(blocked)
                .errors(errors)
                .averageLatencyMillis(average)
                .latencySamples(samples)
                .windowCapacity(windowCapacity)
                .build();
        });
    }
}
