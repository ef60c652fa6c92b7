package com.aegis.screening.payment;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

/**
 * Point-in-time copy of the running payment statistics
 */
@Getter
@Builder
@ToString
public class StatisticsSnapshot {

    private final Instant timestamp;
    private final long totalProcessed;
    private final long cleared;
    private final long review;
    private final long blocked;
    private final long errors;
    private final double averageLatencyMillis;
    private final int latencySamples;
    private final int windowCapacity;
}
