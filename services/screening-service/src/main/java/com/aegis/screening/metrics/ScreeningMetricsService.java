package com.aegis.screening.metrics;

import com.aegis.screening.domain.ScreeningResult;
import com.aegis.screening.payment.PaymentScreeningStatus;
import com.aegis.screening.payment.PaymentStatisticsTracker;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Locale;

/**
 * Micrometer meters for candidate and payment screening
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ScreeningMetricsService {

    private final MeterRegistry meterRegistry;
    private final PaymentStatisticsTracker statisticsTracker;

    private Counter publishFailureCounter;
    private Counter storeFailureCounter;
    private Counter rejectedEventCounter;
    private Timer paymentLatencyTimer;

    @PostConstruct
    public void initMetrics() {
        publishFailureCounter = Counter.builder("screening.publish.failures.total")
                .description("Screening results that could not be published")
                .register(meterRegistry);

        storeFailureCounter = Counter.builder("screening.store.failures.total")
                .description("Screening results that could not be stored")
                .register(meterRegistry);

        rejectedEventCounter = Counter.builder("screening.payment.rejected.total")
                .description("Payment events discarded before screening because they carry no payment id")
                .register(meterRegistry);

        paymentLatencyTimer = Timer.builder("screening.payment.duration")
                .description("End-to-end screening time per payment")
                .register(meterRegistry);

        Gauge.builder("screening.payment.latency.moving.average.ms", statisticsTracker,
                        tracker -> tracker.snapshot().getAverageLatencyMillis())
                .description("Moving average over the recent latency window")
                .register(meterRegistry);
    }

    /**
     * Record a finished candidate screening
     */
    public void recordCandidateScreening(ScreeningResult result) {
        Counter.builder("screening.candidate.total")
                .description("Candidate screenings by decision")
                .tag("decision", result.getDecision().name())
                .register(meterRegistry)
                .increment();

        if (result.getMetadata() != null && result.getMetadata().getFailedEvaluations() > 0) {
            Counter.builder("screening.record.evaluation.failures.total")
                    .description("Watchlist records skipped because their evaluation failed")
                    .register(meterRegistry)
                    .increment(result.getMetadata().getFailedEvaluations());
        }
    }

    /**
     * Record a finished payment in its terminal state
     */
    public void recordPaymentOutcome(PaymentScreeningStatus status, Duration latency) {
        Counter.builder("screening.payment.total")
                .description("Screened payments by terminal state")
                .tag("status", status.name().toLowerCase(Locale.ROOT))
                .register(meterRegistry)
                .increment();
        paymentLatencyTimer.record(latency);

        log.debug("Recorded payment outcome: status={}, latencyMs={}", status, latency.toMillis());
    }

    public void recordPublishFailure() {
        publishFailureCounter.increment();
    }

    public void recordStoreFailure() {
        storeFailureCounter.increment();
    }

    public void recordRejectedEvent() {
        rejectedEventCounter.increment();
    }
}
