package com.aegis.screening.metrics;

import com.aegis.screening.domain.Decision;
import com.aegis.screening.domain.ScreeningMetadata;
import com.aegis.screening.domain.ScreeningResult;
import com.aegis.screening.payment.PaymentScreeningStatus;
import com.aegis.screening.payment.PaymentStatisticsTracker;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ScreeningMetricsService")
class ScreeningMetricsServiceTest {

    private SimpleMeterRegistry registry;
    private PaymentStatisticsTracker tracker;
    private ScreeningMetricsService metricsService;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        tracker = new PaymentStatisticsTracker(10);
        metricsService = new ScreeningMetricsService(registry, tracker);
        metricsService.initMetrics();
    }

    @Test
    @DisplayName("Payment outcomes are counted per terminal state")
    void countsPaymentOutcomes() {
        metricsService.recordPaymentOutcome(PaymentScreeningStatus.BLOCKED, Duration.ofMillis(40));
        metricsService.recordPaymentOutcome(PaymentScreeningStatus.BLOCKED, Duration.ofMillis(60));
        metricsService.recordPaymentOutcome(PaymentScreeningStatus.CLEARED, Duration.ofMillis(5));

        assertThat(registry.get("screening.payment.total").tag("status", "blocked").counter().count()).isEqualTo(2.0);
        assertThat(registry.get("screening.payment.total").tag("status", "cleared").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("screening.payment.duration").timer().count()).isEqualTo(3);
    }

    @Test
    @DisplayName("The moving average gauge reads the statistics window")
    void gaugeFollowsTracker() {
        tracker.record(PaymentScreeningStatus.CLEARED, Duration.ofMillis(20));
        tracker.record(PaymentScreeningStatus.REVIEW, Duration.ofMillis(40));

        assertThat(registry.get("screening.payment.latency.moving.average.ms").gauge().value()).isEqualTo(30.0);
    }

    @Test
    @DisplayName("Publish and store failures have their own counters")
    void countsFailures() {
        metricsService.recordPublishFailure();
        metricsService.recordStoreFailure();
        metricsService.recordStoreFailure();
        metricsService.recordRejectedEvent();

        assertThat(registry.get("screening.publish.failures.total").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("screening.store.failures.total").counter().count()).isEqualTo(2.0);
        assertThat(registry.get("screening.payment.rejected.total").counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Skipped record evaluations are added to the failure counter")
    void countsFailedEvaluations() {
        metricsService.recordCandidateScreening(ScreeningResult.builder()
            .findings(List.of())
            .decision(Decision.CLEAR)
            .metadata(ScreeningMetadata.builder().recordsEvaluated(10).failedEvaluations(3).build())
            .build());

        assertThat(registry.get("screening.candidate.total").tag("decision", "CLEAR").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("screening.record.evaluation.failures.total").counter().count()).isEqualTo(3.0);
    }
}
