package com.aegis.screening.payment;

import com.aegis.common.concurrent.ConcurrencyUtils;
import com.aegis.screening.config.ScreeningProperties;
import com.aegis.screening.domain.Decision;
import com.aegis.screening.domain.ScreeningResult;
import com.aegis.screening.domain.ScreeningThresholds;
import com.aegis.screening.engine.DecisionClassifier;
import com.aegis.screening.engine.ScreeningEngine;
import com.aegis.screening.exception.ScreeningTimeoutException;
import com.aegis.screening.messaging.ScreeningResultPublisher;
import com.aegis.screening.metrics.ScreeningMetricsService;
import com.aegis.screening.persistence.ScreeningResultStore;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;

/**
 * Screens both parties of a payment and emits one combined result.
 *
 * <p>Sender and recipient are screened concurrently and joined within the
 * configured timeout; tasks still running at the deadline are cancelled and
 * their results are never read. The combined risk is the higher of the two
 * parties. The run is fail-closed:
 * <ul>
 *   <li>a party whose screening throws is left out, contributes no risk and
 *       forces ERROR with a BLOCK decision</li>
 *   <li>a timeout, a saturated executor or any unexpected failure yields ERROR
 *       with risk 1.0 and BLOCK</li>
 * </ul>
 * Every run ends with exactly one statistics update, one store call and one
 * publish. Store and publish failures are logged and dropped.
 *
 * @author Aegis Screening Team
 * @since 1.0.0
 */
@Slf4j
@Service
public class PaymentScreeningOrchestrator {

    static final String MDC_PAYMENT_ID = "paymentId";

    private final ScreeningEngine screeningEngine;
    private final ScreeningThresholds thresholds;
    private final ExecutorService screeningExecutor;
    private final PaymentStatisticsTracker statisticsTracker;
    private final ScreeningResultStore resultStore;
    private final ScreeningResultPublisher resultPublisher;
    private final ScreeningMetricsService metricsService;
    private final Duration timeout;

    public PaymentScreeningOrchestrator(ScreeningEngine screeningEngine,
                                        ScreeningThresholds thresholds,
                                        @Qualifier("paymentScreeningExecutor") ExecutorService screeningExecutor,
                                        PaymentStatisticsTracker statisticsTracker,
                                        ScreeningResultStore resultStore,
                                        ScreeningResultPublisher resultPublisher,
                                        ScreeningMetricsService metricsService,
                                        ScreeningProperties properties) {
        this.screeningEngine = screeningEngine;
        this.thresholds = thresholds;
        this.screeningExecutor = screeningExecutor;
        this.statisticsTracker = statisticsTracker;
        this.resultStore = resultStore;
        this.resultPublisher = resultPublisher;
        this.metricsService = metricsService;
        this.timeout = properties.getPayment().getTimeout();
    }

    public PaymentScreeningResult process(PaymentEvent event) {
        long startNanos = System.nanoTime();
        MDC.put(MDC_PAYMENT_ID, event.getPaymentId());
        try {
            PaymentScreeningStatus status = PaymentScreeningStatus.RECEIVED;
            log.info("Screening payment {} ({} -> {})",
                event.getPaymentId(), event.getSenderName(), event.getRecipientName());

            PaymentScreeningResult result;
            try {
                status = transition(status, PaymentScreeningStatus.SCREENING);
                result = screenParties(event, startNanos);
            } catch (RuntimeException e) {
                log.error("Screening of payment {} failed unexpectedly", event.getPaymentId(), e);
                result = failClosed(event, null, null, startNanos, false, "Unexpected failure: " + e.getMessage());
            }
            transition(status, result.getStatus());

            finish(result);
            return result;
        } finally {
            MDC.remove(MDC_PAYMENT_ID);
        }
    }

    public StatisticsSnapshot statistics() {
        return statisticsTracker.snapshot();
    }

    private PaymentScreeningResult screenParties(PaymentEvent event, long startNanos) {
        String paymentId = event.getPaymentId();
        List<Callable<ScreeningResult>> tasks = List.of(
            () -> screenParty(paymentId, event.getSenderName(), event.getSenderCountry()),
            () -> screenParty(paymentId, event.getRecipientName(), event.getRecipientCountry())
        );

        List<Future<ScreeningResult>> futures;
        try {
            futures = ConcurrencyUtils.invokeAllWithin(tasks, screeningExecutor, timeout);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Interrupted while screening payment {}", paymentId);
            return failClosed(event, null, null, startNanos, false, "Screening interrupted");
        } catch (RejectedExecutionException e) {
            log.error("Screening executor saturated, payment {} not screened", paymentId);
            return failClosed(event, null, null, startNanos, false, "Screening executor saturated");
        }

        PartyOutcome sender = collect(futures.get(0), paymentId, "sender");
        PartyOutcome recipient = collect(futures.get(1), paymentId, "recipient");

        if (sender.timedOut() || recipient.timedOut()) {
            ScreeningTimeoutException timeoutException = new ScreeningTimeoutException(paymentId, timeout);
            log.error("{}", timeoutException.getMessage());
            return failClosed(event, sender.result(), recipient.result(), startNanos, true,
                timeoutException.getMessage());
        }

        double combinedRisk = Math.max(riskOf(sender.result()), riskOf(recipient.result()));
        if (sender.error() != null || recipient.error() != null) {
            String description = describeFailures(sender, recipient);
            log.error("Payment {} failed closed: {}", paymentId, description);
            return build(event, sender.result(), recipient.result(), combinedRisk, Decision.BLOCK,
                PaymentScreeningStatus.ERROR, startNanos, false, description);
        }

        Decision decision = DecisionClassifier.decisionFor(combinedRisk, thresholds);
        return build(event, sender.result(), recipient.result(), combinedRisk, decision,
            PaymentScreeningStatus.fromDecision(decision), startNanos, false, null);
    }

    private ScreeningResult screenParty(String paymentId, String name, String country) {
        String previous = MDC.get(MDC_PAYMENT_ID);
        MDC.put(MDC_PAYMENT_ID, paymentId);
        try {
            ScreeningResult result = screeningEngine.screen(PaymentPartyMapper.toCandidate(name, country), thresholds);
            metricsService.recordCandidateScreening(result);
            return result;
        } finally {
            if (previous != null) {
                MDC.put(MDC_PAYMENT_ID, previous);
            } else {
                MDC.remove(MDC_PAYMENT_ID);
            }
        }
    }

    private PartyOutcome collect(Future<ScreeningResult> future, String paymentId, String party) {
        if (future.isCancelled()) {
            log.warn("Screening of {} for payment {} did not finish in time", party, paymentId);
            return new PartyOutcome(null, null, true);
        }
        try {
            return new PartyOutcome(future.get(), null, false);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("Screening of {} for payment {} failed", party, paymentId, cause);
            return new PartyOutcome(null, party + ": " + cause.getMessage(), false);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return new PartyOutcome(null, party + ": interrupted", false);
        }
    }

    private PaymentScreeningResult failClosed(PaymentEvent event, ScreeningResult sender, ScreeningResult recipient,
                                              long startNanos, boolean timedOut, String description) {
        return build(event, sender, recipient, 1.0, Decision.BLOCK, PaymentScreeningStatus.ERROR,
            startNanos, timedOut, description);
    }

    private PaymentScreeningResult build(PaymentEvent event, ScreeningResult sender, ScreeningResult recipient,
                                         double combinedRisk, Decision decision, PaymentScreeningStatus status,
                                         long startNanos, boolean timedOut, String errorDescription) {
        return PaymentScreeningResult.builder()
            .paymentId(event.getPaymentId())
            .transactionId(event.getTransactionId())
            .senderResult(sender)
            .recipientResult(recipient)
            .combinedRiskScore(combinedRisk)
            .decision(decision)
            .status(status)
            .latency(Duration.ofNanos(System.nanoTime() - startNanos))
            .screenedAt(Instant.now())
            .metadata(PaymentResultMetadata.builder()
                .paymentType(event.getPaymentType())
                .amount(event.getAmount())
                .currency(event.getCurrency())
                .timedOut(timedOut)
                .errorDescription(errorDescription)
                .build())
            .build();
    }

    private void finish(PaymentScreeningResult result) {
        statisticsTracker.record(result.getStatus(), result.getLatency());
        metricsService.recordPaymentOutcome(result.getStatus(), result.getLatency());

        try {
            resultStore.store(result);
        } catch (RuntimeException e) {
            metricsService.recordStoreFailure();
            log.error("Failed to store screening result for payment {}", result.getPaymentId(), e);
        }

        try {
            resultPublisher.publish(result, result.routingKey());
        } catch (RuntimeException e) {
            metricsService.recordPublishFailure();
            log.error("Failed to publish screening result for payment {}", result.getPaymentId(), e);
        }

        log.info("Payment {} screened: status={}, risk={}, latencyMs={}",
            result.getPaymentId(), result.getStatus(), result.getCombinedRiskScore(), result.getLatency().toMillis());
    }

    private static PaymentScreeningStatus transition(PaymentScreeningStatus from, PaymentScreeningStatus to) {
        if (!from.canTransitionTo(to)) {
            throw new IllegalStateException("Illegal screening transition " + from + " -> " + to);
        }
        return to;
    }

    private static double riskOf(ScreeningResult result) {
        return result != null ? result.getRiskScore() : 0.0;
    }

    private static String describeFailures(PartyOutcome sender, PartyOutcome recipient) {
        if (sender.error() != null && recipient.error() != null) {
            return sender.error() + "; " + recipient.error();
        }
        return sender.error() != null ? sender.error() : recipient.error();
    }

    private record PartyOutcome(ScreeningResult result, String error, boolean timedOut) {
    }
}
