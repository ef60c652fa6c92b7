package com.aegis.screening.messaging;

import com.aegis.screening.metrics.ScreeningMetricsService;
import com.aegis.screening.payment.PaymentEvent;
import com.aegis.screening.payment.PaymentScreeningOrchestrator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.kafka.support.KafkaHeaders;
import org.springframework.messaging.handler.annotation.Header;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.stereotype.Component;

/**
 * Kafka consumer for payments awaiting sanctions screening
 *
 * Each listener thread screens one payment at a time, so the listener
 * concurrency is the upper bound of payments in flight.
 *
 * RESILIENCE:
 * - Manual acknowledgment once the orchestrator has returned
 * - The orchestrator fails closed, so every delivered payment yields a result
 * - Events without a payment id are counted as rejected and skipped
 * - Undeserializable messages are logged and skipped by the container error handler
 *
 * @author Aegis Screening Team
 * @since 1.0.0
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PaymentEventConsumer {

    private final PaymentScreeningOrchestrator orchestrator;
    private final ScreeningMetricsService metricsService;

    @KafkaListener(
        topics = "${screening.kafka.payment-topic}",
        groupId = "${screening.kafka.consumer-group}",
        concurrency = "${screening.kafka.concurrency}",
        containerFactory = "paymentEventListenerContainerFactory"
    )
    public void consumePaymentEvent(
            @Payload(required = false) PaymentEvent event,
            @Header(name = KafkaHeaders.RECEIVED_KEY, required = false) String key,
            @Header(KafkaHeaders.RECEIVED_PARTITION) int partition,
            @Header(KafkaHeaders.OFFSET) long offset,
            Acknowledgment acknowledgment) {

        if (event == null || event.getPaymentId() == null || event.getPaymentId().isBlank()) {
            log.warn("Discarding payment event without payment id: key={}, partition={}, offset={}",
                key, partition, offset);
            metricsService.recordRejectedEvent();
            acknowledgment.acknowledge();
            return;
        }

        log.debug("Received payment event: paymentId={}, key={}, partition={}, offset={}",
            event.getPaymentId(), key, partition, offset);

        try {
            orchestrator.process(event);
        } catch (Exception e) {
            log.error("Failed to screen payment event: paymentId={}, partition={}, offset={}",
                event.getPaymentId(), partition, offset, e);
        } finally {
            acknowledgment.acknowledge();
        }
    }
}
