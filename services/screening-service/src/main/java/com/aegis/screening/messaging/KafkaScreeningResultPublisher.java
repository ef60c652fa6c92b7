package com.aegis.screening.messaging;

import com.aegis.screening.config.ScreeningProperties;
import com.aegis.screening.metrics.ScreeningMetricsService;
import com.aegis.screening.payment.PaymentScreeningResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.header.internals.RecordHeader;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;

/**
 * Publishes payment screening results to the result topic.
 *
 * Records are keyed by payment id so every result for a payment lands on the
 * same partition, and carry a {@code routing-key} header of the form
 * {@code screening.result.<decision>} for downstream routing.
 * Send failures are logged and counted, never rethrown.
 *
 * @author Aegis Screening Team
 * @since 1.0.0
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class KafkaScreeningResultPublisher implements ScreeningResultPublisher {

    static final String ROUTING_KEY_HEADER = "routing-key";

    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final ScreeningProperties properties;
    private final ScreeningMetricsService metricsService;

    @Override
    public void publish(PaymentScreeningResult result, String routingKey) {
        String topic = properties.getKafka().getResultTopic();
        ProducerRecord<String, Object> record = new ProducerRecord<>(topic, result.getPaymentId(), result);
        record.headers().add(new RecordHeader(ROUTING_KEY_HEADER, routingKey.getBytes(StandardCharsets.UTF_8)));

        try {
            kafkaTemplate.send(record).whenComplete((sendResult, ex) -> {
                if (ex == null) {
                    log.debug("Published screening result: paymentId={}, routingKey={}, offset={}",
                        result.getPaymentId(), routingKey, sendResult.getRecordMetadata().offset());
                } else {
                    metricsService.recordPublishFailure();
                    log.error("Failed to publish screening result: paymentId={}, routingKey={}",
                        result.getPaymentId(), routingKey, ex);
                }
            });
        } catch (RuntimeException e) {
            metricsService.recordPublishFailure();
            log.error("Failed to hand screening result to Kafka: paymentId={}, routingKey={}",
                result.getPaymentId(), routingKey, e);
        }
    }
}
