package com.aegis.screening.messaging;

import com.aegis.screening.payment.PaymentScreeningResult;

/**
 * Outbound side of the payment pipeline
 */
public interface ScreeningResultPublisher {

    /**
     * Hands a result to the broker. Delivery failures are the publisher's to
     * log; they must not change the result.
     */
    void publish(PaymentScreeningResult result, String routingKey);
}
