package com.aegis.screening.payment;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Inbound payment to be screened, as delivered on the payment topic
 */
@Getter
@Builder
@Jacksonized
@ToString
@JsonIgnoreProperties(ignoreUnknown = true)
public class PaymentEvent {

    private final String paymentId;
    private final String transactionId;
    private final String senderName;
    private final String senderCountry;
    private final String recipientName;
    private final String recipientCountry;
    private final BigDecimal amount;
    private final String currency;
    private final PaymentType paymentType;
    private final Instant timestamp;
    private final PaymentMetadata metadata;
}
