package com.aegis.screening.payment;

import com.aegis.screening.domain.Decision;
import com.aegis.screening.domain.ScreeningResult;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;
import java.time.Instant;

/**
 * Combined outcome for one payment. A party whose screening failed or did
 * not finish in time has a null result and contributed no risk.
 */
@Getter
@Builder
@ToString
public class PaymentScreeningResult {

    private final String paymentId;
    private final String transactionId;
    private final ScreeningResult senderResult;
    private final ScreeningResult recipientResult;
    private final double combinedRiskScore;
    private final Decision decision;
    private final PaymentScreeningStatus status;
    private final Duration latency;
    private final Instant screenedAt;
    private final PaymentResultMetadata metadata;

    public String routingKey() {
        return "screening.result." + decision.routingSuffix();
    }
}
