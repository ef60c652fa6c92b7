package com.aegis.screening.payment;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;

@Getter
@Builder
@ToString
public class PaymentResultMetadata {

    private final PaymentType paymentType;
    private final BigDecimal amount;
    private final String currency;
    private final boolean timedOut;
    private final String errorDescription;
}
