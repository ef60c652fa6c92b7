package com.aegis.screening.exception;

import com.aegis.common.exception.ErrorCode;

import java.time.Duration;

/**
 * A payment did not finish screening within the configured deadline
 */
public class ScreeningTimeoutException extends ScreeningException {

    public ScreeningTimeoutException(String paymentId, Duration timeout) {
        super(ErrorCode.SCR_TIMEOUT,
            String.format("Screening of payment %s exceeded %d ms", paymentId, timeout.toMillis()));
        withMetadata("paymentId", paymentId);
    }
}
