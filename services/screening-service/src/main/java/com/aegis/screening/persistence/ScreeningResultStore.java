package com.aegis.screening.persistence;

import com.aegis.screening.domain.ScreeningResult;
import com.aegis.screening.payment.PaymentScreeningResult;

import java.util.Optional;

/**
 * Audit sink for screening outcomes. Writes are fire-and-forget from the
 * caller's point of view: a failing store never changes a decision.
 */
public interface ScreeningResultStore {

    void store(ScreeningResult result);

    void store(PaymentScreeningResult result);

    Optional<PaymentScreeningResult> findByPaymentId(String paymentId);

    Optional<ScreeningResult> findByScreeningId(String screeningId);
}
