package com.aegis.screening.persistence;

import com.aegis.screening.domain.ScreeningResult;
import com.aegis.screening.payment.PaymentScreeningResult;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Bounded in-memory store. Once full, the oldest entry is evicted.
 */
@Slf4j
public class InMemoryScreeningResultStore implements ScreeningResultStore {

    private final Map<String, ScreeningResult> screenings;
    private final Map<String, PaymentScreeningResult> payments;

    public InMemoryScreeningResultStore(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.screenings = boundedMap(capacity);
        this.payments = boundedMap(capacity);
    }

    @Override
    public void store(ScreeningResult result) {
        synchronized (screenings) {
            screenings.put(result.getScreeningId(), result);
        }
    }

    @Override
    public void store(PaymentScreeningResult result) {
        synchronized (payments) {
            payments.put(result.getPaymentId(), result);
        }
        log.debug("Stored screening result for payment {}", result.getPaymentId());
    }

    @Override
    public Optional<PaymentScreeningResult> findByPaymentId(String paymentId) {
        synchronized (payments) {
            return Optional.ofNullable(payments.get(paymentId));
        }
    }

    @Override
    public Optional<ScreeningResult> findByScreeningId(String screeningId) {
        synchronized (screenings) {
            return Optional.ofNullable(screenings.get(screeningId));
        }
    }

    private static <V> Map<String, V> boundedMap(int capacity) {
        return new LinkedHashMap<>(16, 0.75f, false) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, V> eldest) {
                return size() > capacity;
            }
        };
    }
}
