package com.aegis.screening.payment;

import com.aegis.screening.domain.Candidate;
import com.aegis.screening.domain.EntityType;

/**
 * Payment parties are screened as individuals whose nationality is the
 * party's country
 */
final class PaymentPartyMapper {

    private PaymentPartyMapper() {
    }

    static Candidate toCandidate(String name, String country) {
        return Candidate.builder()
            .name(name)
            .nationality(country)
            .entityType(EntityType.INDIVIDUAL)
            .build();
    }
}
