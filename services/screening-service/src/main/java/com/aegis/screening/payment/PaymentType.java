package com.aegis.screening.payment;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

/**
 * Payment rail carrying the transfer
 */
public enum PaymentType {
    WIRE_TRANSFER,
    SEPA,
    SWIFT,
    ACH,
    RTGS,
    INTERNAL_TRANSFER,
    OTHER;

    /**
     * Lenient parse for inbound events: unknown or missing rails map to OTHER
     * so that a new rail never stops a payment from being screened.
     */
    @JsonCreator
    public static PaymentType fromValue(String value) {
        if (value == null || value.isBlank()) {
            return OTHER;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        for (PaymentType type : values()) {
            if (type.name().equals(normalized)) {
                return type;
            }
        }
        return OTHER;
    }
}
