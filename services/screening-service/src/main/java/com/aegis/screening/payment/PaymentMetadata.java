package com.aegis.screening.payment;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import lombok.extern.jackson.Jacksonized;

/**
 * Optional payment context known to the screening pipeline. Anything else the
 * upstream system sends travels untouched in {@code extensions}.
 */
@Getter
@Builder
@Jacksonized
@ToString
@JsonIgnoreProperties(ignoreUnknown = true)
public class PaymentMetadata {

    private final String channel;
    private final String reference;
    private final String purpose;
    private final String originatingBank;
    private final String beneficiaryBank;
    private final String correlationId;
    private final JsonNode extensions;
}
