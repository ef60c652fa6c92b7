package com.aegis.screening.domain;

/**
 * Identity attributes that can corroborate a finding
 */
public enum MatchedField {
    NAME,
    DATE_OF_BIRTH,
    NATIONALITY,
    PASSPORT_NUMBER
}
