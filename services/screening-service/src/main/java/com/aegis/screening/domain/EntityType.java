package com.aegis.screening.domain;

import com.aegis.screening.exception.InvalidCandidateException;

import java.util.Locale;

/**
 * Kind of party being screened or listed
 */
public enum EntityType {
    INDIVIDUAL,
    ORGANIZATION;

    /**
     * Parses a case-insensitive type tag. Blank input defaults to INDIVIDUAL.
     *
     * @throws InvalidCandidateException for an unknown tag
     */
    public static EntityType fromValue(String value) {
        if (value == null || value.isBlank()) {
            return INDIVIDUAL;
        }
        try {
            return EntityType.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidCandidateException("entityType", "Unsupported entity type: " + value, e);
        }
    }
}
