package com.aegis.screening.domain;

import java.util.Locale;

/**
 * Screening decision, ordered from least to most restrictive
 */
public enum Decision {
    CLEAR,
    REVIEW,
    BLOCK;

    /**
     * Routing suffix used when results are republished
     */
    public String routingSuffix() {
        return name().toLowerCase(Locale.ROOT);
    }
}
