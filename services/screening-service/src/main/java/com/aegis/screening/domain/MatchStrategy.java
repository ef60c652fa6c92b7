package com.aegis.screening.domain;

/**
 * Strategy that produced a finding
 */
public enum MatchStrategy {
    EXACT,
    FUZZY,
    SEMANTIC
}
