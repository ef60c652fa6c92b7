package com.aegis.screening.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Evidence that a candidate matches one watchlist record under one strategy.
 *
 * <p>The risk contribution is derived from the confidence and never set
 * directly: an exact finding always carries confidence 1.0 and risk 1.0, any
 * other strategy contributes its confidence clamped to [0,1]. The mapping is
 * therefore non-decreasing in confidence for a fixed strategy.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class MatchFinding {

    private final WatchlistRecord record;
    private final Set<MatchedField> matchedFields;
    private final MatchStrategy strategy;
    private final double confidence;
    private final double riskContribution;

    private MatchFinding(WatchlistRecord record, Set<MatchedField> matchedFields,
                         MatchStrategy strategy, double confidence) {
        this.record = record;
        this.matchedFields = matchedFields.isEmpty()
            ? Collections.emptySet()
            : Collections.unmodifiableSet(EnumSet.copyOf(matchedFields));
        this.strategy = strategy;
        this.confidence = confidence;
        this.riskContribution = riskFor(strategy, confidence);
    }

    public static MatchFinding exact(WatchlistRecord record, Set<MatchedField> matchedFields) {
        return new MatchFinding(record, matchedFields, MatchStrategy.EXACT, 1.0);
    }

    public static MatchFinding of(WatchlistRecord record, Set<MatchedField> matchedFields,
                                  MatchStrategy strategy, double confidence) {
        if (strategy == MatchStrategy.EXACT) {
            return exact(record, matchedFields);
        }
        return new MatchFinding(record, matchedFields, strategy, clamp(confidence));
    }

    static double riskFor(MatchStrategy strategy, double confidence) {
        if (strategy == MatchStrategy.EXACT) {
            return 1.0;
        }
        return clamp(confidence);
    }

    private static double clamp(double value) {
        if (Double.isNaN(value) || value < 0.0) {
            return 0.0;
        }
        return Math.min(value, 1.0);
    }
}
