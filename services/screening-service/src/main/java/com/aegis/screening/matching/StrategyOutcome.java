package com.aegis.screening.matching;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Result of running one matching strategy against one record: either a score
 * in [0,1] or a failure tag. A failed outcome scores 0.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class StrategyOutcome {

    private static final StrategyOutcome ZERO = new StrategyOutcome(0.0, null);

    private final double score;
    private final String failureReason;

    private StrategyOutcome(double score, String failureReason) {
        this.score = score;
        this.failureReason = failureReason;
    }

    public static StrategyOutcome scored(double score) {
        if (Double.isNaN(score) || score <= 0.0) {
            return ZERO;
        }
        return new StrategyOutcome(Math.min(score, 1.0), null);
    }

    public static StrategyOutcome failed(String reason) {
        return new StrategyOutcome(0.0, reason != null ? reason : "unknown failure");
    }

    public boolean isFailed() {
        return failureReason != null;
    }

    public boolean meets(double threshold) {
        return !isFailed() && score >= threshold;
    }
}
