package com.aegis.screening.domain;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Matching and decision thresholds applied to one screening call.
 *
 * <p>The service holds a default instance built from configuration; callers
 * override individual values with {@code defaults.toBuilder()...build()}.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class ScreeningThresholds {

    private final double fuzzyThreshold;
    private final double similarityThreshold;
    private final double fieldThreshold;
    private final double blockThreshold;
    private final double reviewThreshold;
    private final double blockConfidence;
    private final double reviewConfidence;
    private final double clearConfidence;
    private final double noMatchConfidence;

    @Builder(toBuilder = true)
    private ScreeningThresholds(double fuzzyThreshold, double similarityThreshold, double fieldThreshold,
                                double blockThreshold, double reviewThreshold,
                                double blockConfidence, double reviewConfidence,
                                double clearConfidence, double noMatchConfidence) {
        this.fuzzyThreshold = requireUnit("fuzzyThreshold", fuzzyThreshold);
        this.similarityThreshold = requireUnit("similarityThreshold", similarityThreshold);
        this.fieldThreshold = requireUnit("fieldThreshold", fieldThreshold);
        this.blockThreshold = requireUnit("blockThreshold", blockThreshold);
        this.reviewThreshold = requireUnit("reviewThreshold", reviewThreshold);
        this.blockConfidence = requireUnit("blockConfidence", blockConfidence);
        this.reviewConfidence = requireUnit("reviewConfidence", reviewConfidence);
        this.clearConfidence = requireUnit("clearConfidence", clearConfidence);
        this.noMatchConfidence = requireUnit("noMatchConfidence", noMatchConfidence);
        if (reviewThreshold > blockThreshold) {
            throw new IllegalArgumentException(String.format(
                "reviewThreshold (%.3f) must not exceed blockThreshold (%.3f)", reviewThreshold, blockThreshold));
        }
    }

    /**
     * Platform defaults: fuzzy 0.80, semantic 0.85, field 0.85, block at 0.90, review at 0.70
     */
    public static ScreeningThresholds defaults() {
        return ScreeningThresholds.builder()
            .fuzzyThreshold(0.80)
            .similarityThreshold(0.85)
            .fieldThreshold(0.85)
            .blockThreshold(0.90)
            .reviewThreshold(0.70)
            .blockConfidence(0.95)
            .reviewConfidence(0.85)
            .clearConfidence(0.90)
            .noMatchConfidence(1.0)
            .build();
    }

    private static double requireUnit(String name, double value) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new IllegalArgumentException(name + " must be within [0,1] but was " + value);
        }
        return value;
    }
}
