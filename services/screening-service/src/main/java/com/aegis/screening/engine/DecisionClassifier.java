package com.aegis.screening.engine;

import com.aegis.screening.domain.Decision;
import com.aegis.screening.domain.ScreeningThresholds;

/**
 * Maps an aggregate risk to a decision. Both bounds are inclusive on the
 * restrictive side: risk at the block threshold blocks, risk at the review
 * threshold goes to review.
 */
public final class DecisionClassifier {

    private DecisionClassifier() {
    }

    public static Decision decisionFor(double risk, ScreeningThresholds thresholds) {
        if (risk >= thresholds.getBlockThreshold()) {
            return Decision.BLOCK;
        }
        if (risk >= thresholds.getReviewThreshold()) {
            return Decision.REVIEW;
        }
        return Decision.CLEAR;
    }

    public static Classification classify(double risk, boolean hasFindings, ScreeningThresholds thresholds) {
        if (!hasFindings) {
            return new Classification(Decision.CLEAR, thresholds.getNoMatchConfidence());
        }
        Decision decision = decisionFor(risk, thresholds);
        double confidence = switch (decision) {
            case BLOCK -> thresholds.getBlockConfidence();
            case REVIEW -> thresholds.getReviewConfidence();
            case CLEAR -> thresholds.getClearConfidence();
        };
        return new Classification(decision, confidence);
    }
}
