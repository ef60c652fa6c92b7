package com.aegis.screening.engine;

import com.aegis.screening.domain.MatchFinding;

import java.util.List;

/**
 * Combines finding risks into one score.
 *
 * <p>Each finding is weighted by its own risk, {@code sum(r^2) / sum(r)}, so
 * strong findings dominate weak ones and the result never exceeds the
 * largest contribution. No findings, or only zero-risk findings, score 0.
 */
public final class RiskAggregator {

    private RiskAggregator() {
    }

    public static double aggregate(List<MatchFinding> findings) {
        double weighted = 0.0;
        double total = 0.0;
        for (MatchFinding finding : findings) {
            double risk = finding.getRiskContribution();
            weighted += risk * risk;
            total += risk;
        }
        if (total <= 0.0) {
            return 0.0;
        }
        return Math.min(1.0, Math.max(0.0, weighted / total));
    }
}
