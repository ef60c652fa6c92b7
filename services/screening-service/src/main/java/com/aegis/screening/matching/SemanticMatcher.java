package com.aegis.screening.matching;

import com.aegis.screening.semantic.SimilarityProvider;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Meaning-level name comparison through the configured {@link SimilarityProvider}.
 *
 * <p>Each candidate name is sent as one batch query against all record names;
 * the best score over the whole cartesian product wins. A provider failure is
 * reported as a failed outcome and never propagates.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SemanticMatcher {

    private final SimilarityProvider similarityProvider;

    public StrategyOutcome score(List<String> candidateNames, List<String> recordNames) {
        if (candidateNames.isEmpty() || recordNames.isEmpty()) {
            return StrategyOutcome.scored(0.0);
        }
        try {
            double best = 0.0;
            for (String query : candidateNames) {
                List<Double> scores = similarityProvider.batchSimilarity(query, recordNames);
                for (Double score : scores) {
                    if (score != null && score > best) {
                        best = score;
                    }
                }
            }
            return StrategyOutcome.scored(best);
        } catch (RuntimeException e) {
            log.warn("Similarity provider failed for {} candidate names: {}", candidateNames.size(), e.getMessage());
            return StrategyOutcome.failed(e.getMessage());
        }
    }
}
