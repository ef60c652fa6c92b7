package com.aegis.screening.semantic;

import java.util.Collections;
import java.util.List;

/**
 * Provider used when no embedding service is configured. Scores everything 0.
 */
public class NoOpSimilarityProvider implements SimilarityProvider {

    @Override
    public double similarity(String a, String b) {
        return 0.0;
    }

    @Override
    public List<Double> batchSimilarity(String query, List<String> candidates) {
        return Collections.nCopies(candidates.size(), 0.0);
    }

    @Override
    public String providerName() {
        return "none";
    }
}
