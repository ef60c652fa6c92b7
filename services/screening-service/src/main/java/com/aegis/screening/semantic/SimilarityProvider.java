package com.aegis.screening.semantic;

import java.util.List;

/**
 * Meaning-level similarity between two names, in [0,1].
 *
 * <p>Implementations may throw {@link com.aegis.screening.exception.SimilarityProviderException};
 * callers treat that as a zero score for the affected comparison.
 */
public interface SimilarityProvider {

    double similarity(String a, String b);

    /**
     * Scores the query against every candidate. The returned list has the
     * same size and order as {@code candidates}.
     */
    List<Double> batchSimilarity(String query, List<String> candidates);

    default String providerName() {
        return getClass().getSimpleName();
    }
}
