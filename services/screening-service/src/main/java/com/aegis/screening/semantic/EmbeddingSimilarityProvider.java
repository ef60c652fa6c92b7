package com.aegis.screening.semantic;

import com.aegis.screening.exception.SimilarityProviderException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Cosine similarity of sentence embeddings, clamped to [0,1].
 *
 * <p>Names are preprocessed before embedding. A batch call embeds the query
 * and all candidates in a single request. Any transport failure, open circuit
 * or malformed response surfaces as {@link SimilarityProviderException}.
 */
@Slf4j
@RequiredArgsConstructor
public class EmbeddingSimilarityProvider implements SimilarityProvider {

    private final EmbeddingServiceClient client;
    private final String model;

    @Override
    public double similarity(String a, String b) {
        List<Double> scores = batchSimilarity(a, List.of(b == null ? "" : b));
        return scores.get(0);
    }

    @Override
    public List<Double> batchSimilarity(String query, List<String> candidates) {
        if (candidates.isEmpty()) {
            return List.of();
        }
        String processedQuery = NamePreprocessor.preprocess(query);
        List<String> inputs = new ArrayList<>(candidates.size() + 1);
        inputs.add(processedQuery);
        for (String candidate : candidates) {
            inputs.add(NamePreprocessor.preprocess(candidate));
        }

        List<List<Double>> vectors = embed(inputs);
        List<Double> queryVector = vectors.get(0);
        List<Double> scores = new ArrayList<>(candidates.size());
        for (int i = 0; i < candidates.size(); i++) {
            if (processedQuery.isEmpty() || inputs.get(i + 1).isEmpty()) {
                scores.add(0.0);
            } else {
                scores.add(clamp(cosine(queryVector, vectors.get(i + 1))));
            }
        }
        return scores;
    }

    @Override
    public String providerName() {
        return "embedding";
    }

    private List<List<Double>> embed(List<String> inputs) {
        EmbeddingResponse response;
        try {
            response = client.embed(EmbeddingRequest.builder().model(model).inputs(inputs).build());
        } catch (RuntimeException e) {
            throw new SimilarityProviderException("Embedding service call failed: " + e.getMessage(), e);
        }
        if (response == null || response.getEmbeddings() == null
                || response.getEmbeddings().size() != inputs.size()) {
            throw new SimilarityProviderException(String.format(
                "Embedding service returned %d vectors for %d inputs",
                response == null || response.getEmbeddings() == null ? 0 : response.getEmbeddings().size(),
                inputs.size()));
        }
        return response.getEmbeddings();
    }

    static double cosine(List<Double> left, List<Double> right) {
        if (left == null || right == null || left.size() != right.size() || left.isEmpty()) {
            throw new SimilarityProviderException("Embedding vectors have mismatched dimensions");
        }
        double dot = 0.0;
        double leftNorm = 0.0;
        double rightNorm = 0.0;
        for (int i = 0; i < left.size(); i++) {
            double l = left.get(i);
            double r = right.get(i);
            dot += l * r;
            leftNorm += l * l;
            rightNorm += r * r;
        }
        if (leftNorm == 0.0 || rightNorm == 0.0) {
            return 0.0;
        }
        return dot / (Math.sqrt(leftNorm) * Math.sqrt(rightNorm));
    }

    private static double clamp(double value) {
        if (Double.isNaN(value) || value < 0.0) {
            return 0.0;
        }
        return Math.min(value, 1.0);
    }
}
