package com.aegis.screening.semantic;

import com.aegis.screening.matching.NameNormalizer;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;

/**
 * Prepares a name for embedding: normalized, leading honorific and trailing
 * generational suffix removed
 */
public final class NamePreprocessor {

    private static final Set<String> PREFIXES = Set.of("mr.", "mrs.", "ms.", "dr.", "prof.", "sir", "madam");
    private static final Set<String> SUFFIXES = Set.of("jr.", "sr.", "ii", "iii", "iv");

    private NamePreprocessor() {
    }

    public static String preprocess(String name) {
        String normalized = NameNormalizer.normalize(name);
        if (normalized.isEmpty()) {
            return normalized;
        }
        List<String> tokens = new ArrayList<>(Arrays.asList(normalized.split(" ")));
        if (tokens.size() > 1 && PREFIXES.contains(tokens.get(0))) {
            tokens.remove(0);
        }
        if (tokens.size() > 1 && SUFFIXES.contains(tokens.get(tokens.size() - 1))) {
            tokens.remove(tokens.size() - 1);
        }
        return String.join(" ", tokens);
    }
}
