package com.aegis.screening.matching;

import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Exact and fuzzy name comparison.
 *
 * <p>The fuzzy score is a fixed weighted average of four ratios
 * (whole-string 0.30, partial 0.20, token-sort 0.25, token-set 0.25) on a
 * 0-100 scale, normalized to [0,1]. Empty input scores 0.
 */
@Component
public class LexicalMatcher {

    static final double SIMPLE_WEIGHT = 0.30;
    static final double PARTIAL_WEIGHT = 0.20;
    static final double TOKEN_SORT_WEIGHT = 0.25;
    static final double TOKEN_SET_WEIGHT = 0.25;

    /**
     * True when any name on one side equals any name on the other after
     * trimming, lower-casing and whitespace collapsing
     */
    public boolean isExactMatch(List<String> names, List<String> otherNames) {
        Set<String> normalized = new HashSet<>();
        for (String name : names) {
            String value = NameNormalizer.normalize(name);
            if (!value.isEmpty()) {
                normalized.add(value);
            }
        }
        for (String other : otherNames) {
            if (normalized.contains(NameNormalizer.normalize(other))) {
                return true;
            }
        }
        return false;
    }

    /**
     * Weighted ratio on the 0-100 scale
     */
    public double weightedRatio(String a, String b) {
        if (isBlank(a) || isBlank(b)) {
            return 0.0;
        }
        return SIMPLE_WEIGHT * StringSimilarity.ratio(a, b)
            + PARTIAL_WEIGHT * StringSimilarity.partialRatio(a, b)
            + TOKEN_SORT_WEIGHT * StringSimilarity.tokenSortRatio(a, b)
            + TOKEN_SET_WEIGHT * StringSimilarity.tokenSetRatio(a, b);
    }

    /**
     * Weighted ratio normalized to [0,1]
     */
    public double similarity(String a, String b) {
        return Math.min(1.0, weightedRatio(a, b) / 100.0);
    }

    /**
     * Highest normalized similarity across every pairing of the two name lists
     */
    public double fuzzyScore(List<String> names, List<String> otherNames) {
        double best = 0.0;
        for (String name : names) {
            for (String other : otherNames) {
                best = Math.max(best, similarity(name, other));
            }
        }
        return best;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
