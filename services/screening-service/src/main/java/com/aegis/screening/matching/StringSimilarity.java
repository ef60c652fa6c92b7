package com.aegis.screening.matching;

import java.util.ArrayList;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Classical string similarity ratios on a 0-100 scale.
 *
 * <p>{@link #ratio} is the normalized indel similarity
 * {@code 200 * lcs(a, b) / (|a| + |b|)}; the partial and token variants are
 * built on top of it. Every ratio returns 0 when either input is empty.
 */
public final class StringSimilarity {

    private StringSimilarity() {
    }

    /**
     * Whole-string similarity of the normalized inputs
     */
    public static double ratio(String a, String b) {
        return rawRatio(NameNormalizer.normalize(a), NameNormalizer.normalize(b));
    }

    /**
     * Best whole-string similarity of the shorter input against every
     * equally long window of the longer one
     */
    public static double partialRatio(String a, String b) {
        String first = NameNormalizer.normalize(a);
        String second = NameNormalizer.normalize(b);
        if (first.isEmpty() || second.isEmpty()) {
            return 0.0;
        }
        String shorter = first.length() <= second.length() ? first : second;
        String longer = shorter == first ? second : first;
        if (shorter.length() == longer.length()) {
            return rawRatio(shorter, longer);
        }

        double best = 0.0;
        int window = shorter.length();
        for (int start = 0; start + window <= longer.length(); start++) {
            double score = rawRatio(shorter, longer.substring(start, start + window));
            if (score > best) {
                best = score;
                if (best >= 100.0) {
                    break;
                }
            }
        }
        return best;
    }

    /**
     * Word-order independent similarity: tokens are sorted before comparison
     */
    public static double tokenSortRatio(String a, String b) {
        List<String> first = new ArrayList<>(NameNormalizer.tokens(a));
        List<String> second = new ArrayList<>(NameNormalizer.tokens(b));
        if (first.isEmpty() || second.isEmpty()) {
            return 0.0;
        }
        first.sort(null);
        second.sort(null);
        return rawRatio(String.join(" ", first), String.join(" ", second));
    }

    /**
     * Set-overlap similarity: the shared tokens are compared with each side's
     * shared-plus-remaining tokens and the best pairing wins
     */
    public static double tokenSetRatio(String a, String b) {
        SortedSet<String> first = new TreeSet<>(NameNormalizer.tokens(a));
        SortedSet<String> second = new TreeSet<>(NameNormalizer.tokens(b));
        if (first.isEmpty() || second.isEmpty()) {
            return 0.0;
        }

        SortedSet<String> intersection = new TreeSet<>(first);
        intersection.retainAll(second);
        SortedSet<String> onlyFirst = new TreeSet<>(first);
        onlyFirst.removeAll(second);
        SortedSet<String> onlySecond = new TreeSet<>(second);
        onlySecond.removeAll(first);

        String sorted = String.join(" ", intersection);
        String combinedFirst = join(sorted, String.join(" ", onlyFirst));
        String combinedSecond = join(sorted, String.join(" ", onlySecond));

        return Math.max(rawRatio(sorted, combinedFirst),
            Math.max(rawRatio(sorted, combinedSecond), rawRatio(combinedFirst, combinedSecond)));
    }

    static double rawRatio(String a, String b) {
        if (a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }
        if (a.equals(b)) {
            return 100.0;
        }
        int lcs = longestCommonSubsequence(a, b);
        return 200.0 * lcs / (a.length() + b.length());
    }

    private static int longestCommonSubsequence(String a, String b) {
        int[] previous = new int[b.length() + 1];
        int[] current = new int[b.length() + 1];
        for (int i = 1; i <= a.length(); i++) {
            char ca = a.charAt(i - 1);
            for (int j = 1; j <= b.length(); j++) {
                if (ca == b.charAt(j - 1)) {
                    current[j] = previous[j - 1] + 1;
                } else {
                    current[j] = Math.max(previous[j], current[j - 1]);
                }
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[b.length()];
    }

    private static String join(String head, String tail) {
        if (head.isEmpty()) {
            return tail;
        }
        if (tail.isEmpty()) {
            return head;
        }
        return head + " " + tail;
    }
}
