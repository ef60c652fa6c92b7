package com.aegis.screening.matching;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Case and whitespace normalization shared by the matchers. No stemming.
 */
public final class NameNormalizer {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^\\p{L}\\p{N}]+");

    private NameNormalizer() {
    }

    /**
     * Lower-cases, trims and collapses runs of whitespace. Null becomes empty.
     */
    public static String normalize(String value) {
        if (value == null) {
            return "";
        }
        return WHITESPACE.matcher(value.trim()).replaceAll(" ").toLowerCase(Locale.ROOT);
    }

    /**
     * Normalization used by the token based ratios: punctuation is treated as a separator.
     */
    public static String normalizeForTokens(String value) {
        if (value == null) {
            return "";
        }
        return normalize(NON_ALPHANUMERIC.matcher(value).replaceAll(" "));
    }

    public static List<String> tokens(String value) {
        String processed = normalizeForTokens(value);
        if (processed.isEmpty()) {
            return List.of();
        }
        return Arrays.asList(WHITESPACE.split(processed));
    }
}
