package com.premiumlens.core.ingest;

import java.util.Collection;
import java.util.Objects;
import java.util.Optional;

/**
 * Levenshtein-based closest-match lookup used to repair misspelled
 * categorical values.
 *
 * @since 1.0.0
 */
public final class FuzzyMatcher {

    private FuzzyMatcher() {
        // utility class
    }

    /**
     * Similarity of two strings: {@code 1 - distance / max(length)}.
     *
     * @return value in [0, 1]; 1 for equal strings (including two empty ones)
     */
    public static double similarity(String a, String b) {
        Objects.requireNonNull(a, "a must not be null");
        Objects.requireNonNull(b, "b must not be null");
        int longest = Math.max(a.length(), b.length());
        if (longest == 0) {
            return 1.0;
        }
        return 1.0 - (double) distance(a, b) / longest;
    }

    /**
     * Find the candidate most similar to {@code value}.
     *
     * @param value      raw value
     * @param candidates legal values, in preference order for equal scores
     * @param threshold  minimum similarity in (0, 1]
     * @return best candidate at or above the threshold, or empty
     */
    public static Optional<String> bestMatch(String value, Collection<String> candidates, double threshold) {
        Objects.requireNonNull(candidates, "candidates must not be null");
        if (value == null || value.isEmpty()) {
            return Optional.empty();
        }
        String best = null;
        double bestScore = threshold;
        for (String candidate : candidates) {
            double score = similarity(value, candidate);
            if (score > bestScore || (best == null && score == bestScore)) {
                best = candidate;
                bestScore = score;
            }
        }
        return Optional.ofNullable(best);
    }

    /**
     * Classic two-row Levenshtein edit distance.
     */
    static int distance(String a, String b) {
        int[] previous = new int[b.length() + 1];
        int[] current = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) {
            previous[j] = j;
        }
        for (int i = 1; i <= a.length(); i++) {
            current[0] = i;
            for (int j = 1; j <= b.length(); j++) {
                int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
                current[j] = Math.min(Math.min(current[j - 1] + 1, previous[j] + 1), previous[j - 1] + cost);
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[b.length()];
    }
}
