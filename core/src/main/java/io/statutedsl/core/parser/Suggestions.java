package io.statutedsl.core.parser;

import java.util.Collection;
import java.util.Locale;

/** "Did you mean" helpers based on Levenshtein edit distance. */
public final class Suggestions {

    private Suggestions() {
        // utility class
    }

    /** Classic Levenshtein distance (insertions, deletions and substitutions cost 1). */
    public static int levenshtein(String a, String b) {
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

    /**
     * Returns the candidate closest to {@code word} within {@code maxDistance}, or {@code null}.
     * Ties go to the candidate seen first. A candidate identical to {@code word} is never
     * suggested.
     *
     * @param ignoreCase compare case-insensitively (for keywords)
     */
    public static String closest(String word, Collection<String> candidates, int maxDistance, boolean ignoreCase) {
        if (word == null || maxDistance <= 0) {
            return null;
        }
        String probe = ignoreCase ? word.toUpperCase(Locale.ROOT) : word;
        String best = null;
        int bestDistance = Integer.MAX_VALUE;
        for (String candidate : candidates) {
            if (candidate.equals(word)) {
                continue;
            }
            String target = ignoreCase ? candidate.toUpperCase(Locale.ROOT) : candidate;
            int distance = levenshtein(probe, target);
            if (distance <= maxDistance && distance < bestDistance) {
                best = candidate;
                bestDistance = distance;
            }
        }
        return best;
    }
}
