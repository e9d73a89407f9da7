package org.strata.diff.cost;

import lombok.experimental.UtilityClass;

/**
 * Edit-distance helpers used to price replaced strings and comments.
 */
@UtilityClass
public final class TokenSimilarity {

    /**
     * Levenshtein distance over Unicode code points.
     */
    public static int levenshtein(String lhs, String rhs) {
        int[] a = lhs.codePoints().toArray();
        int[] b = rhs.codePoints().toArray();
        if (a.length == 0) {
            return b.length;
        }
        if (b.length == 0) {
            return a.length;
        }

        // Two rolling rows over the shorter input.
        if (b.length > a.length) {
            int[] swap = a;
            a = b;
            b = swap;
        }
        int[] previous = new int[b.length + 1];
        int[] current = new int[b.length + 1];
        for (int j = 0; j <= b.length; j++) {
            previous[j] = j;
        }
        for (int i = 1; i <= a.length; i++) {
            current[0] = i;
            for (int j = 1; j <= b.length; j++) {
                int substitution = previous[j - 1] + (a[i - 1] == b[j - 1] ? 0 : 1);
                int deletion = previous[j] + 1;
                int insertion = current[j - 1] + 1;
                current[j] = Math.min(substitution, Math.min(deletion, insertion));
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[b.length];
    }

    /**
     * Similarity in {@code [0, 100]}: {@code 100 * (1 - distance / longerLength)}, floored.
     * Two empty inputs are fully similar.
     */
    public static int similarityPercent(String lhs, String rhs) {
        int longer = Math.max(lhs.codePointCount(0, lhs.length()), rhs.codePointCount(0, rhs.length()));
        if (longer == 0) {
            return 100;
        }
        int distance = levenshtein(lhs, rhs);
        return (int) ((100L * (longer - distance)) / longer);
    }
}
