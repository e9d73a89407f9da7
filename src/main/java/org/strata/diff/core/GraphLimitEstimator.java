package org.strata.diff.core;

import lombok.experimental.UtilityClass;
import org.strata.syntax.SyntaxTree;

/**
 * Search-space estimates derived from tree sizes.
 *
 * <p>The alignment graph has roughly one vertex per pair of cursor positions, so sizes scale
 * with {@code lhsNodes * rhsNodes}. Estimates saturate instead of overflowing.</p>
 */
@UtilityClass
public final class GraphLimitEstimator {
    private static final int PAIR_FACTOR = 2;

    /**
     * Proposes a graph limit proportional to the product of node counts, capped at {@code ceiling}.
     */
    public static int estimate(SyntaxTree lhs, SyntaxTree rhs, int ceiling) {
        if (ceiling <= 0) {
            throw new IllegalArgumentException("ceiling must be positive, got " + ceiling);
        }
        long lhsCount = Math.max(1, lhs.nodeCount());
        long rhsCount = Math.max(1, rhs.nodeCount());
        long proposed = saturatingMultiply(saturatingMultiply(lhsCount + 1, rhsCount + 1), PAIR_FACTOR);
        return (int) Math.min(ceiling, proposed);
    }

    /**
     * Initial seen-table capacity. Only affects allocation, never results.
     */
    public static int sizeHint(SyntaxTree lhs, SyntaxTree rhs, int graphLimit) {
        long product = saturatingMultiply(lhs.nodeCount(), rhs.nodeCount());
        return (int) Math.max(0L, Math.min(graphLimit, product));
    }

    private static long saturatingMultiply(long a, long b) {
        if (a != 0 && b > Long.MAX_VALUE / a) {
            return Long.MAX_VALUE;
        }
        return a * b;
    }
}
