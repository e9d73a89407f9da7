package org.strata.diff.search;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Deterministic bound on search-graph growth for one diff.
 *
 * <p>The bound counts distinct vertices, not time, so a diff that fails on one machine fails
 * identically on every other.</p>
 */
public final class SearchBudget {
    public static final String REASON_GRAPH_LIMIT_EXCEEDED = "DIFF_GRAPH_LIMIT_EXCEEDED";

    private final int graphLimit;

    private SearchBudget(int graphLimit) {
        if (graphLimit < 0) {
            throw new IllegalArgumentException("graphLimit must be >= 0, got " + graphLimit);
        }
        this.graphLimit = graphLimit;
    }

    /**
     * Creates a budget allowing at most {@code graphLimit} distinct vertices.
     */
    public static SearchBudget of(int graphLimit) {
        return new SearchBudget(graphLimit);
    }

    public int graphLimit() {
        return graphLimit;
    }

    /**
     * Validates the number of distinct vertices allocated so far.
     *
     * @throws GraphLimitExceededException when {@code vertexCount > graphLimit}.
     */
    public void checkGraphSize(int vertexCount) {
        if (vertexCount > graphLimit) {
            throw new GraphLimitExceededException(graphLimit, vertexCount);
        }
    }

    /**
     * Deterministic fail-fast signal for an oversized search graph.
     */
    @Getter
    @Accessors(fluent = true)
    public static final class GraphLimitExceededException extends RuntimeException {
        private final int graphLimit;
        private final int vertexCount;

        GraphLimitExceededException(int graphLimit, int vertexCount) {
            super("graph limit exceeded: " + vertexCount + " > " + graphLimit);
            this.graphLimit = graphLimit;
            this.vertexCount = vertexCount;
        }

        public String reasonCode() {
            return REASON_GRAPH_LIMIT_EXCEEDED;
        }
    }
}
