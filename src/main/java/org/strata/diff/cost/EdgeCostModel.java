package org.strata.diff.cost;

import lombok.experimental.UtilityClass;

/**
 * Fixed integer cost table for edit moves.
 *
 * <p>All costs are non-negative and bounded by {@link #maxEdgeCost()}, which the monotone
 * bucket frontier relies on. Costs are chosen so that:</p>
 * <ul>
 * <li>identical trees align at total cost 0,</li>
 * <li>matching across different nesting depths is slightly penalized,</li>
 * <li>replacing a string/comment is always cheaper than deleting plus inserting it,</li>
 * <li>leaving a list is free since its entry was already paid for.</li>
 * </ul>
 */
@UtilityClass
public final class EdgeCostModel {
    public static final int MAX_DEPTH_PENALTY = 40;
    public static final int REPLACEMENT_BASE_COST = 150;
    public static final int NOVEL_COST = 300;
    public static final int EXIT_COST = 0;

    /**
     * Returns the cost of one edge.
     */
    public static int cost(Edge edge) {
        return switch (edge.kind()) {
            case UNCHANGED_NODE, ENTER_UNCHANGED_DELIMITER -> Math.min(MAX_DEPTH_PENALTY, edge.depthDifference());
            case REPLACED_STRING, REPLACED_COMMENT -> REPLACEMENT_BASE_COST + (100 - edge.similarityPercent());
            case NOVEL_ATOM_LHS, NOVEL_ATOM_RHS, ENTER_NOVEL_DELIMITER_LHS, ENTER_NOVEL_DELIMITER_RHS -> NOVEL_COST;
            case EXIT_DELIMITER_BOTH, EXIT_DELIMITER_LHS, EXIT_DELIMITER_RHS -> EXIT_COST;
        };
    }

    /**
     * Upper bound over every edge cost the model can produce.
     */
    public static int maxEdgeCost() {
        return NOVEL_COST;
    }
}
