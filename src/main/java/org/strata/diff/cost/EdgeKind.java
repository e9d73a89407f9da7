package org.strata.diff.cost;

/**
 * Closed set of edit moves between two search states.
 */
public enum EdgeKind {
    /** Both cursors step over structurally equal nodes. */
    UNCHANGED_NODE,
    /** Both cursors descend into lists with matching delimiters. */
    ENTER_UNCHANGED_DELIMITER,
    /** Both cursors step over two different string literals. */
    REPLACED_STRING,
    /** Both cursors step over two different comments. */
    REPLACED_COMMENT,
    NOVEL_ATOM_LHS,
    NOVEL_ATOM_RHS,
    /** Old-side cursor descends into a list that has no counterpart. */
    ENTER_NOVEL_DELIMITER_LHS,
    /** New-side cursor descends into a list that has no counterpart. */
    ENTER_NOVEL_DELIMITER_RHS,
    /** Both cursors leave lists entered together. */
    EXIT_DELIMITER_BOTH,
    EXIT_DELIMITER_LHS,
    EXIT_DELIMITER_RHS;

    /**
     * Returns whether the move leaves a list rather than consuming a node.
     */
    public boolean isExit() {
        return this == EXIT_DELIMITER_BOTH || this == EXIT_DELIMITER_LHS || this == EXIT_DELIMITER_RHS;
    }
}
