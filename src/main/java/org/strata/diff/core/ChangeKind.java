package org.strata.diff.core;

/**
 * Classification of one syntax node after alignment.
 */
public enum ChangeKind {
    /** Present on both sides; the opposite node is recorded. */
    UNCHANGED,
    /** Present only in the old tree. */
    NOVEL_OLD,
    /** Present only in the new tree. */
    NOVEL_NEW,
    /** String literal aligned with a different string literal. */
    REPLACED_STRING,
    /** Comment aligned with a different comment. */
    REPLACED_COMMENT;

    public boolean isNovel() {
        return this == NOVEL_OLD || this == NOVEL_NEW;
    }

    /**
     * Returns whether the node has a counterpart on the other side.
     */
    public boolean isPaired() {
        return !isNovel();
    }
}
