package org.strata.syntax;

/**
 * One node of a parsed syntax tree: either a delimited {@link ListNode} or a leaf {@link AtomNode}.
 *
 * <p>Nodes are created by a {@link SyntaxArena} and become read-only once the enclosing
 * {@link SyntaxTree} is sealed. Two kinds of identity are carried:</p>
 * <ul>
 * <li>{@link #id()} - unique per arena, used as the node key in change maps.</li>
 * <li>{@link #contentId()} - shared by every structurally equal subtree in the same arena.</li>
 * </ul>
 */
public abstract class SyntaxNode {
    private final SyntaxArena arena;
    private final int id;
    private final int contentId;

    private ListNode parent;
    private SyntaxNode nextSibling;
    private int depth;
    private boolean adopted;

    SyntaxNode(SyntaxArena arena, int id, int contentId) {
        this.arena = arena;
        this.id = id;
        this.contentId = contentId;
    }

    /**
     * Arena-unique node identity.
     */
    public int id() {
        return id;
    }

    /**
     * Structural identity. Equal for two nodes iff their subtrees are equal token for token.
     */
    public int contentId() {
        return contentId;
    }

    /**
     * Enclosing list, or {@code null} for top-level nodes.
     */
    public ListNode parent() {
        return parent;
    }

    /**
     * Following node in the same child sequence, or {@code null} for the last one.
     */
    public SyntaxNode nextSibling() {
        return nextSibling;
    }

    /**
     * Number of ancestors; top-level nodes have depth 0.
     */
    public int depth() {
        return depth;
    }

    /**
     * Number of nodes strictly below this one.
     */
    public abstract int numDescendants();

    public abstract boolean isList();

    public final boolean isAtom() {
        return !isList();
    }

    /**
     * Returns whether two nodes have the same structure and content.
     */
    public final boolean structurallyEquals(SyntaxNode other) {
        return other != null && arena == other.arena && contentId == other.contentId;
    }

    /**
     * Node identity is reference identity; hashing uses the arena id so hash layouts are reproducible.
     */
    @Override
    public final boolean equals(Object o) {
        return this == o;
    }

    @Override
    public final int hashCode() {
        return id;
    }

    SyntaxArena arena() {
        return arena;
    }

    /**
     * Claims this node for one parent sequence. A node belongs to exactly one tree position.
     */
    void adopt(ListNode newParent, SyntaxNode newNextSibling) {
        if (adopted) {
            throw new IllegalStateException("syntax node " + id + " already belongs to a tree");
        }
        this.adopted = true;
        this.parent = newParent;
        this.nextSibling = newNextSibling;
    }

    void setDepth(int depth) {
        this.depth = depth;
    }
}
