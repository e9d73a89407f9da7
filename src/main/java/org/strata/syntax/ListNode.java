package org.strata.syntax;

import java.util.List;

/**
 * Delimited sequence of child nodes, e.g. {@code (a b c)} or {@code [x]}.
 */
public final class ListNode extends SyntaxNode {
    private final String openDelimiter;
    private final String closeDelimiter;
    private final List<SyntaxNode> children;
    private final int numDescendants;

    ListNode(
            SyntaxArena arena,
            int id,
            int contentId,
            String openDelimiter,
            List<SyntaxNode> children,
            String closeDelimiter
    ) {
        super(arena, id, contentId);
        this.openDelimiter = openDelimiter;
        this.closeDelimiter = closeDelimiter;
        this.children = List.copyOf(children);

        int descendants = 0;
        for (SyntaxNode child : this.children) {
            descendants += 1 + child.numDescendants();
        }
        this.numDescendants = descendants;
    }

    public String openDelimiter() {
        return openDelimiter;
    }

    public String closeDelimiter() {
        return closeDelimiter;
    }

    public List<SyntaxNode> children() {
        return children;
    }

    /**
     * First child, or {@code null} for an empty list.
     */
    public SyntaxNode firstChild() {
        return children.isEmpty() ? null : children.get(0);
    }

    /**
     * Returns whether both lists use the same open and close delimiters.
     */
    public boolean sameDelimiters(ListNode other) {
        return openDelimiter.equals(other.openDelimiter) && closeDelimiter.equals(other.closeDelimiter);
    }

    @Override
    public int numDescendants() {
        return numDescendants;
    }

    @Override
    public boolean isList() {
        return true;
    }

    @Override
    public String toString() {
        return "List{" + id() + " " + openDelimiter + "..." + closeDelimiter + ", children=" + children.size() + '}';
    }
}
