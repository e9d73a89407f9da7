package org.strata.syntax;

/**
 * Leaf token of a syntax tree.
 */
public final class AtomNode extends SyntaxNode {
    private final AtomKind kind;
    private final String content;

    AtomNode(SyntaxArena arena, int id, int contentId, AtomKind kind, String content) {
        super(arena, id, contentId);
        this.kind = kind;
        this.content = content;
    }

    public AtomKind kind() {
        return kind;
    }

    public String content() {
        return content;
    }

    @Override
    public int numDescendants() {
        return 0;
    }

    @Override
    public boolean isList() {
        return false;
    }

    @Override
    public String toString() {
        return "Atom{" + id() + " " + kind + " '" + content + "'}";
    }
}
