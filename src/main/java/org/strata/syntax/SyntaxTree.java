package org.strata.syntax;

import java.util.ArrayDeque;
import java.util.List;
import java.util.function.Consumer;

/**
 * Sealed top-level node sequence for one version of a source file.
 *
 * <p>An empty tree stands for an absent side of a diff (a created or deleted file).</p>
 */
public final class SyntaxTree {
    private static final SyntaxTree EMPTY = new SyntaxTree(null, List.of(), 0);

    private final SyntaxArena arena;
    private final List<SyntaxNode> roots;
    private final int nodeCount;

    SyntaxTree(SyntaxArena arena, List<SyntaxNode> roots, int nodeCount) {
        this.arena = arena;
        this.roots = roots;
        this.nodeCount = nodeCount;
    }

    /**
     * Shared empty tree.
     */
    public static SyntaxTree empty() {
        return EMPTY;
    }

    public List<SyntaxNode> roots() {
        return roots;
    }

    /**
     * First top-level node, or {@code null} when the tree is empty.
     */
    public SyntaxNode firstRoot() {
        return roots.isEmpty() ? null : roots.get(0);
    }

    public boolean isEmpty() {
        return roots.isEmpty();
    }

    /**
     * Total number of nodes at every depth.
     */
    public int nodeCount() {
        return nodeCount;
    }

    /**
     * Returns whether both trees were built from the same arena. Empty trees are compatible with any tree.
     */
    public boolean sharesArenaWith(SyntaxTree other) {
        return arena == null || other.arena == null || arena == other.arena;
    }

    /**
     * Visits every node in depth-first pre-order.
     */
    public void forEachNode(Consumer<SyntaxNode> visitor) {
        ArrayDeque<SyntaxNode> pending = new ArrayDeque<>();
        for (int i = roots.size() - 1; i >= 0; i--) {
            pending.push(roots.get(i));
        }
        while (!pending.isEmpty()) {
            SyntaxNode node = pending.pop();
            visitor.accept(node);
            if (node instanceof ListNode) {
                List<SyntaxNode> children = ((ListNode) node).children();
                for (int i = children.size() - 1; i >= 0; i--) {
                    pending.push(children.get(i));
                }
            }
        }
    }
}
