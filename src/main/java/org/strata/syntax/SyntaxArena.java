package org.strata.syntax;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Factory and identity space for syntax nodes.
 *
 * <p>Both sides of one diff must be built from the same arena: node ids are unique per arena and
 * structural content ids are interned here, so equal subtrees on either side share one content id.
 * Nodes are built bottom-up; {@link #tree(List)} seals a top-level sequence.</p>
 *
 * <p>Not thread-safe. Build the trees on one thread, then share the sealed trees freely.</p>
 */
public final class SyntaxArena {
    private static final int NO_CONTENT_ID = -1;

    private final Object2IntOpenHashMap<Object> contentIds = new Object2IntOpenHashMap<>();
    private int nextNodeId;

    public SyntaxArena() {
        contentIds.defaultReturnValue(NO_CONTENT_ID);
    }

    /**
     * Creates a {@link AtomKind#NORMAL} atom.
     */
    public AtomNode atom(String content) {
        return atom(AtomKind.NORMAL, content);
    }

    /**
     * Creates an atom of the given kind.
     */
    public AtomNode atom(AtomKind kind, String content) {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(content, "content");
        int contentId = intern(new AtomKey(kind, content));
        return new AtomNode(this, nextNodeId++, contentId, kind, content);
    }

    /**
     * Creates a delimited list and adopts the children into it.
     *
     * @throws IllegalArgumentException when a child comes from another arena.
     * @throws IllegalStateException when a child already belongs to a list or tree.
     */
    public ListNode list(String openDelimiter, List<? extends SyntaxNode> children, String closeDelimiter) {
        Objects.requireNonNull(openDelimiter, "openDelimiter");
        Objects.requireNonNull(closeDelimiter, "closeDelimiter");
        Objects.requireNonNull(children, "children");

        IntArrayList childContentIds = new IntArrayList(children.size());
        for (SyntaxNode child : children) {
            requireOwned(child);
            childContentIds.add(child.contentId());
        }
        int contentId = intern(new ListKey(openDelimiter, closeDelimiter, childContentIds));
        ListNode list = new ListNode(this, nextNodeId++, contentId, openDelimiter, List.copyOf(children), closeDelimiter);
        link(list, list.children());
        return list;
    }

    /**
     * Convenience overload of {@link #list(String, List, String)}.
     */
    public ListNode list(String openDelimiter, String closeDelimiter, SyntaxNode... children) {
        return list(openDelimiter, Arrays.asList(children), closeDelimiter);
    }

    /**
     * Seals a top-level node sequence into a tree and computes node depths.
     */
    public SyntaxTree tree(List<? extends SyntaxNode> roots) {
        Objects.requireNonNull(roots, "roots");
        if (roots.isEmpty()) {
            return SyntaxTree.empty();
        }
        for (SyntaxNode root : roots) {
            requireOwned(root);
        }
        List<SyntaxNode> sealedRoots = List.copyOf(roots);
        link(null, sealedRoots);

        int nodeCount = 0;
        ArrayDeque<SyntaxNode> pending = new ArrayDeque<>(sealedRoots);
        while (!pending.isEmpty()) {
            SyntaxNode node = pending.pop();
            nodeCount++;
            if (node instanceof ListNode) {
                ListNode list = (ListNode) node;
                for (SyntaxNode child : list.children()) {
                    child.setDepth(list.depth() + 1);
                    pending.push(child);
                }
            }
        }
        return new SyntaxTree(this, sealedRoots, nodeCount);
    }

    /**
     * Convenience overload of {@link #tree(List)}.
     */
    public SyntaxTree tree(SyntaxNode... roots) {
        return tree(Arrays.asList(roots));
    }

    /**
     * Number of nodes created by this arena so far.
     */
    public int nodeCount() {
        return nextNodeId;
    }

    private void requireOwned(SyntaxNode node) {
        Objects.requireNonNull(node, "syntax node");
        if (node.arena() != this) {
            throw new IllegalArgumentException("syntax node " + node.id() + " belongs to another arena");
        }
    }

    private int intern(Object key) {
        int existing = contentIds.getInt(key);
        if (existing != NO_CONTENT_ID) {
            return existing;
        }
        int assigned = contentIds.size();
        contentIds.put(key, assigned);
        return assigned;
    }

    private static void link(ListNode parent, List<SyntaxNode> sequence) {
        for (int i = 0; i < sequence.size(); i++) {
            SyntaxNode next = i + 1 < sequence.size() ? sequence.get(i + 1) : null;
            sequence.get(i).adopt(parent, next);
        }
    }

    private record AtomKey(AtomKind kind, String content) {
    }

    private record ListKey(String openDelimiter, String closeDelimiter, IntArrayList childContentIds) {
    }
}
