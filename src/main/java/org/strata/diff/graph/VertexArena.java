package org.strata.diff.graph;

import it.unimi.dsi.fastutil.objects.Object2ObjectOpenHashMap;
import org.strata.syntax.SyntaxNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Owns every vertex of one diff invocation and doubles as the seen table.
 *
 * <p>Vertices are interned by {@code (lhs cursor, rhs cursor, entered delimiters)}, so two edit
 * paths reaching the same state share one vertex and its predecessor slot. Forward links
 * (neighbour lists) and backward links (predecessors) point into this arena only; the whole
 * arena is dropped together once the diff returns.</p>
 *
 * <p>Not thread-safe. One arena per diff call.</p>
 */
public final class VertexArena {
    private static final int MAX_PRESIZE = 1 << 20;

    private final Object2ObjectOpenHashMap<StateKey, Vertex> seen;
    private final List<Vertex> vertices;

    /**
     * Creates an arena.
     *
     * @param sizeHint expected vertex count. Only affects initial allocation; clamped to a sane bound.
     */
    public VertexArena(int sizeHint) {
        int capacity = Math.max(16, Math.min(MAX_PRESIZE, sizeHint));
        this.seen = new Object2ObjectOpenHashMap<>(capacity);
        this.vertices = new ArrayList<>(capacity);
    }

    /**
     * Returns the unique vertex for a state, allocating it on first sight.
     */
    public Vertex intern(SyntaxNode lhsSyntax, SyntaxNode rhsSyntax, PersistentStack<EnteredDelimiter> parents) {
        Objects.requireNonNull(parents, "parents");
        StateKey key = new StateKey(lhsSyntax, rhsSyntax, parents);
        Vertex existing = seen.get(key);
        if (existing != null) {
            return existing;
        }
        Vertex created = new Vertex(lhsSyntax, rhsSyntax, parents, vertices.size());
        seen.put(key, created);
        vertices.add(created);
        return created;
    }

    /**
     * Allocates the start state for two sequences.
     */
    public Vertex start(SyntaxNode lhsRoot, SyntaxNode rhsRoot) {
        return intern(lhsRoot, rhsRoot, PersistentStack.empty());
    }

    /**
     * Number of distinct vertices allocated so far.
     */
    public int size() {
        return vertices.size();
    }

    /**
     * Returns the vertex allocated at {@code index}.
     */
    public Vertex get(int index) {
        return vertices.get(index);
    }

    /**
     * Search-state identity. Cursors compare by node reference.
     */
    private record StateKey(SyntaxNode lhs, SyntaxNode rhs, PersistentStack<EnteredDelimiter> parents) {
        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof StateKey)) {
                return false;
            }
            StateKey other = (StateKey) o;
            return lhs == other.lhs && rhs == other.rhs && parents.equals(other.parents);
        }

        @Override
        public int hashCode() {
            int result = lhs == null ? -1 : lhs.id();
            result = 31 * result + (rhs == null ? -1 : rhs.id());
            return 31 * result + parents.hashCode();
        }
    }
}
