package org.strata.diff.graph;

import org.strata.syntax.SyntaxNode;

import java.util.List;

/**
 * One search state: a cursor into each tree plus the lists the cursors are inside.
 *
 * <p>A {@code null} cursor means that side has consumed every node of its current sequence.
 * Vertices are allocated only by a {@link VertexArena}, which shares structurally identical
 * states. Besides the state, a vertex carries three per-search slots:</p>
 * <ul>
 * <li>a write-once neighbour list filled by {@link NeighbourExpander},</li>
 * <li>the best known predecessor and distance, used only to backtrack,</li>
 * <li>a visited flag set when the search settles the vertex.</li>
 * </ul>
 *
 * <p>Not thread-safe; confined to the search that owns its arena.</p>
 */
public final class Vertex {
    public static final long NO_DISTANCE = -1L;

    private final SyntaxNode lhsSyntax;
    private final SyntaxNode rhsSyntax;
    private final PersistentStack<EnteredDelimiter> parents;
    private final int arenaIndex;

    private List<Neighbour> neighbours;
    private Vertex predecessor;
    private long predecessorDistance = NO_DISTANCE;
    private boolean visited;

    Vertex(SyntaxNode lhsSyntax, SyntaxNode rhsSyntax, PersistentStack<EnteredDelimiter> parents, int arenaIndex) {
        this.lhsSyntax = lhsSyntax;
        this.rhsSyntax = rhsSyntax;
        this.parents = parents;
        this.arenaIndex = arenaIndex;
    }

    /**
     * Old-side cursor, or {@code null}.
     */
    public SyntaxNode lhsSyntax() {
        return lhsSyntax;
    }

    /**
     * New-side cursor, or {@code null}.
     */
    public SyntaxNode rhsSyntax() {
        return rhsSyntax;
    }

    public PersistentStack<EnteredDelimiter> parents() {
        return parents;
    }

    /**
     * Allocation order within the owning arena.
     */
    public int arenaIndex() {
        return arenaIndex;
    }

    /**
     * Accepting state: both trees fully consumed at top level.
     */
    public boolean isEnd() {
        return lhsSyntax == null && rhsSyntax == null && parents.isEmpty();
    }

    public boolean hasNeighbours() {
        return neighbours != null;
    }

    /**
     * Cached outgoing edges.
     *
     * @throws IllegalStateException if the vertex was never expanded.
     */
    public List<Neighbour> neighbours() {
        if (neighbours == null) {
            throw new IllegalStateException("neighbours not computed for " + this);
        }
        return neighbours;
    }

    void setNeighbours(List<Neighbour> computed) {
        if (neighbours != null) {
            throw new IllegalStateException("neighbours already computed for " + this);
        }
        neighbours = List.copyOf(computed);
    }

    public Vertex predecessor() {
        return predecessor;
    }

    /**
     * Best known distance from the start, or {@link #NO_DISTANCE}. The start vertex reports 0.
     */
    public long predecessorDistance() {
        return predecessorDistance;
    }

    /**
     * Records a shorter path to this vertex.
     */
    public void setPredecessor(long distance, Vertex from) {
        this.predecessorDistance = distance;
        this.predecessor = from;
    }

    /**
     * Marks the start vertex, which has distance 0 and no predecessor.
     */
    public void markStart() {
        this.predecessorDistance = 0L;
        this.predecessor = null;
    }

    public boolean isVisited() {
        return visited;
    }

    public void markVisited() {
        visited = true;
    }

    @Override
    public String toString() {
        return "Vertex{#" + arenaIndex +
                " lhs=" + (lhsSyntax == null ? "-" : lhsSyntax.id()) +
                ", rhs=" + (rhsSyntax == null ? "-" : rhsSyntax.id()) +
                ", parents=" + parents +
                '}';
    }
}
