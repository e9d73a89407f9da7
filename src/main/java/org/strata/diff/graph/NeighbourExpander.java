package org.strata.diff.graph;

import org.strata.diff.cost.Edge;
import org.strata.diff.cost.EdgeKind;
import org.strata.diff.cost.TokenSimilarity;
import org.strata.syntax.AtomKind;
import org.strata.syntax.AtomNode;
import org.strata.syntax.ListNode;
import org.strata.syntax.SyntaxNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Lazily computes the outgoing edges of a vertex.
 *
 * <p>Moves are generated in a fixed order so the graph, and therefore the chosen alignment,
 * is identical on every run:</p>
 * <ol>
 * <li>leave a pair of lists entered together (both cursors exhausted),</li>
 * <li>leave a novel old-side list, then a novel new-side list (that cursor exhausted),</li>
 * <li>step over a structurally equal pair,</li>
 * <li>enter a pair of lists with matching delimiters,</li>
 * <li>replace a string or comment with one of the same kind,</li>
 * <li>consume the old-side node as novel (atom) or enter it as a novel list,</li>
 * <li>the same for the new-side node.</li>
 * </ol>
 * Every vertex except the end vertex receives at least one edge.
 */
public final class NeighbourExpander {

    private NeighbourExpander() {
    }

    /**
     * Computes and caches neighbours of {@code vertex}. No-op when already computed.
     *
     * @param vertex vertex to expand.
     * @param arena arena owning {@code vertex}; newly reached states are allocated there.
     */
    public static void setNeighbours(Vertex vertex, VertexArena arena) {
        if (vertex.hasNeighbours()) {
            return;
        }

        List<Neighbour> neighbours = new ArrayList<>(4);
        SyntaxNode lhs = vertex.lhsSyntax();
        SyntaxNode rhs = vertex.rhsSyntax();
        PersistentStack<EnteredDelimiter> parents = vertex.parents();

        if (lhs == null && rhs == null) {
            EnteredDelimiter.Popped popped = EnteredDelimiter.tryPopBoth(parents);
            if (popped != null) {
                neighbours.add(new Neighbour(
                        Edge.of(EdgeKind.EXIT_DELIMITER_BOTH),
                        arena.intern(popped.lhsList().nextSibling(), popped.rhsList().nextSibling(), popped.remaining())
                ));
            }
        }

        if (lhs == null) {
            EnteredDelimiter.Popped popped = EnteredDelimiter.tryPopLhs(parents);
            if (popped != null) {
                neighbours.add(new Neighbour(
                        Edge.of(EdgeKind.EXIT_DELIMITER_LHS),
                        arena.intern(popped.lhsList().nextSibling(), rhs, popped.remaining())
                ));
            }
        }

        if (rhs == null) {
            EnteredDelimiter.Popped popped = EnteredDelimiter.tryPopRhs(parents);
            if (popped != null) {
                neighbours.add(new Neighbour(
                        Edge.of(EdgeKind.EXIT_DELIMITER_RHS),
                        arena.intern(lhs, popped.rhsList().nextSibling(), popped.remaining())
                ));
            }
        }

        if (lhs != null && rhs != null) {
            addPairedMoves(lhs, rhs, parents, arena, neighbours);
        }

        if (lhs != null) {
            if (lhs instanceof ListNode) {
                ListNode lhsList = (ListNode) lhs;
                neighbours.add(new Neighbour(
                        Edge.of(EdgeKind.ENTER_NOVEL_DELIMITER_LHS),
                        arena.intern(lhsList.firstChild(), rhs, EnteredDelimiter.pushLhs(parents, lhsList))
                ));
            } else {
                neighbours.add(new Neighbour(
                        Edge.of(EdgeKind.NOVEL_ATOM_LHS),
                        arena.intern(lhs.nextSibling(), rhs, parents)
                ));
            }
        }

        if (rhs != null) {
            if (rhs instanceof ListNode) {
                ListNode rhsList = (ListNode) rhs;
                neighbours.add(new Neighbour(
                        Edge.of(EdgeKind.ENTER_NOVEL_DELIMITER_RHS),
                        arena.intern(lhs, rhsList.firstChild(), EnteredDelimiter.pushRhs(parents, rhsList))
                ));
            } else {
                neighbours.add(new Neighbour(
                        Edge.of(EdgeKind.NOVEL_ATOM_RHS),
                        arena.intern(lhs, rhs.nextSibling(), parents)
                ));
            }
        }

        vertex.setNeighbours(neighbours);
    }

    private static void addPairedMoves(
            SyntaxNode lhs,
            SyntaxNode rhs,
            PersistentStack<EnteredDelimiter> parents,
            VertexArena arena,
            List<Neighbour> neighbours
    ) {
        int depthDifference = Math.abs(lhs.depth() - rhs.depth());

        if (lhs.structurallyEquals(rhs)) {
            neighbours.add(new Neighbour(
                    Edge.unchangedNode(depthDifference),
                    arena.intern(lhs.nextSibling(), rhs.nextSibling(), parents)
            ));
        }

        if (lhs instanceof ListNode && rhs instanceof ListNode) {
            ListNode lhsList = (ListNode) lhs;
            ListNode rhsList = (ListNode) rhs;
            if (lhsList.sameDelimiters(rhsList)) {
                neighbours.add(new Neighbour(
                        Edge.enterUnchangedDelimiter(depthDifference),
                        arena.intern(
                                lhsList.firstChild(),
                                rhsList.firstChild(),
                                EnteredDelimiter.pushBoth(parents, lhsList, rhsList)
                        )
                ));
            }
        }

        if (lhs instanceof AtomNode && rhs instanceof AtomNode) {
            AtomNode lhsAtom = (AtomNode) lhs;
            AtomNode rhsAtom = (AtomNode) rhs;
            Edge replacement = replacementEdge(lhsAtom, rhsAtom);
            if (replacement != null) {
                neighbours.add(new Neighbour(
                        replacement,
                        arena.intern(lhs.nextSibling(), rhs.nextSibling(), parents)
                ));
            }
        }
    }

    /**
     * Returns the replacement move for two differing strings or comments, or {@code null}.
     */
    private static Edge replacementEdge(AtomNode lhs, AtomNode rhs) {
        if (lhs.kind() != rhs.kind() || lhs.content().equals(rhs.content())) {
            return null;
        }
        if (lhs.kind() == AtomKind.STRING) {
            return Edge.replacedString(TokenSimilarity.similarityPercent(lhs.content(), rhs.content()));
        }
        if (lhs.kind() == AtomKind.COMMENT) {
            return Edge.replacedComment(TokenSimilarity.similarityPercent(lhs.content(), rhs.content()));
        }
        return null;
    }
}
