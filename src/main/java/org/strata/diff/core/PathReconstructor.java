package org.strata.diff.core;

import org.strata.diff.cost.Edge;
import org.strata.diff.graph.Neighbour;
import org.strata.diff.graph.Vertex;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Recovers the edit path from predecessor links left by the search.
 */
final class PathReconstructor {
    static final String REASON_EDGE_NOT_FOUND = "DIFF_EDGE_NOT_FOUND";
    static final String REASON_PATH_COST_MISMATCH = "DIFF_PATH_COST_MISMATCH";

    private PathReconstructor() {
    }

    /**
     * Walks predecessor links back from {@code end} and returns the vertices in start-to-end order.
     */
    static List<Vertex> shortestVertexPath(Vertex end) {
        List<Vertex> reversed = new ArrayList<>();
        Vertex cursor = Objects.requireNonNull(end, "end");
        while (cursor != null) {
            reversed.add(cursor);
            cursor = cursor.predecessor();
        }
        Collections.reverse(reversed);
        return reversed;
    }

    /**
     * Returns the cheapest edge from {@code before} to {@code after}. On equal cost the edge
     * generated first wins.
     *
     * @throws DiffInvariantException when no edge connects the pair.
     */
    static Edge edgeBetween(Vertex before, Vertex after) {
        Edge best = null;
        if (before.hasNeighbours()) {
            for (Neighbour neighbour : before.neighbours()) {
                if (neighbour.to() != after) {
                    continue;
                }
                if (best == null || neighbour.edge().cost() < best.cost()) {
                    best = neighbour.edge();
                }
            }
        }
        if (best == null) {
            throw new DiffInvariantException(
                    REASON_EDGE_NOT_FOUND,
                    "no edge from " + before + " to " + after
            );
        }
        return best;
    }

    /**
     * Returns the moves of the shortest path ending at {@code end}, checking that their summed cost
     * equals the distance the search settled {@code end} at.
     */
    static List<PathStep> shortestPath(Vertex end, long expectedDistance) {
        List<Vertex> vertices = shortestVertexPath(end);
        List<PathStep> steps = new ArrayList<>(Math.max(0, vertices.size() - 1));
        long total = 0L;
        for (int i = 1; i < vertices.size(); i++) {
            Vertex before = vertices.get(i - 1);
            Vertex after = vertices.get(i);
            Edge edge = edgeBetween(before, after);
            total += edge.cost();
            steps.add(new PathStep(edge, before, after));
        }
        if (total != expectedDistance) {
            throw new DiffInvariantException(
                    REASON_PATH_COST_MISMATCH,
                    "path cost " + total + " does not match settled distance " + expectedDistance
            );
        }
        return steps;
    }
}
