package org.strata.diff.core;

import org.strata.diff.cost.Edge;
import org.strata.diff.graph.Vertex;

/**
 * One move on the reconstructed shortest path.
 *
 * @param edge cheapest edge connecting {@code from} to {@code to}.
 * @param from vertex the move starts at; its cursors name the nodes the move consumes.
 * @param to vertex the move arrives at.
 */
public record PathStep(Edge edge, Vertex from, Vertex to) {
}
