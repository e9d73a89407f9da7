package org.strata.diff.graph;

import org.strata.diff.cost.Edge;

/**
 * Outgoing edge of a vertex.
 *
 * @param edge edit move taken.
 * @param to destination vertex, owned by the same arena.
 */
public record Neighbour(Edge edge, Vertex to) {
}
