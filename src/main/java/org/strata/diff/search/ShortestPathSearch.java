package org.strata.diff.search;

import it.unimi.dsi.fastutil.longs.LongArrayList;
import lombok.Getter;
import lombok.experimental.Accessors;
import lombok.extern.slf4j.Slf4j;
import org.strata.diff.cost.EdgeCostModel;
import org.strata.diff.graph.Neighbour;
import org.strata.diff.graph.NeighbourExpander;
import org.strata.diff.graph.Vertex;
import org.strata.diff.graph.VertexArena;

import java.util.Objects;

/**
 * Dijkstra search over the lazily expanded alignment graph.
 *
 * <p>Vertices are expanded only when settled. Stale frontier entries (a vertex pushed again at a
 * better distance) are skipped on pop via the visited flag rather than removed eagerly.
 * A vertex's predecessor is replaced only on a strict improvement, so among equal-cost paths the
 * first one discovered wins, which keeps results independent of allocation order.</p>
 *
 * <p>After every settled pop the arena size is checked against the {@link SearchBudget}; the
 * graph grows lazily, so a start-time check alone cannot bound adversarial inputs.</p>
 */
@Slf4j
public final class ShortestPathSearch {
    public static final String REASON_FRONTIER_EXHAUSTED = "DIFF_FRONTIER_EXHAUSTED";

    private static final long[] NO_TRACE = new long[0];

    private final SearchBudget budget;
    private final FrontierQueueType queueType;
    private final boolean traceDistances;

    /**
     * Creates a search.
     *
     * @param budget graph-size bound.
     * @param queueType frontier implementation.
     * @param traceDistances whether to record settle distances in pop order.
     */
    public ShortestPathSearch(SearchBudget budget, FrontierQueueType queueType, boolean traceDistances) {
        this.budget = Objects.requireNonNull(budget, "budget");
        this.queueType = Objects.requireNonNull(queueType, "queueType");
        this.traceDistances = traceDistances;
    }

    /**
     * Runs the search from {@code start} until the end vertex is settled.
     *
     * @throws SearchBudget.GraphLimitExceededException when the arena outgrows the graph limit.
     * @throws FrontierExhaustedException when the frontier empties before the end vertex is reached.
     */
    public SearchOutcome run(VertexArena arena, Vertex start) {
        FrontierQueue<Vertex> frontier = queueType.create(EdgeCostModel.maxEdgeCost());
        LongArrayList trace = traceDistances ? new LongArrayList() : null;

        start.markStart();
        frontier.push(0L, start);

        int popped = 0;
        int peakFrontier = 1;

        while (!frontier.isEmpty()) {
            Vertex current = frontier.pop();
            if (current.isVisited()) {
                continue;
            }
            current.markVisited();
            long distance = frontier.lastPoppedDistance();
            popped++;
            if (trace != null) {
                trace.add(distance);
            }

            budget.checkGraphSize(arena.size());

            if (current.isEnd()) {
                log.debug("Search settled end vertex at distance {} after {} pops ({} vertices)",
                        distance, popped, arena.size());
                return new SearchOutcome(
                        current,
                        distance,
                        popped,
                        arena.size(),
                        peakFrontier,
                        trace == null ? NO_TRACE : trace.toLongArray()
                );
            }

            NeighbourExpander.setNeighbours(current, arena);
            for (Neighbour neighbour : current.neighbours()) {
                Vertex next = neighbour.to();
                if (next.isVisited()) {
                    continue;
                }
                long candidate = distance + neighbour.edge().cost();
                long known = next.predecessorDistance();
                if (known == Vertex.NO_DISTANCE || candidate < known) {
                    next.setPredecessor(candidate, current);
                    frontier.push(candidate, next);
                }
            }
            peakFrontier = Math.max(peakFrontier, frontier.size());
        }

        throw new FrontierExhaustedException(
                "frontier exhausted after " + popped + " pops without reaching the end vertex ("
                        + arena.size() + " vertices)"
        );
    }

    /**
     * Raised when the edge set leaves the end vertex unreachable. Indicates a defect in neighbour
     * generation, never a property of the input.
     */
    @Getter
    @Accessors(fluent = true)
    public static final class FrontierExhaustedException extends IllegalStateException {
        private final String reasonCode = REASON_FRONTIER_EXHAUSTED;

        FrontierExhaustedException(String message) {
            super(message);
        }
    }
}
