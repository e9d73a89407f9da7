package org.strata.diff.search;

import org.strata.diff.graph.Vertex;

/**
 * Result of one successful shortest-path run.
 *
 * @param end settled end vertex; follow predecessors to recover the path.
 * @param totalDistance shortest distance from start to end.
 * @param verticesPopped number of vertices settled, end included.
 * @param verticesAllocated distinct vertices allocated in the arena.
 * @param peakFrontierSize largest frontier size observed.
 * @param poppedDistances settle distances in pop order, or an empty array when tracing is off.
 */
public record SearchOutcome(
        Vertex end,
        long totalDistance,
        int verticesPopped,
        int verticesAllocated,
        int peakFrontierSize,
        long[] poppedDistances
) {
}
