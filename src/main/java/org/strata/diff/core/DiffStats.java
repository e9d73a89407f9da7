package org.strata.diff.core;

import lombok.Builder;
import lombok.Value;

/**
 * Immutable execution telemetry for one diff.
 */
@Value
@Builder
public class DiffStats {

    /** Configured bound on distinct vertices. */
    int graphLimit;

    /** Distinct vertices allocated when the search stopped. */
    int verticesAllocated;

    /** Vertices settled by the search. Zero when the graph limit stopped it. */
    int verticesPopped;

    /** Largest frontier size observed. */
    int peakFrontierSize;

    /** Number of moves on the reconstructed path. Zero when no path was found. */
    int pathLength;

    /** Settle distances in pop order when tracing was enabled, otherwise empty. */
    long[] poppedDistances;

    static DiffStats exceeded(int graphLimit, int verticesAllocated) {
        return DiffStats.builder()
                .graphLimit(graphLimit)
                .verticesAllocated(verticesAllocated)
                .poppedDistances(new long[0])
                .build();
    }
}
