package org.strata.diff.core;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Objects;

/**
 * Outcome of one diff: either a completed alignment or a graph-limit bail-out.
 *
 * <p>A bail-out carries no partial change map; callers typically fall back to a cheaper
 * line-based diff.</p>
 */
@Getter
@Accessors(fluent = true)
public final class DiffResult {

    public enum Outcome {
        COMPLETED,
        EXCEEDED_GRAPH_LIMIT
    }

    private final Outcome outcome;
    @Getter(AccessLevel.NONE)
    private final ChangeMap changeMap;
    private final long totalCost;
    private final DiffStats stats;

    private DiffResult(Outcome outcome, ChangeMap changeMap, long totalCost, DiffStats stats) {
        this.outcome = outcome;
        this.changeMap = changeMap;
        this.totalCost = totalCost;
        this.stats = Objects.requireNonNull(stats, "stats");
    }

    static DiffResult completed(ChangeMap changeMap, long totalCost, DiffStats stats) {
        return new DiffResult(Outcome.COMPLETED, Objects.requireNonNull(changeMap, "changeMap"), totalCost, stats);
    }

    static DiffResult graphLimitExceeded(DiffStats stats) {
        return new DiffResult(Outcome.EXCEEDED_GRAPH_LIMIT, null, -1L, stats);
    }

    public boolean isCompleted() {
        return outcome == Outcome.COMPLETED;
    }

    public boolean exceededGraphLimit() {
        return outcome == Outcome.EXCEEDED_GRAPH_LIMIT;
    }

    /**
     * Sealed change map of a completed diff.
     *
     * @throws IllegalStateException when the diff exceeded the graph limit.
     */
    public ChangeMap changeMap() {
        if (changeMap == null) {
            throw new IllegalStateException("diff exceeded graph limit " + stats.getGraphLimit() + "; no change map");
        }
        return changeMap;
    }
}
