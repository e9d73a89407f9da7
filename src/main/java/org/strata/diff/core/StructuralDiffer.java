package org.strata.diff.core;

import lombok.Builder;
import lombok.extern.slf4j.Slf4j;
import org.strata.diff.graph.Vertex;
import org.strata.diff.graph.VertexArena;
import org.strata.diff.search.SearchBudget;
import org.strata.diff.search.SearchOutcome;
import org.strata.diff.search.ShortestPathSearch;
import org.strata.syntax.SyntaxTree;

import java.util.List;
import java.util.Objects;

/**
 * Main structural diff entry point.
 *
 * <p>Execution flow for one call:</p>
 * <ul>
 * <li>Validate that both trees share one syntax arena (node ids key the change map).</li>
 * <li>Allocate a fresh vertex arena, pre-sized from the tree sizes.</li>
 * <li>Run the bounded shortest-path search from {@code (old root, new root)}.</li>
 * <li>Reconstruct the edit path and fold it into a sealed {@link ChangeMap}.</li>
 * </ul>
 *
 * <p>A graph-limit bail-out is returned as a typed {@link DiffResult}; engine defects surface as
 * {@link DiffInvariantException}. The differ holds no per-call state and can be shared across
 * threads; every call owns its arena, frontier and change map.</p>
 */
@Slf4j
public final class StructuralDiffer {
    public static final String REASON_ARENA_MISMATCH = "DIFF_ARENA_MISMATCH";
    public static final String REASON_CHANGE_MAP_NOT_EMPTY = "DIFF_CHANGE_MAP_NOT_EMPTY";
    public static final String REASON_FRONTIER_EXHAUSTED = ShortestPathSearch.REASON_FRONTIER_EXHAUSTED;

    private final DiffConfig config;

    /**
     * Creates a differ.
     *
     * @param config runtime configuration; {@link DiffConfig#defaults()} when {@code null}.
     */
    @Builder
    public StructuralDiffer(DiffConfig config) {
        this.config = config == null ? DiffConfig.defaults() : config;
    }

    /**
     * Creates a differ configured from system properties.
     */
    public static StructuralDiffer create() {
        return new StructuralDiffer(null);
    }

    public DiffConfig config() {
        return config;
    }

    /**
     * Diffs two trees into a fresh change map.
     *
     * @param lhs old tree, or {@code null} when the old side is absent.
     * @param rhs new tree, or {@code null} when the new side is absent.
     * @return completed result or graph-limit bail-out.
     * @throws DiffEngineException when the trees come from different arenas.
     * @throws DiffInvariantException on internal engine defects.
     */
    public DiffResult diff(SyntaxTree lhs, SyntaxTree rhs) {
        SyntaxTree left = lhs == null ? SyntaxTree.empty() : lhs;
        SyntaxTree right = rhs == null ? SyntaxTree.empty() : rhs;
        return diffInto(left, right, new ChangeMap(left.nodeCount() + right.nodeCount()));
    }

    /**
     * Diffs two trees into a caller-owned, empty change map. The map is sealed on success and left
     * empty on a graph-limit bail-out.
     *
     * @throws DiffEngineException when the map is not empty or the trees come from different arenas.
     */
    public DiffResult diffInto(SyntaxTree lhs, SyntaxTree rhs, ChangeMap target) {
        SyntaxTree left = lhs == null ? SyntaxTree.empty() : lhs;
        SyntaxTree right = rhs == null ? SyntaxTree.empty() : rhs;
        Objects.requireNonNull(target, "target");
        if (!target.isEmpty() || target.isSealed()) {
            throw new DiffEngineException(REASON_CHANGE_MAP_NOT_EMPTY, "target change map must be empty and unsealed");
        }
        if (!left.sharesArenaWith(right)) {
            throw new DiffEngineException(REASON_ARENA_MISMATCH, "old and new trees were built from different syntax arenas");
        }

        int graphLimit = config.getGraphLimit();
        VertexArena arena = new VertexArena(GraphLimitEstimator.sizeHint(left, right, graphLimit));
        Vertex start = arena.start(left.firstRoot(), right.firstRoot());
        ShortestPathSearch search = new ShortestPathSearch(
                SearchBudget.of(graphLimit),
                config.getQueueType(),
                config.isTraceDistances()
        );

        SearchOutcome outcome;
        try {
            outcome = search.run(arena, start);
        } catch (SearchBudget.GraphLimitExceededException ex) {
            log.warn("Structural diff abandoned: {} (old={} nodes, new={} nodes)",
                    ex.getMessage(), left.nodeCount(), right.nodeCount());
            return DiffResult.graphLimitExceeded(DiffStats.exceeded(graphLimit, ex.vertexCount()));
        } catch (ShortestPathSearch.FrontierExhaustedException ex) {
            throw new DiffInvariantException(ex.reasonCode(), ex.getMessage(), ex);
        }

        List<PathStep> path = PathReconstructor.shortestPath(outcome.end(), outcome.totalDistance());
        ChangeMapPopulator.populate(path, target);
        ChangeMapPopulator.requireComplete(left, right, target);
        target.seal();

        log.debug("Structural diff completed: cost={}, path={} moves, vertices={}, popped={}",
                outcome.totalDistance(), path.size(), outcome.verticesAllocated(), outcome.verticesPopped());

        DiffStats stats = DiffStats.builder()
                .graphLimit(graphLimit)
                .verticesAllocated(outcome.verticesAllocated())
                .verticesPopped(outcome.verticesPopped())
                .peakFrontierSize(outcome.peakFrontierSize())
                .pathLength(path.size())
                .poppedDistances(outcome.poppedDistances())
                .build();
        return DiffResult.completed(target, outcome.totalDistance(), stats);
    }
}
