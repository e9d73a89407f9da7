package org.strata.diff.cost;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * One edit move with the attributes its cost depends on.
 *
 * <p>Edges are immutable. Attribute-free kinds are shared singletons obtained via {@link #of(EdgeKind)}.</p>
 */
@Getter
@Accessors(fluent = true)
@EqualsAndHashCode
public final class Edge {
    private static final Map<EdgeKind, Edge> PLAIN = new EnumMap<>(EdgeKind.class);

    static {
        for (EdgeKind kind : EdgeKind.values()) {
            PLAIN.put(kind, new Edge(kind, 0, 0));
        }
    }

    private final EdgeKind kind;
    private final int depthDifference;
    private final int similarityPercent;

    private Edge(EdgeKind kind, int depthDifference, int similarityPercent) {
        this.kind = kind;
        this.depthDifference = depthDifference;
        this.similarityPercent = similarityPercent;
    }

    /**
     * Returns the attribute-free edge of one kind.
     */
    public static Edge of(EdgeKind kind) {
        return PLAIN.get(Objects.requireNonNull(kind, "kind"));
    }

    public static Edge unchangedNode(int depthDifference) {
        return new Edge(EdgeKind.UNCHANGED_NODE, requireNonNegative(depthDifference), 0);
    }

    public static Edge enterUnchangedDelimiter(int depthDifference) {
        return new Edge(EdgeKind.ENTER_UNCHANGED_DELIMITER, requireNonNegative(depthDifference), 0);
    }

    public static Edge replacedString(int similarityPercent) {
        return new Edge(EdgeKind.REPLACED_STRING, 0, requirePercent(similarityPercent));
    }

    public static Edge replacedComment(int similarityPercent) {
        return new Edge(EdgeKind.REPLACED_COMMENT, 0, requirePercent(similarityPercent));
    }

    /**
     * Fixed cost of this move under the default {@link EdgeCostModel}.
     */
    public int cost() {
        return EdgeCostModel.cost(this);
    }

    private static int requireNonNegative(int depthDifference) {
        if (depthDifference < 0) {
            throw new IllegalArgumentException("depthDifference must be >= 0, got " + depthDifference);
        }
        return depthDifference;
    }

    private static int requirePercent(int similarityPercent) {
        if (similarityPercent < 0 || similarityPercent > 100) {
            throw new IllegalArgumentException("similarityPercent must be in [0, 100], got " + similarityPercent);
        }
        return similarityPercent;
    }

    @Override
    public String toString() {
        return switch (kind) {
            case UNCHANGED_NODE, ENTER_UNCHANGED_DELIMITER -> kind + "{depthDifference=" + depthDifference + '}';
            case REPLACED_STRING, REPLACED_COMMENT -> kind + "{similarity=" + similarityPercent + "%}";
            default -> kind.name();
        };
    }
}
