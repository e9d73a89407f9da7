package org.strata.diff.core;

import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;
import org.strata.syntax.SyntaxNode;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Per-node change classification produced by one diff.
 *
 * <p>Keyed by {@link SyntaxNode#id()}, so both trees must come from one arena. The engine fills
 * the map once and seals it; afterwards it is read-only and safe to share across threads.</p>
 */
public final class ChangeMap {
    private final Int2ObjectOpenHashMap<Change> changes;
    private boolean sealed;

    public ChangeMap() {
        this(16);
    }

    /**
     * @param expectedSize expected number of classified nodes.
     */
    public ChangeMap(int expectedSize) {
        this.changes = new Int2ObjectOpenHashMap<>(Math.max(16, expectedSize));
    }

    /**
     * Returns the entry for {@code node}, or {@code null} when unclassified.
     */
    public Change get(SyntaxNode node) {
        return changes.get(Objects.requireNonNull(node, "node").id());
    }

    /**
     * Returns the classification of {@code node}, or {@code null} when unclassified.
     */
    public ChangeKind kindOf(SyntaxNode node) {
        Change change = get(node);
        return change == null ? null : change.kind();
    }

    /**
     * Returns the aligned node on the other side, or {@code null}.
     */
    public SyntaxNode opposite(SyntaxNode node) {
        Change change = get(node);
        return change == null ? null : change.opposite();
    }

    public boolean contains(SyntaxNode node) {
        return changes.containsKey(Objects.requireNonNull(node, "node").id());
    }

    public int size() {
        return changes.size();
    }

    public boolean isEmpty() {
        return changes.isEmpty();
    }

    /**
     * Number of entries with the given classification.
     */
    public int countOf(ChangeKind kind) {
        int count = 0;
        for (Change change : changes.values()) {
            if (change.kind() == kind) {
                count++;
            }
        }
        return count;
    }

    /**
     * Histogram of classifications.
     */
    public Map<ChangeKind, Integer> summary() {
        Map<ChangeKind, Integer> summary = new EnumMap<>(ChangeKind.class);
        for (ChangeKind kind : ChangeKind.values()) {
            summary.put(kind, 0);
        }
        for (Change change : changes.values()) {
            summary.merge(change.kind(), 1, Integer::sum);
        }
        return summary;
    }

    public boolean isSealed() {
        return sealed;
    }

    /**
     * Records a classification.
     *
     * @throws IllegalStateException once the map is sealed.
     */
    void insert(SyntaxNode node, ChangeKind kind, SyntaxNode opposite) {
        if (sealed) {
            throw new IllegalStateException("change map is sealed");
        }
        changes.put(node.id(), new Change(kind, opposite));
    }

    void seal() {
        sealed = true;
    }

    @Override
    public String toString() {
        return "ChangeMap{size=" + changes.size() + ", summary=" + summary() + '}';
    }
}
