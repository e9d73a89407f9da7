package org.strata.diff.search;

/**
 * Frontier implementation selector.
 */
public enum FrontierQueueType {
    /** Monotone bucket queue; requires bounded integer edge costs. */
    BUCKET,
    /** Binary heap; valid for any non-negative costs. */
    HEAP;

    /**
     * Creates an empty frontier of this type.
     *
     * @param maxEdgeCost upper bound on edge costs (used by {@link #BUCKET} only).
     */
    public <T> FrontierQueue<T> create(int maxEdgeCost) {
        return switch (this) {
            case BUCKET -> new BucketFrontierQueue<>(maxEdgeCost);
            case HEAP -> new HeapFrontierQueue<>();
        };
    }
}
