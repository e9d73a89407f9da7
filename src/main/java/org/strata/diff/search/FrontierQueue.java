package org.strata.diff.search;

/**
 * Min-priority frontier for the shortest-path search.
 *
 * <p>Implementations break distance ties first-in first-out, so every implementation pops
 * the same sequence for the same pushes.</p>
 *
 * @param <T> queued element type.
 */
public interface FrontierQueue<T> {

    /**
     * Adds an element at a non-negative distance.
     */
    void push(long distance, T element);

    /**
     * Removes and returns the element with the smallest distance.
     *
     * @throws EmptyQueueException when empty.
     */
    T pop();

    /**
     * Distance of the element most recently returned by {@link #pop()}, or 0 before the first pop.
     */
    long lastPoppedDistance();

    boolean isEmpty();

    int size();
}
