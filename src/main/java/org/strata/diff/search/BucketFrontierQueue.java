package org.strata.diff.search;

import it.unimi.dsi.fastutil.objects.ObjectArrayFIFOQueue;

/**
 * Monotone bucket queue (Dial's algorithm) for small non-negative integer edge costs.
 * <p>
 * <strong>Contract:</strong>
 * <ul>
 * <li>Pop order is non-decreasing in distance.</li>
 * <li>Every pushed distance lies in {@code [lastPopped, lastPopped + maxEdgeCost]}; anything else
 * violates the monotone discipline and is rejected.</li>
 * <li>Elements of equal distance leave in insertion order.</li>
 * </ul>
 * Both push and pop are O(1) amortized; a pop scans at most {@code maxEdgeCost + 1} buckets.
 * </p>
 * <p><strong>Usage Warning:</strong> This class is NOT thread-safe. It is intended for single-threaded use.</p>
 *
 * @param <T> queued element type.
 */
public final class BucketFrontierQueue<T> implements FrontierQueue<T> {

    // Circular buckets: distance d lives in buckets[d % buckets.length]
    private final ObjectArrayFIFOQueue<T>[] buckets;
    private final int maxEdgeCost;

    private long currentDistance = 0L;
    private int size = 0;

    /**
     * Creates a queue for edge costs in {@code [0, maxEdgeCost]}.
     *
     * @throws IllegalArgumentException if {@code maxEdgeCost} is negative.
     */
    @SuppressWarnings("unchecked")
    public BucketFrontierQueue(int maxEdgeCost) {
        if (maxEdgeCost < 0) {
            throw new IllegalArgumentException("maxEdgeCost must be non-negative");
        }
        this.maxEdgeCost = maxEdgeCost;
        this.buckets = new ObjectArrayFIFOQueue[maxEdgeCost + 1];
        for (int i = 0; i < buckets.length; i++) {
            buckets[i] = new ObjectArrayFIFOQueue<>();
        }
    }

    /**
     * {@inheritDoc}
     *
     * @throws IllegalArgumentException if {@code distance} is outside the monotone window.
     */
    @Override
    public void push(long distance, T element) {
        if (distance < currentDistance || distance - currentDistance > maxEdgeCost) {
            throw new IllegalArgumentException(
                    "distance " + distance + " outside monotone window [" + currentDistance + ", "
                            + (currentDistance + maxEdgeCost) + "]"
            );
        }
        buckets[bucketIndex(distance)].enqueue(element);
        size++;
    }

    @Override
    public T pop() {
        if (size == 0) {
            throw new EmptyQueueException("Queue is empty");
        }
        ObjectArrayFIFOQueue<T> bucket = buckets[bucketIndex(currentDistance)];
        while (bucket.isEmpty()) {
            currentDistance++;
            bucket = buckets[bucketIndex(currentDistance)];
        }
        size--;
        return bucket.dequeue();
    }

    @Override
    public long lastPoppedDistance() {
        return currentDistance;
    }

    @Override
    public boolean isEmpty() {
        return size == 0;
    }

    @Override
    public int size() {
        return size;
    }

    private int bucketIndex(long distance) {
        return (int) (distance % buckets.length);
    }
}
