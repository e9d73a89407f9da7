package org.strata.diff.search;

import java.util.PriorityQueue;

/**
 * Comparison-based frontier over a binary heap.
 *
 * <p>Accepts any non-negative distance, so it stays valid for cost models without a small
 * upper bound. Ties are broken by insertion sequence to match {@link BucketFrontierQueue}.</p>
 *
 * @param <T> queued element type.
 */
public final class HeapFrontierQueue<T> implements FrontierQueue<T> {
    private final PriorityQueue<Entry<T>> heap = new PriorityQueue<>();
    private long sequence = 0L;
    private long lastPoppedDistance = 0L;

    @Override
    public void push(long distance, T element) {
        if (distance < 0L) {
            throw new IllegalArgumentException("distance must be >= 0, got " + distance);
        }
        heap.add(new Entry<>(distance, sequence++, element));
    }

    @Override
    public T pop() {
        Entry<T> entry = heap.poll();
        if (entry == null) {
            throw new EmptyQueueException("Queue is empty");
        }
        lastPoppedDistance = entry.distance();
        return entry.element();
    }

    @Override
    public long lastPoppedDistance() {
        return lastPoppedDistance;
    }

    @Override
    public boolean isEmpty() {
        return heap.isEmpty();
    }

    @Override
    public int size() {
        return heap.size();
    }

    private record Entry<T>(long distance, long sequence, T element) implements Comparable<Entry<T>> {
        /**
         * Orders by distance, then insertion sequence for FIFO ties.
         */
        @Override
        public int compareTo(Entry<T> other) {
            int byDistance = Long.compare(distance, other.distance);
            if (byDistance != 0) {
                return byDistance;
            }
            return Long.compare(sequence, other.sequence);
        }
    }
}
