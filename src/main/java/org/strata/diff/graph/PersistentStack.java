package org.strata.diff.graph;

import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Immutable singly-linked stack with structural sharing.
 *
 * <p>Push and pop are O(1) and never copy. The hash code is computed once per cell, so stacks
 * can key hash tables cheaply even when deep. Equality is element-wise using {@code equals}.</p>
 *
 * @param <T> element type; elements must be effectively immutable.
 */
public final class PersistentStack<T> {
    private static final PersistentStack<?> EMPTY = new PersistentStack<>(null, null, 0, 1);

    private final T head;
    private final PersistentStack<T> tail;
    private final int size;
    private final int hash;

    private PersistentStack(T head, PersistentStack<T> tail, int size, int hash) {
        this.head = head;
        this.tail = tail;
        this.size = size;
        this.hash = hash;
    }

    @SuppressWarnings("unchecked")
    public static <T> PersistentStack<T> empty() {
        return (PersistentStack<T>) EMPTY;
    }

    /**
     * Returns a new stack with {@code value} on top; this stack is unchanged.
     */
    public PersistentStack<T> push(T value) {
        Objects.requireNonNull(value, "value");
        return new PersistentStack<>(value, this, size + 1, 31 * hash + value.hashCode());
    }

    /**
     * Returns the top element, or {@code null} when empty.
     */
    public T peek() {
        return head;
    }

    /**
     * Returns the stack below the top element.
     *
     * @throws NoSuchElementException when empty.
     */
    public PersistentStack<T> pop() {
        if (size == 0) {
            throw new NoSuchElementException("pop on empty stack");
        }
        return tail;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    public int size() {
        return size;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PersistentStack)) {
            return false;
        }
        PersistentStack<?> left = this;
        PersistentStack<?> right = (PersistentStack<?>) o;
        if (left.size != right.size || left.hash != right.hash) {
            return false;
        }
        while (left != right && left.size > 0) {
            if (!left.head.equals(right.head)) {
                return false;
            }
            left = left.tail;
            right = right.tail;
        }
        return true;
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("[");
        PersistentStack<T> cursor = this;
        while (cursor.size > 0) {
            if (cursor != this) {
                sb.append(", ");
            }
            sb.append(cursor.head);
            cursor = cursor.tail;
        }
        return sb.append(']').toString();
    }
}
