package org.strata.diff.search;

/**
 * Thrown when popping from an empty frontier.
 */
public class EmptyQueueException extends IllegalStateException {
    public EmptyQueueException(String message) {
        super(message);
    }
}
