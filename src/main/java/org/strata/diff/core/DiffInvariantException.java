package org.strata.diff.core;

/**
 * Unrecoverable engine defect: the search graph or reconstructed path broke an internal invariant.
 *
 * <p>Never caused by input data. Callers should not catch and retry; the diff would be wrong.</p>
 */
public final class DiffInvariantException extends DiffEngineException {

    public DiffInvariantException(String reasonCode, String message) {
        super(reasonCode, message);
    }

    public DiffInvariantException(String reasonCode, String message, Throwable cause) {
        super(reasonCode, message, cause);
    }
}
