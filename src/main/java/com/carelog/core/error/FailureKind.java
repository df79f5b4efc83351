package com.carelog.core.error;

/**
 * Distinguishes failures the user should hear about from failures the
 * infrastructure should retry.
 */
public enum FailureKind {

    /** A free-text name did not resolve to any active concern. */
    NO_MATCH(false),

    /** The request is malformed or contradicts current state (e.g. merge of one concern). */
    INVALID_REQUEST(false),

    /** A concrete identifier does not exist. */
    NOT_FOUND(false),

    /** A concern status change not allowed by the lifecycle. */
    INVALID_TRANSITION(false),

    /** Store or transport failure; safe to retry. */
    TRANSIENT(true);

    private final boolean retryable;

    FailureKind(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean retryable() {
        return retryable;
    }

    public boolean userFacing() {
        return !retryable;
    }
}
