package com.carelog.core.error;

/**
 * Base type for failures raised by the concern and follow-up engines.
 *
 * Callers branch on {@link #kind()} instead of parsing messages.
 */
public abstract class CareLogException extends RuntimeException {

    private final FailureKind kind;

    protected CareLogException(FailureKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected CareLogException(FailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public FailureKind kind() {
        return kind;
    }

    public boolean retryable() {
        return kind.retryable();
    }
}
