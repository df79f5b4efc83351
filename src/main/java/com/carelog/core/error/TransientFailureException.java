package com.carelog.core.error;

/**
 * Wraps an infrastructure failure (store, queue, messaging transport) that
 * the outer retry policy may retry.
 */
public class TransientFailureException extends CareLogException {

    public TransientFailureException(String message, Throwable cause) {
        super(FailureKind.TRANSIENT, message, cause);
    }
}
