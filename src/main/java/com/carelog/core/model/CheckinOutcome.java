package com.carelog.core.model;

/**
 * Result of a fire-time check-in attempt.
 *
 * Only {@link #SENT} delivers a message. Every other value is a decided
 * "not sent" and must not be retried.
 */
public enum CheckinOutcome {

    SENT,

    /** No state row exists for the user. */
    NO_STATE,

    /** Status was not SCHEDULED at fire time (canceled, completed, already sent). */
    NOT_SCHEDULED,

    /** A newer schedule owns the state; it was put back in the queue and state left untouched. */
    SUPERSEDED,

    /** The user wrote after the triggering summary; status set to CANCELED. */
    USER_REENGAGED,

    /** Bot and user both active inside the trailing window; status set to CANCELED. */
    CONVERSATION_ACTIVE,

    /** The user profile could not be loaded; status set to CANCELED. */
    USER_NOT_FOUND;

    public boolean sent() {
        return this == SENT;
    }
}
