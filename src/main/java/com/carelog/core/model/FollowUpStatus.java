package com.carelog.core.model;

import java.util.Locale;

/**
 * =====================================================================
 * FollowUpStatus
 * =====================================================================
 *
 * PURPOSE
 * -------
 * Lifecycle state of the per-user follow-up ("check-in") slot.
 *
 * The status column is the single source of truth for whether a delayed
 * job should still fire. Queue-level cancellation is an optimization only;
 * the job re-reads this value before it acts.
 *
 * STATE MACHINE
 * -------------
 *
 *   NOT_SCHEDULED ──schedule──▶ SCHEDULED ──fire(ok)───▶ SENT ──reply──▶ COMPLETED
 *                                │    ▲
 *                  cancel / fire(skip)│schedule
 *                                ▼    │
 *                               CANCELED
 *
 * NOT_SCHEDULED, CANCELED and COMPLETED are quiescent. SCHEDULED and SENT
 * carry an outstanding obligation (a job to fire, a reply to classify).
 */
public enum FollowUpStatus {

    /** No follow-up was ever scheduled for the user. */
    NOT_SCHEDULED,

    /** A delayed job is outstanding and may still fire. */
    SCHEDULED,

    /** The check-in was delivered; the next user message is treated as its reply. */
    SENT,

    /** Canceled explicitly or suppressed at fire time. */
    CANCELED,

    /** The user's reply was classified and acknowledged. */
    COMPLETED;

    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isQuiescent() {
        return this == NOT_SCHEDULED || this == CANCELED || this == COMPLETED;
    }

    public static FollowUpStatus fromDb(String value) {
        if (value == null || value.isBlank()) {
            return NOT_SCHEDULED;
        }
        return FollowUpStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
