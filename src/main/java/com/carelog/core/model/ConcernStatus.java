package com.carelog.core.model;

import java.util.Locale;

/**
 * Lifecycle state of a {@link Concern}.
 *
 * STATE MACHINE
 * -------------
 *
 *   ACTIVE ──▶ IMPROVING ──▶ RESOLVED
 *      │                        ▲
 *      └────────────────────────┘
 *
 * RESOLVED is terminal. A later mention of the same topic creates a fresh
 * concern instead of re-activating the resolved one.
 */
public enum ConcernStatus {

    ACTIVE,

    IMPROVING,

    RESOLVED;

    /** Column value as stored in {@code health_concerns.status}. */
    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Active and improving concerns take part in matching and in the legacy aggregate. */
    public boolean isOpen() {
        return this != RESOLVED;
    }

    public boolean canTransitionTo(ConcernStatus next) {
        return switch (this) {
            case ACTIVE -> next == IMPROVING || next == RESOLVED;
            case IMPROVING -> next == RESOLVED;
            case RESOLVED -> false;
        };
    }

    public static ConcernStatus fromDb(String value) {
        if (value == null || value.isBlank()) {
            return ACTIVE;
        }
        return ConcernStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
