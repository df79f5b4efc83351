package com.carelog.core.model;

import java.util.Locale;

/**
 * Coarse classification of a reply to a check-in.
 */
public enum CheckinReplyKind {
    SAME,
    BETTER,
    WORSE,
    OTHER;

    /** Key used in the message template catalog. */
    public String templateKey() {
        return name().toLowerCase(Locale.ROOT);
    }
}
