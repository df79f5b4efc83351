package com.carelog.core.model;

import java.util.Locale;

/**
 * Why a {@link ConcernSnapshot} was recorded.
 */
public enum SnapshotReason {

    /** Content regenerated from the conversation. */
    AUTO_UPDATE,

    /** Content changed by an explicit user action (merge, check-in reply). */
    USER_EDIT;

    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static SnapshotReason fromDb(String value) {
        return SnapshotReason.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
