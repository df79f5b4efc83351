package com.carelog.core.model;

import java.time.Instant;

/**
 * Payload of a delayed check-in job.
 *
 * {@link #scheduledFor} identifies which schedule produced the job, so a
 * job that outlived a newer schedule can recognise itself as superseded.
 */
public record CheckinJob(
        String userId,
        String conversationRef,
        Instant scheduledAt,
        Instant scheduledFor) {

    private static final String KEY_PREFIX = "checkin-";

    /** Deterministic job slot key; one per user. */
    public String jobKey() {
        return keyFor(userId);
    }

    public static String keyFor(String userId) {
        return KEY_PREFIX + userId;
    }

    /** Inverse of {@link #keyFor(String)}. */
    public static String userIdOf(String jobKey) {
        if (jobKey == null || !jobKey.startsWith(KEY_PREFIX) || jobKey.length() == KEY_PREFIX.length()) {
            throw new IllegalArgumentException("Not a check-in job key: " + jobKey);
        }
        return jobKey.substring(KEY_PREFIX.length());
    }
}
