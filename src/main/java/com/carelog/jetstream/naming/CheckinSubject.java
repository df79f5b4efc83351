package com.carelog.jetstream.naming;

import java.nio.charset.StandardCharsets;

import com.carelog.core.model.CheckinJob;

/**
 * Maps check-in jobs onto JetStream subjects and message ids.
 *
 * <h2>Subject format</h2>
 * <pre>
 * &lt;prefix&gt;.&lt;token&gt;      e.g. checkin.due.user-42
 * </pre>
 *
 * The token is an injective encoding of the user id: ASCII letters, digits
 * and {@code -} pass through; every other UTF-8 byte, {@code _} included,
 * becomes {@code _XX} (upper-case hex). Dots, wildcards and whitespace
 * therefore never reach the subject, and two users never share a slot.
 *
 * <h2>Message id</h2>
 * <pre>
 * checkin-&lt;userId&gt;-&lt;scheduledForEpochMs&gt;
 * </pre>
 * A retried publish of the same schedule is dropped by the server's
 * duplicate window; a new schedule always gets a new id.
 */
public final class CheckinSubject {

    private static final char[] HEX = "0123456789ABCDEF".toCharArray();

    private CheckinSubject() {}

    public static String forUser(String prefix, String userId) {
        return prefix + "." + encodeToken(userId);
    }

    public static String forJobKey(String prefix, String jobKey) {
        return forUser(prefix, CheckinJob.userIdOf(jobKey));
    }

    public static String messageId(CheckinJob job) {
        if (job.scheduledFor() == null) {
            throw new IllegalArgumentException("scheduledFor is required to derive a message id");
        }
        return job.jobKey() + "-" + job.scheduledFor().toEpochMilli();
    }

    static String encodeToken(String value) {
        if (value == null || value.isEmpty()) {
            throw new IllegalArgumentException("userId must not be empty");
        }
        StringBuilder sb = new StringBuilder(value.length() + 8);
        for (byte b : value.getBytes(StandardCharsets.UTF_8)) {
            int c = b & 0xFF;
            if ((c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9') || c == '-') {
                sb.append((char) c);
            } else {
                sb.append('_').append(HEX[c >> 4]).append(HEX[c & 0x0F]);
            }
        }
        return sb.toString();
    }
}
