package com.carelog.core.model;

/**
 * A classified check-in reply: the acknowledgment to send back and the note
 * entry to append to the user's record.
 */
public record CheckinReply(CheckinReplyKind kind, String acknowledgment, String noteEntry) {
}
