package com.carelog.core.model;

import java.time.Instant;

/**
 * =====================================================================
 * FollowUpState
 * =====================================================================
 *
 * One row per user holding the scheduling state of the follow-up slot.
 *
 * The row is created lazily on first write. Each timestamp is written
 * independently by the event it names:
 *  - lastSummaryCreatedAt → a summary was delivered and a check-in scheduled
 *  - lastUserMessageAt    → the user sent anything
 *  - lastBotMessageAt     → the assistant sent anything
 *
 * Every nullable component stays null until its event first happens.
 */
public record FollowUpState(

        String userId,

        FollowUpStatus status,

        /*
         * When the outstanding job is due. Cleared on cancel.
         */
        Instant scheduledFor,

        Instant lastSummaryCreatedAt,

        Instant lastUserMessageAt,

        Instant lastBotMessageAt,

        /*
         * Short label extracted from the summary, e.g. "your back".
         */
        String caseLabel) {

    public static FollowUpState initial(String userId) {
        return new FollowUpState(userId, FollowUpStatus.NOT_SCHEDULED, null, null, null, null, null);
    }

    /**
     * True when the user wrote after the summary that triggered scheduling.
     */
    public boolean userReengagedAfterSummary() {
        return lastUserMessageAt != null
                && lastSummaryCreatedAt != null
                && lastUserMessageAt.isAfter(lastSummaryCreatedAt);
    }

    /**
     * True when both sides of the conversation were active after {@code since}.
     */
    public boolean conversationActiveSince(Instant since) {
        return lastBotMessageAt != null && lastBotMessageAt.isAfter(since)
                && lastUserMessageAt != null && lastUserMessageAt.isAfter(since);
    }
}
