package com.carelog.core.store;

import com.carelog.core.model.FollowUpState;
import com.carelog.core.model.FollowUpStatus;

import reactor.core.publisher.Mono;

import java.time.Instant;

/**
 * Per-user follow-up state. Every write is one upsert against the user's row,
 * so the row is created lazily by whichever event arrives first.
 */
public interface FollowUpStateStore {

    /**
     * Emits empty when the user has no row yet.
     */
    Mono<FollowUpState> find(String userId);

    /**
     * Records a delivered summary and the schedule it triggered in one write:
     * status SCHEDULED, scheduledFor, lastSummaryCreatedAt and caseLabel.
     */
    Mono<Void> markScheduled(String userId, Instant summaryAt, String caseLabel, Instant scheduledFor);

    /**
     * Unconditionally sets status and scheduledFor.
     */
    Mono<Void> setStatus(String userId, FollowUpStatus status, Instant scheduledFor);

    /**
     * Moves {@code expected -> next} only if the row is still in {@code expected}.
     * Emits whether the transition happened.
     */
    Mono<Boolean> transition(String userId, FollowUpStatus expected, FollowUpStatus next);

    Mono<Void> touchUserMessage(String userId, Instant at);

    Mono<Void> touchBotMessage(String userId, Instant at);
}
