package com.carelog.followup;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.carelog.core.messaging.MessagingClient;
import com.carelog.core.model.CheckinJob;
import com.carelog.core.model.CheckinOutcome;
import com.carelog.core.model.CheckinReply;
import com.carelog.core.model.CheckinReplyKind;
import com.carelog.core.model.FollowUpState;
import com.carelog.core.model.FollowUpStatus;
import com.carelog.core.model.UserProfile;
import com.carelog.core.queue.CheckinJobQueue;
import com.carelog.core.store.FollowUpStateStore;
import com.carelog.core.store.UserDirectory;

import reactor.core.publisher.Mono;

/**
 * =====================================================================
 * FollowUpScheduler
 * =====================================================================
 *
 * PURPOSE
 * -------
 * Owns the per-user check-in slot: schedule, cancel, fire and reply.
 *
 * CONCURRENCY MODEL
 * -----------------
 * There is no in-process lock. Correctness rests on:
 *  - a deterministic job key per user (one queue slot)
 *  - the state row as the only cancellation signal
 *  - re-reading that row when the job fires
 *
 * A fired job therefore never trusts what was true at schedule time.
 * Queue-level cancel is best effort and its failure is ignored.
 *
 * FAILURE SEMANTICS
 * -----------------
 * A failed send leaves the status at SCHEDULED and propagates the error so
 * the queue's retry policy can redeliver. Nothing is retried here.
 */
@Service
public class FollowUpScheduler {

    private static final Logger log = LoggerFactory.getLogger(FollowUpScheduler.class);

    private final FollowUpStateStore states;
    private final CheckinJobQueue queue;
    private final UserDirectory users;
    private final MessagingClient messaging;
    private final MessageTemplates templates;
    private final CheckinReplyClassifier replyClassifier;
    private final FollowUpProperties props;
    private final Clock clock;

    public FollowUpScheduler(FollowUpStateStore states, CheckinJobQueue queue, UserDirectory users,
            MessagingClient messaging, MessageTemplates templates, CheckinReplyClassifier replyClassifier,
            FollowUpProperties props, Clock clock) {
        this.states = states;
        this.queue = queue;
        this.users = users;
        this.messaging = messaging;
        this.templates = templates;
        this.replyClassifier = replyClassifier;
        this.props = props;
        this.clock = clock;
    }

    public Mono<FollowUpState> getState(String userId) {
        return states.find(userId).defaultIfEmpty(FollowUpState.initial(userId));
    }

    /**
     * Replaces any outstanding check-in with one due after the configured delay.
     * The state row is written before the job is enqueued, so an early firing
     * always finds SCHEDULED.
     */
    public Mono<CheckinJob> scheduleCheckin(String userId, String conversationRef, String caseLabel) {
        return cancelExistingCheckin(userId).then(Mono.defer(() -> {
            Instant now = clock.instant();
            Instant scheduledFor = now.plus(props.getDelay());
            CheckinJob job = new CheckinJob(userId, conversationRef, now, scheduledFor);

            return states.markScheduled(userId, now, caseLabel, scheduledFor)
                    .then(queue.enqueue(job, props.getDelay()))
                    .doOnNext(handle -> log.info("Check-in scheduled userId={} scheduledFor={} caseLabel={} handle={}",
                            userId, scheduledFor, caseLabel, handle))
                    .thenReturn(job);
        }));
    }

    /**
     * Idempotent. Removes the queued job if the queue still has it and sets the
     * status to CANCELED whatever it was.
     */
    public Mono<Void> cancelExistingCheckin(String userId) {
        String jobKey = CheckinJob.keyFor(userId);
        return queue.cancel(jobKey)
                .doOnNext(removed -> {
                    if (removed) {
                        log.info("Existing check-in job removed userId={} jobKey={}", userId, jobKey);
                    }
                })
                .onErrorResume(err -> {
                    log.debug("Check-in job removal failed userId={} jobKey={} err={}", userId, jobKey, err.toString());
                    return Mono.just(false);
                })
                .then(states.setStatus(userId, FollowUpStatus.CANCELED, null));
    }

    /**
     * Fire path for an operator or a job without schedule identity.
     */
    public Mono<CheckinOutcome> executeCheckin(String userId, String conversationRef) {
        return executeCheckin(new CheckinJob(userId, conversationRef, null, null));
    }

    /**
     * Fire-time re-validation followed by delivery. Checks run against state
     * read now, in this order:
     * <ol>
     *   <li>state exists and is SCHEDULED</li>
     *   <li>the job belongs to the current schedule; an older job that is not
     *       yet due re-queues the current one, a due one fires it</li>
     *   <li>the user has not written since the triggering summary</li>
     *   <li>the conversation is not live (bot and user both inside the active window)</li>
     *   <li>the user still exists</li>
     * </ol>
     */
    public Mono<CheckinOutcome> executeCheckin(CheckinJob job) {
        String userId = job.userId();
        return states.find(userId)
                .flatMap(state -> validateAndSend(job, state))
                .switchIfEmpty(Mono.defer(() -> {
                    log.warn("No check-in state found, skipping userId={}", userId);
                    return Mono.just(CheckinOutcome.NO_STATE);
                }));
    }

    /**
     * Emits the reply to send when the user is answering a delivered check-in,
     * or empty when the message is ordinary conversation.
     */
    public Mono<CheckinReply> handleCheckinResponse(String userId, String userMessage) {
        return states.find(userId)
                .filter(state -> state.status() == FollowUpStatus.SENT)
                .flatMap(state -> users.findProfile(userId)
                        .map(UserProfile::language)
                        .defaultIfEmpty(UserProfile.DEFAULT_LANGUAGE))
                .flatMap(language -> {
                    CheckinReplyKind kind = replyClassifier.classify(userMessage);
                    CheckinReply reply = templates.checkinReply(language, kind, userMessage);
                    return states.transition(userId, FollowUpStatus.SENT, FollowUpStatus.COMPLETED)
                            .flatMap(moved -> {
                                if (!moved) {
                                    log.debug("Check-in reply already handled userId={}", userId);
                                    return Mono.<CheckinReply>empty();
                                }
                                log.info("Check-in reply classified userId={} kind={}", userId, kind.templateKey());
                                return Mono.just(reply);
                            });
                });
    }

    private Mono<CheckinOutcome> validateAndSend(CheckinJob job, FollowUpState state) {
        String userId = job.userId();

        if (state.status() != FollowUpStatus.SCHEDULED) {
            log.info("Check-in not in scheduled state, skipping userId={} status={}", userId, state.status().dbValue());
            return Mono.just(CheckinOutcome.NOT_SCHEDULED);
        }

        if (job.scheduledFor() != null && state.scheduledFor() != null
                && job.scheduledFor().isBefore(state.scheduledFor())) {
            Instant now = clock.instant();
            if (now.isBefore(state.scheduledFor())) {
                return requeueCurrent(job, state, now);
            }
            // The state row is authoritative; its own job may have been displaced from the slot.
            log.info("Older check-in job firing the current schedule userId={} jobScheduledFor={} currentScheduledFor={}",
                    userId, job.scheduledFor(), state.scheduledFor());
        }

        if (state.userReengagedAfterSummary()) {
            log.info("User wrote after summary, canceling check-in userId={}", userId);
            return cancelScheduled(userId, CheckinOutcome.USER_REENGAGED);
        }

        Instant now = clock.instant();
        if (state.conversationActiveSince(now.minus(props.getActiveWindow()))) {
            log.info("Conversation active within {}, canceling check-in userId={}", props.getActiveWindow(), userId);
            return cancelScheduled(userId, CheckinOutcome.CONVERSATION_ACTIVE);
        }

        return users.findProfile(userId)
                .flatMap(profile -> send(job, state, profile))
                .switchIfEmpty(Mono.defer(() -> {
                    log.warn("User not found, canceling check-in userId={}", userId);
                    return cancelScheduled(userId, CheckinOutcome.USER_NOT_FOUND);
                }));
    }

    private Mono<CheckinOutcome> send(CheckinJob job, FollowUpState state, UserProfile profile) {
        String userId = job.userId();
        String message = templates.checkinPrompt(profile.language(), profile.name(), state.caseLabel());

        return messaging.send(job.conversationRef(), message)
                .doOnError(err -> log.error("Failed to send check-in userId={} conversationRef={} err={}",
                        userId, job.conversationRef(), err.toString()))
                .then(states.transition(userId, FollowUpStatus.SCHEDULED, FollowUpStatus.SENT))
                .flatMap(moved -> {
                    if (!moved) {
                        log.warn("Check-in sent but state changed concurrently userId={}", userId);
                    }
                    return states.touchBotMessage(userId, clock.instant());
                })
                .doOnSuccess(v -> log.info("Check-in sent userId={} conversationRef={}", userId, job.conversationRef()))
                .thenReturn(CheckinOutcome.SENT);
    }

    /**
     * An older job reached the slot after the current schedule's job (two
     * overlapping schedules). Puts the current schedule back in the slot so it
     * still fires.
     */
    private Mono<CheckinOutcome> requeueCurrent(CheckinJob stale, FollowUpState state, Instant now) {
        String userId = stale.userId();
        CheckinJob current = new CheckinJob(userId, stale.conversationRef(), state.lastSummaryCreatedAt(),
                state.scheduledFor());
        return queue.enqueue(current, Duration.between(now, state.scheduledFor()))
                .doOnNext(handle -> log.info("Superseded check-in job replaced by current schedule userId={} "
                        + "jobScheduledFor={} currentScheduledFor={} handle={}",
                        userId, stale.scheduledFor(), state.scheduledFor(), handle))
                .thenReturn(CheckinOutcome.SUPERSEDED);
    }

    // Compare-and-set so a schedule that landed after our read is left alone.
    private Mono<CheckinOutcome> cancelScheduled(String userId, CheckinOutcome outcome) {
        return states.transition(userId, FollowUpStatus.SCHEDULED, FollowUpStatus.CANCELED).thenReturn(outcome);
    }
}
