package com.carelog.conversation;

import java.time.Clock;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.carelog.concern.ConcernCommandExecutor;
import com.carelog.concern.ConcernLifecycleService;
import com.carelog.concern.ConcernTitleResolver;
import com.carelog.core.error.CareLogException;
import com.carelog.core.messaging.MessagingClient;
import com.carelog.core.model.CheckinReply;
import com.carelog.core.model.Concern;
import com.carelog.core.model.ConcernCommand;
import com.carelog.core.model.SnapshotReason;
import com.carelog.core.model.SummaryEvent;
import com.carelog.core.store.FollowUpStateStore;
import com.carelog.followup.CaseLabelExtractor;
import com.carelog.followup.FollowUpScheduler;
import com.carelog.followup.MessageTemplates;

import reactor.core.publisher.Mono;

/**
 * Entry point for inbound conversation events. Routes each event into the
 * concern path, the follow-up path or both, and keeps the activity
 * timestamps the scheduler validates against.
 */
@Service
public class ConversationEventService {

    private static final Logger log = LoggerFactory.getLogger(ConversationEventService.class);

    private final ConcernLifecycleService concerns;
    private final ConcernCommandExecutor commands;
    private final ConcernTitleResolver titles;
    private final FollowUpScheduler scheduler;
    private final FollowUpStateStore states;
    private final CaseLabelExtractor caseLabels;
    private final MessageTemplates templates;
    private final MessagingClient messaging;
    private final Clock clock;

    public ConversationEventService(ConcernLifecycleService concerns, ConcernCommandExecutor commands,
            ConcernTitleResolver titles, FollowUpScheduler scheduler, FollowUpStateStore states,
            CaseLabelExtractor caseLabels, MessageTemplates templates, MessagingClient messaging, Clock clock) {
        this.concerns = concerns;
        this.commands = commands;
        this.titles = titles;
        this.scheduler = scheduler;
        this.states = states;
        this.caseLabels = caseLabels;
        this.templates = templates;
        this.messaging = messaging;
        this.clock = clock;
    }

    /**
     * Records user activity, then treats the message as a check-in reply when
     * one is outstanding. Emits the acknowledgment that was sent, or empty for
     * ordinary conversation.
     *
     * The reply is consumed (SENT to COMPLETED) before anything else happens,
     * so the note entry is written before the acknowledgment goes out: a failed
     * send loses the acknowledgment, never the note.
     */
    public Mono<CheckinReply> onUserMessage(String userId, String conversationRef, String text) {
        return states.touchUserMessage(userId, clock.instant())
                .then(scheduler.handleCheckinResponse(userId, text))
                .flatMap(reply -> concerns.appendToPrimaryConcern(userId, reply.noteEntry())
                        .then(Mono.defer(() -> messaging.send(conversationRef, reply.acknowledgment())))
                        .then(Mono.defer(() -> states.touchBotMessage(userId, clock.instant())))
                        .thenReturn(reply));
    }

    /**
     * A generated note was delivered: file it under a concern and schedule the
     * check-in. Scheduling failures are logged; the concern update stands.
     */
    public Mono<Concern> onSummaryDelivered(SummaryEvent event) {
        String userId = event.userId();

        return concerns.getActiveConcerns(userId)
                .map(Concern::title)
                .collectList()
                .flatMap(existing -> titles.resolve(event, existing))
                .flatMap(title -> concerns.getOrCreateConcern(userId, title))
                .flatMap(concern -> concerns.updateConcernSummary(concern.id(), event.summaryContent(), SnapshotReason.AUTO_UPDATE)
                        .thenReturn(concern))
                .flatMap(concern -> states.touchBotMessage(userId, clock.instant())
                        .then(schedule(event, concern))
                        .thenReturn(concern));
    }

    /**
     * Runs a concern command and reports back in the user's language. User-facing
     * failures become the localized no-match reply; anything else propagates.
     * Emits the text that was sent.
     */
    public Mono<String> onCommand(String userId, String conversationRef, String language, ConcernCommand command) {
        return commands.execute(userId, command)
                .map(names -> templates.commandConfirmation(language, command.type(), names))
                .onErrorResume(CareLogException.class, err -> {
                    if (!err.kind().userFacing()) {
                        return Mono.error(err);
                    }
                    log.info("Command rejected userId={} type={} kind={} message={}",
                            userId, command.type(), err.kind(), err.getMessage());
                    return Mono.just(templates.commandNoMatch(language));
                })
                .flatMap(text -> messaging.send(conversationRef, text)
                        .then(Mono.defer(() -> states.touchBotMessage(userId, clock.instant())))
                        .thenReturn(text));
    }

    private Mono<Void> schedule(SummaryEvent event, Concern concern) {
        Optional<String> label = caseLabels.extractCaseLabel(
                concern.title() + "\n" + event.summaryContent(), event.language());

        return scheduler.scheduleCheckin(event.userId(), event.conversationRef(), label.orElse(null))
                .then()
                .onErrorResume(err -> {
                    log.warn("Check-in scheduling failed userId={} err={}", event.userId(), err.toString());
                    return Mono.empty();
                });
    }
}
