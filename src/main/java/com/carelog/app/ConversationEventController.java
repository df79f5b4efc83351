package com.carelog.app;

import java.util.List;
import java.util.UUID;

import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.carelog.conversation.ConversationEventService;
import com.carelog.core.model.ConcernCommand;
import com.carelog.core.model.SummaryEvent;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import reactor.core.publisher.Mono;

/**
 * Ingress for events produced by the conversation pipeline (webhook handler,
 * note generator, intent parser).
 */
@RestController
@RequestMapping(path = "/api/events", produces = MediaType.APPLICATION_JSON_VALUE,
        consumes = MediaType.APPLICATION_JSON_VALUE)
public class ConversationEventController {

    private final ConversationEventService events;

    public ConversationEventController(ConversationEventService events) {
        this.events = events;
    }

    @PostMapping("/summary-delivered")
    public Mono<SummaryResponse> summaryDelivered(@Valid @RequestBody SummaryRequest req) {
        return events.onSummaryDelivered(req.toEvent())
                .map(c -> new SummaryResponse(c.id(), c.title()));
    }

    /**
     * Emits {@code checkinReply=false} for ordinary conversation.
     */
    @PostMapping("/user-message")
    public Mono<UserMessageResponse> userMessage(@Valid @RequestBody UserMessageRequest req) {
        return events.onUserMessage(req.userId(), req.conversationRef(), req.text())
                .map(reply -> new UserMessageResponse(true, reply.kind().templateKey(), reply.acknowledgment()))
                .defaultIfEmpty(new UserMessageResponse(false, null, null));
    }

    @PostMapping("/command")
    public Mono<CommandResponse> command(@Valid @RequestBody CommandRequest req) {
        ConcernCommand command = new ConcernCommand(req.type(), req.targets(), req.newName());
        return events.onCommand(req.userId(), req.conversationRef(), req.language(), command)
                .map(CommandResponse::new);
    }

    public record SummaryRequest(@NotBlank String userId, @NotBlank String conversationRef, String language,
            @NotBlank String summaryContent, String candidateTitle, String conversationExcerpt) {

        SummaryEvent toEvent() {
            return new SummaryEvent(userId, conversationRef, language, summaryContent, candidateTitle,
                    conversationExcerpt);
        }
    }

    public record SummaryResponse(UUID concernId, String title) {
    }

    public record UserMessageRequest(@NotBlank String userId, @NotBlank String conversationRef, @NotNull String text) {
    }

    public record UserMessageResponse(boolean checkinReply, String kind, String acknowledgment) {
    }

    public record CommandRequest(@NotBlank String userId, @NotBlank String conversationRef, String language,
            @NotNull ConcernCommand.Type type, List<String> targets, String newName) {
    }

    public record CommandResponse(String reply) {
    }
}
