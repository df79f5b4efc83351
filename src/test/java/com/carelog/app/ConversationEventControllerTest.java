package com.carelog.app;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

import com.carelog.conversation.ConversationEventService;
import com.carelog.core.model.CheckinReply;
import com.carelog.core.model.CheckinReplyKind;
import com.carelog.core.model.SummaryEvent;

import reactor.core.publisher.Mono;

class ConversationEventControllerTest {

    private ConversationEventService events;
    private WebTestClient client;

    @BeforeEach
    void setUp() {
        events = mock(ConversationEventService.class);
        client = WebTestClient.bindToController(new ConversationEventController(events))
                .controllerAdvice(new ApiExceptionHandler())
                .build();
    }

    @Test
    void ordinaryMessageIsNotACheckinReply() {
        when(events.onUserMessage("u1", "42", "hello")).thenReturn(Mono.empty());

        client.post().uri("/api/events/user-message")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("userId", "u1", "conversationRef", "42", "text", "hello"))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.checkinReply").isEqualTo(false);
    }

    @Test
    void checkinReplyReportsKindAndAcknowledgment() {
        when(events.onUserMessage("u1", "42", "worse"))
                .thenReturn(Mono.just(new CheckinReply(CheckinReplyKind.WORSE, "Thanks for letting me know.", "note")));

        client.post().uri("/api/events/user-message")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("userId", "u1", "conversationRef", "42", "text", "worse"))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.checkinReply").isEqualTo(true)
                .jsonPath("$.kind").isEqualTo(CheckinReplyKind.WORSE.templateKey())
                .jsonPath("$.acknowledgment").isEqualTo("Thanks for letting me know.");
    }

    @Test
    void summaryWithoutContentIsRejected() {
        client.post().uri("/api/events/summary-delivered")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("userId", "u1", "conversationRef", "42", "summaryContent", " "))
                .exchange()
                .expectStatus().isEqualTo(422);

        verify(events, never()).onSummaryDelivered(any(SummaryEvent.class));
    }

    @Test
    void commandReplyIsReturned() {
        when(events.onCommand(eq("u1"), eq("42"), eq("en"), any()))
                .thenReturn(Mono.just("Done, I've removed Back Pain from your notes."));

        client.post().uri("/api/events/command")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("userId", "u1", "conversationRef", "42", "language", "en",
                        "type", "DELETE", "targets", List.of("back")))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.reply").isEqualTo("Done, I've removed Back Pain from your notes.");
    }
}
