package com.carelog.chatwoot;

import java.util.LinkedHashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import com.carelog.core.messaging.MessagingClient;

import reactor.core.publisher.Mono;

/**
 * {@link MessagingClient} over the Chatwoot REST API.
 *
 * <pre>
 * POST {baseUrl}/api/v1/accounts/{accountId}/conversations/{conversationRef}/messages
 * api_access_token: {apiToken}
 * {"content": "...", "message_type": "outgoing", "private": false}
 * </pre>
 *
 * Non-2xx responses surface as {@code WebClientResponseException}; a send that
 * exceeds {@code sendTimeout} surfaces as {@code TimeoutException}. No retries.
 */
@Component
public class ChatwootMessagingClient implements MessagingClient {

    private static final Logger log = LoggerFactory.getLogger(ChatwootMessagingClient.class);

    static final String TOKEN_HEADER = "api_access_token";

    private final WebClient web;
    private final ChatwootProperties props;

    public ChatwootMessagingClient(WebClient.Builder builder, ChatwootProperties props) {
        this.props = props;
        this.web = builder
                .baseUrl(props.getBaseUrl())
                .build();
    }

    @Override
    public Mono<Void> send(String conversationRef, String text) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("content", text);
        body.put("message_type", "outgoing");
        body.put("private", false);

        return web.post()
                .uri("/api/v1/accounts/{accountId}/conversations/{conversationRef}/messages",
                        props.getAccountId(), conversationRef)
                .contentType(MediaType.APPLICATION_JSON)
                .header(TOKEN_HEADER, props.getApiToken() == null ? "" : props.getApiToken())
                .bodyValue(body)
                .retrieve()
                .toBodilessEntity()
                .timeout(props.getSendTimeout())
                .doOnSuccess(r -> log.debug("Message sent via Chatwoot conversationRef={} contentLength={}",
                        conversationRef, text.length()))
                .doOnError(err -> log.debug("Chatwoot send failed conversationRef={} err={}", conversationRef, err.toString()))
                .then();
    }
}
