package com.carelog.chatwoot;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.codec.HttpMessageWriter;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.mock.http.client.reactive.MockClientHttpRequest;
import org.springframework.web.reactive.function.BodyInserter;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import reactor.core.publisher.Mono;

class ChatwootMessagingClientTest {

    private ChatwootProperties props;
    private AtomicReference<ClientRequest> captured;

    @BeforeEach
    void setUp() {
        props = new ChatwootProperties();
        props.setBaseUrl("http://chatwoot.test");
        props.setApiToken("secret");
        props.setAccountId(3);
        captured = new AtomicReference<>();
    }

    private ChatwootMessagingClient client(ExchangeFunction exchange) {
        return new ChatwootMessagingClient(WebClient.builder().exchangeFunction(exchange), props);
    }

    private ExchangeFunction respondWith(HttpStatus status) {
        return request -> {
            captured.set(request);
            return Mono.just(ClientResponse.create(status).build());
        };
    }

    private static String bodyOf(ClientRequest request) {
        MockClientHttpRequest out = new MockClientHttpRequest(request.method(), request.url());
        request.body().insert(out, new BodyInserter.Context() {
            @Override
            public List<HttpMessageWriter<?>> messageWriters() {
                return ExchangeStrategies.withDefaults().messageWriters();
            }

            @Override
            public Optional<ServerHttpRequest> serverRequest() {
                return Optional.empty();
            }

            @Override
            public Map<String, Object> hints() {
                return Map.of();
            }
        }).block();
        return out.getBodyAsString().block();
    }

    @Test
    void postsOutgoingMessageToConversation() throws Exception {
        client(respondWith(HttpStatus.OK)).send("42", "Hi Sam").block();

        ClientRequest request = captured.get();
        assertThat(request.method()).isEqualTo(HttpMethod.POST);
        assertThat(request.url().toString())
                .isEqualTo("http://chatwoot.test/api/v1/accounts/3/conversations/42/messages");
        assertThat(request.headers().getFirst(ChatwootMessagingClient.TOKEN_HEADER)).isEqualTo("secret");

        Map<String, Object> body = new ObjectMapper().readValue(bodyOf(request),
                new TypeReference<Map<String, Object>>() { });
        assertThat(body).containsEntry("content", "Hi Sam")
                .containsEntry("message_type", "outgoing")
                .containsEntry("private", false);
    }

    @Test
    void serverErrorSurfacesAsResponseException() {
        assertThatThrownBy(() -> client(respondWith(HttpStatus.SERVICE_UNAVAILABLE)).send("42", "x").block())
                .isInstanceOf(WebClientResponseException.class)
                .satisfies(e -> assertThat(((WebClientResponseException) e).getStatusCode().value()).isEqualTo(503));
    }

    @Test
    void slowSendTimesOut() {
        props.setSendTimeout(Duration.ofMillis(50));

        assertThatThrownBy(() -> client(request -> Mono.never()).send("42", "x").block())
                .hasCauseInstanceOf(TimeoutException.class);
    }
}
