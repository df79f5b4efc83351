package com.carelog.core.messaging;

import reactor.core.publisher.Mono;

/**
 * Outbound chat channel.
 *
 * A completed Mono means the provider accepted the message. Errors propagate
 * unchanged; implementations do not retry.
 */
public interface MessagingClient {

    Mono<Void> send(String conversationRef, String text);
}
