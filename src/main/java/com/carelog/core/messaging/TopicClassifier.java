package com.carelog.core.messaging;

import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Language-model collaborator proposing topic titles for a conversation.
 *
 * Output is untrusted free text. It is always fuzzy-matched against existing
 * concerns, never used as an identifier.
 */
public interface TopicClassifier {

    Mono<List<String>> detectTopic(String conversationExcerpt, List<String> existingTitles);
}
