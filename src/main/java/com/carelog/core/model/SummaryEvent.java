package com.carelog.core.model;

/**
 * A generated health note was delivered to the user.
 *
 * {@code candidateTitle} is optional; when absent the title is derived from
 * the note itself or from the topic classifier. {@code conversationExcerpt}
 * is what the classifier sees.
 */
public record SummaryEvent(
        String userId,
        String conversationRef,
        String language,
        String summaryContent,
        String candidateTitle,
        String conversationExcerpt) {
}
