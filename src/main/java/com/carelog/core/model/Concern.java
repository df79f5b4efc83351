package com.carelog.core.model;

import java.time.Instant;
import java.util.UUID;

/**
 * A single tracked health topic for one user (e.g. "Back Pain").
 *
 * The {@link #id} is owned by the store. {@link #userId} is a foreign reference;
 * one user has many concerns. {@link #summaryContent} is null until the first
 * summary is written.
 */
public record Concern(
        UUID id,
        String userId,
        String title,
        ConcernStatus status,
        String summaryContent,
        Instant createdAt,
        Instant updatedAt) {

    public boolean hasContent() {
        return summaryContent != null && !summaryContent.isBlank();
    }

    public Concern withTitle(String newTitle, Instant at) {
        return new Concern(id, userId, newTitle, status, summaryContent, createdAt, at);
    }

    public Concern withSummary(String content, Instant at) {
        return new Concern(id, userId, title, status, content, createdAt, at);
    }

    public Concern withStatus(ConcernStatus newStatus, Instant at) {
        return new Concern(id, userId, title, newStatus, summaryContent, createdAt, at);
    }
}
