package com.carelog.core.model;

import java.time.Instant;
import java.util.UUID;

/**
 * Immutable copy of a concern's content at the moment of a meaningful update.
 *
 * Snapshots are append-only: never updated, never deleted (also not when the
 * owning concern is deleted).
 */
public record ConcernSnapshot(
        UUID id,
        UUID concernId,
        String userId,
        String content,
        SnapshotReason reason,
        Instant createdAt) {
}
