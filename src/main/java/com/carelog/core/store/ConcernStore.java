package com.carelog.core.store;

import com.carelog.core.model.Concern;
import com.carelog.core.model.ConcernSnapshot;
import com.carelog.core.model.ConcernStatus;
import com.carelog.core.model.SnapshotReason;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.UUID;

/**
 * =====================================================================
 * ConcernStore
 * =====================================================================
 *
 * PURPOSE
 * -------
 * Row-level persistence for concerns and their snapshots. Holds no business
 * rules: matching, snapshot decisions and aggregation live in
 * {@code ConcernLifecycleService}.
 *
 * CONTRACT
 * --------
 *  - Every method is a single statement, except work wrapped in
 *    {@link #inTransaction(Mono)}.
 *  - Update/delete methods emit {@code false} when no row was affected.
 *  - Snapshots are append-only; deleting a concern keeps its snapshots.
 *
 * FAILURE SEMANTICS
 * -----------------
 * Store failures surface as Mono.error(...) and are never swallowed here.
 */
public interface ConcernStore {

    Mono<Concern> findById(UUID concernId);

    /**
     * Active and improving concerns, most recently updated first.
     */
    Flux<Concern> findOpenByUser(String userId);

    /**
     * Every concern including resolved ones, most recently updated first.
     */
    Flux<Concern> findAllByUser(String userId);

    /**
     * Inserts an ACTIVE concern with no content.
     */
    Mono<Concern> insert(String userId, String title, Instant at);

    Mono<Boolean> updateSummary(UUID concernId, String content, Instant at);

    Mono<Boolean> updateTitle(UUID concernId, String title, Instant at);

    Mono<Boolean> updateStatus(UUID concernId, ConcernStatus status, Instant at);

    Mono<Boolean> delete(UUID concernId);

    Mono<ConcernSnapshot> appendSnapshot(UUID concernId, String userId, String content,
                                         SnapshotReason reason, Instant at);

    /**
     * Snapshot history, newest first.
     */
    Flux<ConcernSnapshot> findSnapshots(UUID concernId);

    /**
     * Serializes concern-set mutations for one user until the surrounding
     * transaction ends. Only meaningful inside {@link #inTransaction(Mono)}.
     */
    Mono<Void> lockUser(String userId);

    /**
     * Runs {@code work} all-or-nothing.
     */
    <T> Mono<T> inTransaction(Mono<T> work);
}
