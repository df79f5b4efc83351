package com.carelog.testing;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;

import com.carelog.core.model.Concern;
import com.carelog.core.model.ConcernSnapshot;
import com.carelog.core.model.ConcernStatus;
import com.carelog.core.model.SnapshotReason;
import com.carelog.core.store.ConcernStore;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Map-backed {@link ConcernStore}. Transactions pass through; locking is a no-op.
 * Ties on timestamps resolve to the most recently inserted row.
 */
public class InMemoryConcernStore implements ConcernStore {

    private final Map<UUID, Concern> concerns = new LinkedHashMap<>();
    private final Map<UUID, Long> insertOrder = new LinkedHashMap<>();
    private final List<ConcernSnapshot> snapshots = new ArrayList<>();
    private final AtomicLong seq = new AtomicLong();

    private RuntimeException failOpenReads;

    /** Makes every subsequent {@link #findOpenByUser} fail with {@code err}. */
    public void failOpenReads(RuntimeException err) {
        this.failOpenReads = err;
    }

    public List<ConcernSnapshot> snapshots() {
        return List.copyOf(snapshots);
    }

    public List<Concern> all() {
        return List.copyOf(concerns.values());
    }

    @Override
    public Mono<Concern> findById(UUID concernId) {
        return Mono.justOrEmpty(concerns.get(concernId));
    }

    @Override
    public Flux<Concern> findOpenByUser(String userId) {
        if (failOpenReads != null) {
            return Flux.error(failOpenReads);
        }
        return Flux.defer(() -> Flux.fromIterable(sorted(userId, true)));
    }

    @Override
    public Flux<Concern> findAllByUser(String userId) {
        return Flux.defer(() -> Flux.fromIterable(sorted(userId, false)));
    }

    @Override
    public Mono<Concern> insert(String userId, String title, Instant at) {
        return Mono.fromSupplier(() -> {
            Concern c = new Concern(UUID.randomUUID(), userId, title, ConcernStatus.ACTIVE, null, at, at);
            concerns.put(c.id(), c);
            insertOrder.put(c.id(), seq.incrementAndGet());
            return c;
        });
    }

    @Override
    public Mono<Boolean> updateSummary(UUID concernId, String content, Instant at) {
        return Mono.fromSupplier(() -> replace(concernId, c -> c.withSummary(content, at)));
    }

    @Override
    public Mono<Boolean> updateTitle(UUID concernId, String title, Instant at) {
        return Mono.fromSupplier(() -> replace(concernId, c -> c.withTitle(title, at)));
    }

    @Override
    public Mono<Boolean> updateStatus(UUID concernId, ConcernStatus status, Instant at) {
        return Mono.fromSupplier(() -> replace(concernId, c -> c.withStatus(status, at)));
    }

    @Override
    public Mono<Boolean> delete(UUID concernId) {
        return Mono.fromSupplier(() -> concerns.remove(concernId) != null);
    }

    @Override
    public Mono<ConcernSnapshot> appendSnapshot(UUID concernId, String userId, String content,
            SnapshotReason reason, Instant at) {
        return Mono.fromSupplier(() -> {
            ConcernSnapshot s = new ConcernSnapshot(UUID.randomUUID(), concernId, userId, content, reason, at);
            snapshots.add(s);
            return s;
        });
    }

    @Override
    public Flux<ConcernSnapshot> findSnapshots(UUID concernId) {
        return Flux.defer(() -> {
            List<ConcernSnapshot> out = new ArrayList<>();
            for (int i = snapshots.size() - 1; i >= 0; i--) {
                if (snapshots.get(i).concernId().equals(concernId)) {
                    out.add(snapshots.get(i));
                }
            }
            return Flux.fromIterable(out);
        });
    }

    @Override
    public Mono<Void> lockUser(String userId) {
        return Mono.empty();
    }

    @Override
    public <T> Mono<T> inTransaction(Mono<T> work) {
        return work;
    }

    private boolean replace(UUID id, java.util.function.UnaryOperator<Concern> change) {
        Concern c = concerns.get(id);
        if (c == null) {
            return false;
        }
        concerns.put(id, change.apply(c));
        return true;
    }

    private List<Concern> sorted(String userId, boolean openOnly) {
        return concerns.values().stream()
                .filter(c -> c.userId().equals(userId))
                .filter(c -> !openOnly || c.status().isOpen())
                .sorted(Comparator.comparing(Concern::updatedAt)
                        .thenComparing(Concern::createdAt)
                        .thenComparing(c -> insertOrder.get(c.id()))
                        .reversed())
                .toList();
    }
}
