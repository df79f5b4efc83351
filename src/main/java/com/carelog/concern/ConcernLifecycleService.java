package com.carelog.concern;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.carelog.core.error.ConcernNotFoundException;
import com.carelog.core.error.InvalidCommandException;
import com.carelog.core.error.InvalidStatusTransitionException;
import com.carelog.core.match.FuzzyMatcher;
import com.carelog.core.model.Concern;
import com.carelog.core.model.ConcernSnapshot;
import com.carelog.core.model.ConcernStatus;
import com.carelog.core.model.SnapshotReason;
import com.carelog.core.store.ConcernStore;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * =====================================================================
 * ConcernLifecycleService
 * =====================================================================
 *
 * PURPOSE
 * -------
 * Business rules over the concern store: resolve-or-create by title,
 * snapshot-on-change summary updates, renames, deletes and status changes.
 *
 * AGGREGATE
 * ---------
 * Every public mutation ends with {@link LegacyAggregator#recompute(String)}.
 * Recompute runs after the store work has committed and never fails the
 * mutation.
 *
 * FAILURE SEMANTICS
 * -----------------
 *  - Unknown concern id      → {@link ConcernNotFoundException}
 *  - Blank title or content  → {@link InvalidCommandException}
 *  - Disallowed status move  → {@link InvalidStatusTransitionException}
 *  - Store failures propagate unchanged; nothing is applied.
 */
@Service
public class ConcernLifecycleService {

    private static final Logger log = LoggerFactory.getLogger(ConcernLifecycleService.class);

    private final ConcernStore store;
    private final LegacyAggregator aggregator;
    private final FuzzyMatcher matcher;
    private final Clock clock;

    public ConcernLifecycleService(ConcernStore store, LegacyAggregator aggregator, FuzzyMatcher matcher, Clock clock) {
        this.store = store;
        this.aggregator = aggregator;
        this.matcher = matcher;
        this.clock = clock;
    }

    // ---------------------------------------------------------------------
    // Reads
    // ---------------------------------------------------------------------

    public Mono<Concern> getConcernById(UUID concernId) {
        return store.findById(concernId)
                .switchIfEmpty(Mono.error(() -> new ConcernNotFoundException(concernId)));
    }

    /**
     * Active and improving concerns, most recently updated first.
     */
    public Flux<Concern> getActiveConcerns(String userId) {
        return store.findOpenByUser(userId);
    }

    public Flux<Concern> getAllConcerns(String userId) {
        return store.findAllByUser(userId);
    }

    /**
     * Snapshots newest first. History outlives the concern itself.
     */
    public Flux<ConcernSnapshot> getConcernHistory(UUID concernId) {
        return store.findSnapshots(concernId);
    }

    /**
     * The most recently updated open concern, or empty.
     */
    public Mono<Concern> getPrimaryConcern(String userId) {
        return store.findOpenByUser(userId).next();
    }

    // ---------------------------------------------------------------------
    // Mutations
    // ---------------------------------------------------------------------

    /**
     * Returns the open concern whose title fuzzy-matches {@code candidateTitle},
     * or creates a new ACTIVE one. Serialized per user so two concurrent
     * detections of the same topic yield one concern.
     */
    public Mono<Concern> getOrCreateConcern(String userId, String candidateTitle) {
        if (candidateTitle == null || candidateTitle.isBlank()) {
            return Mono.error(new InvalidCommandException("Concern title must not be blank"));
        }
        String title = candidateTitle.strip();

        Mono<Resolution> resolve = store.lockUser(userId)
                .then(store.findOpenByUser(userId).collectList())
                .flatMap(open -> matcher.best(title, open, Concern::title)
                        .map(existing -> Mono.just(new Resolution(existing, false)))
                        .orElseGet(() -> store.insert(userId, title, clock.instant())
                                .map(created -> new Resolution(created, true))));

        return store.inTransaction(resolve)
                .flatMap(r -> {
                    if (!r.created()) {
                        log.debug("Concern matched userId={} concernId={} title={}", userId, r.concern().id(), r.concern().title());
                        return Mono.just(r.concern());
                    }
                    log.info("Concern created userId={} concernId={} title={}", userId, r.concern().id(), title);
                    return aggregator.recompute(userId).thenReturn(r.concern());
                });
    }

    /**
     * Writes {@code newContent} and appends a snapshot of it, unless it equals the
     * current content after normalization. Emits whether anything changed.
     */
    public Mono<Boolean> updateConcernSummary(UUID concernId, String newContent, SnapshotReason reason) {
        if (newContent == null) {
            return Mono.error(new InvalidCommandException("Summary content must not be null"));
        }
        return getConcernById(concernId)
                .flatMap(current -> store.inTransaction(applySummary(current, newContent, reason))
                        .flatMap(changed -> aggregator.recompute(current.userId()).thenReturn(changed)));
    }

    /**
     * Appends a paragraph to the user's primary concern. Emits empty when the
     * user has no open concern.
     */
    public Mono<Concern> appendToPrimaryConcern(String userId, String entry) {
        return getPrimaryConcern(userId)
                .flatMap(primary -> updateConcernSummary(primary.id(),
                        SummaryContent.appendParagraph(primary.summaryContent(), entry), SnapshotReason.AUTO_UPDATE)
                        .thenReturn(primary))
                .switchIfEmpty(Mono.defer(() -> {
                    log.debug("No open concern to append to userId={}", userId);
                    return Mono.empty();
                }));
    }

    /**
     * Changes the title only; no snapshot is recorded. A title that matches a
     * different open concern is rejected.
     */
    public Mono<Concern> renameConcern(UUID concernId, String newTitle) {
        if (newTitle == null || newTitle.isBlank()) {
            return Mono.error(new InvalidCommandException("New concern name must not be blank"));
        }
        String title = newTitle.strip();

        return getConcernById(concernId)
                .flatMap(current -> rejectTitleClash(current, title)
                        .then(Mono.defer(() -> {
                            Instant now = clock.instant();
                            return store.updateTitle(concernId, title, now)
                                    .flatMap(updated -> updated
                                            ? Mono.just(current.withTitle(title, now))
                                            : Mono.<Concern>error(new ConcernNotFoundException(concernId)));
                        }))
                        .doOnNext(c -> log.info("Concern renamed userId={} concernId={} from={} to={}",
                                c.userId(), concernId, current.title(), title))
                        .flatMap(c -> aggregator.recompute(c.userId()).thenReturn(c)));
    }

    /**
     * Hard-deletes the concern row. Its snapshots are kept.
     */
    public Mono<Concern> deleteConcern(UUID concernId) {
        return getConcernById(concernId)
                .flatMap(current -> store.delete(concernId)
                        .flatMap(deleted -> deleted
                                ? Mono.just(current)
                                : Mono.<Concern>error(new ConcernNotFoundException(concernId))))
                .doOnNext(c -> log.info("Concern deleted userId={} concernId={} title={}", c.userId(), c.id(), c.title()))
                .flatMap(c -> aggregator.recompute(c.userId()).thenReturn(c));
    }

    /**
     * active → improving | resolved, improving → resolved. Same status is a no-op.
     */
    public Mono<Concern> updateConcernStatus(UUID concernId, ConcernStatus next) {
        return getConcernById(concernId).flatMap(current -> {
            if (current.status() == next) {
                return Mono.just(current);
            }
            if (!current.status().canTransitionTo(next)) {
                return Mono.error(new InvalidStatusTransitionException(concernId, current.status(), next));
            }
            Instant now = clock.instant();
            return store.updateStatus(concernId, next, now)
                    .flatMap(updated -> updated
                            ? Mono.just(current.withStatus(next, now))
                            : Mono.<Concern>error(new ConcernNotFoundException(concernId)))
                    .doOnNext(c -> log.info("Concern status changed userId={} concernId={} from={} to={}",
                            c.userId(), concernId, current.status(), next))
                    .flatMap(c -> aggregator.recompute(c.userId()).thenReturn(c));
        });
    }

    /**
     * Folds {@code secondaries} into {@code primary} in one transaction: the
     * secondaries are deleted first, then the primary receives
     * {@code combinedContent} as a user edit.
     */
    public Mono<Concern> absorbConcerns(Concern primary, List<Concern> secondaries, String combinedContent) {
        String userId = primary.userId();

        Mono<Boolean> work = store.lockUser(userId)
                .thenMany(Flux.fromIterable(secondaries))
                .concatMap(secondary -> store.delete(secondary.id())
                        .flatMap(deleted -> deleted
                                ? Mono.just(secondary)
                                : Mono.<Concern>error(new ConcernNotFoundException(secondary.id()))))
                .then(store.findById(primary.id())
                        .switchIfEmpty(Mono.error(() -> new ConcernNotFoundException(primary.id()))))
                .flatMap(fresh -> applySummary(fresh, combinedContent, SnapshotReason.USER_EDIT));

        return store.inTransaction(work)
                .doOnSuccess(changed -> log.info("Concerns merged userId={} primaryId={} absorbed={}",
                        userId, primary.id(), secondaries.stream().map(Concern::id).toList()))
                .then(aggregator.recompute(userId))
                .then(Mono.defer(() -> getConcernById(primary.id())));
    }

    /**
     * Snapshot plus row update without aggregate recompute; callers decide the
     * transaction boundary.
     */
    private Mono<Boolean> applySummary(Concern current, String newContent, SnapshotReason reason) {
        if (!SummaryContent.differs(current.summaryContent(), newContent)) {
            log.debug("Summary unchanged concernId={}", current.id());
            return Mono.just(false);
        }
        Instant now = clock.instant();
        return store.appendSnapshot(current.id(), current.userId(), newContent, reason, now)
                .then(store.updateSummary(current.id(), newContent, now))
                .flatMap(updated -> updated
                        ? Mono.just(true)
                        : Mono.<Boolean>error(new ConcernNotFoundException(current.id())))
                .doOnNext(v -> log.info("Concern summary updated userId={} concernId={} reason={}",
                        current.userId(), current.id(), reason.dbValue()));
    }

    private Mono<Void> rejectTitleClash(Concern renamed, String title) {
        return store.findOpenByUser(renamed.userId())
                .filter(other -> !other.id().equals(renamed.id()))
                .collectList()
                .flatMap(others -> matcher.best(title, others, Concern::title)
                        .<Mono<Void>>map(clash -> Mono.error(new InvalidCommandException(
                                "\"" + title + "\" matches the existing concern \"" + clash.title() + "\"; merge them instead")))
                        .orElseGet(Mono::empty));
    }

    private record Resolution(Concern concern, boolean created) {
    }
}
