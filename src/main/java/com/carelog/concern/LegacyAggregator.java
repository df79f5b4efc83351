package com.carelog.concern;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.carelog.core.model.Concern;
import com.carelog.core.store.ConcernStore;
import com.carelog.core.store.LegacyAggregateStore;

import reactor.core.publisher.Mono;

/**
 * Rebuilds the per-user legacy aggregate from the current set of open concerns.
 *
 * Format: one {@code --- Title ---} block per concern with content, oldest
 * concern first, blocks separated by a blank line. No remaining content
 * yields the empty string.
 *
 * Recompute never fails its caller: the aggregate is a derived view, so a
 * failed write is logged and dropped.
 */
@Component
public class LegacyAggregator {

    private static final Logger log = LoggerFactory.getLogger(LegacyAggregator.class);

    private static final Comparator<Concern> OLDEST_FIRST =
            Comparator.comparing(Concern::createdAt).thenComparing(Concern::title);

    private final ConcernStore concerns;
    private final LegacyAggregateStore aggregates;
    private final Clock clock;

    public LegacyAggregator(ConcernStore concerns, LegacyAggregateStore aggregates, Clock clock) {
        this.concerns = concerns;
        this.aggregates = aggregates;
        this.clock = clock;
    }

    public Mono<Void> recompute(String userId) {
        if (!aggregates.enabled()) {
            return Mono.empty();
        }
        return concerns.findOpenByUser(userId)
                .collectList()
                .map(LegacyAggregator::format)
                .flatMap(content -> aggregates.upsert(userId, content, clock.instant()))
                .doOnSuccess(v -> log.debug("Legacy aggregate recomputed userId={}", userId))
                .onErrorResume(err -> {
                    log.warn("Legacy aggregate recompute failed userId={} err={}", userId, err.toString());
                    return Mono.empty();
                });
    }

    static String format(List<Concern> open) {
        return open.stream()
                .filter(Concern::hasContent)
                .sorted(OLDEST_FIRST)
                .map(c -> "--- " + c.title() + " ---\n" + c.summaryContent().strip())
                .collect(Collectors.joining("\n\n"));
    }
}
