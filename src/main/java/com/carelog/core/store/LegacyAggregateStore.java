package com.carelog.core.store;

import reactor.core.publisher.Mono;

import java.time.Instant;

/**
 * The single per-user text blob kept for consumers that predate per-concern
 * tracking. It is a materialized view: only the aggregator writes it.
 */
public interface LegacyAggregateStore {

    Mono<Void> upsert(String userId, String content, Instant at);

    /**
     * Emits empty when the user has no aggregate row.
     */
    Mono<String> find(String userId);

    default boolean enabled() {
        return true;
    }

    /**
     * Store used when the legacy table is not present in the schema.
     */
    static LegacyAggregateStore disabled() {
        return new LegacyAggregateStore() {
            @Override
            public Mono<Void> upsert(String userId, String content, Instant at) {
                return Mono.empty();
            }

            @Override
            public Mono<String> find(String userId) {
                return Mono.empty();
            }

            @Override
            public boolean enabled() {
                return false;
            }
        };
    }
}
