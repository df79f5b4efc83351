package com.carelog.testing;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

import com.carelog.core.store.LegacyAggregateStore;

import reactor.core.publisher.Mono;

public class InMemoryLegacyAggregateStore implements LegacyAggregateStore {

    private final Map<String, String> rows = new HashMap<>();
    private int writes;
    private RuntimeException failWith;

    public void failWith(RuntimeException err) {
        this.failWith = err;
    }

    public String content(String userId) {
        return rows.get(userId);
    }

    public int writes() {
        return writes;
    }

    @Override
    public Mono<Void> upsert(String userId, String content, Instant at) {
        if (failWith != null) {
            return Mono.error(failWith);
        }
        return Mono.fromRunnable(() -> {
            rows.put(userId, content);
            writes++;
        });
    }

    @Override
    public Mono<String> find(String userId) {
        return Mono.fromSupplier(() -> rows.get(userId));
    }
}
