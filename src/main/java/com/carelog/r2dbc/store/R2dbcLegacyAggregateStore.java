package com.carelog.r2dbc.store;

import java.time.Instant;
import java.util.UUID;

import org.springframework.r2dbc.core.DatabaseClient;

import com.carelog.core.store.LegacyAggregateStore;

import reactor.core.publisher.Mono;

/**
 * Database access helper for the health_summary row of the memories table.
 *
 * Registered by {@code LegacyAggregateConfig} only when the table exists.
 */
public class R2dbcLegacyAggregateStore implements LegacyAggregateStore {

	static final String CATEGORY = "health_summary";

	private final DatabaseClient db;

	public R2dbcLegacyAggregateStore(DatabaseClient db) {
		this.db = db;
	}

	@Override
	public Mono<Void> upsert(String userId, String content, Instant at) {
		String sql = "INSERT INTO memories (id, user_id, category, content, created_at, updated_at) "
				+ "VALUES (:id, :user_id, :category, :content, :at, :at) "
				+ "ON CONFLICT (user_id) WHERE category = 'health_summary' "
				+ "DO UPDATE SET content = EXCLUDED.content, updated_at = EXCLUDED.updated_at";

		return db.sql(sql).bind("id", UUID.randomUUID()).bind("user_id", userId).bind("category", CATEGORY)
				.bind("content", content).bind("at", at).fetch().rowsUpdated().then();
	}

	@Override
	public Mono<String> find(String userId) {
		String sql = "SELECT content FROM memories WHERE user_id = :user_id AND category = :category";
		return db.sql(sql).bind("user_id", userId).bind("category", CATEGORY)
				.map((row, meta) -> row.get("content", String.class)).one();
	}
}
