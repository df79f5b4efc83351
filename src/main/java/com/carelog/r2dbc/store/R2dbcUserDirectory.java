package com.carelog.r2dbc.store;

import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Repository;

import com.carelog.core.model.UserProfile;
import com.carelog.core.store.UserDirectory;

import reactor.core.publisher.Mono;

/**
 * Read-only lookup into the users table owned by the account service.
 */
@Repository
public class R2dbcUserDirectory implements UserDirectory {

	private final DatabaseClient db;

	public R2dbcUserDirectory(DatabaseClient db) {
		this.db = db;
	}

	@Override
	public Mono<UserProfile> findProfile(String userId) {
		String sql = "SELECT id, name, language FROM users WHERE id = :id";
		return db.sql(sql).bind("id", userId)
				.map((row, meta) -> new UserProfile(
						row.get("id", String.class),
						row.get("name", String.class),
						row.get("language", String.class)))
				.one();
	}
}
