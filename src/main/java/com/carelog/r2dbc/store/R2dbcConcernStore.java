package com.carelog.r2dbc.store;

import java.time.Instant;
import java.util.UUID;

import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.reactive.TransactionalOperator;

import com.carelog.core.model.Concern;
import com.carelog.core.model.ConcernSnapshot;
import com.carelog.core.model.ConcernStatus;
import com.carelog.core.model.SnapshotReason;
import com.carelog.core.store.ConcernStore;
import com.carelog.r2dbc.entity.ConcernEntity;

import io.r2dbc.spi.Row;
import io.r2dbc.spi.RowMetadata;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Database access helper for the health_concerns and concern_snapshots tables.
 *
 * Snapshots carry no foreign key to their concern, so deleting a concern keeps
 * its history for audit.
 */
@Repository
public class R2dbcConcernStore implements ConcernStore {

	private static final String CONCERN_COLUMNS =
			"id, user_id, title, status, summary_content, created_at, updated_at";

	private final DatabaseClient db;
	private final TransactionalOperator tx;

	public R2dbcConcernStore(DatabaseClient db, TransactionalOperator tx) {
		this.db = db;
		this.tx = tx;
	}

	@Override
	public Mono<Concern> findById(UUID concernId) {
		String sql = "SELECT " + CONCERN_COLUMNS + " FROM health_concerns WHERE id = :id";
		return db.sql(sql).bind("id", concernId).map(R2dbcConcernStore::readConcern).one();
	}

	@Override
	public Flux<Concern> findOpenByUser(String userId) {
		String sql = "SELECT " + CONCERN_COLUMNS + " FROM health_concerns "
				+ "WHERE user_id = :user_id AND status <> :resolved "
				+ "ORDER BY updated_at DESC, created_at DESC";
		return db.sql(sql).bind("user_id", userId).bind("resolved", ConcernStatus.RESOLVED.dbValue())
				.map(R2dbcConcernStore::readConcern).all();
	}

	@Override
	public Flux<Concern> findAllByUser(String userId) {
		String sql = "SELECT " + CONCERN_COLUMNS + " FROM health_concerns "
				+ "WHERE user_id = :user_id ORDER BY updated_at DESC, created_at DESC";
		return db.sql(sql).bind("user_id", userId).map(R2dbcConcernStore::readConcern).all();
	}

	@Override
	public Mono<Concern> insert(String userId, String title, Instant at) {
		UUID id = UUID.randomUUID();
		Concern created = new Concern(id, userId, title, ConcernStatus.ACTIVE, null, at, at);

		String sql = "INSERT INTO health_concerns (id, user_id, title, status, summary_content, created_at, updated_at) "
				+ "VALUES (:id, :user_id, :title, :status, NULL, :created_at, :updated_at)";

		return db.sql(sql).bind("id", id).bind("user_id", userId).bind("title", title)
				.bind("status", ConcernStatus.ACTIVE.dbValue()).bind("created_at", at).bind("updated_at", at)
				.fetch().rowsUpdated().thenReturn(created);
	}

	@Override
	public Mono<Boolean> updateSummary(UUID concernId, String content, Instant at) {
		String sql = "UPDATE health_concerns SET summary_content = :content, updated_at = :updated_at WHERE id = :id";
		return db.sql(sql).bind("content", content).bind("updated_at", at).bind("id", concernId)
				.fetch().rowsUpdated().map(n -> n > 0);
	}

	@Override
	public Mono<Boolean> updateTitle(UUID concernId, String title, Instant at) {
		String sql = "UPDATE health_concerns SET title = :title, updated_at = :updated_at WHERE id = :id";
		return db.sql(sql).bind("title", title).bind("updated_at", at).bind("id", concernId)
				.fetch().rowsUpdated().map(n -> n > 0);
	}

	@Override
	public Mono<Boolean> updateStatus(UUID concernId, ConcernStatus status, Instant at) {
		String sql = "UPDATE health_concerns SET status = :status, updated_at = :updated_at WHERE id = :id";
		return db.sql(sql).bind("status", status.dbValue()).bind("updated_at", at).bind("id", concernId)
				.fetch().rowsUpdated().map(n -> n > 0);
	}

	@Override
	public Mono<Boolean> delete(UUID concernId) {
		return db.sql("DELETE FROM health_concerns WHERE id = :id").bind("id", concernId)
				.fetch().rowsUpdated().map(n -> n > 0);
	}

	@Override
	public Mono<ConcernSnapshot> appendSnapshot(UUID concernId, String userId, String content,
			SnapshotReason reason, Instant at) {
		UUID id = UUID.randomUUID();
		String sql = "INSERT INTO concern_snapshots (id, concern_id, user_id, content, reason, created_at) "
				+ "VALUES (:id, :concern_id, :user_id, :content, :reason, :created_at)";

		return db.sql(sql).bind("id", id).bind("concern_id", concernId).bind("user_id", userId)
				.bind("content", content).bind("reason", reason.dbValue()).bind("created_at", at)
				.fetch().rowsUpdated()
				.thenReturn(new ConcernSnapshot(id, concernId, userId, content, reason, at));
	}

	@Override
	public Flux<ConcernSnapshot> findSnapshots(UUID concernId) {
		String sql = "SELECT id, concern_id, user_id, content, reason, created_at FROM concern_snapshots "
				+ "WHERE concern_id = :concern_id ORDER BY created_at DESC";
		return db.sql(sql).bind("concern_id", concernId).map((row, meta) -> new ConcernSnapshot(
				row.get("id", UUID.class),
				row.get("concern_id", UUID.class),
				row.get("user_id", String.class),
				row.get("content", String.class),
				SnapshotReason.fromDb(row.get("reason", String.class)),
				row.get("created_at", Instant.class))).all();
	}

	@Override
	public Mono<Void> lockUser(String userId) {
		// Released automatically at commit/rollback.
		return db.sql("SELECT pg_advisory_xact_lock(hashtext(:user_id))").bind("user_id", userId).then();
	}

	@Override
	public <T> Mono<T> inTransaction(Mono<T> work) {
		return tx.transactional(work);
	}

	private static Concern readConcern(Row row, RowMetadata meta) {
		ConcernEntity e = new ConcernEntity();
		e.setId(row.get("id", UUID.class));
		e.setUserId(row.get("user_id", String.class));
		e.setTitle(row.get("title", String.class));
		e.setStatus(row.get("status", String.class));
		e.setSummaryContent(row.get("summary_content", String.class));
		e.setCreatedAt(row.get("created_at", Instant.class));
		e.setUpdatedAt(row.get("updated_at", Instant.class));
		return toModel(e);
	}

	private static Concern toModel(ConcernEntity e) {
		return new Concern(e.getId(), e.getUserId(), e.getTitle(), ConcernStatus.fromDb(e.getStatus()),
				e.getSummaryContent(), e.getCreatedAt(), e.getUpdatedAt());
	}
}
