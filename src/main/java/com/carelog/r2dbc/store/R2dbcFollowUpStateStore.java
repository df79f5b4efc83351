package com.carelog.r2dbc.store;

import java.time.Instant;

import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Repository;

import com.carelog.core.model.FollowUpState;
import com.carelog.core.model.FollowUpStatus;
import com.carelog.core.store.FollowUpStateStore;
import com.carelog.r2dbc.entity.FollowUpStateEntity;

import reactor.core.publisher.Mono;

/**
 * Database access helper for the follow-up columns of conversation_state.
 *
 * Every write is an upsert keyed by user_id, so whichever event arrives first
 * creates the row.
 */
@Repository
public class R2dbcFollowUpStateStore implements FollowUpStateStore {

	private final DatabaseClient db;

	public R2dbcFollowUpStateStore(DatabaseClient db) {
		this.db = db;
	}

	@Override
	public Mono<FollowUpState> find(String userId) {
		String sql = "SELECT user_id, checkin_status, checkin_scheduled_for, last_summary_created_at, "
				+ "last_user_message_at, last_bot_message_at, case_label "
				+ "FROM conversation_state WHERE user_id = :user_id";

		return db.sql(sql).bind("user_id", userId).map((row, meta) -> {
			FollowUpStateEntity e = new FollowUpStateEntity();
			e.setUserId(row.get("user_id", String.class));
			e.setStatus(row.get("checkin_status", String.class));
			e.setScheduledFor(row.get("checkin_scheduled_for", Instant.class));
			e.setLastSummaryCreatedAt(row.get("last_summary_created_at", Instant.class));
			e.setLastUserMessageAt(row.get("last_user_message_at", Instant.class));
			e.setLastBotMessageAt(row.get("last_bot_message_at", Instant.class));
			e.setCaseLabel(row.get("case_label", String.class));
			return toModel(e);
		}).one();
	}

	@Override
	public Mono<Void> markScheduled(String userId, Instant summaryAt, String caseLabel, Instant scheduledFor) {
		// case_label is overwritten, not coalesced: a summary without a label clears the previous one.
		String sql = "INSERT INTO conversation_state (user_id, checkin_status, checkin_scheduled_for, "
				+ "last_summary_created_at, case_label) "
				+ "VALUES (:user_id, :status, :scheduled_for, :summary_at, :case_label) "
				+ "ON CONFLICT (user_id) DO UPDATE SET checkin_status = EXCLUDED.checkin_status, "
				+ "checkin_scheduled_for = EXCLUDED.checkin_scheduled_for, "
				+ "last_summary_created_at = EXCLUDED.last_summary_created_at, "
				+ "case_label = EXCLUDED.case_label";

		DatabaseClient.GenericExecuteSpec spec = db.sql(sql).bind("user_id", userId)
				.bind("status", FollowUpStatus.SCHEDULED.dbValue()).bind("scheduled_for", scheduledFor)
				.bind("summary_at", summaryAt);
		spec = bindNullable(spec, "case_label", caseLabel, String.class);

		return spec.fetch().rowsUpdated().then();
	}

	@Override
	public Mono<Void> setStatus(String userId, FollowUpStatus status, Instant scheduledFor) {
		String sql = "INSERT INTO conversation_state (user_id, checkin_status, checkin_scheduled_for) "
				+ "VALUES (:user_id, :status, :scheduled_for) "
				+ "ON CONFLICT (user_id) DO UPDATE SET checkin_status = EXCLUDED.checkin_status, "
				+ "checkin_scheduled_for = EXCLUDED.checkin_scheduled_for";

		DatabaseClient.GenericExecuteSpec spec = db.sql(sql).bind("user_id", userId).bind("status", status.dbValue());
		spec = bindNullable(spec, "scheduled_for", scheduledFor, Instant.class);

		return spec.fetch().rowsUpdated().then();
	}

	@Override
	public Mono<Boolean> transition(String userId, FollowUpStatus expected, FollowUpStatus next) {
		String sql = "UPDATE conversation_state SET checkin_status = :next "
				+ "WHERE user_id = :user_id AND checkin_status = :expected";
		return db.sql(sql).bind("next", next.dbValue()).bind("user_id", userId).bind("expected", expected.dbValue())
				.fetch().rowsUpdated().map(n -> n > 0);
	}

	@Override
	public Mono<Void> touchUserMessage(String userId, Instant at) {
		String sql = "INSERT INTO conversation_state (user_id, checkin_status, last_user_message_at) "
				+ "VALUES (:user_id, :status, :at) "
				+ "ON CONFLICT (user_id) DO UPDATE SET last_user_message_at = EXCLUDED.last_user_message_at";
		return db.sql(sql).bind("user_id", userId).bind("status", FollowUpStatus.NOT_SCHEDULED.dbValue())
				.bind("at", at).fetch().rowsUpdated().then();
	}

	@Override
	public Mono<Void> touchBotMessage(String userId, Instant at) {
		String sql = "INSERT INTO conversation_state (user_id, checkin_status, last_bot_message_at) "
				+ "VALUES (:user_id, :status, :at) "
				+ "ON CONFLICT (user_id) DO UPDATE SET last_bot_message_at = EXCLUDED.last_bot_message_at";
		return db.sql(sql).bind("user_id", userId).bind("status", FollowUpStatus.NOT_SCHEDULED.dbValue())
				.bind("at", at).fetch().rowsUpdated().then();
	}

	private static FollowUpState toModel(FollowUpStateEntity e) {
		return new FollowUpState(e.getUserId(), FollowUpStatus.fromDb(e.getStatus()), e.getScheduledFor(),
				e.getLastSummaryCreatedAt(), e.getLastUserMessageAt(), e.getLastBotMessageAt(), e.getCaseLabel());
	}

	private static <T> DatabaseClient.GenericExecuteSpec bindNullable(DatabaseClient.GenericExecuteSpec spec,
			String name, T value, Class<T> type) {
		if (value == null) {
			return spec.bindNull(name, type);
		}
		return spec.bind(name, value);
	}
}
