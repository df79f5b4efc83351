package com.carelog.r2dbc.entity;

import java.time.Instant;

import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

/**
 * Follow-up columns of {@code conversation_state}. Other columns of that table
 * belong to the conversation layer and are not mapped here.
 */
@Table("conversation_state")
public class FollowUpStateEntity {

    @Id
    @Column("user_id")
    private String userId;

    @Column("checkin_status")
    private String status;

    @Column("checkin_scheduled_for")
    private Instant scheduledFor;

    @Column("last_summary_created_at")
    private Instant lastSummaryCreatedAt;

    @Column("last_user_message_at")
    private Instant lastUserMessageAt;

    @Column("last_bot_message_at")
    private Instant lastBotMessageAt;

    @Column("case_label")
    private String caseLabel;

    public String getUserId() { return userId; }
    public void setUserId(String userId) { this.userId = userId; }

    public String getStatus() { return status; }
    public void setStatus(String status) { this.status = status; }

    public Instant getScheduledFor() { return scheduledFor; }
    public void setScheduledFor(Instant scheduledFor) { this.scheduledFor = scheduledFor; }

    public Instant getLastSummaryCreatedAt() { return lastSummaryCreatedAt; }
    public void setLastSummaryCreatedAt(Instant lastSummaryCreatedAt) { this.lastSummaryCreatedAt = lastSummaryCreatedAt; }

    public Instant getLastUserMessageAt() { return lastUserMessageAt; }
    public void setLastUserMessageAt(Instant lastUserMessageAt) { this.lastUserMessageAt = lastUserMessageAt; }

    public Instant getLastBotMessageAt() { return lastBotMessageAt; }
    public void setLastBotMessageAt(Instant lastBotMessageAt) { this.lastBotMessageAt = lastBotMessageAt; }

    public String getCaseLabel() { return caseLabel; }
    public void setCaseLabel(String caseLabel) { this.caseLabel = caseLabel; }
}
