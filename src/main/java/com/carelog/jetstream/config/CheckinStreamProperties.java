package com.carelog.jetstream.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Definition of the JetStream stream that holds delayed check-in jobs.
 *
 * <p><b>Slot model</b></p>
 * <ul>
 *   <li>Each user's jobs go to their own subject under {@code subjectPrefix}.</li>
 *   <li>{@code maxMsgsPerSubject = 1} keeps at most one job per user: a newer
 *       publish evicts the older one.</li>
 *   <li>{@code WorkQueue} retention removes a job once a worker acks it.</li>
 *   <li>Publishes carry a Msg-Id; retries inside {@code duplicateWindow} are dropped
 *       by the server.</li>
 * </ul>
 *
 * <p>Configuration prefix: {@code carelog.jetstream.checkin-stream}</p>
 */
@ConfigurationProperties(prefix = "carelog.jetstream.checkin-stream")
public class CheckinStreamProperties {

    private String name = "CHECKIN_STREAM";

    /** Per-user subjects are {@code <subjectPrefix>.<token>}. */
    private String subjectPrefix = "checkin.due";

    private List<String> subjects = new ArrayList<>(List.of("checkin.due.>"));

    /** Upper bound for a job that nobody consumed. */
    private Duration maxAge = Duration.ofDays(7);

    private String retentionPolicy = "WorkQueue";

    private String storageType = "File";

    private int replicas = 1;

    private long maxMsgsPerSubject = 1;

    private Duration duplicateWindow = Duration.ofMinutes(2);

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public String getSubjectPrefix() { return subjectPrefix; }
    public void setSubjectPrefix(String subjectPrefix) { this.subjectPrefix = subjectPrefix; }

    public List<String> getSubjects() { return subjects; }
    public void setSubjects(List<String> subjects) { this.subjects = subjects; }

    public Duration getMaxAge() { return maxAge; }
    public void setMaxAge(Duration maxAge) { this.maxAge = maxAge; }

    public String getRetentionPolicy() { return retentionPolicy; }
    public void setRetentionPolicy(String retentionPolicy) { this.retentionPolicy = retentionPolicy; }

    public String getStorageType() { return storageType; }
    public void setStorageType(String storageType) { this.storageType = storageType; }

    public int getReplicas() { return replicas; }
    public void setReplicas(int replicas) { this.replicas = replicas; }

    public long getMaxMsgsPerSubject() { return maxMsgsPerSubject; }
    public void setMaxMsgsPerSubject(long maxMsgsPerSubject) { this.maxMsgsPerSubject = maxMsgsPerSubject; }

    public Duration getDuplicateWindow() { return duplicateWindow; }
    public void setDuplicateWindow(Duration duplicateWindow) { this.duplicateWindow = duplicateWindow; }
}
