package com.carelog.jetstream.bootstrap;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import com.carelog.jetstream.config.CheckinStreamProperties;
import com.carelog.jetstream.config.JetStreamBootstrapProperties;

import io.nats.client.JetStreamApiException;
import io.nats.client.JetStreamManagement;
import io.nats.client.api.RetentionPolicy;
import io.nats.client.api.StorageType;
import io.nats.client.api.StreamConfiguration;
import io.nats.client.api.StreamInfo;

/**
 * =====================================================================
 * CheckinStreamBootstrapper
 * =====================================================================
 *
 * PURPOSE
 * -------
 * Ensures the check-in stream exists and matches its configured shape.
 *
 * WHEN THIS RUNS
 * --------------
 * Once at startup, after the NATS connection is established and before
 * the job consumer subscribes.
 *
 * WHAT MUST NOT DRIFT
 * -------------------
 *  - retention (WorkQueue removes acked jobs)
 *  - max messages per subject (the one-slot-per-user rule)
 *  - subjects, storage, max age, replicas
 *
 * Existing streams are never modified. A mismatch fails startup or logs
 * a warning, per {@code carelog.bootstrap.fail-on-mismatch}.
 */
@Component
@ConditionalOnProperty(prefix = "carelog.bootstrap", name = "enabled", havingValue = "true", matchIfMissing = true)
public class CheckinStreamBootstrapper implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(CheckinStreamBootstrapper.class);

    /** JetStream API error code for "stream not found". Matched by code, never by text. */
    private static final int JS_STREAM_NOT_FOUND_ERR = 10059;

    private final JetStreamManagement jsm;
    private final CheckinStreamProperties streamProps;
    private final JetStreamBootstrapProperties bootstrapProps;
    private final ApplicationEventPublisher publisher;

    public CheckinStreamBootstrapper(JetStreamManagement jsm, CheckinStreamProperties streamProps,
            JetStreamBootstrapProperties bootstrapProps, ApplicationEventPublisher publisher) {
        this.jsm = jsm;
        this.streamProps = streamProps;
        this.bootstrapProps = bootstrapProps;
        this.publisher = publisher;
    }

    @Override
    public void run(ApplicationArguments args) throws Exception {
        ensureStream();
        publisher.publishEvent(new JetStreamBootstrapCompleteEvent(streamProps.getName()));
        log.info("JetStream bootstrap complete stream={}", streamProps.getName());
    }

    void ensureStream() throws Exception {
        StreamConfiguration desired = toStreamConfig(streamProps);

        try {
            StreamInfo existing = jsm.getStreamInfo(desired.getName());
            validateExisting(desired, existing);
            return;
        } catch (JetStreamApiException e) {
            // Permission and infrastructure failures must surface.
            if (e.getApiErrorCode() != JS_STREAM_NOT_FOUND_ERR) {
                throw e;
            }
        }

        jsm.addStream(desired);
        log.info("Created JetStream stream: {} (subjects={}, maxAge={}, retention={}, storage={}, replicas={}, maxMsgsPerSubject={})",
                desired.getName(),
                desired.getSubjects(),
                desired.getMaxAge(),
                desired.getRetentionPolicy(),
                desired.getStorageType(),
                desired.getReplicas(),
                desired.getMaxMsgsPerSubject());
    }

    private void validateExisting(StreamConfiguration desired, StreamInfo existing) {
        StreamConfiguration actual = existing.getConfiguration();
        List<String> diffs = new ArrayList<>();

        if (!Objects.equals(actual.getRetentionPolicy(), desired.getRetentionPolicy())) {
            diffs.add("retentionPolicy actual=" + actual.getRetentionPolicy() + " expected=" + desired.getRetentionPolicy());
        }
        if (!Objects.equals(actual.getStorageType(), desired.getStorageType())) {
            diffs.add("storageType actual=" + actual.getStorageType() + " expected=" + desired.getStorageType());
        }
        if (!Objects.equals(actual.getMaxAge(), desired.getMaxAge())) {
            diffs.add("maxAge actual=" + actual.getMaxAge() + " expected=" + desired.getMaxAge());
        }
        if (actual.getReplicas() != desired.getReplicas()) {
            diffs.add("replicas actual=" + actual.getReplicas() + " expected=" + desired.getReplicas());
        }
        if (actual.getMaxMsgsPerSubject() != desired.getMaxMsgsPerSubject()) {
            diffs.add("maxMsgsPerSubject actual=" + actual.getMaxMsgsPerSubject() + " expected=" + desired.getMaxMsgsPerSubject());
        }
        if (!setEquals(actual.getSubjects(), desired.getSubjects())) {
            diffs.add("subjects actual=" + actual.getSubjects() + " expected=" + desired.getSubjects());
        }

        if (diffs.isEmpty()) {
            log.info("JetStream stream exists and matches config: {} (subjects={})", desired.getName(), actual.getSubjects());
            return;
        }

        String msg = "JetStream stream exists but differs from expected: " + desired.getName()
                + " :: " + String.join("; ", diffs);
        if (bootstrapProps.isFailOnMismatch()) {
            throw new IllegalStateException(msg);
        }
        log.warn(msg);
    }

    private static boolean setEquals(List<String> a, List<String> b) {
        Set<String> sa = new HashSet<>(a == null ? List.of() : a);
        Set<String> sb = new HashSet<>(b == null ? List.of() : b);
        return sa.equals(sb);
    }

    static StreamConfiguration toStreamConfig(CheckinStreamProperties props) {
        String name = props.getName();
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name is required for the check-in stream");
        }
        List<String> subjects = props.getSubjects();
        if (subjects == null || subjects.isEmpty()) {
            throw new IllegalArgumentException("subjects is required for stream " + name);
        }
        Objects.requireNonNull(props.getMaxAge(), "maxAge is required for stream " + name);

        return StreamConfiguration.builder()
                .name(name)
                .subjects(subjects.toArray(String[]::new))
                .retentionPolicy(parseRetentionPolicy(props.getRetentionPolicy()))
                .storageType(parseStorageType(props.getStorageType()))
                .maxAge(props.getMaxAge())
                .replicas(props.getReplicas())
                .maxMessagesPerSubject(props.getMaxMsgsPerSubject())
                .duplicateWindow(props.getDuplicateWindow())
                .build();
    }

    /** Default: WorkQueue. */
    static RetentionPolicy parseRetentionPolicy(String value) {
        if (value == null || value.isBlank()) {
            return RetentionPolicy.WorkQueue;
        }
        String v = value.trim().toLowerCase();
        return switch (v) {
            case "workqueue", "work_queue", "work-queue" -> RetentionPolicy.WorkQueue;
            case "limits" -> RetentionPolicy.Limits;
            case "interest" -> RetentionPolicy.Interest;
            default -> throw new IllegalArgumentException("Unsupported retentionPolicy: " + value);
        };
    }

    /** Default: File. */
    static StorageType parseStorageType(String value) {
        if (value == null || value.isBlank()) {
            return StorageType.File;
        }
        String v = value.trim().toLowerCase();
        return switch (v) {
            case "file" -> StorageType.File;
            case "memory" -> StorageType.Memory;
            default -> throw new IllegalArgumentException("Unsupported storageType: " + value);
        };
    }
}
