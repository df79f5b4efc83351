package com.carelog.jetstream.queue;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.TimeoutException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.carelog.core.error.TransientFailureException;
import com.carelog.core.model.CheckinJob;
import com.carelog.core.queue.CheckinJobQueue;
import com.carelog.jetstream.config.CheckinStreamProperties;
import com.carelog.jetstream.naming.CheckinSubject;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.nats.client.JetStream;
import io.nats.client.JetStreamApiException;
import io.nats.client.JetStreamManagement;
import io.nats.client.PublishOptions;
import io.nats.client.PurgeOptions;
import io.nats.client.api.PublishAck;
import io.nats.client.api.PurgeResponse;
import io.nats.client.impl.Headers;
import io.nats.client.impl.NatsMessage;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * JetStream-backed {@link CheckinJobQueue}.
 *
 * <h2>Slot</h2>
 * Each user owns one subject; the stream keeps one message per subject, so a
 * publish replaces the previous job and a subject purge cancels it.
 *
 * <h2>Delay</h2>
 * JetStream has no delayed publish. The due time travels in the
 * {@value #FIRE_AT_HEADER} header (ISO-8601) and the consumer defers early
 * deliveries with {@code nakWithDelay}.
 *
 * <h2>Threading</h2>
 * Publish and purge are blocking round trips and run on
 * {@link Schedulers#boundedElastic()}.
 */
@Component
public class JetStreamCheckinJobQueue implements CheckinJobQueue {

    private static final Logger log = LoggerFactory.getLogger(JetStreamCheckinJobQueue.class);

    public static final String FIRE_AT_HEADER = "Checkin-Fire-At";

    private final JetStream js;
    private final JetStreamManagement jsm;
    private final CheckinStreamProperties streamProps;
    private final ObjectMapper mapper;
    private final Clock clock;

    public JetStreamCheckinJobQueue(JetStream js, JetStreamManagement jsm, CheckinStreamProperties streamProps,
            ObjectMapper mapper, Clock clock) {
        this.js = js;
        this.jsm = jsm;
        this.streamProps = streamProps;
        this.mapper = mapper;
        this.clock = clock;
    }

    @Override
    public Mono<String> enqueue(CheckinJob job, Duration delay) {
        return Mono.fromCallable(() -> {
                    String subject = CheckinSubject.forUser(streamProps.getSubjectPrefix(), job.userId());
                    Instant fireAt = job.scheduledFor() != null ? job.scheduledFor() : clock.instant().plus(delay);
                    CheckinJob payload = job.scheduledFor() != null
                            ? job
                            : new CheckinJob(job.userId(), job.conversationRef(), job.scheduledAt(), fireAt);

                    Headers headers = new Headers();
                    headers.put(FIRE_AT_HEADER, fireAt.toString());

                    NatsMessage msg = NatsMessage.builder()
                            .subject(subject)
                            .headers(headers)
                            .data(toJson(payload))
                            .build();

                    PublishOptions opts = PublishOptions.builder()
                            .stream(streamProps.getName())
                            .messageId(CheckinSubject.messageId(payload))
                            .build();

                    PublishAck ack = js.publish(msg, opts);
                    if (ack.isDuplicate()) {
                        log.debug("Duplicate check-in publish ignored userId={} subject={}", job.userId(), subject);
                    }
                    log.info("Check-in job published userId={} subject={} fireAt={} stream={} seq={}",
                            job.userId(), subject, fireAt, ack.getStream(), ack.getSeqno());
                    return ack.getStream() + ":" + ack.getSeqno();
                })
                .onErrorMap(QueueFailures::isTransport,
                        e -> new TransientFailureException("Check-in job publish failed userId=" + job.userId(), e))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public Mono<Boolean> cancel(String jobKey) {
        return Mono.fromCallable(() -> {
                    String subject = CheckinSubject.forJobKey(streamProps.getSubjectPrefix(), jobKey);
                    PurgeResponse resp = jsm.purgeStream(streamProps.getName(), PurgeOptions.subject(subject));
                    boolean removed = resp.getPurged() > 0;
                    log.debug("Check-in subject purged jobKey={} subject={} purged={}", jobKey, subject, resp.getPurged());
                    return removed;
                })
                .onErrorMap(QueueFailures::isTransport,
                        e -> new TransientFailureException("Check-in job purge failed jobKey=" + jobKey, e))
                .subscribeOn(Schedulers.boundedElastic());
    }

    private byte[] toJson(CheckinJob job) throws JsonProcessingException {
        return mapper.writeValueAsBytes(job);
    }

    private static final class QueueFailures {

        private QueueFailures() {
        }

        // Connection loss, timeouts and server-side API errors; serialization bugs stay as they are.
        static boolean isTransport(Throwable t) {
            return (t instanceof IOException && !(t instanceof JsonProcessingException))
                    || t instanceof JetStreamApiException
                    || t instanceof TimeoutException;
        }
    }
}
