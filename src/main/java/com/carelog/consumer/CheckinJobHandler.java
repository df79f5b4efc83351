package com.carelog.consumer;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.carelog.core.error.Failures;
import com.carelog.core.model.CheckinJob;
import com.carelog.followup.FollowUpProperties;
import com.carelog.followup.FollowUpScheduler;
import com.carelog.jetstream.queue.JetStreamCheckinJobQueue;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.nats.client.Message;
import io.nats.client.impl.Headers;
import reactor.core.publisher.Mono;

/**
 * Decides what happens to one delivered check-in job.
 *
 * <ul>
 *   <li>unreadable payload: {@code term}</li>
 *   <li>delivered before its fire time: {@code nakWithDelay(remaining)}</li>
 *   <li>any decided outcome from the scheduler: {@code ack}</li>
 *   <li>retryable failure: {@code nakWithDelay(backoff)} until the last attempt</li>
 *   <li>anything else: {@code term}</li>
 * </ul>
 *
 * The returned Mono never errors.
 */
@Component
public class CheckinJobHandler {

    private static final Logger log = LoggerFactory.getLogger(CheckinJobHandler.class);

    public enum Disposition {
        ACKED,
        DEFERRED,
        RETRY,
        TERMINATED
    }

    private final FollowUpScheduler scheduler;
    private final ObjectMapper mapper;
    private final RetryBackoff backoff;
    private final int maxDeliver;
    private final Clock clock;

    public CheckinJobHandler(FollowUpScheduler scheduler, ObjectMapper mapper, FollowUpProperties props, Clock clock) {
        this.scheduler = scheduler;
        this.mapper = mapper;
        this.backoff = new RetryBackoff(props.getConsumer().getRetryInitial(), props.getConsumer().getRetryMax());
        this.maxDeliver = props.getConsumer().getMaxDeliver();
        this.clock = clock;
    }

    public Mono<Disposition> handle(Message msg) {
        CheckinJob job;
        try {
            job = mapper.readValue(msg.getData(), CheckinJob.class);
        } catch (Exception e) {
            log.error("Unreadable check-in job, terminating subject={} err={}", msg.getSubject(), e.toString());
            msg.term();
            return Mono.just(Disposition.TERMINATED);
        }
        if (job.userId() == null || job.userId().isBlank()) {
            log.error("Check-in job without userId, terminating subject={}", msg.getSubject());
            msg.term();
            return Mono.just(Disposition.TERMINATED);
        }

        Instant fireAt = fireAt(msg, job);
        Instant now = clock.instant();
        if (fireAt != null && now.isBefore(fireAt)) {
            Duration remaining = Duration.between(now, fireAt);
            log.debug("Check-in job not yet due userId={} fireAt={} deferBy={}", job.userId(), fireAt, remaining);
            msg.nakWithDelay(remaining);
            return Mono.just(Disposition.DEFERRED);
        }

        final CheckinJob due = job;
        return scheduler.executeCheckin(due)
                .map(outcome -> {
                    msg.ack();
                    log.info("Check-in job done userId={} outcome={}", due.userId(), outcome);
                    return Disposition.ACKED;
                })
                .onErrorResume(err -> Mono.just(onFailure(msg, due, err)));
    }

    private Disposition onFailure(Message msg, CheckinJob job, Throwable err) {
        long attempt = deliveredCount(msg);
        if (!Failures.isRetryable(err)) {
            log.error("Check-in job failed permanently userId={} attempt={} err={}", job.userId(), attempt, err.toString());
            msg.term();
            return Disposition.TERMINATED;
        }
        if (attempt >= maxDeliver) {
            log.error("Check-in job out of attempts userId={} attempt={} maxDeliver={} err={}",
                    job.userId(), attempt, maxDeliver, err.toString());
            msg.term();
            return Disposition.TERMINATED;
        }
        Duration delay = backoff.delayFor(attempt);
        log.warn("Check-in job failed, retrying userId={} attempt={} retryIn={} err={}",
                job.userId(), attempt, delay, err.toString());
        msg.nakWithDelay(delay);
        return Disposition.RETRY;
    }

    private static Instant fireAt(Message msg, CheckinJob job) {
        Headers headers = msg.getHeaders();
        String value = headers == null ? null : headers.getFirst(JetStreamCheckinJobQueue.FIRE_AT_HEADER);
        if (value != null) {
            try {
                return Instant.parse(value);
            } catch (DateTimeParseException e) {
                log.warn("Bad {} header, using payload userId={} value={}",
                        JetStreamCheckinJobQueue.FIRE_AT_HEADER, job.userId(), value);
            }
        }
        return job.scheduledFor();
    }

    private static long deliveredCount(Message msg) {
        try {
            return msg.metaData().deliveredCount();
        } catch (IllegalStateException e) {
            // Not a JetStream message (no reply-to metadata).
            return 1;
        }
    }
}
