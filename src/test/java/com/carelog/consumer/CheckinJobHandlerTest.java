package com.carelog.consumer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.carelog.consumer.CheckinJobHandler.Disposition;
import com.carelog.core.error.InvalidCommandException;
import com.carelog.core.error.TransientFailureException;
import com.carelog.core.model.CheckinJob;
import com.carelog.core.model.CheckinOutcome;
import com.carelog.followup.FollowUpProperties;
import com.carelog.followup.FollowUpScheduler;
import com.carelog.jetstream.config.JacksonConfig;
import com.carelog.jetstream.queue.JetStreamCheckinJobQueue;
import com.carelog.testing.MutableClock;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.nats.client.Message;
import io.nats.client.impl.Headers;
import io.nats.client.impl.NatsJetStreamMetaData;
import reactor.core.publisher.Mono;

class CheckinJobHandlerTest {

    private static final Instant NOW = Instant.parse("2026-03-02T09:00:00Z");

    private MutableClock clock;
    private ObjectMapper mapper;
    private FollowUpScheduler scheduler;
    private CheckinJobHandler handler;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        mapper = JacksonConfig.createMapper();
        scheduler = mock(FollowUpScheduler.class);
        FollowUpProperties props = new FollowUpProperties();
        props.getConsumer().setMaxDeliver(4);
        props.getConsumer().setRetryInitial(Duration.ofSeconds(10));
        props.getConsumer().setRetryMax(Duration.ofMinutes(5));
        handler = new CheckinJobHandler(scheduler, mapper, props, clock);
    }

    private Message message(CheckinJob job, String fireAtHeader, long delivered) throws Exception {
        return message(mapper.writeValueAsBytes(job), fireAtHeader, delivered);
    }

    private static Message message(byte[] data, String fireAtHeader, long delivered) {
        Message msg = mock(Message.class);
        when(msg.getData()).thenReturn(data);
        when(msg.getSubject()).thenReturn("checkin.due.u1");
        Headers headers = new Headers();
        if (fireAtHeader != null) {
            headers.put(JetStreamCheckinJobQueue.FIRE_AT_HEADER, fireAtHeader);
        }
        when(msg.getHeaders()).thenReturn(headers);
        NatsJetStreamMetaData meta = mock(NatsJetStreamMetaData.class);
        when(meta.deliveredCount()).thenReturn(delivered);
        when(msg.metaData()).thenReturn(meta);
        return msg;
    }

    private static CheckinJob job(Instant scheduledFor) {
        return new CheckinJob("u1", "42", scheduledFor.minus(Duration.ofHours(24)), scheduledFor);
    }

    @Test
    void dueJobIsExecutedAndAcked() throws Exception {
        CheckinJob job = job(NOW);
        when(scheduler.executeCheckin(job)).thenReturn(Mono.just(CheckinOutcome.SENT));
        Message msg = message(job, NOW.toString(), 1);

        assertThat(handler.handle(msg).block()).isEqualTo(Disposition.ACKED);
        verify(msg).ack();
    }

    @Test
    void skippedOutcomeIsStillAcked() throws Exception {
        CheckinJob job = job(NOW);
        when(scheduler.executeCheckin(job)).thenReturn(Mono.just(CheckinOutcome.SUPERSEDED));
        Message msg = message(job, NOW.toString(), 1);

        assertThat(handler.handle(msg).block()).isEqualTo(Disposition.ACKED);
        verify(msg).ack();
    }

    @Test
    void earlyDeliveryIsDeferredUntilFireTime() throws Exception {
        Instant fireAt = NOW.plus(Duration.ofHours(3));
        Message msg = message(job(fireAt), fireAt.toString(), 1);

        assertThat(handler.handle(msg).block()).isEqualTo(Disposition.DEFERRED);
        verify(msg).nakWithDelay(Duration.ofHours(3));
        verify(scheduler, never()).executeCheckin(any(CheckinJob.class));
    }

    @Test
    void payloadScheduleIsUsedWithoutHeader() throws Exception {
        Instant fireAt = NOW.plus(Duration.ofMinutes(10));
        Message msg = message(job(fireAt), null, 1);

        assertThat(handler.handle(msg).block()).isEqualTo(Disposition.DEFERRED);
        verify(msg).nakWithDelay(Duration.ofMinutes(10));
    }

    @Test
    void retryableFailureBacksOff() throws Exception {
        CheckinJob job = job(NOW);
        when(scheduler.executeCheckin(job)).thenReturn(Mono.error(new TransientFailureException("chatwoot 503", null)));
        Message msg = message(job, NOW.toString(), 2);

        assertThat(handler.handle(msg).block()).isEqualTo(Disposition.RETRY);
        verify(msg).nakWithDelay(Duration.ofSeconds(20));
        verify(msg, never()).ack();
    }

    @Test
    void lastAttemptTerminates() throws Exception {
        CheckinJob job = job(NOW);
        when(scheduler.executeCheckin(job)).thenReturn(Mono.error(new TransientFailureException("chatwoot 503", null)));
        Message msg = message(job, NOW.toString(), 4);

        assertThat(handler.handle(msg).block()).isEqualTo(Disposition.TERMINATED);
        verify(msg).term();
    }

    @Test
    void nonRetryableFailureTerminates() throws Exception {
        CheckinJob job = job(NOW);
        when(scheduler.executeCheckin(job)).thenReturn(Mono.error(new InvalidCommandException("bad")));
        Message msg = message(job, NOW.toString(), 1);

        assertThat(handler.handle(msg).block()).isEqualTo(Disposition.TERMINATED);
        verify(msg).term();
    }

    @Test
    void unreadablePayloadTerminates() {
        Message msg = message("{not json".getBytes(StandardCharsets.UTF_8), null, 1);

        assertThat(handler.handle(msg).block()).isEqualTo(Disposition.TERMINATED);
        verify(msg).term();
    }

    @Test
    void missingUserIdTerminates() {
        Message msg = message("{\"conversationRef\":\"42\"}".getBytes(StandardCharsets.UTF_8), null, 1);

        assertThat(handler.handle(msg).block()).isEqualTo(Disposition.TERMINATED);
        verify(msg).term();
    }
}
