package com.carelog.core.queue;

import com.carelog.core.model.CheckinJob;

import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * =====================================================================
 * CheckinJobQueue
 * =====================================================================
 *
 * PURPOSE
 * -------
 * Delayed-job contract used by the follow-up scheduler. The primary
 * implementation targets NATS JetStream, but callers only rely on:
 *
 *  - one job slot per {@link CheckinJob#jobKey()}: enqueueing replaces
 *    whatever the slot held
 *  - at-least-once delivery of a job once its delay has elapsed
 *  - best-effort {@link #cancel(String)}
 *
 * IMPORTANT
 * ---------
 * Cancellation here is advisory. Whether a fired job may act is decided
 * by the follow-up state store at fire time, never by this queue.
 */
public interface CheckinJobQueue {

    /**
     * Enqueues {@code job} to fire after {@code delay}.
     *
     * @return an opaque handle describing where the job was stored
     */
    Mono<String> enqueue(CheckinJob job, Duration delay);

    /**
     * Removes the job in the slot, if any. Absence is not an error.
     *
     * @return whether a job was removed
     */
    Mono<Boolean> cancel(String jobKey);
}
