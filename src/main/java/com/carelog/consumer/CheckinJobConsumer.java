package com.carelog.consumer;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import com.carelog.followup.FollowUpProperties;
import com.carelog.jetstream.bootstrap.JetStreamBootstrapCompleteEvent;
import com.carelog.jetstream.config.CheckinStreamProperties;

import io.nats.client.JetStream;
import io.nats.client.JetStreamApiException;
import io.nats.client.JetStreamSubscription;
import io.nats.client.Message;
import io.nats.client.PullSubscribeOptions;
import io.nats.client.api.AckPolicy;
import io.nats.client.api.ConsumerConfiguration;
import io.nats.client.api.DeliverPolicy;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Durable pull consumer for due check-in jobs.
 *
 * <h2>Operational behavior</h2>
 * <ul>
 *   <li>Starts on application-ready or on bootstrap-complete, whichever comes first.</li>
 *   <li>Waits, retrying, while the stream does not exist yet.</li>
 *   <li>Explicit ack; every instance shares one durable, so each job goes to one worker.</li>
 *   <li>Messages are handled one at a time per instance.</li>
 * </ul>
 */
@Component
@ConditionalOnProperty(prefix = "carelog.followup.consumer", name = "enabled", havingValue = "true", matchIfMissing = true)
public class CheckinJobConsumer implements DisposableBean {

    private static final Logger log = LoggerFactory.getLogger(CheckinJobConsumer.class);

    private static final int JS_STREAM_NOT_FOUND_ERR = 10059;

    private static final Duration SUBSCRIBE_RETRY_INTERVAL = Duration.ofSeconds(2);

    private static final Duration NEXT_MESSAGE_POLL = Duration.ofMillis(250);

    /** Must exceed the messaging send timeout plus store round trips. */
    private static final Duration ACK_WAIT = Duration.ofSeconds(60);

    private final JetStream js;
    private final CheckinJobHandler handler;
    private final CheckinStreamProperties streamProps;
    private final FollowUpProperties.Consumer props;

    private final AtomicReference<Disposable> running = new AtomicReference<>();

    public CheckinJobConsumer(JetStream js, CheckinJobHandler handler, CheckinStreamProperties streamProps,
            FollowUpProperties followUpProps) {
        this.js = js;
        this.handler = handler;
        this.streamProps = streamProps;
        this.props = followUpProps.getConsumer();
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onAppReady() {
        startIfNotStarted();
    }

    @EventListener(JetStreamBootstrapCompleteEvent.class)
    public void onBootstrapComplete() {
        startIfNotStarted();
    }

    private void startIfNotStarted() {
        if (running.get() != null) {
            return;
        }

        String filterSubject = streamProps.getSubjectPrefix() + ".>";
        ConsumerConfiguration consumerConfig = consumerConfiguration(props, filterSubject);

        PullSubscribeOptions pso = PullSubscribeOptions.builder()
                .stream(streamProps.getName())
                .configuration(consumerConfig)
                .build();

        Disposable d = Flux.interval(Duration.ZERO, SUBSCRIBE_RETRY_INTERVAL)
                .onBackpressureDrop()
                .publishOn(Schedulers.boundedElastic())
                .concatMap(tick -> subscribeAndConsumeOnce(pso, filterSubject)
                        .onErrorResume(err -> {
                            log.warn("Check-in consumer loop ended with error. Will retry subscription. stream={} durable={} err={}",
                                    streamProps.getName(), props.getDurable(), err.toString());
                            return Mono.empty();
                        }))
                .subscribe(
                        v -> { },
                        err -> log.error("Check-in consumer supervisor terminated unexpectedly: {}", err.toString(), err));

        if (!running.compareAndSet(null, d)) {
            d.dispose();
        }
    }

    // Deferred jobs stay ack-pending until their fire time, hence the explicit maxAckPending.
    static ConsumerConfiguration consumerConfiguration(FollowUpProperties.Consumer props, String filterSubject) {
        return ConsumerConfiguration.builder()
                .durable(props.getDurable())
                .deliverPolicy(DeliverPolicy.All)
                .ackPolicy(AckPolicy.Explicit)
                .ackWait(ACK_WAIT)
                .maxDeliver(props.getMaxDeliver())
                .maxAckPending(props.getMaxAckPending())
                .filterSubject(filterSubject)
                .build();
    }

    private Mono<Void> subscribeAndConsumeOnce(PullSubscribeOptions pso, String filterSubject) {
        return Mono.fromCallable(() -> {
                    try {
                        JetStreamSubscription sub = js.subscribe(filterSubject, pso);
                        log.info("Subscribed: stream={} filter={} durable={}", streamProps.getName(), filterSubject, props.getDurable());
                        return sub;
                    } catch (JetStreamApiException jse) {
                        if (jse.getApiErrorCode() == JS_STREAM_NOT_FOUND_ERR) {
                            log.warn("Waiting for stream to exist: stream={}. Will retry...", streamProps.getName());
                            return null;
                        }
                        throw jse;
                    }
                })
                .flatMap(sub -> consumePullLoop(sub)
                        .doFinally(sig -> {
                            try {
                                sub.unsubscribe();
                            } catch (Exception e) {
                                log.debug("Unsubscribe failed (ignored): {}", e.toString());
                            }
                        }));
    }

    private Mono<Void> consumePullLoop(JetStreamSubscription sub) {
        return Flux.interval(props.getPollInterval())
                .onBackpressureDrop()
                .publishOn(Schedulers.boundedElastic())
                .doOnNext(t -> sub.pull(props.getBatchSize()))
                .concatMap(t -> Flux.<Message>generate(sink -> {
                    try {
                        Message m = sub.nextMessage(NEXT_MESSAGE_POLL);
                        if (m == null) {
                            sink.complete();
                        } else {
                            sink.next(m);
                        }
                    } catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                        sink.complete();
                    } catch (Exception e) {
                        sink.error(e);
                    }
                }).concatMap(handler::handle))
                .then();
    }

    @Override
    public void destroy() {
        Disposable d = running.getAndSet(null);
        if (d != null && !d.isDisposed()) {
            d.dispose();
        }
    }
}
