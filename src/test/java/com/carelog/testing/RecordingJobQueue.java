package com.carelog.testing;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.carelog.core.model.CheckinJob;
import com.carelog.core.queue.CheckinJobQueue;

import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

/** One slot per job key, like the real queue. */
public class RecordingJobQueue implements CheckinJobQueue {

    private final Map<String, CheckinJob> slots = new LinkedHashMap<>();
    private final List<CheckinJob> enqueued = new ArrayList<>();
    private final List<String> cancels = new ArrayList<>();
    private RuntimeException cancelFailure;
    private RuntimeException enqueueFailure;
    private Sinks.Empty<Void> nextEnqueueGate;

    public void failEnqueues(RuntimeException err) {
        this.enqueueFailure = err;
    }

    public void failCancels(RuntimeException err) {
        this.cancelFailure = err;
    }

    /** The next enqueue lands in the slot only once the returned sink completes. */
    public Sinks.Empty<Void> holdNextEnqueue() {
        nextEnqueueGate = Sinks.empty();
        return nextEnqueueGate;
    }

    public CheckinJob slot(String userId) {
        return slots.get(CheckinJob.keyFor(userId));
    }

    public List<CheckinJob> enqueued() {
        return List.copyOf(enqueued);
    }

    public List<String> cancels() {
        return List.copyOf(cancels);
    }

    @Override
    public Mono<String> enqueue(CheckinJob job, Duration delay) {
        if (enqueueFailure != null) {
            return Mono.error(enqueueFailure);
        }
        Mono<String> put = Mono.fromSupplier(() -> {
            slots.put(job.jobKey(), job);
            enqueued.add(job);
            return "mem:" + enqueued.size();
        });
        Sinks.Empty<Void> gate = nextEnqueueGate;
        nextEnqueueGate = null;
        return gate == null ? put : gate.asMono().then(put);
    }

    @Override
    public Mono<Boolean> cancel(String jobKey) {
        if (cancelFailure != null) {
            return Mono.error(cancelFailure);
        }
        return Mono.fromSupplier(() -> {
            cancels.add(jobKey);
            return slots.remove(jobKey) != null;
        });
    }
}
