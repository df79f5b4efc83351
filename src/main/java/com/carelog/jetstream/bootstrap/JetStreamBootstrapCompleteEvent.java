package com.carelog.jetstream.bootstrap;

/**
 * Published once the check-in stream exists and has been validated.
 *
 * The job consumer listens for it, and also starts on application-ready for
 * nodes where bootstrap is disabled.
 */
public record JetStreamBootstrapCompleteEvent(String streamName) {
}
