package com.carelog.jetstream.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * =====================================================================
 * JetStreamBootstrapProperties
 * =====================================================================
 *
 * Controls the startup create-or-validate pass over the check-in stream.
 *
 * CONFIGURATION PREFIX -------------------- carelog.bootstrap.*
 *
 * {@code enabled} should be true only on nodes allowed to own the stream.
 * {@code failOnMismatch} chooses between failing startup and logging a
 * warning when an existing stream differs from the configured one. It
 * controls reaction, never repair: existing streams are not modified.
 */
@ConfigurationProperties(prefix = "carelog.bootstrap")
public class JetStreamBootstrapProperties {

	private boolean enabled = true;

	private boolean failOnMismatch = false;

	public boolean isEnabled() {
		return enabled;
	}

	public void setEnabled(boolean enabled) {
		this.enabled = enabled;
	}

	public boolean isFailOnMismatch() {
		return failOnMismatch;
	}

	public void setFailOnMismatch(boolean failOnMismatch) {
		this.failOnMismatch = failOnMismatch;
	}
}
