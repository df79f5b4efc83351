package com.carelog.followup;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Follow-up scheduling and job consumer settings.
 *
 * <pre>
 * carelog:
 *   followup:
 *     delay: 24h
 *     active-window: 6h
 *     consumer:
 *       enabled: true
 *       durable: checkin-worker
 *       poll-interval: 5s
 *       batch-size: 10
 *       max-deliver: 8
 *       max-ack-pending: 50000
 *       retry-initial: 30s
 *       retry-max: 30m
 * </pre>
 */
@ConfigurationProperties(prefix = "carelog.followup")
public class FollowUpProperties {

    /** Time between a delivered summary and its check-in. */
    private Duration delay = Duration.ofHours(24);

    /**
     * A check-in is suppressed when both the bot and the user wrote within
     * this window before fire time.
     */
    private Duration activeWindow = Duration.ofHours(6);

    private Consumer consumer = new Consumer();

    public Duration getDelay() { return delay; }
    public void setDelay(Duration delay) { this.delay = delay; }

    public Duration getActiveWindow() { return activeWindow; }
    public void setActiveWindow(Duration activeWindow) { this.activeWindow = activeWindow; }

    public Consumer getConsumer() { return consumer; }
    public void setConsumer(Consumer consumer) { this.consumer = consumer; }

    public static class Consumer {

        private boolean enabled = true;

        /** Durable consumer name; every worker instance shares it. */
        private String durable = "checkin-worker";

        private Duration pollInterval = Duration.ofSeconds(5);

        private int batchSize = 10;

        /** Total delivery attempts per job, including deferrals of early deliveries. */
        private int maxDeliver = 8;

        /**
         * Upper bound on jobs delivered but not yet acked. Every outstanding
         * check-in sits here while deferred to its fire time, so this must
         * exceed the number of users with a check-in scheduled at once.
         */
        private long maxAckPending = 50_000;

        private Duration retryInitial = Duration.ofSeconds(30);

        private Duration retryMax = Duration.ofMinutes(30);

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getDurable() { return durable; }
        public void setDurable(String durable) { this.durable = durable; }

        public Duration getPollInterval() { return pollInterval; }
        public void setPollInterval(Duration pollInterval) { this.pollInterval = pollInterval; }

        public int getBatchSize() { return batchSize; }
        public void setBatchSize(int batchSize) { this.batchSize = batchSize; }

        public int getMaxDeliver() { return maxDeliver; }
        public void setMaxDeliver(int maxDeliver) { this.maxDeliver = maxDeliver; }

        public long getMaxAckPending() { return maxAckPending; }
        public void setMaxAckPending(long maxAckPending) { this.maxAckPending = maxAckPending; }

        public Duration getRetryInitial() { return retryInitial; }
        public void setRetryInitial(Duration retryInitial) { this.retryInitial = retryInitial; }

        public Duration getRetryMax() { return retryMax; }
        public void setRetryMax(Duration retryMax) { this.retryMax = retryMax; }
    }
}
