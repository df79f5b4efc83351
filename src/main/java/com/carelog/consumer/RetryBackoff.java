package com.carelog.consumer;

import java.time.Duration;

/**
 * Exponential redelivery delay: {@code initial * 2^(attempt-1)}, capped at {@code max}.
 */
public final class RetryBackoff {

    private final Duration initial;
    private final Duration max;

    public RetryBackoff(Duration initial, Duration max) {
        if (initial == null || initial.isNegative() || initial.isZero()) {
            throw new IllegalArgumentException("initial backoff must be positive");
        }
        if (max == null || max.compareTo(initial) < 0) {
            throw new IllegalArgumentException("max backoff must be >= initial backoff");
        }
        this.initial = initial;
        this.max = max;
    }

    /**
     * @param attempt 1-based delivery attempt that just failed
     */
    public Duration delayFor(long attempt) {
        long n = Math.max(1, attempt);
        // 2^62 already exceeds any sane cap; stop doubling before overflow.
        int shift = (int) Math.min(n - 1, 62);
        long capMillis = max.toMillis();
        long initMillis = initial.toMillis();
        if (initMillis > (capMillis >> shift)) {
            return max;
        }
        return Duration.ofMillis(Math.min(capMillis, initMillis << shift));
    }
}
