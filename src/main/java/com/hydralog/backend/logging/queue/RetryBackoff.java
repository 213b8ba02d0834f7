package com.hydralog.backend.logging.queue;

import java.time.Duration;

/**
 * Exponential backoff between replay attempts: initial, 2x, 4x, ... capped.
 * With the defaults: 1s, 2s, 4s, 8s, then 16s/30s cap.
 */
public final class RetryBackoff {

    private final Duration initial;
    private final Duration max;
    private final int maxAttempts;

    public RetryBackoff(Duration initial, Duration max, int maxAttempts) {
        this.initial = initial;
        this.max = max;
        this.maxAttempts = maxAttempts;
    }

    /** Wait before the next attempt, given how many attempts already failed (1-based). */
    public Duration delayAfter(int failedAttempts) {
        int shift = Math.max(0, Math.min(failedAttempts - 1, 20));
        Duration d = initial.multipliedBy(1L << shift);
        return d.compareTo(max) > 0 ? max : d;
    }

    public boolean shouldGiveUp(int failedAttempts) {
        return failedAttempts >= maxAttempts;
    }

    public int maxAttempts() {
        return maxAttempts;
    }
}
