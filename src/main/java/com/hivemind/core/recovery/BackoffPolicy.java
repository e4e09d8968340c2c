package com.hivemind.core.recovery;

import java.time.Duration;

/**
 * Bounded exponential backoff: the n-th retry (0-based) waits {@code base × 2^n}.
 */
public record BackoffPolicy(Duration base, int maxRetries) {

    public BackoffPolicy {
        if (base == null || base.isNegative()) {
            throw new IllegalArgumentException("Backoff base must be a non-negative duration");
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0, got " + maxRetries);
        }
    }

    /**
     * Delay before the retry that follows {@code attemptsSoFar} earlier retries.
     */
    public Duration delayFor(int attemptsSoFar) {
        return base.multipliedBy(1L << Math.min(attemptsSoFar, 30));
    }

    public boolean exhausted(int attemptsSoFar) {
        return attemptsSoFar >= maxRetries;
    }
}
