package com.validatorpayments.common;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Linear backoff for chain query retries: the n-th retry waits {@code baseDelay * n}, with optional jitter.
 */
public final class RetryPolicy {

    private final long baseDelayMs;
    private final double jitterFactor;
    private final int maxAttempts;

    public RetryPolicy(long baseDelayMs, double jitterFactor, int maxAttempts) {
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be positive");
        }
        this.baseDelayMs = Math.max(0L, baseDelayMs);
        this.jitterFactor = Math.max(0.0, jitterFactor);
        this.maxAttempts = maxAttempts;
    }

    /**
     * Delay in milliseconds before the retry that follows the given failed attempt (1-based).
     * Formula: baseDelay * attempt, then ±jitter.
     */
    public long delayMs(int failedAttempt) {
        long linear = baseDelayMs * Math.max(1, failedAttempt);
        return jitter(linear);
    }

    private long jitter(long value) {
        if (jitterFactor == 0.0) {
            return value;
        }
        ThreadLocalRandom r = ThreadLocalRandom.current();
        double jitter = 1.0 + (r.nextDouble() * 2.0 - 1.0) * jitterFactor;
        return Math.max(0, (long) (value * jitter));
    }

    /** Total attempts including the initial call. */
    public int getMaxAttempts() {
        return maxAttempts;
    }

    public long getBaseDelayMs() {
        return baseDelayMs;
    }

    /**
     * Default: 1s base, no jitter, 5 attempts (1 initial + 4 retries).
     */
    public static RetryPolicy defaultPolicy() {
        return new RetryPolicy(1000L, 0.0, 5);
    }
}
