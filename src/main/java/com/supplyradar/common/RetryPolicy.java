package com.supplyradar.common;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Delay schedule and attempt budget for RPC retries. Fixed delay by default; exponential growth and
 * jitter are opt-in (see supplyradar.rpc in application.yml).
 */
public final class RetryPolicy {

    private final long baseDelayMs;
    private final double jitterFactor;
    private final int maxAttempts;
    private final boolean exponential;

    public RetryPolicy(long baseDelayMs, double jitterFactor, int maxAttempts, boolean exponential) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        if (baseDelayMs < 0) {
            throw new IllegalArgumentException("baseDelayMs must not be negative");
        }
        if (jitterFactor < 0 || jitterFactor > 1) {
            throw new IllegalArgumentException("jitterFactor must be within 0..1");
        }
        this.baseDelayMs = baseDelayMs;
        this.jitterFactor = jitterFactor;
        this.maxAttempts = maxAttempts;
        this.exponential = exponential;
    }

    /**
     * Same delay before every retry, no jitter.
     */
    public static RetryPolicy fixed(long delayMs, int maxAttempts) {
        return new RetryPolicy(delayMs, 0.0, maxAttempts, false);
    }

    /**
     * Delay in milliseconds to wait after the given zero-based failed attempt.
     * Fixed: baseDelay. Exponential: baseDelay * 2^attempt. Then ±jitterFactor.
     */
    public long delayMs(int attempt) {
        if (!exponential || attempt <= 0) {
            return jitter(baseDelayMs);
        }
        long grown = baseDelayMs * (1L << Math.min(attempt, 20));
        return jitter(grown);
    }

    private long jitter(long value) {
        if (jitterFactor == 0.0) {
            return value;
        }
        ThreadLocalRandom r = ThreadLocalRandom.current();
        double jitter = 1.0 + (r.nextDouble() * 2.0 - 1.0) * jitterFactor;
        return Math.max(0, (long) (value * jitter));
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public long getBaseDelayMs() {
        return baseDelayMs;
    }

    public boolean isExponential() {
        return exponential;
    }

    /**
     * Default: 3 attempts, fixed 1s between them.
     */
    public static RetryPolicy defaultPolicy() {
        return fixed(1000L, 3);
    }

    @Override
    public String toString() {
        return "RetryPolicy[maxAttempts=" + maxAttempts + ", baseDelayMs=" + baseDelayMs
                + ", exponential=" + exponential + ", jitter=" + jitterFactor + "]";
    }
}
