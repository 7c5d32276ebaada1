package com.georep.storage.retry;

import io.github.resilience4j.core.IntervalFunction;

import java.time.Duration;

/**
 * Retries with a fixed delay between attempts.
 */
public class LinearRetryPolicy extends AbstractRetryPolicy {
    
    public static final Duration DEFAULT_DELTA_BACKOFF = Duration.ofSeconds(30);
    public static final int DEFAULT_MAX_ATTEMPTS = 4;
    
    private final Duration deltaBackoff;
    private final IntervalFunction intervalFunction;
    
    public LinearRetryPolicy() {
        this(DEFAULT_DELTA_BACKOFF, DEFAULT_MAX_ATTEMPTS);
    }
    
    public LinearRetryPolicy(Duration deltaBackoff, int maxAttempts) {
        super(maxAttempts);
        if (deltaBackoff == null || deltaBackoff.isNegative()) {
            throw new IllegalArgumentException("Delta backoff must be zero or positive");
        }
        this.deltaBackoff = deltaBackoff;
        // IntervalFunction.of rejects intervals under one millisecond
        long deltaMillis = deltaBackoff.toMillis();
        this.intervalFunction = deltaMillis >= 1
            ? IntervalFunction.of(deltaBackoff)
            : attempt -> 0L;
    }
    
    public Duration getDeltaBackoff() {
        return deltaBackoff;
    }
    
    @Override
    protected IntervalFunction intervalFunction() {
        return intervalFunction;
    }
    
    @Override
    public String toString() {
        return String.format("LinearRetryPolicy{deltaBackoff=%s, maxAttempts=%d}", deltaBackoff, getMaxAttempts());
    }
}
