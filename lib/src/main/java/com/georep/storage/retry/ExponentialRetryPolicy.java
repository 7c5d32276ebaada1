package com.georep.storage.retry;

import io.github.resilience4j.core.IntervalFunction;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Retries with exponentially growing, jittered delays:
 * {@code min(maxBackoff, delta * (2^(n-1) - 1) / 2 + jitter)}, where {@code n}
 * is the 1-based number of the failed attempt and the jitter is uniform over
 * the last increment, {@code [0, delta * 2^(n-2))}. Because the jitter never
 * exceeds the gap to the next base value, delays never decrease with {@code n}.
 */
public class ExponentialRetryPolicy extends AbstractRetryPolicy {
    
    public static final Duration DEFAULT_DELTA_BACKOFF = Duration.ofSeconds(4);
    public static final Duration DEFAULT_MAX_BACKOFF = Duration.ofSeconds(120);
    public static final int DEFAULT_MAX_ATTEMPTS = 4;
    
    private final Duration deltaBackoff;
    private final Duration maxBackoff;
    private final DoubleSupplier random;
    private final IntervalFunction intervalFunction;
    
    public ExponentialRetryPolicy() {
        this(DEFAULT_DELTA_BACKOFF, DEFAULT_MAX_BACKOFF, DEFAULT_MAX_ATTEMPTS);
    }
    
    public ExponentialRetryPolicy(Duration deltaBackoff, Duration maxBackoff, int maxAttempts) {
        this(deltaBackoff, maxBackoff, maxAttempts, () -> ThreadLocalRandom.current().nextDouble());
    }
    
    /**
     * @param random source of values in {@code [0, 1)}; inject a constant for reproducible delays
     */
    public ExponentialRetryPolicy(Duration deltaBackoff, Duration maxBackoff, int maxAttempts,
                                  DoubleSupplier random) {
        super(maxAttempts);
        if (deltaBackoff == null || deltaBackoff.isNegative()) {
            throw new IllegalArgumentException("Delta backoff must be zero or positive");
        }
        if (maxBackoff == null || maxBackoff.isNegative()) {
            throw new IllegalArgumentException("Max backoff must be zero or positive");
        }
        if (random == null) {
            throw new IllegalArgumentException("Random source is required");
        }
        this.deltaBackoff = deltaBackoff;
        this.maxBackoff = maxBackoff;
        this.random = random;
        this.intervalFunction = this::computeDelayMillis;
    }
    
    public Duration getDeltaBackoff() {
        return deltaBackoff;
    }
    
    public Duration getMaxBackoff() {
        return maxBackoff;
    }
    
    @Override
    protected IntervalFunction intervalFunction() {
        return intervalFunction;
    }
    
    /**
     * Backoff after the failed attempt {@code attemptNumber}.
     */
    public Duration delayFor(int attemptNumber) {
        return Duration.ofMillis(computeDelayMillis(attemptNumber));
    }
    
    private long computeDelayMillis(Integer attemptNumber) {
        int n = Math.max(1, attemptNumber);
        double delta = deltaBackoff.toMillis();
        double base = delta * (Math.pow(2, n - 1) - 1) / 2.0;
        double lastIncrement = delta * Math.pow(2, n - 2);
        double jitter = clamp(random.getAsDouble()) * lastIncrement;
        return (long) Math.min(maxBackoff.toMillis(), base + jitter);
    }
    
    private static double clamp(double value) {
        if (value < 0 || Double.isNaN(value)) {
            return 0;
        }
        return Math.min(value, Math.nextDown(1.0));
    }
    
    @Override
    public String toString() {
        return String.format("ExponentialRetryPolicy{deltaBackoff=%s, maxBackoff=%s, maxAttempts=%d}",
            deltaBackoff, maxBackoff, getMaxAttempts());
    }
}
