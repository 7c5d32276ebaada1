package com.georep.storage.retry;

import java.time.Duration;
import java.util.Optional;

/**
 * Decides whether a failed attempt is retried. Only consulted after a
 * retryable failure; the first attempt is always sent.
 * <p>
 * Implementations must be pure and side-effect free: one instance is shared
 * by every concurrent operation of a client.
 */
@FunctionalInterface
public interface RetryPolicy {
    
    /**
     * @return the retry decision, or empty to stop
     */
    Optional<RetryInfo> evaluate(RetryContext context);
    
    static RetryPolicy noRetry() {
        return NoRetryPolicy.INSTANCE;
    }
    
    static RetryPolicy linear(Duration deltaBackoff, int maxAttempts) {
        return new LinearRetryPolicy(deltaBackoff, maxAttempts);
    }
    
    static RetryPolicy exponential(Duration deltaBackoff, Duration maxBackoff, int maxAttempts) {
        return new ExponentialRetryPolicy(deltaBackoff, maxBackoff, maxAttempts);
    }
}
