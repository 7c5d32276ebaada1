package com.georep.storage.retry;

import com.georep.storage.config.LocationMode;
import com.georep.storage.core.AttemptClassifier;
import com.georep.storage.model.StorageLocation;
import io.github.resilience4j.core.IntervalFunction;

import java.time.Duration;
import java.util.Optional;

/**
 * Attempt cap, status filtering and location selection shared by the
 * built-in policies. Subclasses supply only the backoff interval.
 */
public abstract class AbstractRetryPolicy implements RetryPolicy {
    
    private final int maxAttempts;
    
    protected AbstractRetryPolicy(int maxAttempts) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("Max attempts must be at least 1");
        }
        this.maxAttempts = maxAttempts;
    }
    
    public int getMaxAttempts() {
        return maxAttempts;
    }
    
    /**
     * Backoff in milliseconds, keyed by the 1-based number of the failed attempt.
     */
    protected abstract IntervalFunction intervalFunction();
    
    @Override
    public Optional<RetryInfo> evaluate(RetryContext context) {
        if (context.attemptNumber() >= maxAttempts) {
            return Optional.empty();
        }
        Integer status = context.lastStatusCode();
        if (!AttemptClassifier.isRetryableStatus(status)) {
            return Optional.empty();
        }
        long delayMillis = intervalFunction().apply(context.attemptNumber());
        return Optional.of(new RetryInfo(Duration.ofMillis(delayMillis), nextLocation(context, status)));
    }
    
    /**
     * Switches location only when the mode allows it and the failure suggests the
     * location itself is the problem; throttling (429) stays where it is.
     */
    protected StorageLocation nextLocation(RetryContext context, Integer status) {
        LocationMode mode = context.locationMode();
        StorageLocation current = context.currentLocation();
        if (AttemptClassifier.isLocationFallbackEligible(status)) {
            return mode.alternate(current);
        }
        return mode.canTarget(current) ? current : mode.initialLocation();
    }
}
