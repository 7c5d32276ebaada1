package com.georep.storage.retry;

import com.georep.storage.model.StorageLocation;

import java.time.Duration;

/**
 * A decision to retry: how long to wait and which location to target next.
 */
public record RetryInfo(Duration backoffDelay, StorageLocation nextLocation) {
    
    public RetryInfo {
        if (backoffDelay == null || backoffDelay.isNegative()) {
            throw new IllegalArgumentException("Backoff delay must be zero or positive");
        }
        if (nextLocation == null) {
            throw new IllegalArgumentException("Next location is required");
        }
    }
}
