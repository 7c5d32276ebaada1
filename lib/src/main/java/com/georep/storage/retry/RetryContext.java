package com.georep.storage.retry;

import com.georep.storage.config.LocationMode;
import com.georep.storage.model.RequestResult;
import com.georep.storage.model.StorageLocation;

import java.util.List;

/**
 * Everything a retry policy may look at after a failed attempt.
 *
 * @param attemptNumber   1-based number of the attempt that just failed
 * @param lastRequestResult the failed attempt
 * @param currentLocation location the failed attempt targeted
 * @param locationMode    location mode in effect for the operation
 * @param history         all attempts so far, oldest first, ending with {@code lastRequestResult}
 */
public record RetryContext(
    int attemptNumber,
    RequestResult lastRequestResult,
    StorageLocation currentLocation,
    LocationMode locationMode,
    List<RequestResult> history
) {
    
    public RetryContext {
        if (attemptNumber < 1) {
            throw new IllegalArgumentException("Attempt number must be at least 1");
        }
        if (lastRequestResult == null || currentLocation == null || locationMode == null) {
            throw new IllegalArgumentException("Last result, location and location mode are required");
        }
        history = history == null ? List.of(lastRequestResult) : List.copyOf(history);
    }
    
    public RetryContext(int attemptNumber, RequestResult lastRequestResult,
                        StorageLocation currentLocation, LocationMode locationMode) {
        this(attemptNumber, lastRequestResult, currentLocation, locationMode, null);
    }
    
    public Integer lastStatusCode() {
        return lastRequestResult.getStatusCode();
    }
}
