package com.georep.storage.core;

import com.georep.storage.exception.StorageException;
import com.georep.storage.exception.StorageException.ClientErrorException;
import com.georep.storage.exception.StorageException.ServerErrorException;
import com.georep.storage.exception.StorageException.TransientFailureException;

import java.util.Set;

/**
 * Maps HTTP status codes to attempt outcomes. A {@code null} status stands for
 * an attempt that produced no response (network failure or timeout).
 */
public final class AttemptClassifier {
    
    private static final Set<Integer> RETRYABLE_STATUS_CODES = Set.of(408, 429, 500, 502, 503, 504);
    
    public enum Outcome {
        SUCCESS,
        RETRYABLE,
        FATAL
    }
    
    private AttemptClassifier() {
    }
    
    public static Outcome classify(Integer statusCode) {
        if (statusCode == null) {
            return Outcome.RETRYABLE;
        }
        if (statusCode >= 200 && statusCode < 300) {
            return Outcome.SUCCESS;
        }
        return RETRYABLE_STATUS_CODES.contains(statusCode) ? Outcome.RETRYABLE : Outcome.FATAL;
    }
    
    public static boolean isRetryableStatus(Integer statusCode) {
        return classify(statusCode) == Outcome.RETRYABLE;
    }
    
    /**
     * True for failures that point at the location rather than the request:
     * no response, 408, or any 5xx.
     */
    public static boolean isLocationFallbackEligible(Integer statusCode) {
        return statusCode == null || statusCode == 408 || statusCode >= 500;
    }
    
    /**
     * Per-attempt error for a non-success status.
     */
    public static StorageException failureFor(int statusCode, String serviceRequestId) {
        String message = String.format("Service returned status %d (request id %s)", statusCode, serviceRequestId);
        return switch (classify(statusCode)) {
            case RETRYABLE -> new TransientFailureException(message, null, statusCode);
            case FATAL -> statusCode >= 400 && statusCode < 500
                ? new ClientErrorException(statusCode, message)
                : new ServerErrorException(statusCode, message, null);
            case SUCCESS -> throw new IllegalArgumentException("Status " + statusCode + " is not a failure");
        };
    }
}
