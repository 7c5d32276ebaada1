package com.georep.storage.exception;

/**
 * Classification of a terminal (or recorded per-attempt) failure.
 */
public enum ErrorKind {
    
    /**
     * Malformed endpoint, unsupported location or signing failure. Never retried.
     */
    CONFIGURATION,
    
    /**
     * Network failure, attempt timeout, 408, 429 or a retryable 5xx.
     * Retried subject to the retry policy.
     */
    TRANSIENT,
    
    /**
     * 4xx other than 408 and 429. Never retried.
     */
    CLIENT,
    
    /**
     * Any other non-success status, or a response body that could not be parsed.
     */
    SERVER,
    
    /**
     * The caller cancelled the operation.
     */
    CANCELLED,
    
    /**
     * The retry policy declined another attempt after a transient failure.
     */
    EXHAUSTED_RETRIES,
    
    /**
     * The per-operation deadline elapsed.
     */
    OPERATION_TIMEOUT
}
