package com.georep.storage.retry;

import java.util.Optional;

/**
 * Never retries; every operation makes exactly one attempt.
 */
public final class NoRetryPolicy implements RetryPolicy {
    
    static final NoRetryPolicy INSTANCE = new NoRetryPolicy();
    
    private NoRetryPolicy() {
    }
    
    @Override
    public Optional<RetryInfo> evaluate(RetryContext context) {
        return Optional.empty();
    }
    
    @Override
    public String toString() {
        return "NoRetryPolicy";
    }
}
