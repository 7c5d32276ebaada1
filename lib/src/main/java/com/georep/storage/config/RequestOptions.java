package com.georep.storage.config;

import com.georep.storage.retry.RetryPolicy;

import java.time.Duration;

/**
 * Per-call settings. Any value left unset falls back to the client's
 * {@link StorageClientConfiguration} when the options are resolved, so two
 * concurrent calls can run with different settings without touching shared state.
 */
public class RequestOptions {
    
    private final RetryPolicy retryPolicy;
    private final LocationMode locationMode;
    private final Duration attemptTimeout;
    private final Duration maximumExecutionTime;
    private final PayloadFormat payloadFormat;
    
    private RequestOptions(Builder builder) {
        this.retryPolicy = builder.retryPolicy;
        this.locationMode = builder.locationMode;
        this.attemptTimeout = builder.attemptTimeout;
        this.maximumExecutionTime = builder.maximumExecutionTime;
        this.payloadFormat = builder.payloadFormat;
    }
    
    public RetryPolicy getRetryPolicy() {
        return retryPolicy;
    }
    
    public LocationMode getLocationMode() {
        return locationMode;
    }
    
    /**
     * Deadline for a single attempt; also sent to the service as its server-side timeout.
     */
    public Duration getAttemptTimeout() {
        return attemptTimeout;
    }
    
    /**
     * Deadline for the whole operation, including every attempt and backoff wait.
     */
    public Duration getMaximumExecutionTime() {
        return maximumExecutionTime;
    }
    
    public PayloadFormat getPayloadFormat() {
        return payloadFormat;
    }
    
    public boolean isResolved() {
        return retryPolicy != null && locationMode != null && attemptTimeout != null
            && maximumExecutionTime != null && payloadFormat != null;
    }
    
    /**
     * Returns a copy in which every unset value is taken from {@code defaults}.
     */
    public RequestOptions resolve(StorageClientConfiguration defaults) {
        return builder()
            .retryPolicy(retryPolicy != null ? retryPolicy : defaults.getRetryPolicy())
            .locationMode(locationMode != null ? locationMode : defaults.getLocationMode())
            .attemptTimeout(attemptTimeout != null ? attemptTimeout : defaults.getAttemptTimeout())
            .maximumExecutionTime(maximumExecutionTime != null
                ? maximumExecutionTime : defaults.getMaximumExecutionTime())
            .payloadFormat(payloadFormat != null ? payloadFormat : defaults.getPayloadFormat())
            .build();
    }
    
    public static RequestOptions none() {
        return builder().build();
    }
    
    public static Builder builder() {
        return new Builder();
    }
    
    public static class Builder {
        private RetryPolicy retryPolicy;
        private LocationMode locationMode;
        private Duration attemptTimeout;
        private Duration maximumExecutionTime;
        private PayloadFormat payloadFormat;
        
        public Builder retryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = retryPolicy;
            return this;
        }
        
        public Builder locationMode(LocationMode locationMode) {
            this.locationMode = locationMode;
            return this;
        }
        
        public Builder attemptTimeout(Duration attemptTimeout) {
            this.attemptTimeout = attemptTimeout;
            return this;
        }
        
        public Builder maximumExecutionTime(Duration maximumExecutionTime) {
            this.maximumExecutionTime = maximumExecutionTime;
            return this;
        }
        
        public Builder payloadFormat(PayloadFormat payloadFormat) {
            this.payloadFormat = payloadFormat;
            return this;
        }
        
        public RequestOptions build() {
            if (attemptTimeout != null && (attemptTimeout.isZero() || attemptTimeout.isNegative())) {
                throw new IllegalArgumentException("Attempt timeout must be positive");
            }
            if (maximumExecutionTime != null
                && (maximumExecutionTime.isZero() || maximumExecutionTime.isNegative())) {
                throw new IllegalArgumentException("Maximum execution time must be positive");
            }
            return new RequestOptions(this);
        }
    }
    
    @Override
    public String toString() {
        return String.format("RequestOptions{retryPolicy=%s, locationMode=%s, attemptTimeout=%s, "
                + "maximumExecutionTime=%s, payloadFormat=%s}",
            retryPolicy, locationMode, attemptTimeout, maximumExecutionTime, payloadFormat);
    }
}
