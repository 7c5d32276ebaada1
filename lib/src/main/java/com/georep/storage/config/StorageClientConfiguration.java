package com.georep.storage.config;

import com.georep.storage.model.StorageUri;
import com.georep.storage.retry.ExponentialRetryPolicy;
import com.georep.storage.retry.RetryPolicy;

import java.time.Duration;

/**
 * Client-wide defaults: the endpoint pair, location mode, retry policy,
 * deadlines, payload format and the service's maximum page size.
 * Immutable and safe to share between threads.
 */
public class StorageClientConfiguration {
    
    public static final int DEFAULT_SERVER_MAX_PAGE_SIZE = 1000;
    
    private final StorageUri storageUri;
    private final LocationMode locationMode;
    private final RetryPolicy retryPolicy;
    private final Duration attemptTimeout;
    private final Duration maximumExecutionTime;
    private final PayloadFormat payloadFormat;
    private final int serverMaxPageSize;
    private final int schedulerThreads;
    
    private StorageClientConfiguration(Builder builder) {
        this.storageUri = builder.storageUri;
        this.locationMode = builder.locationMode;
        this.retryPolicy = builder.retryPolicy;
        this.attemptTimeout = builder.attemptTimeout;
        this.maximumExecutionTime = builder.maximumExecutionTime;
        this.payloadFormat = builder.payloadFormat;
        this.serverMaxPageSize = builder.serverMaxPageSize;
        this.schedulerThreads = builder.schedulerThreads;
    }
    
    public StorageUri getStorageUri() {
        return storageUri;
    }
    
    public LocationMode getLocationMode() {
        return locationMode;
    }
    
    public RetryPolicy getRetryPolicy() {
        return retryPolicy;
    }
    
    public Duration getAttemptTimeout() {
        return attemptTimeout;
    }
    
    public Duration getMaximumExecutionTime() {
        return maximumExecutionTime;
    }
    
    public PayloadFormat getPayloadFormat() {
        return payloadFormat;
    }
    
    public int getServerMaxPageSize() {
        return serverMaxPageSize;
    }
    
    public int getSchedulerThreads() {
        return schedulerThreads;
    }
    
    /**
     * Options with every value taken from this configuration.
     */
    public RequestOptions defaultRequestOptions() {
        return RequestOptions.none().resolve(this);
    }
    
    public static Builder builder() {
        return new Builder();
    }
    
    public static StorageClientConfiguration defaultConfig(StorageUri storageUri) {
        return builder().storageUri(storageUri).build();
    }

    /**
     * Configuration for a read-heavy client that starts on the primary and
     * falls back to the secondary replica.
     */
    public static StorageClientConfiguration readAccessGeoRedundant(StorageUri storageUri) {
        return builder()
            .storageUri(storageUri)
            .locationMode(LocationMode.PRIMARY_THEN_SECONDARY)
            .build();
    }
    
    public static class Builder {
        private StorageUri storageUri;
        private LocationMode locationMode = LocationMode.PRIMARY_ONLY;
        private RetryPolicy retryPolicy = new ExponentialRetryPolicy();
        private Duration attemptTimeout = Duration.ofSeconds(30);
        private Duration maximumExecutionTime = Duration.ofMinutes(5);
        private PayloadFormat payloadFormat = PayloadFormat.JSON;
        private int serverMaxPageSize = DEFAULT_SERVER_MAX_PAGE_SIZE;
        private int schedulerThreads = 2;
        
        public Builder storageUri(StorageUri storageUri) {
            this.storageUri = storageUri;
            return this;
        }
        
        public Builder locationMode(LocationMode locationMode) {
            this.locationMode = locationMode;
            return this;
        }
        
        public Builder retryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = retryPolicy;
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
        
        public Builder serverMaxPageSize(int serverMaxPageSize) {
            this.serverMaxPageSize = serverMaxPageSize;
            return this;
        }
        
        public Builder schedulerThreads(int schedulerThreads) {
            this.schedulerThreads = schedulerThreads;
            return this;
        }
        
        public StorageClientConfiguration build() {
            if (storageUri == null) {
                throw new IllegalArgumentException("Storage URI is required");
            }
            if (locationMode == null) {
                throw new IllegalArgumentException("Location mode is required");
            }
            if (!storageUri.validateLocationMode(locationMode)) {
                throw new IllegalArgumentException(
                    "Location mode " + locationMode + " requires a secondary URI, none configured for "
                        + storageUri.getPrimaryUri());
            }
            if (retryPolicy == null) {
                throw new IllegalArgumentException("Retry policy is required");
            }
            if (payloadFormat == null) {
                throw new IllegalArgumentException("Payload format is required");
            }
            if (attemptTimeout == null || attemptTimeout.isZero() || attemptTimeout.isNegative()) {
                throw new IllegalArgumentException("Attempt timeout must be positive");
            }
            if (maximumExecutionTime == null || maximumExecutionTime.isZero()
                || maximumExecutionTime.isNegative()) {
                throw new IllegalArgumentException("Maximum execution time must be positive");
            }
            if (serverMaxPageSize < 1) {
                throw new IllegalArgumentException("Server max page size must be at least 1");
            }
            if (schedulerThreads < 1) {
                throw new IllegalArgumentException("Scheduler threads must be at least 1");
            }
            return new StorageClientConfiguration(this);
        }
    }
    
    @Override
    public String toString() {
        return String.format("StorageClientConfiguration{storageUri=%s, locationMode=%s, retryPolicy=%s, "
                + "attemptTimeout=%s, maximumExecutionTime=%s, payloadFormat=%s, serverMaxPageSize=%d}",
            storageUri, locationMode, retryPolicy, attemptTimeout, maximumExecutionTime,
            payloadFormat, serverMaxPageSize);
    }
}
