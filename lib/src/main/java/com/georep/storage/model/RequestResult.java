package com.georep.storage.model;

import java.time.Duration;
import java.time.Instant;

/**
 * Outcome of one physical request attempt. Immutable once recorded.
 */
public final class RequestResult {
    
    private final StorageLocation location;
    private final Integer statusCode;
    private final String serviceRequestId;
    private final Instant startTime;
    private final Instant endTime;
    private final Throwable error;
    
    private RequestResult(Builder builder) {
        this.location = builder.location;
        this.statusCode = builder.statusCode;
        this.serviceRequestId = builder.serviceRequestId;
        this.startTime = builder.startTime;
        this.endTime = builder.endTime;
        this.error = builder.error;
    }
    
    public StorageLocation getLocation() {
        return location;
    }
    
    /**
     * HTTP status, or {@code null} when the attempt produced no response.
     */
    public Integer getStatusCode() {
        return statusCode;
    }
    
    public String getServiceRequestId() {
        return serviceRequestId;
    }
    
    public Instant getStartTime() {
        return startTime;
    }
    
    public Instant getEndTime() {
        return endTime;
    }
    
    public Throwable getError() {
        return error;
    }
    
    public boolean isSuccess() {
        return error == null;
    }
    
    public Duration getElapsed() {
        return Duration.between(startTime, endTime);
    }
    
    @Override
    public String toString() {
        return String.format("RequestResult{location=%s, status=%s, requestId='%s', elapsed=%dms, error=%s}",
            location, statusCode, serviceRequestId, getElapsed().toMillis(),
            error == null ? null : error.getMessage());
    }
    
    public static Builder builder() {
        return new Builder();
    }
    
    public static class Builder {
        private StorageLocation location = StorageLocation.PRIMARY;
        private Integer statusCode;
        private String serviceRequestId;
        private Instant startTime;
        private Instant endTime;
        private Throwable error;
        
        public Builder location(StorageLocation location) {
            this.location = location;
            return this;
        }
        
        public Builder statusCode(Integer statusCode) {
            this.statusCode = statusCode;
            return this;
        }
        
        public Builder serviceRequestId(String serviceRequestId) {
            this.serviceRequestId = serviceRequestId;
            return this;
        }
        
        public Builder startTime(Instant startTime) {
            this.startTime = startTime;
            return this;
        }
        
        public Builder endTime(Instant endTime) {
            this.endTime = endTime;
            return this;
        }
        
        public Builder error(Throwable error) {
            this.error = error;
            return this;
        }
        
        public RequestResult build() {
            if (location == null) {
                throw new IllegalArgumentException("Location is required");
            }
            if (startTime == null) {
                throw new IllegalArgumentException("Start time is required");
            }
            if (endTime == null) {
                endTime = startTime;
            }
            return new RequestResult(this);
        }
    }
}
