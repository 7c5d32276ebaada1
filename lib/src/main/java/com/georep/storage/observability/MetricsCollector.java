package com.georep.storage.observability;

import com.georep.storage.exception.ErrorKind;
import com.georep.storage.model.StorageLocation;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Collects metrics for storage operations: physical attempts per location,
 * attempt latency, retries, terminal operation outcomes and query paging.
 */
public class MetricsCollector {
    
    private static final Logger logger = LoggerFactory.getLogger(MetricsCollector.class);
    
    private final MeterRegistry meterRegistry;
    private final Map<StorageLocation, LocationMetrics> locationMetrics;
    
    private final Counter retries;
    private final Counter succeededOperations;
    private final Counter pages;
    private final Counter entities;
    
    public MetricsCollector() {
        this(new SimpleMeterRegistry());
    }
    
    public MetricsCollector(MeterRegistry meterRegistry) {
        if (meterRegistry == null) {
            throw new IllegalArgumentException("Meter registry is required");
        }
        this.meterRegistry = meterRegistry;
        this.locationMetrics = new EnumMap<>(StorageLocation.class);
        for (StorageLocation location : StorageLocation.values()) {
            locationMetrics.put(location, new LocationMetrics(location, meterRegistry));
        }
        
        this.retries = Counter.builder("georep.storage.retries")
            .description("Retries scheduled by the retry policy")
            .register(meterRegistry);
        
        this.succeededOperations = Counter.builder("georep.storage.operations")
            .tag("result", "success")
            .description("Completed logical operations")
            .register(meterRegistry);
        
        this.pages = Counter.builder("georep.storage.pages")
            .description("Query result pages fetched")
            .register(meterRegistry);
        
        this.entities = Counter.builder("georep.storage.entities")
            .description("Entities returned by queries")
            .register(meterRegistry);
        
        logger.debug("Metrics collector initialized with {}", meterRegistry.getClass().getSimpleName());
    }
    
    public void recordAttempt(StorageLocation location, Duration latency, boolean success) {
        if (location != null) {
            locationMetrics.get(location).recordAttempt(latency, success);
        }
    }
    
    public void recordRetry() {
        retries.increment();
    }
    
    public void recordOperationSuccess() {
        succeededOperations.increment();
    }
    
    public void recordOperationFailure(ErrorKind kind) {
        Counter.builder("georep.storage.operations")
            .tag("result", kind.name().toLowerCase())
            .description("Completed logical operations")
            .register(meterRegistry)
            .increment();
    }
    
    public void recordPage(int entityCount) {
        pages.increment();
        entities.increment(entityCount);
    }
    
    public MeterRegistry getMeterRegistry() {
        return meterRegistry;
    }
    
    /**
     * Location-specific metrics container.
     */
    private static class LocationMetrics {
        private final Counter successes;
        private final Counter failures;
        private final Timer latency;
        
        LocationMetrics(StorageLocation location, MeterRegistry registry) {
            String tag = location.name().toLowerCase();
            this.successes = Counter.builder("georep.storage.attempts")
                .tag("location", tag)
                .tag("outcome", "success")
                .description("Physical attempts per location")
                .register(registry);
            
            this.failures = Counter.builder("georep.storage.attempts")
                .tag("location", tag)
                .tag("outcome", "failure")
                .description("Physical attempts per location")
                .register(registry);
            
            this.latency = Timer.builder("georep.storage.attempt.latency")
                .tag("location", tag)
                .description("Attempt latency per location")
                .register(registry);
        }
        
        void recordAttempt(Duration attemptLatency, boolean success) {
            if (success) {
                successes.increment();
            } else {
                failures.increment();
            }
            if (attemptLatency != null) {
                latency.record(attemptLatency);
            }
        }
    }
}
