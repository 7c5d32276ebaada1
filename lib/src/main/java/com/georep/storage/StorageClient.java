package com.georep.storage;

import com.georep.storage.config.StorageClientConfiguration;
import com.georep.storage.operations.AsyncOperations;
import com.georep.storage.operations.ReactiveOperations;
import com.georep.storage.operations.SyncOperations;
import io.micrometer.core.instrument.MeterRegistry;

/**
 * Main client interface for a geo-replicated storage account.
 * Provides sync, async and reactive programming models over one execution
 * engine that handles retries, location fallback and cancellation.
 */
public interface StorageClient extends AutoCloseable {
    
    /**
     * Get synchronous operations interface.
     * @return SyncOperations instance for blocking operations
     */
    SyncOperations sync();
    
    /**
     * Get asynchronous operations interface.
     * @return AsyncOperations instance for CompletableFuture-based operations
     */
    AsyncOperations async();
    
    /**
     * Get reactive operations interface.
     * @return ReactiveOperations instance for Mono/Flux-based operations
     */
    ReactiveOperations reactive();
    
    StorageClientConfiguration getConfiguration();
    
    /**
     * Registry holding the client's attempt, retry and paging meters.
     */
    MeterRegistry getMeterRegistry();
    
    boolean isClosed();
    
    /**
     * Cancels every operation in progress and shuts down the client's scheduler.
     */
    @Override
    void close();
}
