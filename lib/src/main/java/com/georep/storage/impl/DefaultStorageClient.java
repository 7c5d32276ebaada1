package com.georep.storage.impl;

import com.georep.storage.StorageClient;
import com.georep.storage.config.StorageClientConfiguration;
import com.georep.storage.core.ExecutionEngine;
import com.georep.storage.observability.MetricsCollector;
import com.georep.storage.operations.AsyncOperations;
import com.georep.storage.operations.ReactiveOperations;
import com.georep.storage.operations.SyncOperations;
import com.georep.storage.transport.HttpTransport;
import com.georep.storage.transport.PayloadCodec;
import com.georep.storage.transport.RequestSigner;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Default implementation of StorageClient. Owns the scheduler used for
 * backoff waits and attempt deadlines.
 */
public class DefaultStorageClient implements StorageClient {
    
    private static final Logger logger = LoggerFactory.getLogger(DefaultStorageClient.class);
    
    private final StorageClientConfiguration configuration;
    private final MetricsCollector metricsCollector;
    private final ScheduledExecutorService scheduler;
    private final ExecutionEngine engine;
    private final OperationDispatcher dispatcher;
    private final SyncOperations syncOperations;
    private final AsyncOperations asyncOperations;
    private final ReactiveOperations reactiveOperations;
    
    public DefaultStorageClient(StorageClientConfiguration configuration, HttpTransport transport,
                                RequestSigner signer, PayloadCodec codec, MetricsCollector metricsCollector) {
        this.configuration = configuration;
        this.metricsCollector = metricsCollector;
        this.scheduler = Executors.newScheduledThreadPool(
            configuration.getSchedulerThreads(), new SchedulerThreadFactory());
        
        this.engine = new ExecutionEngine(transport, signer, scheduler, metricsCollector);
        this.dispatcher = new OperationDispatcher(engine, configuration, codec, metricsCollector);
        this.syncOperations = new SyncOperationsImpl(dispatcher);
        this.asyncOperations = new AsyncOperationsImpl(dispatcher);
        this.reactiveOperations = new ReactiveOperationsImpl(dispatcher);
        
        logger.info("Storage client initialized for {} in mode {}",
                    configuration.getStorageUri(), configuration.getLocationMode());
    }
    
    @Override
    public SyncOperations sync() {
        dispatcher.checkNotClosed();
        return syncOperations;
    }
    
    @Override
    public AsyncOperations async() {
        dispatcher.checkNotClosed();
        return asyncOperations;
    }
    
    @Override
    public ReactiveOperations reactive() {
        dispatcher.checkNotClosed();
        return reactiveOperations;
    }
    
    @Override
    public StorageClientConfiguration getConfiguration() {
        return configuration;
    }
    
    @Override
    public MeterRegistry getMeterRegistry() {
        return metricsCollector.getMeterRegistry();
    }
    
    @Override
    public boolean isClosed() {
        return dispatcher.isClosed();
    }
    
    @Override
    public void close() {
        if (dispatcher.close()) {
            logger.info("Closing storage client for {}", configuration.getStorageUri());
            engine.cancelAll();
            scheduler.shutdownNow();
            logger.info("Storage client closed");
        }
    }
    
    private static final class SchedulerThreadFactory implements ThreadFactory {
        private static final AtomicInteger POOL = new AtomicInteger();
        private final int pool = POOL.incrementAndGet();
        private final AtomicInteger thread = new AtomicInteger();
        
        @Override
        public Thread newThread(Runnable runnable) {
            Thread t = new Thread(runnable, "georep-storage-" + pool + "-scheduler-" + thread.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
