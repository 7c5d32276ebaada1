package com.georep.storage.impl;

import com.georep.storage.config.RequestOptions;
import com.georep.storage.config.StorageClientConfiguration;
import com.georep.storage.core.CancellationSignal;
import com.georep.storage.core.ExecutionEngine;
import com.georep.storage.core.StorageCommand;
import com.georep.storage.model.ContinuationToken;
import com.georep.storage.model.OperationContext;
import com.georep.storage.model.ResultSegment;
import com.georep.storage.observability.MetricsCollector;
import com.georep.storage.query.QueryCommand;
import com.georep.storage.query.SegmentedEnumerator;
import com.georep.storage.query.TableQuery;
import com.georep.storage.query.TakeBudget;
import com.georep.storage.transport.PayloadCodec;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Shared plumbing behind the sync, async and reactive operations: resolves
 * per-call options against the client configuration and hands commands to
 * the {@link ExecutionEngine}.
 */
class OperationDispatcher {
    
    private final ExecutionEngine engine;
    private final StorageClientConfiguration configuration;
    private final PayloadCodec codec;
    private final MetricsCollector metricsCollector;
    private final AtomicBoolean closed = new AtomicBoolean(false);
    
    OperationDispatcher(ExecutionEngine engine, StorageClientConfiguration configuration,
                        PayloadCodec codec, MetricsCollector metricsCollector) {
        this.engine = engine;
        this.configuration = configuration;
        this.codec = codec;
        this.metricsCollector = metricsCollector;
    }
    
    RequestOptions resolve(RequestOptions options) {
        return (options == null ? RequestOptions.none() : options).resolve(configuration);
    }
    
    <T> CompletableFuture<T> execute(StorageCommand<T> command, RequestOptions options,
                                     OperationContext context, CancellationSignal cancellation) {
        checkNotClosed();
        if (command == null) {
            throw new IllegalArgumentException("Command is required");
        }
        return engine.executeAsync(command, resolve(options),
            context == null ? new OperationContext() : context,
            cancellation == null ? new CancellationSignal() : cancellation);
    }
    
    <T> SegmentedEnumerator<T> enumerator(TableQuery query, Class<T> entityType, ContinuationToken token,
                                          TakeBudget budget, RequestOptions options,
                                          OperationContext context, CancellationSignal cancellation) {
        checkNotClosed();
        if (query == null || entityType == null) {
            throw new IllegalArgumentException("Query and entity type are required");
        }
        RequestOptions resolved = resolve(options);
        OperationContext operationContext = context == null ? new OperationContext() : context;
        CancellationSignal signal = cancellation == null ? new CancellationSignal() : cancellation;
        SegmentedEnumerator.PageFetcher<T> fetcher = (pageToken, top) -> {
            checkNotClosed();
            QueryCommand<T> command = new QueryCommand<>(
                configuration.getStorageUri(), query, pageToken, top, codec, entityType);
            CompletableFuture<ResultSegment<T>> page =
                engine.executeAsync(command, resolved, operationContext, signal);
            page.thenAccept(segment -> metricsCollector.recordPage(segment.size()));
            return page;
        };
        return new SegmentedEnumerator<>(fetcher, budget, configuration.getServerMaxPageSize(), token);
    }
    
    <T> CompletableFuture<ResultSegment<T>> querySegment(TableQuery query, Class<T> entityType,
                                                         ContinuationToken token, RequestOptions options,
                                                         OperationContext context, CancellationSignal cancellation) {
        CancellationSignal signal = cancellation == null ? new CancellationSignal() : cancellation;
        TakeBudget budget = query == null ? TakeBudget.unbounded() : query.newBudget();
        CompletableFuture<ResultSegment<T>> page =
            enumerator(query, entityType, token, budget, options, context, signal).nextPageAsync();
        page.whenComplete((segment, error) -> {
            if (page.isCancelled()) {
                signal.cancel();
            }
        });
        return page;
    }
    
    StorageClientConfiguration getConfiguration() {
        return configuration;
    }
    
    boolean close() {
        return closed.compareAndSet(false, true);
    }
    
    boolean isClosed() {
        return closed.get();
    }
    
    void checkNotClosed() {
        if (closed.get()) {
            throw new IllegalStateException("Storage client has been closed");
        }
    }
}
