package com.georep.storage.impl;

import com.georep.storage.config.RequestOptions;
import com.georep.storage.core.CancellationSignal;
import com.georep.storage.core.StorageCommand;
import com.georep.storage.model.ContinuationToken;
import com.georep.storage.model.OperationContext;
import com.georep.storage.model.ResultSegment;
import com.georep.storage.operations.AsyncOperations;
import com.georep.storage.query.TableQuery;

import java.util.concurrent.CompletableFuture;

/**
 * Asynchronous operations implementation.
 */
public class AsyncOperationsImpl implements AsyncOperations {
    
    private final OperationDispatcher dispatcher;
    
    AsyncOperationsImpl(OperationDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }
    
    @Override
    public <T> CompletableFuture<T> executeAsync(StorageCommand<T> command) {
        return executeAsync(command, null, null, null);
    }
    
    @Override
    public <T> CompletableFuture<T> executeAsync(StorageCommand<T> command, RequestOptions options,
                                                 OperationContext context, CancellationSignal cancellation) {
        return dispatcher.execute(command, options, context, cancellation);
    }
    
    @Override
    public <T> CompletableFuture<ResultSegment<T>> executeQuerySegmentedAsync(TableQuery query, Class<T> entityType,
                                                                              ContinuationToken token) {
        return executeQuerySegmentedAsync(query, entityType, token, null, null, null);
    }
    
    @Override
    public <T> CompletableFuture<ResultSegment<T>> executeQuerySegmentedAsync(TableQuery query, Class<T> entityType,
                                                                              ContinuationToken token,
                                                                              RequestOptions options,
                                                                              OperationContext context,
                                                                              CancellationSignal cancellation) {
        return dispatcher.querySegment(query, entityType, token, options, context, cancellation);
    }
}
