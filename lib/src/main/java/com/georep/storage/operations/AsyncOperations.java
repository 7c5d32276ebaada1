package com.georep.storage.operations;

import com.georep.storage.config.RequestOptions;
import com.georep.storage.core.CancellationSignal;
import com.georep.storage.core.StorageCommand;
import com.georep.storage.model.ContinuationToken;
import com.georep.storage.model.OperationContext;
import com.georep.storage.model.ResultSegment;
import com.georep.storage.query.TableQuery;

import java.util.concurrent.CompletableFuture;

/**
 * Non-blocking storage operations based on {@link CompletableFuture}.
 * Cancelling a returned future cancels the operation.
 */
public interface AsyncOperations {
    
    <T> CompletableFuture<T> executeAsync(StorageCommand<T> command);
    <T> CompletableFuture<T> executeAsync(StorageCommand<T> command, RequestOptions options,
                                          OperationContext context, CancellationSignal cancellation);
    
    <T> CompletableFuture<ResultSegment<T>> executeQuerySegmentedAsync(TableQuery query, Class<T> entityType,
                                                                       ContinuationToken token);
    <T> CompletableFuture<ResultSegment<T>> executeQuerySegmentedAsync(TableQuery query, Class<T> entityType,
                                                                       ContinuationToken token,
                                                                       RequestOptions options,
                                                                       OperationContext context,
                                                                       CancellationSignal cancellation);
}
