package com.georep.storage.operations;

import com.georep.storage.config.RequestOptions;
import com.georep.storage.core.StorageCommand;
import com.georep.storage.model.ContinuationToken;
import com.georep.storage.model.OperationContext;
import com.georep.storage.model.ResultSegment;
import com.georep.storage.query.TableQuery;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Reactive storage operations. Nothing is sent until subscription, and
 * cancelling the subscription cancels the operation in progress.
 */
public interface ReactiveOperations {
    
    <T> Mono<T> execute(StorageCommand<T> command);
    <T> Mono<T> execute(StorageCommand<T> command, RequestOptions options, OperationContext context);
    
    <T> Mono<ResultSegment<T>> executeQuerySegmented(TableQuery query, Class<T> entityType, ContinuationToken token);
    
    /**
     * Streams every result, fetching the next page only once the previous one was emitted.
     * Each subscription starts from the first page.
     */
    <T> Flux<T> executeQuery(TableQuery query, Class<T> entityType);
    <T> Flux<T> executeQuery(TableQuery query, Class<T> entityType, RequestOptions options, OperationContext context);
}
