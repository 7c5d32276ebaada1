package com.georep.storage.impl;

import com.georep.storage.config.RequestOptions;
import com.georep.storage.core.CancellationSignal;
import com.georep.storage.core.StorageCommand;
import com.georep.storage.model.ContinuationToken;
import com.georep.storage.model.OperationContext;
import com.georep.storage.model.ResultSegment;
import com.georep.storage.operations.ReactiveOperations;
import com.georep.storage.query.SegmentedEnumerator;
import com.georep.storage.query.TableQuery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Reactive operations implementation built on Project Reactor. Each
 * subscription owns a {@link CancellationSignal} that is fired when the
 * subscriber cancels.
 */
public class ReactiveOperationsImpl implements ReactiveOperations {
    
    private static final Logger logger = LoggerFactory.getLogger(ReactiveOperationsImpl.class);
    
    private final OperationDispatcher dispatcher;
    
    ReactiveOperationsImpl(OperationDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }
    
    @Override
    public <T> Mono<T> execute(StorageCommand<T> command) {
        return execute(command, null, null);
    }
    
    @Override
    public <T> Mono<T> execute(StorageCommand<T> command, RequestOptions options, OperationContext context) {
        return Mono.defer(() -> {
            CancellationSignal signal = new CancellationSignal();
            return Mono.fromFuture(dispatcher.execute(command, options, context, signal))
                .doOnCancel(signal::cancel);
        });
    }
    
    @Override
    public <T> Mono<ResultSegment<T>> executeQuerySegmented(TableQuery query, Class<T> entityType,
                                                            ContinuationToken token) {
        return Mono.defer(() -> {
            CancellationSignal signal = new CancellationSignal();
            return Mono.fromFuture(dispatcher.querySegment(query, entityType, token, null, null, signal))
                .doOnCancel(signal::cancel);
        });
    }
    
    @Override
    public <T> Flux<T> executeQuery(TableQuery query, Class<T> entityType) {
        return executeQuery(query, entityType, null, null);
    }
    
    @Override
    public <T> Flux<T> executeQuery(TableQuery query, Class<T> entityType,
                                    RequestOptions options, OperationContext context) {
        if (query == null || entityType == null) {
            return Flux.error(new IllegalArgumentException("Query and entity type are required"));
        }
        return Flux.defer(() -> {
            CancellationSignal signal = new CancellationSignal();
            SegmentedEnumerator<T> enumerator = dispatcher.enumerator(
                query, entityType, null, query.newBudget(), options, context, signal);
            return Mono.fromFuture(enumerator::nextPageAsync)
                .expand(page -> enumerator.hasMorePages()
                    ? Mono.fromFuture(enumerator::nextPageAsync)
                    : Mono.empty())
                .flatMapIterable(ResultSegment::getResults)
                .doOnCancel(() -> {
                    logger.debug("Subscriber cancelled query on table {}", query.getTableName());
                    signal.cancel();
                });
        });
    }
}
