package com.georep.storage.impl;

import com.georep.storage.config.RequestOptions;
import com.georep.storage.core.ExecutionEngine;
import com.georep.storage.core.StorageCommand;
import com.georep.storage.model.ContinuationToken;
import com.georep.storage.model.OperationContext;
import com.georep.storage.model.ResultSegment;
import com.georep.storage.operations.SyncOperations;
import com.georep.storage.query.SegmentedEnumerator;
import com.georep.storage.query.TableQuery;
import com.georep.storage.query.TakeBudget;

/**
 * Synchronous operations implementation; blocks on the async engine.
 */
public class SyncOperationsImpl implements SyncOperations {
    
    private final OperationDispatcher dispatcher;
    
    SyncOperationsImpl(OperationDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }
    
    @Override
    public <T> T execute(StorageCommand<T> command) {
        return execute(command, null, null);
    }
    
    @Override
    public <T> T execute(StorageCommand<T> command, RequestOptions options, OperationContext context) {
        return ExecutionEngine.join(dispatcher.execute(command, options, context, null));
    }
    
    @Override
    public <T> ResultSegment<T> executeQuerySegmented(TableQuery query, Class<T> entityType,
                                                      ContinuationToken token) {
        return executeQuerySegmented(query, entityType, token, null, null);
    }
    
    @Override
    public <T> ResultSegment<T> executeQuerySegmented(TableQuery query, Class<T> entityType, ContinuationToken token,
                                                      RequestOptions options, OperationContext context) {
        return ExecutionEngine.join(dispatcher.querySegment(query, entityType, token, options, context, null));
    }
    
    @Override
    public <T> Iterable<T> executeQuery(TableQuery query, Class<T> entityType) {
        return executeQuery(query, entityType, null, null);
    }
    
    @Override
    public <T> Iterable<T> executeQuery(TableQuery query, Class<T> entityType,
                                        RequestOptions options, OperationContext context) {
        if (query == null || entityType == null) {
            throw new IllegalArgumentException("Query and entity type are required");
        }
        return () -> enumerate(query, entityType, options, context).entities();
    }
    
    @Override
    public <T> SegmentedEnumerator<T> enumerate(TableQuery query, Class<T> entityType,
                                                RequestOptions options, OperationContext context) {
        TakeBudget budget = query == null ? TakeBudget.unbounded() : query.newBudget();
        return dispatcher.enumerator(query, entityType, null, budget, options, context, null);
    }
    
    @Override
    public <T> SegmentedEnumerator<T> resume(TableQuery query, Class<T> entityType, ContinuationToken token,
                                             Integer remaining, RequestOptions options, OperationContext context) {
        Integer requested = query == null ? null : query.getTakeCount();
        TakeBudget budget = TakeBudget.resume(requested, remaining);
        return dispatcher.enumerator(query, entityType, token, budget, options, context, null);
    }
}
