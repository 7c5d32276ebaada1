package com.georep.storage.operations;

import com.georep.storage.config.RequestOptions;
import com.georep.storage.core.StorageCommand;
import com.georep.storage.model.ContinuationToken;
import com.georep.storage.model.OperationContext;
import com.georep.storage.model.ResultSegment;
import com.georep.storage.query.SegmentedEnumerator;
import com.georep.storage.query.TableQuery;

/**
 * Blocking storage operations. Every call blocks the calling thread until the
 * logical operation completes and throws
 * {@link com.georep.storage.exception.StorageException} on failure.
 * Options left unset fall back to the client configuration.
 */
public interface SyncOperations {
    
    <T> T execute(StorageCommand<T> command);
    <T> T execute(StorageCommand<T> command, RequestOptions options, OperationContext context);
    
    /**
     * Fetches one page of results starting at {@code token} ({@code null} for the first page).
     */
    <T> ResultSegment<T> executeQuerySegmented(TableQuery query, Class<T> entityType, ContinuationToken token);
    <T> ResultSegment<T> executeQuerySegmented(TableQuery query, Class<T> entityType, ContinuationToken token,
                                               RequestOptions options, OperationContext context);
    
    /**
     * Lazily iterates over all results. Each {@code iterator()} call starts a
     * fresh enumeration from the first page.
     */
    <T> Iterable<T> executeQuery(TableQuery query, Class<T> entityType);
    <T> Iterable<T> executeQuery(TableQuery query, Class<T> entityType,
                                 RequestOptions options, OperationContext context);
    
    /**
     * Page-by-page enumeration from the start of the query.
     */
    <T> SegmentedEnumerator<T> enumerate(TableQuery query, Class<T> entityType,
                                         RequestOptions options, OperationContext context);
    
    /**
     * Resumes an enumeration from a saved token and remaining take budget.
     *
     * @param remaining entities still allowed, or {@code null} when the query has no take-count
     */
    <T> SegmentedEnumerator<T> resume(TableQuery query, Class<T> entityType, ContinuationToken token,
                                      Integer remaining, RequestOptions options, OperationContext context);
}
