package com.georep.storage.query;

import com.georep.storage.core.ExecutionEngine;
import com.georep.storage.model.ContinuationToken;
import com.georep.storage.model.ResultSegment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.concurrent.CompletableFuture;

/**
 * Walks a query page by page. Each page is one logical operation; the
 * enumerator carries the continuation token and the take budget between
 * pages and stops when the service returns no token or the budget runs out.
 * <p>
 * Not thread-safe. Resume an enumeration later by creating a new enumerator
 * from {@link #getContinuationToken()} and {@link #getRemaining()}.
 *
 * @param <T> entity type
 */
public class SegmentedEnumerator<T> {
    
    private static final Logger logger = LoggerFactory.getLogger(SegmentedEnumerator.class);
    
    /**
     * Fetches one page starting at {@code token}.
     */
    @FunctionalInterface
    public interface PageFetcher<T> {
        /**
         * @param top page size to request, or {@code null} when the query has no take-count
         */
        CompletableFuture<ResultSegment<T>> fetch(ContinuationToken token, Integer top);
    }
    
    private final PageFetcher<T> fetcher;
    private final TakeBudget budget;
    private final int serverMaxPageSize;
    
    private ContinuationToken token;
    private boolean finished;
    private boolean pagePending;
    
    public SegmentedEnumerator(PageFetcher<T> fetcher, TakeBudget budget, int serverMaxPageSize) {
        this(fetcher, budget, serverMaxPageSize, null);
    }
    
    public SegmentedEnumerator(PageFetcher<T> fetcher, TakeBudget budget, int serverMaxPageSize,
                               ContinuationToken startToken) {
        if (fetcher == null || budget == null) {
            throw new IllegalArgumentException("Page fetcher and take budget are required");
        }
        if (serverMaxPageSize < 1) {
            throw new IllegalArgumentException("Server max page size must be at least 1");
        }
        this.fetcher = fetcher;
        this.budget = budget;
        this.serverMaxPageSize = serverMaxPageSize;
        this.token = startToken;
        this.finished = budget.isExhausted();
    }
    
    public boolean hasMorePages() {
        return !finished;
    }
    
    /**
     * Token for the next page, or {@code null} when the service reported no further results.
     */
    public ContinuationToken getContinuationToken() {
        return token;
    }
    
    /**
     * Entities still allowed by the take-count, or {@code null} for an unbounded query.
     */
    public Integer getRemaining() {
        return budget.getRemaining();
    }
    
    public TakeBudget getBudget() {
        return budget;
    }
    
    public ResultSegment<T> nextPage() {
        return ExecutionEngine.join(nextPageAsync());
    }
    
    /**
     * Fetches the next page. Once the enumeration is finished this returns an
     * empty segment without contacting the service.
     */
    public CompletableFuture<ResultSegment<T>> nextPageAsync() {
        if (finished) {
            return CompletableFuture.completedFuture(new ResultSegment<>(List.of(), null));
        }
        if (pagePending) {
            throw new IllegalStateException("A page request is already in progress");
        }
        pagePending = true;
        Integer top = budget.isBounded() ? budget.nextPageSize(serverMaxPageSize) : null;
        CompletableFuture<ResultSegment<T>> page;
        try {
            page = fetcher.fetch(token, top);
        } catch (RuntimeException e) {
            pagePending = false;
            throw e;
        }
        return page.handle((segment, error) -> {
            pagePending = false;
            if (error != null) {
                throw error instanceof RuntimeException ? (RuntimeException) error : new IllegalStateException(error);
            }
            return accept(segment);
        });
    }
    
    private ResultSegment<T> accept(ResultSegment<T> segment) {
        List<T> results = segment.getResults();
        ContinuationToken next = segment.getContinuationToken();
        Integer remaining = budget.getRemaining();
        if (remaining != null && results.size() > remaining) {
            logger.warn("Service returned {} entities but only {} were requested, discarding the surplus",
                        results.size(), remaining);
            results = results.subList(0, remaining);
            next = null;
        }
        budget.consume(results.size());
        token = next;
        finished = next == null || budget.isExhausted();
        logger.debug("Fetched page of {} entities, budget {}, more pages: {}", results.size(), budget, !finished);
        return new ResultSegment<>(results, next);
    }
    
    /**
     * Lazily iterates over every entity, fetching pages on demand.
     */
    public Iterator<T> entities() {
        return new EntityIterator();
    }
    
    private final class EntityIterator implements Iterator<T> {
        private Iterator<T> current = List.<T>of().iterator();
        
        @Override
        public boolean hasNext() {
            while (!current.hasNext()) {
                if (!hasMorePages()) {
                    return false;
                }
                current = nextPage().iterator();
            }
            return true;
        }
        
        @Override
        public T next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            return current.next();
        }
    }
}
