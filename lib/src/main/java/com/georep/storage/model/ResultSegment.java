package com.georep.storage.model;

import java.util.Iterator;
import java.util.List;

/**
 * One page of query results plus the token for the next page, which is
 * {@code null} when there is nothing more to fetch.
 */
public final class ResultSegment<T> implements Iterable<T> {
    
    private final List<T> results;
    private final ContinuationToken continuationToken;
    
    public ResultSegment(List<T> results, ContinuationToken continuationToken) {
        this.results = results == null ? List.of() : List.copyOf(results);
        this.continuationToken = continuationToken;
    }
    
    public List<T> getResults() {
        return results;
    }
    
    public ContinuationToken getContinuationToken() {
        return continuationToken;
    }
    
    public boolean hasMoreResults() {
        return continuationToken != null;
    }
    
    public int size() {
        return results.size();
    }
    
    @Override
    public Iterator<T> iterator() {
        return results.iterator();
    }
    
    @Override
    public String toString() {
        return String.format("ResultSegment{size=%d, continuationToken=%s}", results.size(), continuationToken);
    }
}
