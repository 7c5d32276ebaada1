package com.georep.storage.query;

/**
 * Remaining number of entities an enumeration may still return. An unbounded
 * budget has no requested count and never runs out. Owned by one enumerator.
 */
public final class TakeBudget {
    
    private final Integer requested;
    private Integer remaining;
    
    private TakeBudget(Integer requested, Integer remaining) {
        this.requested = requested;
        this.remaining = remaining;
    }
    
    public static TakeBudget unbounded() {
        return new TakeBudget(null, null);
    }
    
    public static TakeBudget of(int takeCount) {
        if (takeCount <= 0) {
            throw new IllegalArgumentException("Take count must be positive, got " + takeCount);
        }
        return new TakeBudget(takeCount, takeCount);
    }
    
    /**
     * Budget for an enumeration resumed after some entities were already returned.
     */
    public static TakeBudget resume(Integer requested, Integer remaining) {
        if (requested == null) {
            return unbounded();
        }
        if (requested <= 0) {
            throw new IllegalArgumentException("Take count must be positive, got " + requested);
        }
        if (remaining == null || remaining < 0 || remaining > requested) {
            throw new IllegalArgumentException(
                "Remaining count must be between 0 and " + requested + ", got " + remaining);
        }
        return new TakeBudget(requested, remaining);
    }
    
    public boolean isBounded() {
        return requested != null;
    }
    
    public Integer getRequested() {
        return requested;
    }
    
    public Integer getRemaining() {
        return remaining;
    }
    
    public boolean isExhausted() {
        return remaining != null && remaining == 0;
    }
    
    public int nextPageSize(int serverMaxPageSize) {
        return remaining == null ? serverMaxPageSize : Math.min(serverMaxPageSize, remaining);
    }
    
    void consume(int count) {
        if (remaining != null) {
            remaining = Math.max(0, remaining - count);
        }
    }
    
    @Override
    public String toString() {
        return isBounded() ? remaining + "/" + requested : "unbounded";
    }
}
