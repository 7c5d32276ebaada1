package com.georep.storage.model;

import java.util.Objects;

/**
 * Opaque server-issued cursor for resuming a paged query, together with the
 * location that issued it. Callers hand it back unmodified; only the query
 * command reads the individual markers.
 */
public final class ContinuationToken {
    
    private final String nextPartitionKey;
    private final String nextRowKey;
    private final String nextTableName;
    private final StorageLocation targetLocation;
    
    private ContinuationToken(String nextPartitionKey, String nextRowKey, String nextTableName,
                              StorageLocation targetLocation) {
        this.nextPartitionKey = nextPartitionKey;
        this.nextRowKey = nextRowKey;
        this.nextTableName = nextTableName;
        this.targetLocation = targetLocation;
    }
    
    /**
     * Creates a token from the markers returned by the service, or returns
     * {@code null} when all markers are absent (end of results).
     */
    public static ContinuationToken fromMarkers(String nextPartitionKey, String nextRowKey,
                                                String nextTableName, StorageLocation issuedBy) {
        if (isBlank(nextPartitionKey) && isBlank(nextRowKey) && isBlank(nextTableName)) {
            return null;
        }
        return new ContinuationToken(blankToNull(nextPartitionKey), blankToNull(nextRowKey),
                                     blankToNull(nextTableName), issuedBy);
    }
    
    public String getNextPartitionKey() {
        return nextPartitionKey;
    }
    
    public String getNextRowKey() {
        return nextRowKey;
    }
    
    public String getNextTableName() {
        return nextTableName;
    }
    
    /**
     * Location that issued this token; resumed requests are pinned to it.
     */
    public StorageLocation getTargetLocation() {
        return targetLocation;
    }
    
    private static boolean isBlank(String value) {
        return value == null || value.isEmpty();
    }
    
    private static String blankToNull(String value) {
        return isBlank(value) ? null : value;
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ContinuationToken)) {
            return false;
        }
        ContinuationToken that = (ContinuationToken) o;
        return Objects.equals(nextPartitionKey, that.nextPartitionKey)
            && Objects.equals(nextRowKey, that.nextRowKey)
            && Objects.equals(nextTableName, that.nextTableName)
            && targetLocation == that.targetLocation;
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(nextPartitionKey, nextRowKey, nextTableName, targetLocation);
    }
    
    @Override
    public String toString() {
        return String.format("ContinuationToken{location=%s}", targetLocation);
    }
}
