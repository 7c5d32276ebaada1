package com.georep.storage.model;

/**
 * One of the two endpoints of a geo-replicated storage resource.
 */
public enum StorageLocation {
    
    /**
     * The primary, writable location.
     */
    PRIMARY,
    
    /**
     * The read-only secondary replica.
     */
    SECONDARY;
    
    public StorageLocation other() {
        return this == PRIMARY ? SECONDARY : PRIMARY;
    }
}
