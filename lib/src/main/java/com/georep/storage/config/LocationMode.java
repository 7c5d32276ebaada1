package com.georep.storage.config;

import com.georep.storage.model.StorageLocation;

/**
 * Specifies which location the first attempt of an operation targets and
 * the order in which retries fall back between primary and secondary.
 */
public enum LocationMode {
    
    /**
     * Requests are always sent to the primary location.
     */
    PRIMARY_ONLY(StorageLocation.PRIMARY, false),
    
    /**
     * Requests are always sent to the secondary location.
     */
    SECONDARY_ONLY(StorageLocation.SECONDARY, false),
    
    /**
     * Requests are sent to the primary location first. Retries after a
     * location-related failure alternate to the secondary and back.
     */
    PRIMARY_THEN_SECONDARY(StorageLocation.PRIMARY, true),
    
    /**
     * Requests are sent to the secondary location first. Retries after a
     * location-related failure alternate to the primary and back.
     */
    SECONDARY_THEN_PRIMARY(StorageLocation.SECONDARY, true);
    
    private final StorageLocation initialLocation;
    private final boolean fallback;
    
    LocationMode(StorageLocation initialLocation, boolean fallback) {
        this.initialLocation = initialLocation;
        this.fallback = fallback;
    }
    
    /**
     * The location targeted by attempt #1.
     */
    public StorageLocation initialLocation() {
        return initialLocation;
    }
    
    public boolean allowsFallback() {
        return fallback;
    }
    
    /**
     * Returns the location a fallback retry should target after a failure on
     * {@code current}. Single-location modes always return their own location.
     */
    public StorageLocation alternate(StorageLocation current) {
        return fallback ? current.other() : initialLocation;
    }
    
    public boolean canTarget(StorageLocation location) {
        return fallback || initialLocation == location;
    }
    
    public boolean requiresSecondary() {
        return this != PRIMARY_ONLY;
    }
    
    /**
     * The single-location mode pinned to {@code location}.
     */
    public static LocationMode pinnedTo(StorageLocation location) {
        return location == StorageLocation.PRIMARY ? PRIMARY_ONLY : SECONDARY_ONLY;
    }
}
