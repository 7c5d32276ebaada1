package com.georep.storage.core;

import com.georep.storage.config.RequestOptions;
import com.georep.storage.model.StorageLocation;
import com.georep.storage.model.StorageUri;
import com.georep.storage.transport.StorageRequest;
import com.georep.storage.transport.StorageResponse;

import java.io.IOException;
import java.net.URI;

/**
 * One logical operation as seen by the {@link ExecutionEngine}: how to build a
 * request for a given physical target and how to turn a successful response
 * into a result. Commands are rebuilt into a fresh request on every attempt.
 *
 * @param <T> result type
 */
public abstract class StorageCommand<T> {
    
    private final StorageUri storageUri;
    
    protected StorageCommand(StorageUri storageUri) {
        if (storageUri == null) {
            throw new IllegalArgumentException("Storage URI is required");
        }
        this.storageUri = storageUri;
    }
    
    public StorageUri getStorageUri() {
        return storageUri;
    }
    
    /**
     * Location every attempt must target regardless of the location mode, or
     * {@code null} to let the mode and retry policy decide.
     */
    public StorageLocation getPinnedLocation() {
        return null;
    }
    
    /**
     * Short name used in logs and metrics.
     */
    public String getName() {
        return getClass().getSimpleName();
    }
    
    /**
     * Adds command-specific query parameters. Called once per attempt with a fresh builder.
     */
    public void addQueryParameters(UriQueryBuilder builder, RequestOptions options) {
    }
    
    /**
     * Builds the request for {@code target}, which already carries every query parameter.
     *
     * @throws IOException if the request body cannot be serialized
     */
    public abstract StorageRequest buildRequest(URI target, RequestOptions options) throws IOException;
    
    /**
     * Parses a 2xx response received from {@code location}.
     *
     * @throws IOException if the body cannot be parsed
     */
    public abstract T parseResponse(StorageResponse response, StorageLocation location,
                                    RequestOptions options) throws IOException;
}
