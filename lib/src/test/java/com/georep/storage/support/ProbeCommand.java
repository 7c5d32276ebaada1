package com.georep.storage.support;

import com.georep.storage.config.RequestOptions;
import com.georep.storage.core.StorageCommand;
import com.georep.storage.model.StorageLocation;
import com.georep.storage.model.StorageUri;
import com.georep.storage.transport.StorageRequest;
import com.georep.storage.transport.StorageResponse;

import java.net.URI;

/**
 * Minimal command whose result is the location that answered.
 */
public class ProbeCommand extends StorageCommand<StorageLocation> {
    
    private final StorageLocation pinnedLocation;
    
    public ProbeCommand(StorageUri storageUri) {
        this(storageUri, null);
    }
    
    public ProbeCommand(StorageUri storageUri, StorageLocation pinnedLocation) {
        super(storageUri);
        this.pinnedLocation = pinnedLocation;
    }
    
    @Override
    public StorageLocation getPinnedLocation() {
        return pinnedLocation;
    }
    
    @Override
    public StorageRequest buildRequest(URI target, RequestOptions options) {
        return StorageRequest.builder().method("HEAD").uri(target).build();
    }
    
    @Override
    public StorageLocation parseResponse(StorageResponse response, StorageLocation location,
                                         RequestOptions options) {
        return location;
    }
}
