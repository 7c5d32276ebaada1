package com.georep.storage.transport;

import java.security.GeneralSecurityException;

/**
 * Adds authentication to an outgoing request. A failure means the client is
 * misconfigured and is never retried.
 */
@FunctionalInterface
public interface RequestSigner {
    
    StorageRequest sign(StorageRequest request) throws GeneralSecurityException;
    
    /**
     * Signer that passes requests through unchanged, for pre-authorized URIs.
     */
    static RequestSigner anonymous() {
        return request -> request;
    }
}
