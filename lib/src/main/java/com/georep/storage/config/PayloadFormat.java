package com.georep.storage.config;

/**
 * Wire format requested from the service for entity payloads. The engine
 * never interprets the payload itself; the format is passed through to the
 * {@link com.georep.storage.transport.PayloadCodec} and mapped to the
 * {@code Accept} header.
 */
public enum PayloadFormat {
    
    JSON("application/json;odata=minimalmetadata"),
    
    JSON_NO_METADATA("application/json;odata=nometadata"),
    
    JSON_FULL_METADATA("application/json;odata=fullmetadata"),
    
    ATOM_PUB("application/atom+xml,application/xml");
    
    private final String acceptHeader;
    
    PayloadFormat(String acceptHeader) {
        this.acceptHeader = acceptHeader;
    }
    
    public String getAcceptHeader() {
        return acceptHeader;
    }
}
