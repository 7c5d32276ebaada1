package com.georep.storage.transport;

import com.georep.storage.config.PayloadFormat;

import java.io.IOException;
import java.util.List;

/**
 * Serializes request bodies and parses entity payloads. The engine treats the
 * wire format as opaque.
 */
public interface PayloadCodec {
    
    byte[] serializeRequestBody(Object operation, PayloadFormat format) throws IOException;
    
    <T> List<T> parseEntities(byte[] body, String contentType, Class<T> entityType,
                              PayloadFormat format) throws IOException;
}
