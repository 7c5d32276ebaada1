package com.georep.storage.transport;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Raw HTTP response as handed back by the transport. Header lookup is
 * case-insensitive.
 */
public final class StorageResponse {
    
    public static final String REQUEST_ID_HEADER = "x-ms-request-id";
    public static final String CONTENT_TYPE_HEADER = "Content-Type";
    
    private final int statusCode;
    private final Map<String, String> headers;
    private final byte[] body;
    
    public StorageResponse(int statusCode, Map<String, String> headers, byte[] body) {
        this.statusCode = statusCode;
        TreeMap<String, String> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (headers != null) {
            copy.putAll(headers);
        }
        this.headers = Collections.unmodifiableMap(copy);
        this.body = body == null ? new byte[0] : body.clone();
    }
    
    public static StorageResponse of(int statusCode) {
        return new StorageResponse(statusCode, Map.of(), null);
    }
    
    public int getStatusCode() {
        return statusCode;
    }
    
    public Map<String, String> getHeaders() {
        return headers;
    }
    
    public String getHeader(String name) {
        return headers.get(name);
    }
    
    public String getContentType() {
        return headers.get(CONTENT_TYPE_HEADER);
    }
    
    public String getServiceRequestId() {
        return headers.get(REQUEST_ID_HEADER);
    }
    
    public byte[] getBody() {
        return body.clone();
    }
    
    @Override
    public String toString() {
        return String.format("StorageResponse{status=%d, requestId='%s', bodyLength=%d}",
            statusCode, getServiceRequestId(), body.length);
    }
}
