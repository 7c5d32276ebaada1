package com.georep.storage.transport;

import java.net.URI;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An HTTP request ready to be signed and sent. Immutable; signers return a
 * copy with extra headers via {@link #withHeader(String, String)}.
 */
public final class StorageRequest {
    
    private final String method;
    private final URI uri;
    private final Map<String, String> headers;
    private final byte[] body;
    
    private StorageRequest(Builder builder) {
        this.method = builder.method;
        this.uri = builder.uri;
        this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(builder.headers));
        this.body = builder.body;
    }
    
    public String getMethod() {
        return method;
    }
    
    public URI getUri() {
        return uri;
    }
    
    public Map<String, String> getHeaders() {
        return headers;
    }
    
    public String getHeader(String name) {
        return headers.get(name);
    }
    
    /**
     * Request body, or {@code null} for requests without one.
     */
    public byte[] getBody() {
        return body == null ? null : body.clone();
    }
    
    public StorageRequest withHeader(String name, String value) {
        return toBuilder().header(name, value).build();
    }
    
    public Builder toBuilder() {
        Builder builder = new Builder()
            .method(method)
            .uri(uri)
            .body(body);
        builder.headers.putAll(headers);
        return builder;
    }
    
    @Override
    public String toString() {
        return String.format("StorageRequest{%s %s}", method, uri);
    }
    
    public static Builder builder() {
        return new Builder();
    }
    
    public static class Builder {
        private String method = "GET";
        private URI uri;
        private final Map<String, String> headers = new LinkedHashMap<>();
        private byte[] body;
        
        public Builder method(String method) {
            this.method = method;
            return this;
        }
        
        public Builder uri(URI uri) {
            this.uri = uri;
            return this;
        }
        
        public Builder header(String name, String value) {
            this.headers.put(name, value);
            return this;
        }
        
        public Builder headers(Map<String, String> headers) {
            this.headers.putAll(headers);
            return this;
        }
        
        public Builder body(byte[] body) {
            this.body = body == null ? null : body.clone();
            return this;
        }
        
        public StorageRequest build() {
            if (method == null || method.trim().isEmpty()) {
                throw new IllegalArgumentException("HTTP method is required");
            }
            if (uri == null) {
                throw new IllegalArgumentException("Request URI is required");
            }
            return new StorageRequest(this);
        }
    }
}
