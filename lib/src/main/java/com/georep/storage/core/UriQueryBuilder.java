package com.georep.storage.core;

import com.georep.storage.model.StorageUri;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Accumulates query parameters and merges them into a URI without disturbing
 * the parameters it already carries. Values are percent-encoded once, on
 * {@link #add(String, String)}; existing query text is never re-encoded.
 * <p>
 * Each logical request builds a fresh instance, so a repeated name is a
 * programming error rather than a multi-valued parameter.
 */
public class UriQueryBuilder {
    
    private final Map<String, String> parameters;
    
    public UriQueryBuilder() {
        this.parameters = new LinkedHashMap<>();
    }
    
    public UriQueryBuilder(UriQueryBuilder other) {
        this.parameters = other == null ? new LinkedHashMap<>() : new LinkedHashMap<>(other.parameters);
    }
    
    /**
     * Adds a parameter. A {@code null} value renders as a bare key.
     *
     * @throws IllegalArgumentException if {@code name} is blank or already present
     */
    public UriQueryBuilder add(String name, String value) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Query parameter name is required");
        }
        if (parameters.containsKey(name)) {
            throw new IllegalArgumentException("Duplicate query parameter: " + name);
        }
        parameters.put(name, value == null ? null : escape(value));
        return this;
    }
    
    public boolean contains(String name) {
        return parameters.containsKey(name);
    }
    
    public boolean isEmpty() {
        return parameters.isEmpty();
    }
    
    /**
     * Renders {@code ?k1=v1&k2=v2}, or an empty string when nothing was added.
     */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, String> parameter : parameters.entrySet()) {
            sb.append(sb.length() == 0 ? '?' : '&');
            sb.append(parameter.getKey());
            if (parameter.getValue() != null) {
                sb.append('=').append(parameter.getValue());
            }
        }
        return sb.toString();
    }
    
    /**
     * Returns a new URI with these parameters appended to {@code uri}'s query.
     *
     * @throws IllegalArgumentException if {@code uri} is null, opaque or cannot be rebuilt
     */
    public URI addToUri(URI uri) {
        if (uri == null) {
            throw new IllegalArgumentException("URI is required");
        }
        if (uri.isOpaque()) {
            throw new IllegalArgumentException("Cannot add query parameters to opaque URI: " + uri);
        }
        if (parameters.isEmpty()) {
            return uri;
        }
        
        String appended = toString().substring(1);
        String existing = uri.getRawQuery();
        String query = existing == null || existing.isEmpty() ? appended : existing + "&" + appended;
        
        StringBuilder sb = new StringBuilder();
        if (uri.getScheme() != null) {
            sb.append(uri.getScheme()).append(':');
        }
        if (uri.getRawAuthority() != null) {
            sb.append("//").append(uri.getRawAuthority());
        }
        if (uri.getRawPath() != null) {
            sb.append(uri.getRawPath());
        }
        sb.append('?').append(query);
        if (uri.getRawFragment() != null) {
            sb.append('#').append(uri.getRawFragment());
        }
        
        try {
            return new URI(sb.toString());
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Malformed URI after adding query: " + sb, e);
        }
    }
    
    /**
     * Parses {@code uri} and appends these parameters to it.
     *
     * @throws IllegalArgumentException if {@code uri} is malformed
     */
    public URI addToUri(String uri) {
        if (uri == null) {
            throw new IllegalArgumentException("URI is required");
        }
        try {
            return addToUri(new URI(uri));
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Malformed URI: " + uri, e);
        }
    }
    
    /**
     * Applies these parameters to both locations of an endpoint pair.
     */
    public StorageUri addToUri(StorageUri storageUri) {
        if (storageUri == null) {
            throw new IllegalArgumentException("Storage URI is required");
        }
        return new StorageUri(
            addToUri(storageUri.getPrimaryUri()),
            storageUri.hasSecondary() ? addToUri(storageUri.getSecondaryUri()) : null);
    }
    
    /**
     * RFC 3986 escaping: everything but unreserved characters is percent-encoded,
     * so a space becomes {@code %20} rather than {@code +}.
     */
    static String escape(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8)
            .replace("+", "%20")
            .replace("*", "%2A")
            .replace("%7E", "~");
    }
}
