package com.georep.storage.model;

import com.georep.storage.config.LocationMode;
import com.georep.storage.exception.StorageException.UnsupportedLocationException;

import java.net.URI;
import java.util.Objects;

/**
 * Identity of a storage resource: a primary URI and an optional read-only
 * secondary replica URI. Immutable.
 */
public final class StorageUri {
    
    private final URI primaryUri;
    private final URI secondaryUri;
    
    public StorageUri(URI primaryUri) {
        this(primaryUri, null);
    }
    
    public StorageUri(URI primaryUri, URI secondaryUri) {
        if (primaryUri == null) {
            throw new IllegalArgumentException("Primary URI is required");
        }
        assertAbsolute(primaryUri, "Primary");
        if (secondaryUri != null) {
            assertAbsolute(secondaryUri, "Secondary");
            if (primaryUri.equals(secondaryUri)) {
                throw new IllegalArgumentException("Primary and secondary URIs must differ: " + primaryUri);
            }
        }
        this.primaryUri = primaryUri;
        this.secondaryUri = secondaryUri;
    }
    
    public static StorageUri of(String primaryUri) {
        return new StorageUri(parse(primaryUri));
    }
    
    public static StorageUri of(String primaryUri, String secondaryUri) {
        return new StorageUri(parse(primaryUri), secondaryUri == null ? null : parse(secondaryUri));
    }
    
    public URI getPrimaryUri() {
        return primaryUri;
    }
    
    public URI getSecondaryUri() {
        return secondaryUri;
    }
    
    public boolean hasSecondary() {
        return secondaryUri != null;
    }
    
    /**
     * Resolves the physical URI for {@code location}.
     *
     * @throws UnsupportedLocationException if the secondary is requested but not configured
     */
    public URI getUri(StorageLocation location) {
        return switch (location) {
            case PRIMARY -> primaryUri;
            case SECONDARY -> {
                if (secondaryUri == null) {
                    throw new UnsupportedLocationException(
                        "Secondary location requested but no secondary URI is configured for " + primaryUri);
                }
                yield secondaryUri;
            }
        };
    }
    
    /**
     * Returns true if every location {@code mode} may target is defined.
     */
    public boolean validateLocationMode(LocationMode mode) {
        return !mode.requiresSecondary() || secondaryUri != null;
    }
    
    private static URI parse(String uri) {
        try {
            return URI.create(uri);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Malformed storage URI: " + uri, e);
        }
    }
    
    private static void assertAbsolute(URI uri, String name) {
        if (!uri.isAbsolute() || uri.getHost() == null) {
            throw new IllegalArgumentException(name + " URI must be absolute with a host: " + uri);
        }
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof StorageUri)) {
            return false;
        }
        StorageUri that = (StorageUri) o;
        return primaryUri.equals(that.primaryUri) && Objects.equals(secondaryUri, that.secondaryUri);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(primaryUri, secondaryUri);
    }
    
    @Override
    public String toString() {
        return String.format("StorageUri{primary='%s', secondary='%s'}", primaryUri, secondaryUri);
    }
}
