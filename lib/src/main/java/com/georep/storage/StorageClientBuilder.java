package com.georep.storage;

import com.georep.storage.config.StorageClientConfiguration;
import com.georep.storage.impl.DefaultStorageClient;
import com.georep.storage.observability.MetricsCollector;
import com.georep.storage.transport.HttpTransport;
import com.georep.storage.transport.PayloadCodec;
import com.georep.storage.transport.RequestSigner;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

/**
 * Builder for creating StorageClient instances.
 * The transport and payload codec are required; requests are sent unsigned
 * unless a signer is given.
 */
public class StorageClientBuilder {
    
    private StorageClientConfiguration configuration;
    private HttpTransport transport;
    private PayloadCodec codec;
    private RequestSigner signer = RequestSigner.anonymous();
    private MeterRegistry meterRegistry;
    
    /**
     * Create a new client with the given configuration and collaborators.
     */
    public static StorageClient create(StorageClientConfiguration configuration,
                                       HttpTransport transport, PayloadCodec codec) {
        return builder().configuration(configuration).transport(transport).codec(codec).build();
    }
    
    public static StorageClientBuilder builder() {
        return new StorageClientBuilder();
    }
    
    public StorageClientBuilder configuration(StorageClientConfiguration configuration) {
        this.configuration = configuration;
        return this;
    }
    
    public StorageClientBuilder transport(HttpTransport transport) {
        this.transport = transport;
        return this;
    }
    
    public StorageClientBuilder codec(PayloadCodec codec) {
        this.codec = codec;
        return this;
    }
    
    public StorageClientBuilder signer(RequestSigner signer) {
        this.signer = signer;
        return this;
    }
    
    public StorageClientBuilder meterRegistry(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        return this;
    }
    
    public StorageClient build() {
        if (configuration == null) {
            throw new IllegalArgumentException("Configuration is required");
        }
        if (transport == null) {
            throw new IllegalArgumentException("HTTP transport is required");
        }
        if (codec == null) {
            throw new IllegalArgumentException("Payload codec is required");
        }
        if (signer == null) {
            throw new IllegalArgumentException("Request signer must not be null");
        }
        MetricsCollector metricsCollector = new MetricsCollector(
            meterRegistry != null ? meterRegistry : new SimpleMeterRegistry());
        return new DefaultStorageClient(configuration, transport, signer, codec, metricsCollector);
    }
}
