package com.georep.storage.transport;

import com.georep.storage.core.CancellationSignal;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;

/**
 * Sends one signed request. Implementations wrap whatever HTTP client the
 * application uses.
 * <p>
 * The returned future completes with the response for any HTTP status, and
 * exceptionally only for transport-level failures (connection refused, reset,
 * DNS). Implementations should abort the exchange when {@code cancellation}
 * fires or the future is cancelled.
 */
@FunctionalInterface
public interface HttpTransport {
    
    CompletableFuture<StorageResponse> send(StorageRequest request, Instant deadline,
                                            CancellationSignal cancellation);
}
