package com.georep.storage.model;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Per-call record of every physical attempt made for one logical operation.
 * <p>
 * The attempt list is append-only. It is written only by the engine driving
 * the owning operation; other threads may read it concurrently and observe a
 * list that grows but never shrinks.
 */
public class OperationContext {
    
    private final String clientRequestId;
    private final CopyOnWriteArrayList<RequestResult> requestResults;
    private volatile Instant startTime;
    private volatile Instant endTime;
    
    public OperationContext() {
        this(UUID.randomUUID().toString());
    }
    
    public OperationContext(String clientRequestId) {
        if (clientRequestId == null || clientRequestId.trim().isEmpty()) {
            throw new IllegalArgumentException("Client request ID is required");
        }
        this.clientRequestId = clientRequestId;
        this.requestResults = new CopyOnWriteArrayList<>();
    }
    
    public String getClientRequestId() {
        return clientRequestId;
    }
    
    public void recordAttempt(RequestResult result) {
        if (result == null) {
            throw new IllegalArgumentException("Request result is required");
        }
        requestResults.add(result);
    }
    
    public int getAttemptCount() {
        return requestResults.size();
    }
    
    public Optional<RequestResult> getLastResult() {
        // snapshot first, the list may grow between size() and get()
        Object[] snapshot = requestResults.toArray();
        return snapshot.length == 0
            ? Optional.empty()
            : Optional.of((RequestResult) snapshot[snapshot.length - 1]);
    }
    
    /**
     * Immutable snapshot of the attempts recorded so far, in chronological order.
     */
    public List<RequestResult> getRequestResults() {
        return List.copyOf(requestResults);
    }
    
    public Instant getStartTime() {
        return startTime;
    }
    
    public Instant getEndTime() {
        return endTime;
    }
    
    /**
     * Set by the engine when the logical operation begins. Later calls are ignored,
     * so a context reused for several pages keeps the first start time.
     */
    public void setStartTime(Instant time) {
        if (startTime == null) {
            startTime = time;
        }
    }
    
    public void setEndTime(Instant time) {
        endTime = time;
    }
    
    @Override
    public String toString() {
        return String.format("OperationContext{clientRequestId='%s', attempts=%d}",
            clientRequestId, requestResults.size());
    }
}
