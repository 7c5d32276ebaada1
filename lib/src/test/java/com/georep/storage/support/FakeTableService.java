package com.georep.storage.support;

import com.georep.storage.core.CancellationSignal;
import com.georep.storage.model.StorageLocation;
import com.georep.storage.model.StorageUri;
import com.georep.storage.query.QueryCommand;
import com.georep.storage.transport.HttpTransport;
import com.georep.storage.transport.StorageRequest;
import com.georep.storage.transport.StorageResponse;

import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * In-memory table service answering on a primary and a secondary host. Rows are
 * {@code ("pk", "00000")} upwards. Scripted responses are consumed, in order,
 * before the table is consulted.
 */
public class FakeTableService implements HttpTransport {
    
    public static final String PRIMARY = "https://account.table.example.com";
    public static final String SECONDARY = "https://account-secondary.table.example.com";
    
    private final List<TestEntity> rows;
    private final int serverMaxPageSize;
    private final List<StorageRequest> requests = new CopyOnWriteArrayList<>();
    private final List<StorageLocation> locations = new CopyOnWriteArrayList<>();
    private final List<CompletableFuture<StorageResponse>> hungResponses = new CopyOnWriteArrayList<>();
    private final Queue<Function<StorageRequest, CompletableFuture<StorageResponse>>> script =
        new ConcurrentLinkedQueue<>();
    private final Map<StorageLocation, Integer> locationStatus = new ConcurrentHashMap<>();
    private final AtomicInteger requestIds = new AtomicInteger();
    private volatile Integer forcedPageSize;
    
    public FakeTableService(int rowCount) {
        this(rowCount, 1000);
    }
    
    public FakeTableService(int rowCount, int serverMaxPageSize) {
        this.serverMaxPageSize = serverMaxPageSize;
        List<TestEntity> table = new ArrayList<>();
        for (int i = 0; i < rowCount; i++) {
            table.add(new TestEntity("pk", String.format("%05d", i)));
        }
        this.rows = List.copyOf(table);
    }
    
    public static StorageUri storageUri() {
        return StorageUri.of(PRIMARY, SECONDARY);
    }
    
    public FakeTableService respondWith(int status) {
        script.add(request -> CompletableFuture.completedFuture(response(status, Map.of(), new byte[0])));
        return this;
    }
    
    public FakeTableService respondWith(int status, int times) {
        for (int i = 0; i < times; i++) {
            respondWith(status);
        }
        return this;
    }
    
    public FakeTableService respondWithBody(byte[] body) {
        script.add(request -> CompletableFuture.completedFuture(response(200, Map.of(), body)));
        return this;
    }
    
    /**
     * Next request completes successfully but carries no response.
     */
    public FakeTableService respondWithNull() {
        script.add(request -> CompletableFuture.completedFuture(null));
        return this;
    }
    
    public FakeTableService failWith(Throwable error) {
        script.add(request -> CompletableFuture.failedFuture(error));
        return this;
    }
    
    /**
     * Next request never receives a response.
     */
    public FakeTableService hang() {
        script.add(request -> {
            CompletableFuture<StorageResponse> future = new CompletableFuture<>();
            hungResponses.add(future);
            return future;
        });
        return this;
    }
    
    public void setLocationStatus(StorageLocation location, int status) {
        locationStatus.put(location, status);
    }
    
    /**
     * Makes the service ignore {@code $top} and return {@code pageSize} rows per page.
     */
    public void forcePageSize(int pageSize) {
        this.forcedPageSize = pageSize;
    }
    
    public List<StorageRequest> getRequests() {
        return requests;
    }
    
    public List<StorageLocation> getRequestLocations() {
        return locations;
    }
    
    public List<CompletableFuture<StorageResponse>> getHungResponses() {
        return hungResponses;
    }
    
    @Override
    public CompletableFuture<StorageResponse> send(StorageRequest request, Instant deadline,
                                                   CancellationSignal cancellation) {
        requests.add(request);
        StorageLocation location = locationOf(request.getUri());
        locations.add(location);
        
        Function<StorageRequest, CompletableFuture<StorageResponse>> scripted = script.poll();
        if (scripted != null) {
            return scripted.apply(request);
        }
        Integer status = locationStatus.get(location);
        if (status != null) {
            return CompletableFuture.completedFuture(response(status, Map.of(), new byte[0]));
        }
        return CompletableFuture.completedFuture(query(request));
    }
    
    private StorageResponse query(StorageRequest request) {
        Map<String, String> parameters = queryParameters(request.getUri());
        int start = 0;
        String nextRowKey = parameters.get(QueryCommand.NEXT_ROW_KEY_PARAMETER);
        if (nextRowKey != null) {
            while (start < rows.size() && rows.get(start).rowKey().compareTo(nextRowKey) < 0) {
                start++;
            }
        }
        int pageSize = serverMaxPageSize;
        String top = parameters.get(QueryCommand.TOP_PARAMETER);
        if (top != null) {
            pageSize = Math.min(pageSize, Integer.parseInt(top));
        }
        if (forcedPageSize != null) {
            pageSize = forcedPageSize;
        }
        int end = Math.min(rows.size(), start + pageSize);
        
        Map<String, String> headers = new HashMap<>();
        if (end < rows.size()) {
            TestEntity next = rows.get(end);
            headers.put(QueryCommand.CONTINUATION_HEADER_PREFIX + QueryCommand.NEXT_PARTITION_KEY_PARAMETER,
                        next.partitionKey());
            headers.put(QueryCommand.CONTINUATION_HEADER_PREFIX + QueryCommand.NEXT_ROW_KEY_PARAMETER,
                        next.rowKey());
        }
        return response(200, headers, LineCodec.encode(rows.subList(start, end)));
    }
    
    private StorageResponse response(int status, Map<String, String> extraHeaders, byte[] body) {
        Map<String, String> headers = new HashMap<>(extraHeaders);
        headers.put(StorageResponse.REQUEST_ID_HEADER, "req-" + requestIds.incrementAndGet());
        headers.put(StorageResponse.CONTENT_TYPE_HEADER, "application/json");
        return new StorageResponse(status, headers, body);
    }
    
    public static StorageLocation locationOf(URI uri) {
        return uri.getHost().equals(URI.create(SECONDARY).getHost())
            ? StorageLocation.SECONDARY : StorageLocation.PRIMARY;
    }
    
    public static Map<String, String> queryParameters(URI uri) {
        Map<String, String> parameters = new LinkedHashMap<>();
        String query = uri.getRawQuery();
        if (query == null || query.isEmpty()) {
            return parameters;
        }
        for (String pair : query.split("&")) {
            int eq = pair.indexOf('=');
            if (eq < 0) {
                parameters.put(pair, null);
            } else {
                parameters.put(pair.substring(0, eq),
                               URLDecoder.decode(pair.substring(eq + 1), StandardCharsets.UTF_8));
            }
        }
        return parameters;
    }
}
