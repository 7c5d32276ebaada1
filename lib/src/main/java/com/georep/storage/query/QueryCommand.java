package com.georep.storage.query;

import com.georep.storage.config.RequestOptions;
import com.georep.storage.core.StorageCommand;
import com.georep.storage.core.UriQueryBuilder;
import com.georep.storage.model.ContinuationToken;
import com.georep.storage.model.ResultSegment;
import com.georep.storage.model.StorageLocation;
import com.georep.storage.model.StorageUri;
import com.georep.storage.transport.PayloadCodec;
import com.georep.storage.transport.StorageRequest;
import com.georep.storage.transport.StorageResponse;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.List;

/**
 * Fetches one page of a {@link TableQuery}. A continuation token pins the
 * request to the location that issued it.
 *
 * @param <T> entity type
 */
public class QueryCommand<T> extends StorageCommand<ResultSegment<T>> {
    
    public static final String FILTER_PARAMETER = "$filter";
    public static final String SELECT_PARAMETER = "$select";
    public static final String TOP_PARAMETER = "$top";
    
    public static final String NEXT_PARTITION_KEY_PARAMETER = "NextPartitionKey";
    public static final String NEXT_ROW_KEY_PARAMETER = "NextRowKey";
    public static final String NEXT_TABLE_NAME_PARAMETER = "NextTableName";
    
    public static final String CONTINUATION_HEADER_PREFIX = "x-ms-continuation-";
    public static final String ACCEPT_HEADER = "Accept";
    
    private final TableQuery query;
    private final ContinuationToken token;
    private final Integer top;
    private final PayloadCodec codec;
    private final Class<T> entityType;
    
    /**
     * @param accountUri account endpoint pair; the table name is appended to both paths
     * @param top page size to request, or {@code null} to let the service decide
     */
    public QueryCommand(StorageUri accountUri, TableQuery query, ContinuationToken token, Integer top,
                        PayloadCodec codec, Class<T> entityType) {
        super(tableUri(accountUri, query.getTableName()));
        if (codec == null || entityType == null) {
            throw new IllegalArgumentException("Payload codec and entity type are required");
        }
        if (top != null && top <= 0) {
            throw new IllegalArgumentException("Page size must be positive, got " + top);
        }
        this.query = query;
        this.token = token;
        this.top = top;
        this.codec = codec;
        this.entityType = entityType;
    }
    
    public ContinuationToken getToken() {
        return token;
    }
    
    @Override
    public StorageLocation getPinnedLocation() {
        return token == null ? null : token.getTargetLocation();
    }
    
    @Override
    public String getName() {
        return "Query(" + query.getTableName() + ")";
    }
    
    @Override
    public void addQueryParameters(UriQueryBuilder builder, RequestOptions options) {
        if (query.getFilter() != null && !query.getFilter().isBlank()) {
            builder.add(FILTER_PARAMETER, query.getFilter());
        }
        if (!query.getSelectColumns().isEmpty()) {
            builder.add(SELECT_PARAMETER, String.join(",", query.getSelectColumns()));
        }
        if (top != null) {
            builder.add(TOP_PARAMETER, String.valueOf(top));
        }
        if (token != null) {
            addIfPresent(builder, NEXT_PARTITION_KEY_PARAMETER, token.getNextPartitionKey());
            addIfPresent(builder, NEXT_ROW_KEY_PARAMETER, token.getNextRowKey());
            addIfPresent(builder, NEXT_TABLE_NAME_PARAMETER, token.getNextTableName());
        }
    }
    
    @Override
    public StorageRequest buildRequest(URI target, RequestOptions options) {
        return StorageRequest.builder()
            .method("GET")
            .uri(target)
            .header(ACCEPT_HEADER, options.getPayloadFormat().getAcceptHeader())
            .build();
    }
    
    @Override
    public ResultSegment<T> parseResponse(StorageResponse response, StorageLocation location,
                                          RequestOptions options) throws IOException {
        List<T> entities = codec.parseEntities(
            response.getBody(), response.getContentType(), entityType, options.getPayloadFormat());
        ContinuationToken next = ContinuationToken.fromMarkers(
            response.getHeader(CONTINUATION_HEADER_PREFIX + NEXT_PARTITION_KEY_PARAMETER),
            response.getHeader(CONTINUATION_HEADER_PREFIX + NEXT_ROW_KEY_PARAMETER),
            response.getHeader(CONTINUATION_HEADER_PREFIX + NEXT_TABLE_NAME_PARAMETER),
            location);
        return new ResultSegment<>(entities == null ? List.of() : entities, next);
    }
    
    private static void addIfPresent(UriQueryBuilder builder, String name, String value) {
        if (value != null) {
            builder.add(name, value);
        }
    }
    
    static StorageUri tableUri(StorageUri accountUri, String tableName) {
        if (accountUri == null) {
            throw new IllegalArgumentException("Storage URI is required");
        }
        URI primary = appendPath(accountUri.getPrimaryUri(), tableName);
        return accountUri.hasSecondary()
            ? new StorageUri(primary, appendPath(accountUri.getSecondaryUri(), tableName))
            : new StorageUri(primary);
    }
    
    private static URI appendPath(URI base, String segment) {
        String path = base.getRawPath() == null ? "" : base.getRawPath();
        if (path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }
        try {
            return new URI(base.getScheme() + "://" + base.getRawAuthority() + path + "/" + segment);
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Invalid table name: " + segment, e);
        }
    }
}
