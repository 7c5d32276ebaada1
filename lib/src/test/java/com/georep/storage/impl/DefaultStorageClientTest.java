package com.georep.storage.impl;

import com.georep.storage.StorageClient;
import com.georep.storage.StorageClientBuilder;
import com.georep.storage.config.LocationMode;
import com.georep.storage.config.PayloadFormat;
import com.georep.storage.config.RequestOptions;
import com.georep.storage.config.StorageClientConfiguration;
import com.georep.storage.core.CancellationSignal;
import com.georep.storage.exception.ErrorKind;
import com.georep.storage.exception.StorageException;
import com.georep.storage.model.OperationContext;
import com.georep.storage.model.ResultSegment;
import com.georep.storage.model.StorageLocation;
import com.georep.storage.query.QueryCommand;
import com.georep.storage.query.SegmentedEnumerator;
import com.georep.storage.query.TableQuery;
import com.georep.storage.retry.LinearRetryPolicy;
import com.georep.storage.retry.RetryPolicy;
import com.georep.storage.support.FakeTableService;
import com.georep.storage.support.LineCodec;
import com.georep.storage.support.ProbeCommand;
import com.georep.storage.support.TestEntity;
import com.georep.storage.transport.StorageRequest;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests against the in-memory table service.
 */
class DefaultStorageClientTest {

    private FakeTableService service;
    private SimpleMeterRegistry meterRegistry;
    private StorageClient client;

    @BeforeEach
    void setUp() {
        service = new FakeTableService(1500, 1000);
        meterRegistry = new SimpleMeterRegistry();
        client = newClient(StorageClientConfiguration.builder()
            .storageUri(FakeTableService.storageUri())
            .retryPolicy(new LinearRetryPolicy(Duration.ofMillis(1), 3))
            .build());
    }

    @AfterEach
    void tearDown() {
        client.close();
    }

    private StorageClient newClient(StorageClientConfiguration configuration) {
        return StorageClientBuilder.builder()
            .configuration(configuration)
            .transport(service)
            .codec(new LineCodec())
            .meterRegistry(meterRegistry)
            .build();
    }

    private static List<TestEntity> toList(Iterable<TestEntity> iterable) {
        List<TestEntity> list = new ArrayList<>();
        iterable.forEach(list::add);
        return list;
    }

    @Test
    void testTakeCountReturnsSinglePage() {
        TableQuery query = TableQuery.from("people").take(100).build();

        SegmentedEnumerator<TestEntity> enumerator =
            client.sync().enumerate(query, TestEntity.class, null, null);
        ResultSegment<TestEntity> page = enumerator.nextPage();

        assertEquals(100, page.size());
        assertEquals(0, enumerator.getRemaining());
        assertFalse(enumerator.hasMorePages());
        assertEquals(1, service.getRequests().size());
        assertEquals("100", FakeTableService.queryParameters(service.getRequests().get(0).getUri())
            .get(QueryCommand.TOP_PARAMETER));
    }

    @Test
    void testContinuationAcrossTwoAttempts() {
        OperationContext context = new OperationContext();

        List<TestEntity> all = toList(client.sync().executeQuery(
            TableQuery.from("people").build(), TestEntity.class, null, context));

        assertEquals(1500, all.size());
        assertEquals("00000", all.get(0).rowKey());
        assertEquals("01499", all.get(1499).rowKey());
        assertEquals(2, context.getAttemptCount());
        assertFalse(FakeTableService.queryParameters(service.getRequests().get(0).getUri())
            .containsKey(QueryCommand.TOP_PARAMETER));
        assertEquals("01000", FakeTableService.queryParameters(service.getRequests().get(1).getUri())
            .get(QueryCommand.NEXT_ROW_KEY_PARAMETER));
    }

    @Test
    void testReEnumerationStartsOver() {
        Iterable<TestEntity> results = client.sync().executeQuery(TableQuery.from("people").build(), TestEntity.class);

        List<TestEntity> first = toList(results);
        List<TestEntity> second = toList(results);

        assertEquals(first, second);
        assertEquals(4, service.getRequests().size());
    }

    @Test
    void testSegmentedQueryAndResume() {
        TableQuery query = TableQuery.from("people").build();

        ResultSegment<TestEntity> first = client.sync().executeQuerySegmented(query, TestEntity.class, null);
        ResultSegment<TestEntity> second = client.sync().executeQuerySegmented(
            query, TestEntity.class, first.getContinuationToken());

        assertEquals(1000, first.size());
        assertTrue(first.hasMoreResults());
        assertEquals(500, second.size());
        assertFalse(second.hasMoreResults());
        assertEquals("01000", second.getResults().get(0).rowKey());
    }

    @Test
    void testResumeWithRemainingBudget() {
        TableQuery query = TableQuery.from("people").take(1200).build();
        SegmentedEnumerator<TestEntity> enumerator = client.sync().enumerate(query, TestEntity.class, null, null);
        enumerator.nextPage();

        SegmentedEnumerator<TestEntity> resumed = client.sync().resume(query, TestEntity.class,
            enumerator.getContinuationToken(), enumerator.getRemaining(), null, null);
        ResultSegment<TestEntity> page = resumed.nextPage();

        assertEquals(200, page.size());
        assertFalse(resumed.hasMorePages());
    }

    @Test
    void testServerSurplusIsTruncated() {
        service.forcePageSize(1000);

        List<TestEntity> all = toList(client.sync().executeQuery(
            TableQuery.from("people").take(100).build(), TestEntity.class));

        assertEquals(100, all.size());
        assertEquals(1, service.getRequests().size());
    }

    @Test
    void testFilterAndProjectionAreSent() {
        client.sync().executeQuerySegmented(
            TableQuery.from("people").where("RowKey ge '00010'").select("Email").build(),
            TestEntity.class, null);

        StorageRequest request = service.getRequests().get(0);
        Map<String, String> parameters = FakeTableService.queryParameters(request.getUri());
        assertEquals("/people", request.getUri().getPath());
        assertEquals("RowKey ge '00010'", parameters.get(QueryCommand.FILTER_PARAMETER));
        assertEquals("Email", parameters.get(QueryCommand.SELECT_PARAMETER));
    }

    @ParameterizedTest
    @EnumSource(PayloadFormat.class)
    void testPayloadFormatPerCall(PayloadFormat format) {
        RequestOptions options = RequestOptions.builder().payloadFormat(format).build();

        ResultSegment<TestEntity> page = client.sync().executeQuerySegmented(
            TableQuery.from("people").take(5).build(), TestEntity.class, null, options, null);

        assertEquals(5, page.size());
        assertEquals(format.getAcceptHeader(),
            service.getRequests().get(0).getHeader(QueryCommand.ACCEPT_HEADER));
    }

    @Test
    void testTokenPinsNextPageToIssuingLocation() {
        StorageClient readFromSecondary = newClient(StorageClientConfiguration.builder()
            .storageUri(FakeTableService.storageUri())
            .locationMode(LocationMode.SECONDARY_THEN_PRIMARY)
            .retryPolicy(new LinearRetryPolicy(Duration.ofMillis(1), 3))
            .build());
        try {
            TableQuery query = TableQuery.from("people").build();
            ResultSegment<TestEntity> first = readFromSecondary.sync().executeQuerySegmented(
                query, TestEntity.class, null);
            service.setLocationStatus(StorageLocation.SECONDARY, 503);

            StorageException e = assertThrows(StorageException.class, () -> readFromSecondary.sync()
                .executeQuerySegmented(query, TestEntity.class, first.getContinuationToken()));

            assertEquals(StorageLocation.SECONDARY, first.getContinuationToken().getTargetLocation());
            assertEquals(ErrorKind.EXHAUSTED_RETRIES, e.getKind());
            assertTrue(e.getRequestResults().stream()
                .allMatch(result -> result.getLocation() == StorageLocation.SECONDARY));
        } finally {
            readFromSecondary.close();
        }
    }

    @Test
    void testRetryPolicyOverridePerCall() {
        service.respondWith(503);
        RequestOptions noRetry = RequestOptions.builder().retryPolicy(RetryPolicy.noRetry()).build();

        StorageException e = assertThrows(StorageException.class,
            () -> client.sync().execute(new ProbeCommand(FakeTableService.storageUri()), noRetry, null));

        assertEquals(ErrorKind.EXHAUSTED_RETRIES, e.getKind());
        assertEquals(1, e.getAttemptCount());
    }

    @Test
    void testAsyncQuerySegment() throws Exception {
        ResultSegment<TestEntity> page = client.async()
            .executeQuerySegmentedAsync(TableQuery.from("people").take(10).build(), TestEntity.class, null)
            .get(5, TimeUnit.SECONDS);

        assertEquals(10, page.size());
    }

    @Test
    void testCancellingAsyncQueryStopsOperation() {
        service.hang();
        CancellationSignal signal = new CancellationSignal();

        CompletableFuture<ResultSegment<TestEntity>> page = client.async().executeQuerySegmentedAsync(
            TableQuery.from("people").build(), TestEntity.class, null, null, null, signal);
        page.cancel(true);

        assertTrue(signal.isCancelled());
        assertTrue(service.getHungResponses().get(0).isCancelled());
    }

    @Test
    void testCloseCancelsOperationsInProgress() {
        service.hang();
        CompletableFuture<StorageLocation> pending =
            client.async().executeAsync(new ProbeCommand(FakeTableService.storageUri()));

        client.close();

        ExecutionException e = assertThrows(ExecutionException.class, () -> pending.get(5, TimeUnit.SECONDS));
        assertEquals(ErrorKind.CANCELLED, ((StorageException) e.getCause()).getKind());
        assertTrue(client.isClosed());
        assertThrows(IllegalStateException.class, () -> client.sync());
    }

    @Test
    void testRecordsPageMetrics() {
        toList(client.sync().executeQuery(TableQuery.from("people").build(), TestEntity.class));

        assertEquals(2.0, meterRegistry.get("georep.storage.pages").counter().count());
        assertEquals(1500.0, meterRegistry.get("georep.storage.entities").counter().count());
        assertSame(meterRegistry, client.getMeterRegistry());
    }

    @Test
    void testBuilderRequiresCollaborators() {
        StorageClientConfiguration configuration = StorageClientConfiguration.builder()
            .storageUri(FakeTableService.storageUri())
            .build();

        assertThrows(IllegalArgumentException.class,
            () -> StorageClientBuilder.builder().configuration(configuration).codec(new LineCodec()).build());
        assertThrows(IllegalArgumentException.class,
            () -> StorageClientBuilder.builder().configuration(configuration).transport(service).build());
        assertThrows(IllegalArgumentException.class,
            () -> StorageClientBuilder.builder().transport(service).codec(new LineCodec()).build());
    }
}
