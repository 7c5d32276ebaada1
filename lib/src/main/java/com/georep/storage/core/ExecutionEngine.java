package com.georep.storage.core;

import com.georep.storage.config.LocationMode;
import com.georep.storage.config.RequestOptions;
import com.georep.storage.exception.ErrorKind;
import com.georep.storage.exception.StorageException;
import com.georep.storage.exception.StorageException.ConfigurationException;
import com.georep.storage.exception.StorageException.OperationCancelledException;
import com.georep.storage.exception.StorageException.OperationTimeoutException;
import com.georep.storage.exception.StorageException.RetriesExhaustedException;
import com.georep.storage.exception.StorageException.ServerErrorException;
import com.georep.storage.exception.StorageException.TransientFailureException;
import com.georep.storage.model.OperationContext;
import com.georep.storage.model.RequestResult;
import com.georep.storage.model.StorageLocation;
import com.georep.storage.observability.MetricsCollector;
import com.georep.storage.retry.RetryContext;
import com.georep.storage.retry.RetryInfo;
import com.georep.storage.retry.RetryPolicy;
import com.georep.storage.transport.HttpTransport;
import com.georep.storage.transport.RequestSigner;
import com.georep.storage.transport.StorageRequest;
import com.georep.storage.transport.StorageResponse;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.security.GeneralSecurityException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Drives one logical operation through its physical attempts: picks the
 * target location, builds and signs a fresh request per attempt, applies the
 * per-attempt deadline, classifies the outcome, records it in the
 * {@link OperationContext} and consults the {@link RetryPolicy}.
 * <p>
 * Backoff waits are scheduled on the shared scheduler, never slept on a
 * caller thread. One instance serves any number of concurrent operations.
 */
public class ExecutionEngine {

    private static final Logger logger = LoggerFactory.getLogger(ExecutionEngine.class);

    public static final String CLIENT_REQUEST_ID_HEADER = "x-ms-client-request-id";
    public static final String TIMEOUT_PARAMETER = "timeout";

    private final HttpTransport transport;
    private final RequestSigner signer;
    private final ScheduledExecutorService scheduler;
    private final MetricsCollector metricsCollector;
    private final Clock clock;
    private final Set<Execution<?>> activeExecutions = ConcurrentHashMap.newKeySet();

    public ExecutionEngine(HttpTransport transport, RequestSigner signer,
                           ScheduledExecutorService scheduler, MetricsCollector metricsCollector) {
        this(transport, signer, scheduler, metricsCollector, Clock.systemUTC());
    }

    public ExecutionEngine(HttpTransport transport, RequestSigner signer, ScheduledExecutorService scheduler,
                           MetricsCollector metricsCollector, Clock clock) {
        if (transport == null || signer == null || scheduler == null || metricsCollector == null || clock == null) {
            throw new IllegalArgumentException("Transport, signer, scheduler, metrics collector and clock are required");
        }
        this.transport = transport;
        this.signer = signer;
        this.scheduler = scheduler;
        this.metricsCollector = metricsCollector;
        this.clock = clock;
    }

    /**
     * Executes {@code command} and returns a future for its result. The future
     * completes exceptionally with a {@link StorageException} carrying this
     * operation's attempt history. Cancelling the returned future has the same
     * effect as cancelling {@code cancellation}.
     *
     * @param options fully resolved options, see {@link RequestOptions#resolve}
     */
    public <T> CompletableFuture<T> executeAsync(StorageCommand<T> command, RequestOptions options,
                                                 OperationContext context, CancellationSignal cancellation) {
        if (command == null || options == null || context == null || cancellation == null) {
            throw new IllegalArgumentException("Command, options, context and cancellation signal are required");
        }
        if (!options.isResolved()) {
            throw new IllegalArgumentException("Request options must be resolved against the client configuration");
        }
        return new Execution<>(command, options, context, cancellation).start();
    }

    /**
     * Cancels every operation still in progress. Called when the owning client closes.
     */
    public void cancelAll() {
        if (!activeExecutions.isEmpty()) {
            logger.info("Cancelling {} operation(s) in progress", activeExecutions.size());
        }
        for (Execution<?> execution : activeExecutions) {
            execution.abort();
        }
    }

    public int getActiveOperationCount() {
        return activeExecutions.size();
    }

    public <T> T execute(StorageCommand<T> command, RequestOptions options, OperationContext context) {
        return join(executeAsync(command, options, context, new CancellationSignal()));
    }

    /**
     * Waits for {@code future}, rethrowing a {@link StorageException} as is.
     */
    public static <T> T join(CompletableFuture<T> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new OperationCancelledException(List.of());
        } catch (CancellationException e) {
            throw new OperationCancelledException(List.of());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof StorageException) {
                throw (StorageException) cause;
            }
            throw new StorageException(ErrorKind.CLIENT, "Operation failed: " + cause.getMessage(), cause);
        }
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
               && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    /**
     * State of a single logical operation.
     */
    private final class Execution<T> {
        private final StorageCommand<T> command;
        private final RequestOptions options;
        private final OperationContext context;
        private final CancellationSignal cancellation;
        private final RetryPolicy retryPolicy;
        private final LocationMode locationMode;
        private final CompletableFuture<T> result = new CompletableFuture<>();
        private final AtomicBoolean finished = new AtomicBoolean(false);
        private final int firstAttemptIndex;
        private final Instant deadline;

        private volatile int attemptNumber;
        private volatile StorageLocation location;
        private volatile ScheduledFuture<?> pendingBackoff;
        private volatile CompletableFuture<StorageResponse> inFlight;
        private volatile CancellationSignal.Registration registration;

        Execution(StorageCommand<T> command, RequestOptions options,
                  OperationContext context, CancellationSignal cancellation) {
            this.command = command;
            this.options = options;
            this.context = context;
            this.cancellation = cancellation;
            this.retryPolicy = options.getRetryPolicy();
            StorageLocation pinned = command.getPinnedLocation();
            this.locationMode = pinned != null ? LocationMode.pinnedTo(pinned) : options.getLocationMode();
            this.location = locationMode.initialLocation();
            this.firstAttemptIndex = context.getAttemptCount();
            Instant now = clock.instant();
            this.deadline = now.plus(options.getMaximumExecutionTime());
            context.setStartTime(now);
        }

        CompletableFuture<T> start() {
            activeExecutions.add(this);
            result.whenComplete((value, error) -> {
                if (result.isCancelled()) {
                    cancellation.cancel();
                    finish(ErrorKind.CANCELLED);
                }
            });
            registration = cancellation.onCancel(this::onCancelled);

            if (!command.getStorageUri().validateLocationMode(locationMode)) {
                fail(new ConfigurationException(String.format(
                    "Location mode %s cannot be used with %s", locationMode, command.getStorageUri())));
                return result;
            }
            logger.debug("Starting {} with client request id {} in mode {}",
                         command.getName(), context.getClientRequestId(), locationMode);
            attempt();
            return result;
        }

        private void attempt() {
            if (isFinished()) {
                return;
            }
            if (cancellation.isCancelled()) {
                fail(new OperationCancelledException(List.of()));
                return;
            }
            Instant now = clock.instant();
            if (!now.isBefore(deadline)) {
                fail(new OperationTimeoutException(
                    "Maximum execution time of " + options.getMaximumExecutionTime() + " elapsed", null, List.of()));
                return;
            }

            int number = ++attemptNumber;
            StorageLocation target = location;
            Duration remaining = Duration.between(now, deadline);
            Duration attemptTimeout = options.getAttemptTimeout().compareTo(remaining) < 0
                ? options.getAttemptTimeout() : remaining;

            StorageRequest request;
            try {
                request = buildRequest(target, attemptTimeout);
            } catch (StorageException e) {
                fail(e);
                return;
            } catch (IOException | RuntimeException e) {
                fail(new ConfigurationException("Failed to build request for " + command.getName(), e));
                return;
            }
            try {
                request = signer.sign(request);
            } catch (GeneralSecurityException | RuntimeException e) {
                fail(new ConfigurationException("Failed to sign request for " + command.getName(), e));
                return;
            }

            StorageRequest signed = request;
            Instant attemptDeadline = now.plus(attemptTimeout);
            Instant startTime = clock.instant();
            TimeLimiter timeLimiter = TimeLimiter.of(command.getName(), TimeLimiterConfig.custom()
                .timeoutDuration(attemptTimeout)
                .cancelRunningFuture(true)
                .build());

            logger.debug("{} attempt {} against {}: {} {}",
                         command.getName(), number, target, signed.getMethod(), signed.getUri());
            try {
                timeLimiter.executeCompletionStage(scheduler, () -> send(signed, attemptDeadline))
                    .whenComplete((response, error) -> onAttemptComplete(
                        number, target, startTime, attemptTimeout, response, error));
            } catch (RejectedExecutionException e) {
                abort();
            }
        }

        private StorageRequest buildRequest(StorageLocation target, Duration serverTimeout) throws IOException {
            UriQueryBuilder query = new UriQueryBuilder();
            command.addQueryParameters(query, options);
            long seconds = Math.max(1, (serverTimeout.toMillis() + 999) / 1000);
            query.add(TIMEOUT_PARAMETER, String.valueOf(seconds));
            URI uri = query.addToUri(command.getStorageUri().getUri(target));
            StorageRequest request = command.buildRequest(uri, options);
            if (request == null) {
                throw new IllegalStateException(command.getName() + " built no request");
            }
            return request.withHeader(CLIENT_REQUEST_ID_HEADER, context.getClientRequestId());
        }

        private CompletableFuture<StorageResponse> send(StorageRequest request, Instant attemptDeadline) {
            CompletableFuture<StorageResponse> future;
            try {
                future = transport.send(request, attemptDeadline, cancellation);
                if (future == null) {
                    future = CompletableFuture.failedFuture(
                        new IllegalStateException("Transport returned no response future"));
                }
            } catch (RuntimeException e) {
                future = CompletableFuture.failedFuture(e);
            }
            inFlight = future;
            if (cancellation.isCancelled()) {
                future.cancel(true);
            }
            return future;
        }

        private void onAttemptComplete(int number, StorageLocation target, Instant startTime, Duration attemptTimeout,
                                       StorageResponse response, Throwable error) {
            try {
                handleAttempt(number, target, startTime, attemptTimeout, response, error);
            } catch (RuntimeException e) {
                onUnexpectedFailure(number, target, startTime, e);
            }
        }

        /**
         * Terminates the operation after the attempt handler itself threw, recording the attempt if it was not.
         */
        private void onUnexpectedFailure(int number, StorageLocation target, Instant startTime, RuntimeException e) {
            logger.error("{} attempt {} could not be processed", command.getName(), number, e);
            StorageException failure = new StorageException(ErrorKind.CLIENT,
                "Failed to process attempt " + number + " of " + command.getName() + ": " + e.getMessage(), e);
            if (history().size() < number) {
                try {
                    record(target, null, null, startTime, clock.instant(), e);
                } catch (RuntimeException recordFailure) {
                    e.addSuppressed(recordFailure);
                }
            }
            try {
                fail(failure);
            } finally {
                if (!result.isDone()) {
                    result.completeExceptionally(failure.withHistory(history()));
                }
            }
        }

        private void handleAttempt(int number, StorageLocation target, Instant startTime, Duration attemptTimeout,
                                   StorageResponse response, Throwable error) {
            inFlight = null;
            Instant endTime = clock.instant();
            Throwable cause = unwrap(error);
            if (cause == null && response == null) {
                cause = new IllegalStateException("Transport completed without a response");
            }

            if (cause != null) {
                record(target, null, null, startTime, endTime, cause);
                if (cancellation.isCancelled()) {
                    fail(new OperationCancelledException(List.of()));
                    return;
                }
                StorageException failure = cause instanceof TimeoutException
                    ? new TransientFailureException("Attempt timed out after " + attemptTimeout, cause, null)
                    : new TransientFailureException("Transport failure: " + cause.getMessage(), cause, null);
                onRetryableFailure(number, target, failure);
                return;
            }

            int status = response.getStatusCode();
            String requestId = response.getServiceRequestId();
            switch (AttemptClassifier.classify(status)) {
                case SUCCESS -> {
                    T value;
                    try {
                        value = command.parseResponse(response, target, options);
                    } catch (IOException | RuntimeException e) {
                        StorageException failure = new ServerErrorException(
                            status, "Failed to parse response for " + command.getName(), e);
                        record(target, status, requestId, startTime, endTime, failure);
                        fail(failure);
                        return;
                    }
                    record(target, status, requestId, startTime, endTime, null);
                    complete(value);
                }
                case RETRYABLE -> {
                    StorageException failure = AttemptClassifier.failureFor(status, requestId);
                    record(target, status, requestId, startTime, endTime, failure);
                    onRetryableFailure(number, target, failure);
                }
                case FATAL -> {
                    StorageException failure = AttemptClassifier.failureFor(status, requestId);
                    record(target, status, requestId, startTime, endTime, failure);
                    fail(failure);
                }
            }
        }

        private void onRetryableFailure(int number, StorageLocation target, StorageException failure) {
            if (isFinished()) {
                return;
            }
            if (cancellation.isCancelled()) {
                fail(new OperationCancelledException(List.of()));
                return;
            }
            List<RequestResult> history = history();
            Instant now = clock.instant();
            if (!now.isBefore(deadline)) {
                fail(new OperationTimeoutException(
                    "Maximum execution time of " + options.getMaximumExecutionTime() + " elapsed", failure, history));
                return;
            }

            Optional<RetryInfo> retry;
            try {
                retry = retryPolicy.evaluate(
                    new RetryContext(number, history.get(history.size() - 1), target, locationMode, history));
            } catch (RuntimeException e) {
                fail(new ConfigurationException("Retry policy " + retryPolicy + " failed", e));
                return;
            }
            if (retry == null || retry.isEmpty()) {
                fail(new RetriesExhaustedException(failure, failure.getStatusCode(), history));
                return;
            }

            RetryInfo info = retry.get();
            if (now.plus(info.backoffDelay()).isAfter(deadline)) {
                fail(new OperationTimeoutException(
                    "Next retry would exceed the maximum execution time of " + options.getMaximumExecutionTime(),
                    failure, history));
                return;
            }
            StorageLocation next = locationMode.canTarget(info.nextLocation()) ? info.nextLocation() : target;
            location = next;
            metricsCollector.recordRetry();
            logger.warn("{} attempt {} against {} failed: {}. Retrying against {} in {} ms",
                        command.getName(), number, target, failure.getMessage(), next,
                        info.backoffDelay().toMillis());

            ScheduledFuture<?> backoff;
            try {
                backoff = scheduler.schedule(this::attempt, info.backoffDelay().toMillis(), TimeUnit.MILLISECONDS);
            } catch (RejectedExecutionException e) {
                abort();
                return;
            }
            pendingBackoff = backoff;
            if (cancellation.isCancelled() && backoff.cancel(false)) {
                fail(new OperationCancelledException(List.of()));
            }
        }

        private void onCancelled() {
            ScheduledFuture<?> backoff = pendingBackoff;
            if (backoff != null && backoff.cancel(false)) {
                logger.debug("{} cancelled during backoff", command.getName());
                fail(new OperationCancelledException(List.of()));
                return;
            }
            CompletableFuture<StorageResponse> current = inFlight;
            if (current != null) {
                current.cancel(true);
            }
        }

        /**
         * Stops the operation because its client is shutting down.
         */
        void abort() {
            fail(new OperationCancelledException(List.of()));
            ScheduledFuture<?> backoff = pendingBackoff;
            if (backoff != null) {
                backoff.cancel(false);
            }
            CompletableFuture<StorageResponse> current = inFlight;
            if (current != null) {
                current.cancel(true);
            }
        }

        private boolean isFinished() {
            return finished.get() || result.isDone();
        }

        private void record(StorageLocation target, Integer status, String requestId,
                            Instant startTime, Instant endTime, Throwable error) {
            RequestResult attempt = RequestResult.builder()
                .location(target)
                .statusCode(status)
                .serviceRequestId(requestId)
                .startTime(startTime)
                .endTime(endTime)
                .error(error)
                .build();
            context.recordAttempt(attempt);
            metricsCollector.recordAttempt(target, attempt.getElapsed(), error == null);
        }

        private List<RequestResult> history() {
            List<RequestResult> all = context.getRequestResults();
            return List.copyOf(all.subList(Math.min(firstAttemptIndex, all.size()), all.size()));
        }

        private void complete(T value) {
            if (finish(null)) {
                result.complete(value);
            }
        }

        private void fail(StorageException failure) {
            StorageException withHistory = failure.withHistory(history());
            if (finish(withHistory.getKind())) {
                if (withHistory.getKind() == ErrorKind.CANCELLED) {
                    logger.debug("{} cancelled after {} attempt(s)",
                                 command.getName(), withHistory.getAttemptCount());
                } else {
                    logger.warn("{} failed after {} attempt(s): {}",
                                command.getName(), withHistory.getAttemptCount(), withHistory.getMessage());
                }
                result.completeExceptionally(withHistory);
            }
        }

        /**
         * Runs the end-of-operation bookkeeping. Returns false if the operation had already finished.
         */
        private boolean finish(ErrorKind failureKind) {
            if (!finished.compareAndSet(false, true)) {
                return false;
            }
            activeExecutions.remove(this);
            CancellationSignal.Registration current = registration;
            if (current != null) {
                current.close();
            }
            context.setEndTime(clock.instant());
            if (failureKind == null) {
                metricsCollector.recordOperationSuccess();
                logger.debug("{} completed after {} attempt(s)", command.getName(), attemptNumber);
            } else {
                metricsCollector.recordOperationFailure(failureKind);
            }
            return true;
        }
    }
}
