package com.georep.storage.exception;

import com.georep.storage.model.RequestResult;

import java.util.List;

/**
 * Terminal failure of a logical storage operation. Carries the full,
 * chronologically ordered attempt history so callers can tell a failure on
 * the first attempt from a failure after several location-switching retries.
 */
public class StorageException extends RuntimeException {
    
    private final ErrorKind kind;
    private final Integer statusCode;
    private final List<RequestResult> requestResults;
    
    public StorageException(ErrorKind kind, String message) {
        this(kind, message, null, null, List.of());
    }
    
    public StorageException(ErrorKind kind, String message, Throwable cause) {
        this(kind, message, cause, null, List.of());
    }
    
    public StorageException(ErrorKind kind, String message, Throwable cause,
                            Integer statusCode, List<RequestResult> requestResults) {
        super(message, cause);
        this.kind = kind;
        this.statusCode = statusCode;
        this.requestResults = requestResults == null ? List.of() : List.copyOf(requestResults);
    }
    
    public ErrorKind getKind() {
        return kind;
    }
    
    /**
     * HTTP status of the last attempt, or {@code null} when no response was received.
     */
    public Integer getStatusCode() {
        return statusCode;
    }
    
    public List<RequestResult> getRequestResults() {
        return requestResults;
    }
    
    public int getAttemptCount() {
        return requestResults.size();
    }
    
    public boolean isRetryable() {
        return kind == ErrorKind.TRANSIENT;
    }
    
    /**
     * Copy of this failure with the attempt history attached.
     */
    public StorageException withHistory(List<RequestResult> history) {
        return new StorageException(kind, getMessage(), getCause(), statusCode, history);
    }
    
    /**
     * Malformed endpoint, invalid location mode or signing failure.
     */
    public static class ConfigurationException extends StorageException {
        public ConfigurationException(String message) {
            super(ErrorKind.CONFIGURATION, message);
        }
        
        public ConfigurationException(String message, Throwable cause) {
            super(ErrorKind.CONFIGURATION, message, cause);
        }
        
        public ConfigurationException(String message, Throwable cause, List<RequestResult> history) {
            super(ErrorKind.CONFIGURATION, message, cause, null, history);
        }
        
        @Override
        public StorageException withHistory(List<RequestResult> history) {
            return new ConfigurationException(getMessage(), getCause(), history);
        }
    }
    
    /**
     * A location was requested that the endpoint pair does not define.
     */
    public static class UnsupportedLocationException extends ConfigurationException {
        public UnsupportedLocationException(String message) {
            super(message);
        }
    }
    
    /**
     * Per-attempt error recorded for a retryable failure.
     */
    public static class TransientFailureException extends StorageException {
        public TransientFailureException(String message, Throwable cause, Integer statusCode) {
            super(ErrorKind.TRANSIENT, message, cause, statusCode, List.of());
        }
    }
    
    /**
     * The service rejected the request with a non-retryable 4xx status.
     */
    public static class ClientErrorException extends StorageException {
        public ClientErrorException(int statusCode, String message) {
            super(ErrorKind.CLIENT, message, null, statusCode, List.of());
        }
        
        private ClientErrorException(String message, Integer statusCode, List<RequestResult> history) {
            super(ErrorKind.CLIENT, message, null, statusCode, history);
        }
        
        @Override
        public StorageException withHistory(List<RequestResult> history) {
            return new ClientErrorException(getMessage(), getStatusCode(), history);
        }
    }
    
    /**
     * Non-retryable server status, or a response the payload codec rejected.
     */
    public static class ServerErrorException extends StorageException {
        public ServerErrorException(Integer statusCode, String message, Throwable cause) {
            super(ErrorKind.SERVER, message, cause, statusCode, List.of());
        }
        
        private ServerErrorException(String message, Throwable cause, Integer statusCode,
                                     List<RequestResult> history) {
            super(ErrorKind.SERVER, message, cause, statusCode, history);
        }
        
        @Override
        public StorageException withHistory(List<RequestResult> history) {
            return new ServerErrorException(getMessage(), getCause(), getStatusCode(), history);
        }
    }
    
    /**
     * The retry policy declined further attempts. The cause is the last attempt's error.
     */
    public static class RetriesExhaustedException extends StorageException {
        public RetriesExhaustedException(Throwable lastError, Integer statusCode, List<RequestResult> history) {
            super(ErrorKind.EXHAUSTED_RETRIES,
                  String.format("Operation failed after %d attempt(s): %s",
                                history.size(), lastError == null ? "unknown error" : lastError.getMessage()),
                  lastError, statusCode, history);
        }
        
        @Override
        public StorageException withHistory(List<RequestResult> history) {
            return new RetriesExhaustedException(getCause(), getStatusCode(), history);
        }
    }
    
    /**
     * The caller cancelled the operation during a send or a backoff wait.
     */
    public static class OperationCancelledException extends StorageException {
        public OperationCancelledException(List<RequestResult> history) {
            super(ErrorKind.CANCELLED, "Operation was cancelled", null, null, history);
        }
        
        @Override
        public StorageException withHistory(List<RequestResult> history) {
            return new OperationCancelledException(history);
        }
    }
    
    /**
     * The per-operation deadline elapsed before the operation could complete.
     */
    public static class OperationTimeoutException extends StorageException {
        public OperationTimeoutException(String message, Throwable lastError, List<RequestResult> history) {
            super(ErrorKind.OPERATION_TIMEOUT, message, lastError, null, history);
        }
        
        @Override
        public StorageException withHistory(List<RequestResult> history) {
            return new OperationTimeoutException(getMessage(), getCause(), history);
        }
    }
}
