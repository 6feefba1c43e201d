package com.phillippitts.sessioncore.presentation.exception;

import com.phillippitts.sessioncore.exception.DuplicateRequestKeyException;
import com.phillippitts.sessioncore.exception.QueueEntryNotFoundException;
import com.phillippitts.sessioncore.exception.QueueStoreException;
import com.phillippitts.sessioncore.exception.UploadRejectedException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Instant;

/**
 * Maps coordination exceptions to HTTP responses at the REST boundary.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * Caller error: a request for the same key is already in flight (HTTP 409).
     */
    @ExceptionHandler(DuplicateRequestKeyException.class)
    ResponseEntity<ApiError> handleDuplicateKey(DuplicateRequestKeyException ex) {
        LOG.warn("Duplicate request key: {}", ex.getKey());
        return error(HttpStatus.CONFLICT, ex, "Request already pending", ex.getMessage());
    }

    /**
     * Not connected or no storage location is a service condition (503); anything about the
     * file itself is the client's (400).
     */
    @ExceptionHandler(UploadRejectedException.class)
    ResponseEntity<ApiError> handleUploadRejected(UploadRejectedException ex) {
        LOG.warn("Upload rejected: file={}, reason={}", ex.getFilename(), ex.getReason());
        return switch (ex.getReason()) {
            case NOT_CONNECTED, NO_STORAGE_LOCATION ->
                    error(HttpStatus.SERVICE_UNAVAILABLE, ex, "Upload service unavailable", ex.getMessage());
            case FILE_NOT_FOUND, SIZE_LIMIT_EXCEEDED, UNREADABLE ->
                    error(HttpStatus.BAD_REQUEST, ex, "Upload rejected", ex.getMessage());
        };
    }

    @ExceptionHandler(QueueEntryNotFoundException.class)
    ResponseEntity<ApiError> handleQueueEntryNotFound(QueueEntryNotFoundException ex) {
        LOG.debug("Queue entry not found: {}", ex.getSessionId());
        return error(HttpStatus.NOT_FOUND, ex, "Session is not queued", ex.getMessage());
    }

    /**
     * Transient error - retry possible (HTTP 503).
     */
    @ExceptionHandler(QueueStoreException.class)
    ResponseEntity<ApiError> handleQueueStore(QueueStoreException ex) {
        LOG.error("Queue store failure", ex);
        return error(HttpStatus.SERVICE_UNAVAILABLE, ex, "Queue storage temporarily unavailable",
                "Please retry in a few seconds");
    }

    /**
     * Catch-all for unexpected errors (HTTP 500).
     */
    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        LOG.error("Unexpected error", ex);
        return ResponseEntity
            .status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ApiError(
                "InternalServerError",
                "An unexpected error occurred",
                "Please contact support with the X-Request-ID header value",
                Instant.now()
            ));
    }

    private static ResponseEntity<ApiError> error(HttpStatus status, Exception ex, String message, String details) {
        return ResponseEntity
            .status(status)
            .body(new ApiError(ex.getClass().getSimpleName(), message, details, Instant.now()));
    }

    /**
     * Standardized error response for API clients.
     */
    record ApiError(
        String errorCode,
        String message,
        String details,
        Instant timestamp
    ) {}
}
