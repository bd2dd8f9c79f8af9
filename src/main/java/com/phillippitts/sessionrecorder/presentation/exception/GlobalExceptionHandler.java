package com.phillippitts.sessionrecorder.presentation.exception;

import com.phillippitts.sessionrecorder.exception.OfflineRecordingNotFoundException;
import com.phillippitts.sessionrecorder.exception.RecordingPersistenceException;
import com.phillippitts.sessionrecorder.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Instant;

/**
 * Global exception handler for REST API boundary.
 *
 * Converts domain exceptions to HTTP responses with appropriate status codes.
 * Logs errors for monitoring while protecting sensitive details from clients.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * Client error - no in-memory recording for the path (HTTP 404).
     */
    @ExceptionHandler(OfflineRecordingNotFoundException.class)
    ResponseEntity<ApiError> handleOfflineNotFound(OfflineRecordingNotFoundException ex) {
        LOG.warn("No in-memory recording for {}", LogSanitizer.fileName(ex.getOutputPath()));
        return ResponseEntity
            .status(HttpStatus.NOT_FOUND)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Recording not held in memory",
                ex.getMessage(),
                Instant.now()
            ));
    }

    /**
     * Transient error - storage unavailable, retry possible (HTTP 503).
     */
    @ExceptionHandler(RecordingPersistenceException.class)
    ResponseEntity<ApiError> handlePersistenceFailure(RecordingPersistenceException ex) {
        LOG.error("Persisting recording failed: file={}", LogSanitizer.fileName(ex.getOutputPath()), ex);
        return ResponseEntity
            .status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Recording storage temporarily unavailable",
                "The recording is still held in memory. Please retry.",
                Instant.now()
            ));
    }

    /**
     * Client error - missing request parameter (HTTP 400).
     */
    @ExceptionHandler(MissingServletRequestParameterException.class)
    ResponseEntity<ApiError> handleMissingParameter(MissingServletRequestParameterException ex) {
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Missing request parameter",
                ex.getParameterName(),
                Instant.now()
            ));
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
                "Please contact support with request ID",
                Instant.now()
            ));
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
