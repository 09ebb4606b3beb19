package com.phillippitts.livetranslate.presentation.exception;

import com.phillippitts.livetranslate.exception.InvalidMessageException;
import com.phillippitts.livetranslate.exception.InvalidSessionException;
import com.phillippitts.livetranslate.exception.PersistenceException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
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
     * Unknown session or expired classroom code (HTTP 404).
     */
    @ExceptionHandler(InvalidSessionException.class)
    ResponseEntity<ApiError> handleInvalidSession(InvalidSessionException ex) {
        LOG.info("Session lookup failed: {}", ex.getIdentifier());
        return ResponseEntity
            .status(HttpStatus.NOT_FOUND)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Session not found",
                ex.getMessage(),
                Instant.now()
            ));
    }

    /**
     * Client error - invalid input (HTTP 400).
     */
    @ExceptionHandler(InvalidMessageException.class)
    ResponseEntity<ApiError> handleInvalidMessage(InvalidMessageException ex) {
        LOG.warn("Invalid request: type={}, reason={}", ex.getMessageType(), ex.getMessage());
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Invalid request",
                ex.getMessage(),
                Instant.now()
            ));
    }

    /**
     * Transient storage error - retry possible (HTTP 503).
     */
    @ExceptionHandler(PersistenceException.class)
    ResponseEntity<ApiError> handlePersistenceFailure(PersistenceException ex) {
        LOG.error("Persistence failed: operation={}", ex.getOperation(), ex);
        return ResponseEntity
            .status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Session storage temporarily unavailable",
                "Please retry in a few seconds",
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
