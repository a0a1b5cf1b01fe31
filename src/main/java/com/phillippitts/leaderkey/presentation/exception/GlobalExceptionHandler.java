package com.phillippitts.leaderkey.presentation.exception;

import com.phillippitts.leaderkey.exception.ConfigDecodeException;
import com.phillippitts.leaderkey.exception.ConfigReadException;
import com.phillippitts.leaderkey.exception.ConfigWriteException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Instant;

/**
 * Global exception handler for REST API boundary.
 *
 * Converts domain exceptions to HTTP responses with appropriate status codes.
 * Logs errors for monitoring while keeping file system details away from clients.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * Client error - posted config document is malformed (HTTP 400).
     */
    @ExceptionHandler(ConfigDecodeException.class)
    ResponseEntity<ApiError> handleDecode(ConfigDecodeException ex) {
        LOG.warn("Rejected config document: {}", ex.getReason());
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Invalid config document",
                ex.getReason(),
                Instant.now()
            ));
    }

    /**
     * Client error - bad key, modifier or parameter (HTTP 400).
     */
    @ExceptionHandler({IllegalArgumentException.class, MethodArgumentNotValidException.class})
    ResponseEntity<ApiError> handleBadRequest(Exception ex) {
        LOG.warn("Bad request: {}", ex.getMessage());
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Invalid request",
                ex instanceof MethodArgumentNotValidException ? "Request body failed validation" : ex.getMessage(),
                Instant.now()
            ));
    }

    /**
     * Config file not accessible - retry possible once the file system is fixed (HTTP 503).
     */
    @ExceptionHandler({ConfigReadException.class, ConfigWriteException.class})
    ResponseEntity<ApiError> handleConfigIo(RuntimeException ex) {
        LOG.error("Config file I/O failed", ex);
        return ResponseEntity
            .status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Config file unavailable",
                "Check permissions of the config directory and retry",
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
                "Please report this with the request ID",
                Instant.now()
            ));
    }

    /**
     * Standardized error response for API clients.
     */
    private record ApiError(
        String errorCode,
        String message,
        String details,
        Instant timestamp
    ) {}
}
