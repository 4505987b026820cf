package com.phillippitts.linkband.presentation.exception;

import com.phillippitts.linkband.exception.LinkBandException;
import com.phillippitts.linkband.exception.SupervisorConfigurationException;
import com.phillippitts.linkband.exception.TransportException;
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
 * Converts supervisor exceptions to HTTP responses with appropriate status codes.
 * Logs errors for monitoring while keeping internal details away from clients.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * Bridge link unavailable - retry once it reconnects (HTTP 503).
     */
    @ExceptionHandler(TransportException.class)
    ResponseEntity<ApiError> handleTransport(TransportException ex) {
        LOG.warn("Bridge unavailable: endpoint={}, reason={}", ex.getEndpoint(), ex.getMessage());
        return ResponseEntity
            .status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Bridge connection unavailable",
                "Please retry once the bridge is connected",
                Instant.now()
            ));
    }

    /**
     * Configuration error - normally fails startup, but if encountered at runtime return 503.
     */
    @ExceptionHandler(SupervisorConfigurationException.class)
    ResponseEntity<ApiError> handleConfiguration(SupervisorConfigurationException ex) {
        LOG.error("Invalid supervisor configuration: property={}", ex.getProperty());
        return ResponseEntity
            .status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Bridge supervisor misconfigured",
                "Invalid setting. Contact administrator.",
                Instant.now()
            ));
    }

    /**
     * Client error - invalid input (HTTP 400).
     */
    @ExceptionHandler(IllegalArgumentException.class)
    ResponseEntity<ApiError> handleBadRequest(IllegalArgumentException ex) {
        LOG.warn("Rejected request: {}", ex.getMessage());
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
     * Any other supervisor failure (HTTP 500).
     */
    @ExceptionHandler(LinkBandException.class)
    ResponseEntity<ApiError> handleSupervisorFailure(LinkBandException ex) {
        LOG.error("Supervisor error", ex);
        return ResponseEntity
            .status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Bridge supervisor error",
                "Please retry; see server logs for details",
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
