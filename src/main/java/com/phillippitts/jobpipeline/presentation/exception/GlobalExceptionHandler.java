package com.phillippitts.jobpipeline.presentation.exception;

import com.phillippitts.jobpipeline.exception.JobPipelineException;
import com.phillippitts.jobpipeline.exception.RateLimitExceededException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Instant;

/**
 * Global exception handler for REST API boundary.
 *
 * Converts the pipeline's error taxonomy to HTTP responses. Client errors carry the
 * exception message; server-side failures never expose internal detail.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * Rate limit exhausted (HTTP 429).
     */
    @ExceptionHandler(RateLimitExceededException.class)
    ResponseEntity<ApiError> handleRateLimited(RateLimitExceededException ex) {
        LOG.info("Rate limited: {}", ex.getMessage());
        return ResponseEntity
            .status(HttpStatus.TOO_MANY_REQUESTS)
            .header(HttpHeaders.RETRY_AFTER, Long.toString(ex.getWindow().toSeconds()))
            .header("X-RateLimit-Remaining", "0")
            .body(new ApiError(
                "RATE_LIMITED",
                "Too many requests",
                "Limit of " + ex.getLimit() + " per " + ex.getWindow().toSeconds() + "s reached",
                Instant.now()
            ));
    }

    @ExceptionHandler(JobPipelineException.class)
    ResponseEntity<ApiError> handlePipeline(JobPipelineException ex) {
        return switch (ex.getKind()) {
            case VALIDATION -> clientError(HttpStatus.BAD_REQUEST, ex, "Invalid request");
            case FORBIDDEN -> clientError(HttpStatus.FORBIDDEN, ex, "Access denied");
            case NOT_FOUND -> clientError(HttpStatus.NOT_FOUND, ex, "Resource not found");
            case RATE_LIMITED -> clientError(HttpStatus.TOO_MANY_REQUESTS, ex, "Too many requests");
            case STORE_UNAVAILABLE, UPSTREAM_UNAVAILABLE -> {
                LOG.error("Dependency unavailable: {}", ex.getMessage(), ex);
                yield ResponseEntity
                    .status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(new ApiError(
                        ex.getKind().name(),
                        "Service temporarily unavailable",
                        "Please retry in a few seconds",
                        Instant.now()
                    ));
            }
            default -> internalError(ex);
        };
    }

    /**
     * Unparseable request body (HTTP 400).
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    ResponseEntity<ApiError> handleUnreadable(HttpMessageNotReadableException ex) {
        LOG.warn("Unreadable request body: {}", ex.getMostSpecificCause().getMessage());
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError(
                "VALIDATION",
                "Invalid request",
                "Request body is missing or malformed",
                Instant.now()
            ));
    }

    /**
     * Catch-all for unexpected errors (HTTP 500).
     */
    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        return internalError(ex);
    }

    private static ResponseEntity<ApiError> clientError(HttpStatus status, JobPipelineException ex, String message) {
        LOG.warn("{}: {}", ex.getKind(), ex.getMessage());
        return ResponseEntity
            .status(status)
            .body(new ApiError(ex.getKind().name(), message, ex.getMessage(), Instant.now()));
    }

    private static ResponseEntity<ApiError> internalError(Exception ex) {
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
    private record ApiError(
        String errorCode,
        String message,
        String details,
        Instant timestamp
    ) {}
}
