package com.seamtalk.presentation.exception;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.seamtalk.exception.CollaboratorException;
import com.seamtalk.exception.InvalidRequestException;
import com.seamtalk.exception.MissingCredentialsException;
import com.seamtalk.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.ErrorResponseException;
import org.springframework.web.HttpMediaTypeNotAcceptableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.time.Instant;

/**
 * Global exception handler for the REST API boundary.
 *
 * Converts domain exceptions to HTTP responses. Provider response bodies are passed through
 * as {@code detail} for upstream failures only; stack traces never leave the server.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * Client error - required fields missing (HTTP 400).
     */
    @ExceptionHandler(InvalidRequestException.class)
    ResponseEntity<ApiError> handleInvalidRequest(InvalidRequestException ex) {
        LOG.warn("Rejected request: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, ex.getMessage(), null);
    }

    /**
     * Client error - body is not JSON (HTTP 400).
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    ResponseEntity<ApiError> handleUnreadable(HttpMessageNotReadableException ex) {
        LOG.warn("Unreadable request body: {}", ex.getMostSpecificCause().getMessage());
        return error(HttpStatus.BAD_REQUEST, "Malformed JSON request body", null);
    }

    /**
     * Deployment error - provider key not configured (HTTP 500).
     */
    @ExceptionHandler(MissingCredentialsException.class)
    ResponseEntity<ApiError> handleMissingCredentials(MissingCredentialsException ex) {
        LOG.error("Provider credentials missing: {}", ex.getVariable());
        return error(HttpStatus.INTERNAL_SERVER_ERROR, ex.getMessage(), null);
    }

    /**
     * Provider failure. A provider HTTP error maps to 502 with its body as detail; a failure
     * before any response (timeout, connection refused) maps to 500.
     */
    @ExceptionHandler(CollaboratorException.class)
    ResponseEntity<ApiError> handleCollaborator(CollaboratorException ex) {
        if (ex.hasHttpStatus()) {
            LOG.error("Provider {} failed: status={}, body={}", ex.getProvider(), ex.getHttpStatus(),
                    LogSanitizer.truncate(ex.getResponseBody(), 500));
            return error(HttpStatus.BAD_GATEWAY, ex.getReason(), ex.getResponseBody());
        }
        LOG.error("Provider {} unreachable: {}", ex.getProvider(), ex.getMessage());
        return error(HttpStatus.INTERNAL_SERVER_ERROR, ex.getReason(), null);
    }

    /**
     * Framework rejections keep their own status: unknown path (including an upgrade request
     * outside the relay path) 404, wrong method 405, wrong media type 415/406.
     */
    @ExceptionHandler({
            NoResourceFoundException.class,
            HttpRequestMethodNotSupportedException.class,
            HttpMediaTypeNotSupportedException.class,
            HttpMediaTypeNotAcceptableException.class,
            ErrorResponseException.class
    })
    ResponseEntity<ApiError> handleFrameworkRejection(Exception ex) {
        HttpStatusCode status = ((ErrorResponse) ex).getStatusCode();
        LOG.warn("Rejected request with {}: {}", status.value(), ex.getMessage());
        HttpStatus known = HttpStatus.resolve(status.value());
        String reason = known != null ? known.getReasonPhrase() : "Request rejected";
        return ResponseEntity.status(status)
                .body(new ApiError(reason, ((ErrorResponse) ex).getBody().getDetail(), Instant.now()));
    }

    /**
     * Catch-all for unexpected errors (HTTP 500).
     */
    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        LOG.error("Unexpected error", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred", null);
    }

    private static ResponseEntity<ApiError> error(HttpStatus status, String message, String detail) {
        return ResponseEntity.status(status).body(new ApiError(message, detail, Instant.now()));
    }

    /**
     * Error response for API clients: {@code {"error": "...", "detail": "...", "timestamp": "..."}}.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    record ApiError(String error, String detail, Instant timestamp) {}
}
