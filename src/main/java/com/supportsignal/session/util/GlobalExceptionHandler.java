package com.supportsignal.session.util;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import jakarta.servlet.http.HttpServletRequest;

import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import com.supportsignal.session.exception.SessionErrorType;
import com.supportsignal.session.exception.SessionLifecycleException;

import lombok.extern.slf4j.Slf4j;

/**
 * Global exception handler for REST controllers.
 *
 * Lookups report absence as data and never reach this class. Commands throw
 * {@link SessionLifecycleException} subclasses, rendered here as:
 * <pre>
 * {
 *   "success": false,
 *   "error": "Expired",
 *   "message": "Session expired",
 *   "correlationId": "4f1c...",
 *   "timestamp": "2025-11-16T10:30:00Z",
 *   "path": "/api/sessions/refresh"
 * }
 * </pre>
 *
 * Store connectivity failures map to 503 and are never retried here.
 *
 * @see com.supportsignal.session.util.CorrelationIdFilter
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    /**
     * Handles typed session and impersonation command failures.
     *
     * @param ex the exception
     * @param request the HTTP request
     * @return error response with the status for its error type
     */
    @ExceptionHandler(SessionLifecycleException.class)
    public ResponseEntity<Map<String, Object>> handleSessionLifecycleException(
            SessionLifecycleException ex,
            HttpServletRequest request) {

        HttpStatus status = statusFor(ex.getErrorType());

        if (status == HttpStatus.FORBIDDEN) {
            log.warn("Forbidden session operation on {}: {}", request.getRequestURI(), ex.getMessage());
        } else {
            log.info("Session command failed on {}: {} ({})",
                request.getRequestURI(), ex.getMessage(), ex.getErrorType().label());
        }

        return new ResponseEntity<>(
            createErrorBody(ex.getErrorType().label(), ex.getMessage(), request.getRequestURI()),
            status
        );
    }

    /**
     * Handles validation errors (e.g., @Valid annotation failures).
     *
     * @param ex the exception
     * @param request the HTTP request
     * @return error response with HTTP 400
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidationException(
            MethodArgumentNotValidException ex,
            HttpServletRequest request) {

        log.warn("Validation exception: {}", ex.getMessage());

        StringBuilder message = new StringBuilder("Validation failed: ");
        ex.getBindingResult().getFieldErrors().forEach(error ->
            message.append(error.getField())
                   .append(" ")
                   .append(error.getDefaultMessage())
                   .append("; ")
        );

        return new ResponseEntity<>(
            createErrorBody(SessionErrorType.INVALID_REQUEST.label(), message.toString(), request.getRequestURI()),
            HttpStatus.BAD_REQUEST
        );
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<Map<String, Object>> handleMissingHeader(
            MissingRequestHeaderException ex,
            HttpServletRequest request) {

        return new ResponseEntity<>(
            createErrorBody(SessionErrorType.INVALID_REQUEST.label(),
                "Missing header: " + ex.getHeaderName(), request.getRequestURI()),
            HttpStatus.BAD_REQUEST
        );
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalArgumentException(
            IllegalArgumentException ex,
            HttpServletRequest request) {

        log.warn("Illegal argument: {}", ex.getMessage());

        return new ResponseEntity<>(
            createErrorBody(SessionErrorType.INVALID_REQUEST.label(), ex.getMessage(), request.getRequestURI()),
            HttpStatus.BAD_REQUEST
        );
    }

    /**
     * Handles store connectivity failures.
     *
     * The outcome of the interrupted command is unknown; callers re-validate
     * instead of assuming it failed.
     *
     * @param ex the exception
     * @param request the HTTP request
     * @return error response with HTTP 503
     */
    @ExceptionHandler({DataAccessResourceFailureException.class, CannotCreateTransactionException.class})
    public ResponseEntity<Map<String, Object>> handleStoreUnavailable(
            RuntimeException ex,
            HttpServletRequest request) {

        log.error("Session store unavailable on {}: {}", request.getRequestURI(), ex.getMessage());

        return new ResponseEntity<>(
            createErrorBody("StoreUnavailable",
                "Session store temporarily unavailable. Outcome unknown, re-validate before retrying.",
                request.getRequestURI()),
            HttpStatus.SERVICE_UNAVAILABLE
        );
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGenericException(
            Exception ex,
            HttpServletRequest request) {

        log.error("Unhandled exception", ex);

        return new ResponseEntity<>(
            createErrorBody("InternalError",
                "An unexpected error occurred. Please contact support with correlation ID.",
                request.getRequestURI()),
            HttpStatus.INTERNAL_SERVER_ERROR
        );
    }

    static HttpStatus statusFor(SessionErrorType errorType) {
        return switch (errorType) {
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case EXPIRED -> HttpStatus.UNAUTHORIZED;
            case LIMIT_EXCEEDED -> HttpStatus.TOO_MANY_REQUESTS;
            case FORBIDDEN -> HttpStatus.FORBIDDEN;
            case INVALID_REQUEST -> HttpStatus.BAD_REQUEST;
        };
    }

    private Map<String, Object> createErrorBody(String error, String message, String path) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", false);
        body.put("error", error);
        body.put("message", message);
        body.put("correlationId", CorrelationIdFilter.getCurrentCorrelationId());
        body.put("timestamp", Instant.now().toString());
        body.put("path", path);
        return body;
    }
}
