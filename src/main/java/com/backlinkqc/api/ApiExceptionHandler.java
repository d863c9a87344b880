package com.backlinkqc.api;

import com.backlinkqc.contract.ErrorKind;
import com.backlinkqc.contract.PlanningException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Unified error response handler.
 *
 * All errors follow the machine-readable format:
 * {
 *   "error_code": "STALE_MATRIX",
 *   "message": "...",
 *   "context": { "order_id": "..." },
 *   "timestamp": "2026-..."
 * }
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(PlanningException.class)
    public ResponseEntity<Map<String, Object>> handlePlanning(PlanningException ex) {
        HttpStatus status = statusOf(ex.getKind());
        log.warn("{} ({}): {}", ex.getKind(), status.value(), ex.getMessage());
        return ResponseEntity.status(status)
            .body(errorResponse(ex.getKind().name(), ex.getMessage(), ex.getContext()));
    }

    @ExceptionHandler({
        MethodArgumentTypeMismatchException.class,
        HttpMessageNotReadableException.class
    })
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleParseErrors(Exception ex) {
        return errorResponse("BAD_REQUEST", "request format is invalid: " + ex.getMessage(), Map.of());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleIllegalArgument(IllegalArgumentException ex) {
        return errorResponse("INVALID_ARGUMENT", ex.getMessage(), Map.of());
    }

    @ExceptionHandler(Exception.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Map<String, Object> handleUnexpected(Exception ex) {
        log.error("Unexpected error", ex);
        return errorResponse("INTERNAL_ERROR", "an unexpected error occurred", Map.of());
    }

    static HttpStatus statusOf(ErrorKind kind) {
        return switch (kind) {
            case CONTRACT_VIOLATION -> HttpStatus.BAD_REQUEST;
            case ORDER_NOT_FOUND -> HttpStatus.NOT_FOUND;
            case DUPLICATE_ORDER, ORDER_LOCKED, ILLEGAL_TRANSITION, STALE_MATRIX -> HttpStatus.CONFLICT;
            case DEPENDENCY_UNAVAILABLE -> HttpStatus.SERVICE_UNAVAILABLE;
        };
    }

    private Map<String, Object> errorResponse(String errorCode, String message, Map<String, Object> context) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error_code", errorCode);
        body.put("message", message);
        body.put("context", context);
        body.put("timestamp", Instant.now().toString());
        return body;
    }
}
