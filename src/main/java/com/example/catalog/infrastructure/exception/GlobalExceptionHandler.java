package com.example.catalog.infrastructure.exception;

import com.example.catalog.domain.exception.DomainException;
import com.example.catalog.domain.exception.ErrorCode;
import com.example.catalog.domain.exception.InsufficientStockException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ResponseStatusException;

import java.time.Instant;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Global exception handler for REST API.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(InsufficientStockException.class)
    public ResponseEntity<Map<String, Object>> handleInsufficientStock(InsufficientStockException ex) {
        log.warn("Insufficient stock: {}", ex.getMessage());
        return ResponseEntity.status(statusOf(ex.getErrorCode()))
                .body(Map.of(
                        "error", ex.getErrorCode().name(),
                        "message", ex.getMessage(),
                        "product_id", ex.getProductId(),
                        "timestamp", Instant.now().toString()
                ));
    }

    @ExceptionHandler(DomainException.class)
    public ResponseEntity<Map<String, Object>> handleDomainException(DomainException ex) {
        log.warn("Domain error: {} - {}", ex.getErrorCode(), ex.getMessage());
        return ResponseEntity.status(statusOf(ex.getErrorCode()))
                .body(body(ex.getErrorCode().name(), ex.getMessage()));
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(WebExchangeBindException ex) {
        String message = ex.getFieldErrors().stream()
                .map(FieldError::getDefaultMessage)
                .collect(Collectors.joining("; "));
        log.warn("Request validation failed: {}", message);
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(body(ErrorCode.INVALID_INPUT.name(), message.isEmpty() ? "Invalid request" : message));
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<Map<String, Object>> handleResponseStatus(ResponseStatusException ex) {
        HttpStatusCode status = ex.getStatusCode();
        log.warn("Request rejected with {}: {}", status.value(), ex.getReason());
        String error = status.value() == HttpStatus.NOT_FOUND.value()
                ? ErrorCode.NOT_FOUND.name()
                : status.is4xxClientError() ? ErrorCode.INVALID_INPUT.name() : "REQUEST_FAILED";
        return ResponseEntity.status(status)
                .body(body(error, ex.getReason() != null ? ex.getReason() : "Invalid request"));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGenericException(Exception ex) {
        log.error("Unexpected error", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(body("INTERNAL_ERROR", "An unexpected error occurred"));
    }

    private static HttpStatus statusOf(ErrorCode errorCode) {
        return switch (errorCode) {
            case INVALID_INPUT, NOT_ENOUGH_STOCK -> HttpStatus.BAD_REQUEST;
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case INVALID_STATE -> HttpStatus.CONFLICT;
        };
    }

    private static Map<String, Object> body(String error, String message) {
        return Map.of(
                "error", error,
                "message", message,
                "timestamp", Instant.now().toString()
        );
    }
}
