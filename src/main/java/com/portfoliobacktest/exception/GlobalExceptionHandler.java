package com.portfoliobacktest.exception;

import com.portfoliobacktest.backtest.engine.BacktestException;
import com.portfoliobacktest.dto.ApiResponse;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.format.DateTimeParseException;

/**
 * Global exception handler for all REST controllers.
 * Centralizes error handling and provides consistent error responses across the application.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    private static final String DATE_FORMAT_MESSAGE = "Invalid date format. Use yyyy-MM-dd (e.g., 2024-01-31)";
    private static final String MALFORMED_JSON_MESSAGE = "Malformed JSON request. Please check your request body format.";

    /**
     * Handles backtest failures, mapping the error code to an HTTP status.
     */
    @ExceptionHandler(BacktestException.class)
    public ResponseEntity<ApiResponse<Void>> handleBacktestException(BacktestException e) {
        HttpStatus status = mapErrorCodeToHttpStatus(e.getErrorCode());
        if (status.is5xxServerError()) {
            log.error("Backtest error [{}]: {}", e.getErrorCode(), e.getMessage(), e);
        } else {
            log.warn("Backtest error [{}]: {}", e.getErrorCode(), e.getMessage());
        }
        return createErrorResponse(status, "[" + e.getErrorCode() + "] " + e.getMessage());
    }

    static HttpStatus mapErrorCodeToHttpStatus(BacktestException.ErrorCode errorCode) {
        return switch (errorCode) {
            case INVALID_DATE_RANGE, INVALID_REQUEST, STRATEGY_NOT_BOUND -> HttpStatus.BAD_REQUEST;
            case RESULT_NOT_FOUND -> HttpStatus.NOT_FOUND;
            case CANCELLED -> HttpStatus.CONFLICT;
            case DATA_FETCH_FAILED, BACKTEST_DISABLED -> HttpStatus.SERVICE_UNAVAILABLE;
            case LEDGER_ORDER_VIOLATION -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }

    /**
     * Handles malformed JSON in request body.
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiResponse<Void>> handleHttpMessageNotReadable(HttpMessageNotReadableException e) {
        log.warn("Malformed JSON request: {}", e.getMessage());
        return createErrorResponse(HttpStatus.BAD_REQUEST, MALFORMED_JSON_MESSAGE);
    }

    /**
     * Handles validation errors from @Valid annotations on request bodies.
     * Extracts the first validation error message for client feedback.
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiResponse<Void>> handleValidationException(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .findFirst()
                .orElse("Validation failed");

        log.warn("Validation error: {}", message);
        return createErrorResponse(HttpStatus.BAD_REQUEST, "Validation error: " + message);
    }

    /**
     * Handles validation errors on method parameters (e.g. a batch request list).
     */
    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ApiResponse<Void>> handleConstraintViolation(ConstraintViolationException e) {
        String message = e.getConstraintViolations().stream()
                .map(violation -> violation.getMessage())
                .findFirst()
                .orElse("Validation failed");

        log.warn("Validation error: {}", message);
        return createErrorResponse(HttpStatus.BAD_REQUEST, "Validation error: " + message);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiResponse<Void>> handleIllegalArgumentException(IllegalArgumentException e) {
        log.warn("Invalid argument: {}", e.getMessage());
        return createErrorResponse(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    @ExceptionHandler(DateTimeParseException.class)
    public ResponseEntity<ApiResponse<Void>> handleDateTimeParseException(DateTimeParseException e) {
        log.warn("Date parsing error: {}", e.getMessage());
        return createErrorResponse(HttpStatus.BAD_REQUEST, DATE_FORMAT_MESSAGE);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiResponse<Void>> handleTypeMismatchException(MethodArgumentTypeMismatchException e) {
        String message = String.format("Invalid value '%s' for parameter '%s'", e.getValue(), e.getName());
        log.warn("Type mismatch: {}", message);
        return createErrorResponse(HttpStatus.BAD_REQUEST, message);
    }

    /**
     * Handles all uncaught exceptions as a safety net.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Void>> handleGenericException(Exception e) {
        log.error("Unexpected error: {}", e.getMessage(), e);
        return createErrorResponse(HttpStatus.INTERNAL_SERVER_ERROR, "Unexpected error: " + e.getMessage());
    }

    private static ResponseEntity<ApiResponse<Void>> createErrorResponse(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(ApiResponse.error(message));
    }
}
