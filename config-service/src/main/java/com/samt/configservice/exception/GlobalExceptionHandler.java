package com.samt.configservice.exception;

import com.samt.configservice.dto.response.ErrorResponse;
import com.samt.configservice.schema.FieldError;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.List;

/**
 * Maps configuration errors onto the ErrorResponse envelope.
 *
 * Client errors (400/404/409) are logged at WARN, store outages and
 * unexpected failures at ERROR.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(ConfigNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleConfigNotFound(ConfigNotFoundException ex) {
        log.warn("Config not found: {}", ex.getKey());
        return buildErrorResponse(
            HttpStatus.NOT_FOUND,
            "CONFIG_NOT_FOUND",
            ex.getMessage(),
            null
        );
    }

    @ExceptionHandler(ConfigAlreadyExistsException.class)
    public ResponseEntity<ErrorResponse> handleConfigAlreadyExists(ConfigAlreadyExistsException ex) {
        log.warn("Config already exists: {}", ex.getMessage());
        return buildErrorResponse(
            HttpStatus.CONFLICT,
            "CONFIG_ALREADY_EXISTS",
            ex.getMessage(),
            "key"
        );
    }

    @ExceptionHandler(ConflictException.class)
    public ResponseEntity<ErrorResponse> handleConflict(ConflictException ex) {
        log.warn("Conflict: {}", ex.getMessage());
        return buildErrorResponse(
            HttpStatus.CONFLICT,
            "CONFLICT",
            ex.getMessage(),
            null
        );
    }

    @ExceptionHandler(ConfigValidationException.class)
    public ResponseEntity<ErrorResponse> handleConfigValidation(ConfigValidationException ex) {
        log.warn("Config validation error: {}", ex.getMessage());

        List<FieldError> errors = ex.getErrors();
        FieldError first = errors.isEmpty() ? null : errors.get(0);

        return buildErrorResponse(
            HttpStatus.BAD_REQUEST,
            "VALIDATION_ERROR",
            first == null ? "Validation failed" : describe(first),
            first == null ? null : first.path(),
            errors
        );
    }

    @ExceptionHandler(StoreUnavailableException.class)
    public ResponseEntity<ErrorResponse> handleStoreUnavailable(StoreUnavailableException ex) {
        log.error("Store unavailable: {}", ex.getMessage());
        return buildErrorResponse(
            HttpStatus.SERVICE_UNAVAILABLE,
            "STORE_UNAVAILABLE",
            "Configuration store is temporarily unavailable. Please retry later.",
            null
        );
    }

    @ExceptionHandler(BadRequestException.class)
    public ResponseEntity<ErrorResponse> handleBadRequest(BadRequestException ex) {
        log.warn("Bad request: {}", ex.getMessage());
        return buildErrorResponse(
            HttpStatus.BAD_REQUEST,
            "BAD_REQUEST",
            ex.getMessage(),
            null
        );
    }

    /**
     * Bean Validation failures on request DTOs, reported in the same
     * {@code details: [{path, message}]} shape as schema violations.
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException ex) {
        List<FieldError> errors = ex.getBindingResult().getFieldErrors().stream()
            .map(error -> new FieldError(error.getField(), error.getDefaultMessage()))
            .toList();
        log.warn("Request validation failed: {}", errors);

        FieldError first = errors.isEmpty() ? null : errors.get(0);
        return buildErrorResponse(
            HttpStatus.BAD_REQUEST,
            "VALIDATION_ERROR",
            first == null ? "Validation failed" : first.message(),
            first == null ? null : first.path(),
            errors
        );
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException ex) {
        log.warn("Malformed request body: {}", ex.getMostSpecificCause().getMessage());
        return buildErrorResponse(
            HttpStatus.BAD_REQUEST,
            "BAD_REQUEST",
            "Malformed request body: " + ex.getMostSpecificCause().getMessage(),
            null
        );
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ErrorResponse> handleMissingParameter(MissingServletRequestParameterException ex) {
        return buildErrorResponse(
            HttpStatus.BAD_REQUEST,
            "BAD_REQUEST",
            ex.getMessage(),
            ex.getParameterName()
        );
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGeneric(Exception ex) {
        log.error("Unexpected error: {}", ex.getMessage(), ex);
        return buildErrorResponse(
            HttpStatus.INTERNAL_SERVER_ERROR,
            "INTERNAL_SERVER_ERROR",
            "An unexpected error occurred",
            null
        );
    }

    private static String describe(FieldError error) {
        return error.path().isEmpty() ? "value " + error.message() : error.path() + " " + error.message();
    }

    private ResponseEntity<ErrorResponse> buildErrorResponse(
        HttpStatus status,
        String code,
        String message,
        String field
    ) {
        return buildErrorResponse(status, code, message, field, null);
    }

    private ResponseEntity<ErrorResponse> buildErrorResponse(
        HttpStatus status,
        String code,
        String message,
        String field,
        Object details
    ) {
        ErrorResponse response = ErrorResponse.builder()
            .error(ErrorResponse.Error.builder()
                .code(code)
                .message(message)
                .field(field)
                .details(details)
                .build())
            .timestamp(Instant.now().toString())
            .build();

        return ResponseEntity.status(status).body(response);
    }
}
