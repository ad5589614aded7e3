package com.example.playout.exception;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationExceptions(MethodArgumentNotValidException ex) {
        Map<String, String> errors = new HashMap<>();
        ex.getBindingResult().getAllErrors().forEach((error) -> {
            String fieldName = error instanceof FieldError fe ? fe.getField() : error.getObjectName();
            errors.put(fieldName, error.getDefaultMessage());
        });

        logger.warn("Validation failed: {}", errors);
        return ResponseEntity.badRequest().body(new ErrorResponse(
                "VALIDATION_ERROR", "Request data is invalid", errors, LocalDateTime.now()));
    }

    @ExceptionHandler(MalformedTimeException.class)
    public ResponseEntity<ErrorResponse> handleMalformedTime(MalformedTimeException ex) {
        logger.warn("Malformed time in template: {}", ex.getMessage());
        return ResponseEntity.badRequest().body(new ErrorResponse(
                ex.getErrorCode(), ex.getMessage(), Map.of("input", ex.getInput()), LocalDateTime.now()));
    }

    @ExceptionHandler(OverlapDetectedException.class)
    public ResponseEntity<ErrorResponse> handleOverlap(OverlapDetectedException ex) {
        Map<String, String> details = new LinkedHashMap<>();
        details.put("existing_title", ex.getExistingTitle());
        details.put("existing_start", seconds(ex.getExistingStart()));
        details.put("existing_end", seconds(ex.getExistingEnd()));
        details.put("offending_title", ex.getOffendingTitle());
        details.put("offending_start", seconds(ex.getOffendingStart()));
        details.put("offending_end", seconds(ex.getOffendingEnd()));

        logger.error("Overlap detected: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT).body(new ErrorResponse(
                ex.getErrorCode(), ex.getMessage(), details, LocalDateTime.now()));
    }

    @ExceptionHandler({IllegalArgumentException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception ex) {
        logger.warn("Bad request: {}", ex.getMessage());
        return ResponseEntity.badRequest().body(new ErrorResponse(
                "BAD_REQUEST", ex.getMessage(), null, LocalDateTime.now()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception ex) {
        logger.error("Unexpected error", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(new ErrorResponse(
                "INTERNAL_ERROR", "An unexpected error occurred", null, LocalDateTime.now()));
    }

    private static String seconds(double value) {
        return String.format(Locale.ROOT, "%.3f", value);
    }

    public record ErrorResponse(
            String error,
            String message,
            Map<String, String> details,
            LocalDateTime timestamp
    ) {}
}
