package com.zerarate.api.controller;

import com.zerarate.api.dto.ErrorBody;
import com.zerarate.rate.RateResolutionException;
import com.zerarate.rate.source.validator.ValidatorClientException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;

import java.util.Optional;

/**
 * Maps validation failures (@Valid) and rate errors to ErrorBody responses.
 */
@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<ErrorBody> handleValidation(WebExchangeBindException ex) {
        String error = Optional.ofNullable(ex.getFieldError())
                .map(FieldError::getDefaultMessage)
                .filter(msg -> msg != null && !msg.isBlank())
                .orElse("VALIDATION_ERROR");
        String message = userFacingMessage(error, ex);
        return ResponseEntity.badRequest().body(ErrorBody.of(error, message));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorBody> handleInvalidRequest(IllegalArgumentException ex) {
        return ResponseEntity.badRequest().body(ErrorBody.of("INVALID_REQUEST", ex.getMessage()));
    }

    @ExceptionHandler(RateResolutionException.class)
    public ResponseEntity<ErrorBody> handleUnavailable(RateResolutionException ex) {
        log.warn("Rate unavailable for {}: {}", ex.getInstrumentId(), ex.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(ErrorBody.of("RATE_UNAVAILABLE", ex.getMessage()));
    }

    @ExceptionHandler(ValidatorClientException.class)
    public ResponseEntity<ErrorBody> handleValidatorUnavailable(ValidatorClientException ex) {
        log.warn("Validator request failed: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(ErrorBody.of("VALIDATOR_UNAVAILABLE", ex.getMessage()));
    }

    @ExceptionHandler(ArithmeticException.class)
    public ResponseEntity<ErrorBody> handleArithmetic(ArithmeticException ex) {
        return ResponseEntity.unprocessableEntity().body(ErrorBody.of("DIVISION_BY_ZERO", ex.getMessage()));
    }

    private static String userFacingMessage(String errorCode, WebExchangeBindException ex) {
        return switch (errorCode) {
            case "INVALID_RATE" -> "rate must be a non-negative decimal";
            case "INVALID_SOURCE" -> "source must be one of: validator, indexer";
            default -> ex.getFieldErrors().stream()
                    .findFirst()
                    .map(e -> e.getField() + ": " + e.getDefaultMessage())
                    .orElse("Validation failed");
        };
    }
}
