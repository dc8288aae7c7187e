package com.validatorpayments.api.controller;

import com.validatorpayments.api.dto.ErrorBody;
import com.validatorpayments.payments.PaymentsComputationException;
import com.validatorpayments.payments.range.InvalidRangeException;
import com.validatorpayments.payments.validator.NoValidatorsResolvedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;

import java.util.Optional;

/**
 * Maps validation failures and fatal computation errors to ErrorBody responses.
 */
@Slf4j
@RestControllerAdvice
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

    @ExceptionHandler(InvalidRangeException.class)
    public ResponseEntity<ErrorBody> handleInvalidRange(InvalidRangeException ex) {
        return ResponseEntity.badRequest().body(ErrorBody.of("INVALID_RANGE", ex.getMessage()));
    }

    @ExceptionHandler(NoValidatorsResolvedException.class)
    public ResponseEntity<ErrorBody> handleNoValidators(NoValidatorsResolvedException ex) {
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                .body(ErrorBody.of("NO_VALIDATORS_RESOLVED", ex.getMessage()));
    }

    @ExceptionHandler(PaymentsComputationException.class)
    public ResponseEntity<ErrorBody> handleUpstream(PaymentsComputationException ex) {
        log.warn("Payment computation aborted: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
                .body(ErrorBody.of("UPSTREAM_UNAVAILABLE", ex.getMessage()));
    }

    private static String userFacingMessage(String errorCode, WebExchangeBindException ex) {
        return switch (errorCode) {
            case "INVALID_RANGE" -> "Dates must be YYYY-MM-DD";
            case "INVALID_REQUEST" -> "At least one validator id is required";
            default -> ex.getFieldErrors().stream()
                    .findFirst()
                    .map(e -> e.getField() + ": " + e.getDefaultMessage())
                    .orElse("Validation failed");
        };
    }
}
