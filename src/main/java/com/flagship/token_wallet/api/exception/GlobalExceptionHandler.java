package com.flagship.token_wallet.api.exception;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.token_wallet.common.ErrorCode;
import com.flagship.token_wallet.observability.CorrelationContext;
import lombok.Builder;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps typed billing failures and programming errors to HTTP responses.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(BillingFailureException.class)
    public ResponseEntity<ErrorResponse> handleBillingFailure(BillingFailureException e) {
        ErrorCode code = e.getError().getCode();
        HttpStatus status = statusFor(code);
        if (status.is5xxServerError()) {
            log.warn("Billing operation failed: {} {}", code, e.getMessage());
        } else {
            log.info("Billing operation rejected: {} {}", code, e.getMessage());
        }
        return ResponseEntity.status(status).body(errorResponse(status, code.name(), e.getMessage(), null));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(MethodArgumentNotValidException e) {
        log.warn("Validation failed: {}", e.getMessage());

        Map<String, String> errors = e.getBindingResult()
            .getFieldErrors()
            .stream()
            .collect(Collectors.toMap(
                error -> error.getField(),
                error -> error.getDefaultMessage() != null ? error.getDefaultMessage() : "Invalid value",
                (existing, replacement) -> existing
            ));

        return ResponseEntity.badRequest().body(errorResponse(HttpStatus.BAD_REQUEST,
            ErrorCode.INVALID_REQUEST.name(), "Request validation failed", errors));
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorResponse> handleUnreadable(Exception e) {
        log.warn("Unreadable request: {}", e.getMessage());
        return ResponseEntity.badRequest().body(errorResponse(HttpStatus.BAD_REQUEST,
            ErrorCode.INVALID_REQUEST.name(), "Malformed request", null));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException e) {
        log.warn("Invalid argument: {}", e.getMessage());
        return ResponseEntity.badRequest().body(errorResponse(HttpStatus.BAD_REQUEST,
            ErrorCode.INVALID_REQUEST.name(), e.getMessage(), null));
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ErrorResponse> handleIllegalState(IllegalStateException e) {
        log.error("Invalid state: {}", e.getMessage(), e);
        return ResponseEntity.status(HttpStatus.CONFLICT).body(errorResponse(HttpStatus.CONFLICT,
            "INVALID_STATE", e.getMessage(), null));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
        log.error("Unexpected error", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(errorResponse(
            HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "An unexpected error occurred", null));
    }

    static HttpStatus statusFor(ErrorCode code) {
        return switch (code) {
            case INSUFFICIENT_FUNDS -> HttpStatus.PAYMENT_REQUIRED;
            case WALLET_FROZEN -> HttpStatus.LOCKED;
            case WALLET_NOT_FOUND, SESSION_NOT_FOUND, ESCROW_NOT_FOUND -> HttpStatus.NOT_FOUND;
            case WALLET_CLOSED, IDEMPOTENCY_CONFLICT, INVALID_SESSION_STATE, INVALID_ESCROW_STATE -> HttpStatus.CONFLICT;
            case CONCURRENT_MODIFICATION -> HttpStatus.SERVICE_UNAVAILABLE;
            case INVALID_REQUEST -> HttpStatus.BAD_REQUEST;
        };
    }

    private static ErrorResponse errorResponse(HttpStatus status, String code, String message,
                                               Map<String, String> details) {
        return ErrorResponse.builder()
            .error(status.getReasonPhrase())
            .code(code)
            .message(message)
            .details(details)
            .correlationId(CorrelationContext.hasCorrelationId() ? CorrelationContext.getCorrelationId() : null)
            .timestamp(Instant.now())
            .build();
    }

    @Value
    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ErrorResponse {
        String error;
        String code;
        String message;
        Map<String, String> details;
        @JsonProperty("correlation_id")
        String correlationId;
        Instant timestamp;
    }
}
