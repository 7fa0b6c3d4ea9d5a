package com.volunteersinc.payment_settlement.payment.exception;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.volunteersinc.payment_settlement.settlement.exception.SettlementException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps failures to the {@code {success: false, error}} envelope callers of
 * the payment endpoints expect.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(InvalidRequestException.class)
    public ResponseEntity<ErrorResponse> handleInvalidRequest(InvalidRequestException e) {
        log.warn("Invalid request: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, e.getMessage(), null);
    }

    @ExceptionHandler(RecordNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(RecordNotFoundException e) {
        log.warn("Record not found: {}", e.getMessage());
        return respond(HttpStatus.NOT_FOUND, e.getMessage(), null);
    }

    @ExceptionHandler(TransactionNotSettleableException.class)
    public ResponseEntity<ErrorResponse> handleNotSettleable(TransactionNotSettleableException e) {
        log.warn("Confirmation rejected: {}", e.getMessage());
        return respond(HttpStatus.CONFLICT, e.getMessage(), null);
    }

    @ExceptionHandler(SettlementException.class)
    public ResponseEntity<ErrorResponse> handleSettlementFailure(SettlementException e) {
        log.error("Settlement failed: {}", e.getMessage(), e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage(), null);
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

        return respond(HttpStatus.BAD_REQUEST, "Request validation failed", errors);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException e) {
        log.warn("Unreadable request body: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Malformed request body", null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
        log.error("Unexpected error", e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error", null);
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, String error, Map<String, String> details) {
        return ResponseEntity.status(status).body(ErrorResponse.builder()
            .success(false)
            .error(error)
            .details(details)
            .build());
    }

    @lombok.Value
    @lombok.Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ErrorResponse {
        boolean success;
        String error;
        Map<String, String> details;
    }
}
