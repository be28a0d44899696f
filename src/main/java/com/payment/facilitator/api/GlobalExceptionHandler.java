package com.payment.facilitator.api;

import com.payment.facilitator.chain.ChainUnavailableException;
import com.payment.facilitator.core.SettlementAbortedException;
import com.payment.facilitator.registry.InvalidRequirementException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps facilitator exceptions to JSON error bodies. Verification failures are not errors;
 * they come back as 200 results and never reach this handler.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(MethodArgumentNotValidException ex) {
        Map<String, String> errors = ex.getBindingResult().getFieldErrors().stream()
                .collect(Collectors.toMap(FieldError::getField,
                        e -> e.getDefaultMessage() != null ? e.getDefaultMessage() : "invalid",
                        (a, b) -> a));
        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(Map.of("error", "VALIDATION_FAILED", "details", errors));
    }

    @ExceptionHandler(InvalidRequirementException.class)
    public ResponseEntity<Map<String, String>> handleInvalidRequirement(InvalidRequirementException ex) {
        return error(HttpStatus.BAD_REQUEST, "INVALID_REQUIREMENT", ex);
    }

    @ExceptionHandler(InvalidPaymentHeaderException.class)
    public ResponseEntity<Map<String, String>> handleInvalidHeader(InvalidPaymentHeaderException ex) {
        return error(HttpStatus.BAD_REQUEST, "INVALID_PAYMENT_HEADER", ex);
    }

    @ExceptionHandler({IllegalArgumentException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<Map<String, String>> handleBadRequest(Exception ex) {
        return error(HttpStatus.BAD_REQUEST, "BAD_REQUEST", ex);
    }

    @ExceptionHandler(ChainUnavailableException.class)
    public ResponseEntity<Map<String, String>> handleChainUnavailable(ChainUnavailableException ex) {
        log.warn("Chain unavailable network={}: {}", ex.getNetwork(), ex.getMessage());
        return error(HttpStatus.SERVICE_UNAVAILABLE, "CHAIN_UNAVAILABLE", ex);
    }

    @ExceptionHandler(SettlementAbortedException.class)
    public ResponseEntity<Map<String, String>> handleAborted(SettlementAbortedException ex) {
        log.error("Settlement aborted", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "SETTLEMENT_ABORTED", ex);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, String>> handleGeneric(Exception ex) {
        log.error("Unhandled error", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", ex);
    }

    private static ResponseEntity<Map<String, String>> error(HttpStatus status, String code, Throwable ex) {
        return ResponseEntity
                .status(status)
                .body(Map.of("error", code, "message", getMessageOrCause(ex)));
    }

    private static String getMessageOrCause(Throwable ex) {
        Throwable t = ex;
        while (t != null) {
            if (t.getMessage() != null && !t.getMessage().isBlank()) {
                return t.getMessage();
            }
            t = t.getCause();
        }
        return ex.getClass().getSimpleName();
    }
}
