package com.flagship.license_fulfillment.web;

import com.flagship.license_fulfillment.crypto.ChainDataException;
import com.flagship.license_fulfillment.guard.PurchaseRejectedException;
import com.flagship.license_fulfillment.license.AdminAccessDeniedException;
import com.flagship.license_fulfillment.license.DuplicateLicenseKeyException;
import com.flagship.license_fulfillment.webhook.InvalidSignatureException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps exceptions to the API's error body. Users only ever see non-technical
 * messages; details stay in the logs.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    static final String GENERIC_MESSAGE = "Something went wrong, please try again later";

    private final Clock clock;

    public GlobalExceptionHandler(Clock clock) {
        this.clock = clock;
    }

    @ExceptionHandler(InvalidSignatureException.class)
    public ResponseEntity<ErrorResponse> handleInvalidSignature(InvalidSignatureException e) {
        log.warn("Rejected webhook: {}", e.getMessage());
        return respond(HttpStatus.UNAUTHORIZED, "Unauthorized", "Unauthorized", null);
    }

    @ExceptionHandler(PurchaseRejectedException.class)
    public ResponseEntity<ErrorResponse> handlePurchaseRejected(PurchaseRejectedException e) {
        return respond(e.getStatus(), "Purchase Rejected", e.getUserMessage(), null);
    }

    @ExceptionHandler(AdminAccessDeniedException.class)
    public ResponseEntity<ErrorResponse> handleAdminAccessDenied(AdminAccessDeniedException e) {
        return respond(HttpStatus.FORBIDDEN, "Forbidden", "You do not have permission to do that", null);
    }

    @ExceptionHandler(DuplicateLicenseKeyException.class)
    public ResponseEntity<ErrorResponse> handleDuplicateKeys(DuplicateLicenseKeyException e) {
        log.warn("Import rejected: {}", e.getMessage());
        Map<String, String> details = e.getDuplicateKeys().stream()
                .collect(Collectors.toMap(key -> key, key -> "already exists", (a, b) -> a));
        return respond(HttpStatus.CONFLICT, "Duplicate Keys", "Some keys already exist", details);
    }

    @ExceptionHandler(ChainDataException.class)
    public ResponseEntity<ErrorResponse> handleChainData(ChainDataException e) {
        log.error("External price or chain data unavailable", e);
        return respond(HttpStatus.SERVICE_UNAVAILABLE, "Service Unavailable",
                "Failed to get the current exchange rate, please try again later", null);
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
        return respond(HttpStatus.BAD_REQUEST, "Validation Failed", "Request validation failed", errors);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException e) {
        log.warn("Unreadable request body: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Invalid Request", "Request body could not be read", null);
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ErrorResponse> handleMissingParameter(MissingServletRequestParameterException e) {
        return respond(HttpStatus.BAD_REQUEST, "Invalid Request",
                "Required parameter '" + e.getParameterName() + "' is missing", null);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException e) {
        log.warn("Invalid argument: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Invalid Request", e.getMessage(), null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
        log.error("Unexpected error", e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", GENERIC_MESSAGE, null);
    }

    private ResponseEntity<ErrorResponse> respond(HttpStatus status, String error, String message,
                                                  Map<String, String> details) {
        ErrorResponse body = ErrorResponse.builder()
                .error(error)
                .message(message)
                .details(details)
                .timestamp(clock.instant())
                .build();
        return ResponseEntity.status(status).body(body);
    }

    @lombok.Value
    @lombok.Builder
    public static class ErrorResponse {
        String error;
        String message;
        Map<String, String> details;
        Instant timestamp;
    }
}
