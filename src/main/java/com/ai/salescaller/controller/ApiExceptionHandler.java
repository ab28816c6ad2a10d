package com.ai.salescaller.controller;

import com.ai.salescaller.exception.ProviderException;
import com.ai.salescaller.exception.UnknownSessionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Instant;
import java.util.stream.Collectors;

/**
 * JSON errors for the call-management API.
 */
@ControllerAdvice(assignableTypes = CallController.class)
class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(MethodArgumentNotValidException.class)
    ResponseEntity<ApiError> handleInvalid(MethodArgumentNotValidException ex) {
        String details = ex.getBindingResult().getFieldErrors().stream()
                .map(e -> e.getField() + " " + e.getDefaultMessage())
                .collect(Collectors.joining(", "));
        log.warn("Rejected call request: {}", details);
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ApiError("InvalidRequest", "Invalid call request", details, Instant.now()));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    ResponseEntity<ApiError> handleUnreadable(HttpMessageNotReadableException ex) {
        log.warn("Unreadable call request: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ApiError("InvalidRequest", "Invalid call request", "Body must be JSON", Instant.now()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    ResponseEntity<ApiError> handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Rejected call request: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ApiError("InvalidRequest", "Invalid call request", ex.getMessage(), Instant.now()));
    }

    @ExceptionHandler(UnknownSessionException.class)
    ResponseEntity<ApiError> handleUnknownCall(UnknownSessionException ex) {
        log.info("[{}] No such call", ex.getCallId());
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(new ApiError("CallNotFound", "Call not found", ex.getCallId(), Instant.now()));
    }

    /**
     * Telephony provider or record store refused or was unreachable (HTTP 502; 503 when a retry may help).
     */
    @ExceptionHandler(ProviderException.class)
    ResponseEntity<ApiError> handleProvider(ProviderException ex) {
        log.error("Call request failed: provider={} retryable={}", ex.getProvider(), ex.isRetryable(), ex);
        HttpStatus status = ex.isRetryable() ? HttpStatus.SERVICE_UNAVAILABLE : HttpStatus.BAD_GATEWAY;
        return ResponseEntity.status(status)
                .body(new ApiError(ex.getClass().getSimpleName(), "Provider request failed",
                        ex.isRetryable() ? "Please retry in a few seconds" : ex.getMessage(), Instant.now()));
    }

    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        log.error("Unexpected error handling call request", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ApiError("InternalServerError", "An unexpected error occurred", null, Instant.now()));
    }

    record ApiError(String errorCode, String message, String details, Instant timestamp) {
    }
}
