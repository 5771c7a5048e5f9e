package com.payoutengine.api.controller;

import com.payoutengine.common.exception.*;
import com.payoutengine.credentials.CredentialStorageException;
import com.payoutengine.gateway.DuplicateSubmissionException;
import com.payoutengine.gateway.GatewayTimeoutException;
import com.payoutengine.gateway.RateLimitDeferredException;
import com.payoutengine.gateway.RemoteCallException;
import com.payoutengine.platform.PlatformResponseException;
import com.payoutengine.signing.SigningException;
import com.payoutengine.vending.AssignmentNotFoundException;
import com.payoutengine.vending.TerminalDataException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.HashMap;
import java.util.Map;

/**
 * Global exception handler for REST APIs.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler({BeneficiaryNotFoundException.class, PayoutNotFoundException.class,
        AssignmentNotFoundException.class})
    public ResponseEntity<Map<String, String>> handleNotFound(PayoutEngineException e) {
        return buildErrorResponse(HttpStatus.NOT_FOUND, e.getMessage());
    }

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<Map<String, String>> handleValidation(ValidationException e) {
        return buildErrorResponse(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    @ExceptionHandler({InvalidPayoutStateException.class, BatchAlreadyRunningException.class,
        DuplicateSubmissionException.class})
    public ResponseEntity<Map<String, String>> handleConflict(PayoutEngineException e) {
        return buildErrorResponse(HttpStatus.CONFLICT, e.getMessage());
    }

    @ExceptionHandler(SigningException.class)
    public ResponseEntity<Map<String, String>> handleSigning(SigningException e) {
        return buildErrorResponse(HttpStatus.PRECONDITION_FAILED, e.getMessage());
    }

    @ExceptionHandler(RateLimitDeferredException.class)
    public ResponseEntity<Map<String, String>> handleRateLimit(RateLimitDeferredException e) {
        return buildErrorResponse(HttpStatus.TOO_MANY_REQUESTS, e.getMessage());
    }

    @ExceptionHandler(GatewayTimeoutException.class)
    public ResponseEntity<Map<String, String>> handleTimeout(GatewayTimeoutException e) {
        return buildErrorResponse(HttpStatus.GATEWAY_TIMEOUT, e.getMessage());
    }

    @ExceptionHandler({RemoteCallException.class, TerminalDataException.class, PlatformResponseException.class})
    public ResponseEntity<Map<String, String>> handleUpstream(PayoutEngineException e) {
        log.warn("Upstream failure: {}", e.getMessage());
        return buildErrorResponse(HttpStatus.BAD_GATEWAY, e.getMessage());
    }

    @ExceptionHandler(CredentialStorageException.class)
    public ResponseEntity<Map<String, String>> handleCredentialStorage(CredentialStorageException e) {
        log.error("Credential storage failure", e);
        return buildErrorResponse(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, String>> handleValidationErrors(MethodArgumentNotValidException e) {
        Map<String, String> errors = new HashMap<>();
        e.getBindingResult().getFieldErrors().forEach(error ->
            errors.put(error.getField(), error.getDefaultMessage())
        );
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(errors);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class,
        IllegalArgumentException.class})
    public ResponseEntity<Map<String, String>> handleBadRequest(Exception e) {
        return buildErrorResponse(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, String>> handleGenericException(Exception e) {
        log.error("Unexpected error", e);
        return buildErrorResponse(HttpStatus.INTERNAL_SERVER_ERROR,
            "An unexpected error occurred: " + e.getMessage());
    }

    private ResponseEntity<Map<String, String>> buildErrorResponse(HttpStatus status, String message) {
        Map<String, String> error = new HashMap<>();
        error.put("error", message);
        error.put("status", String.valueOf(status.value()));
        return ResponseEntity.status(status).body(error);
    }
}
