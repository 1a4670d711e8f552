package com.provenant.dispatch.api;

import com.provenant.core.error.ErrorCode;
import com.provenant.core.error.ProvenantException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps {@link ProvenantException} codes to HTTP statuses with an {@code {error, message}} body.
 * Unexpected failures are logged and answered with a generic 500.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(ProvenantException.class)
    public ResponseEntity<Map<String, String>> handleProvenant(ProvenantException e) {
        HttpStatus status = statusFor(e.code());
        if (status == HttpStatus.INTERNAL_SERVER_ERROR) {
            log.error("Request failed with {}: {}", e.code(), e.getMessage(), e);
            return body(status, e.code().name(), "Internal error");
        }
        log.debug("Request rejected with {}: {}", e.code(), e.getMessage());
        return body(status, e.code().name(), e.getMessage());
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, IllegalArgumentException.class})
    public ResponseEntity<Map<String, String>> handleBadInput(Exception e) {
        return body(HttpStatus.BAD_REQUEST, ErrorCode.INVALID_REQUEST.name(), "Malformed request: " + e.getMessage());
    }

    @ExceptionHandler(RuntimeException.class)
    public ResponseEntity<Map<String, String>> handleUnexpected(RuntimeException e) {
        log.error("Unhandled error: {}", e.getMessage(), e);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, ErrorCode.INTERNAL.name(), "Internal error");
    }

    static HttpStatus statusFor(ErrorCode code) {
        return switch (code) {
            case INVALID_REQUEST, CONSENSUS_REQUIRED -> HttpStatus.BAD_REQUEST;
            case UNAUTHORIZED -> HttpStatus.UNAUTHORIZED;
            case AUTHORIZATION_MISMATCH, KEY_REVOKED -> HttpStatus.FORBIDDEN;
            case NOT_FOUND, KEY_NOT_FOUND -> HttpStatus.NOT_FOUND;
            case CONFLICT, DENIED, EXPIRED, CHAIN_BROKEN -> HttpStatus.CONFLICT;
            case HSM_UNAVAILABLE -> HttpStatus.SERVICE_UNAVAILABLE;
            default -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }

    private static ResponseEntity<Map<String, String>> body(HttpStatus status, String error, String message) {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("error", error);
        body.put("message", message);
        return ResponseEntity.status(status).body(body);
    }
}
