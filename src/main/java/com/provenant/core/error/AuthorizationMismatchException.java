package com.provenant.core.error;

/**
 * Thrown when an authorization proof is invalid or bound to a different digest, request or key.
 * Always a security-relevant event.
 */
public class AuthorizationMismatchException extends ProvenantException {
    public AuthorizationMismatchException(String message) {
        super(ErrorCode.AUTHORIZATION_MISMATCH, message);
    }

    public AuthorizationMismatchException(String message, Throwable cause) {
        super(ErrorCode.AUTHORIZATION_MISMATCH, message, cause);
    }
}
