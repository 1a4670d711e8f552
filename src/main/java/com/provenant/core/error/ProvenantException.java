package com.provenant.core.error;

/**
 * Base exception for every failure Provenant reports to a caller. The {@link ErrorCode}
 * is what reaches the API response and the audit log.
 */
public class ProvenantException extends RuntimeException {

    private final ErrorCode code;

    public ProvenantException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public ProvenantException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public ErrorCode code() {
        return code;
    }

    public static ProvenantException notFound(String what, String id) {
        return new ProvenantException(ErrorCode.NOT_FOUND, what + " not found: " + id);
    }

    public static ProvenantException invalid(String message) {
        return new ProvenantException(ErrorCode.INVALID_REQUEST, message);
    }

    public static ProvenantException conflict(String message) {
        return new ProvenantException(ErrorCode.CONFLICT, message);
    }
}
