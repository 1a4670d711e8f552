package com.provenant.core.error;

/**
 * The hardware security module could not perform an operation. Signing fails closed.
 */
public class HsmUnavailableException extends ProvenantException {
    public HsmUnavailableException(String message) {
        super(ErrorCode.HSM_UNAVAILABLE, message);
    }

    public HsmUnavailableException(String message, Throwable cause) {
        super(ErrorCode.HSM_UNAVAILABLE, message, cause);
    }
}
