package com.provenant.core.error;

/**
 * Thrown when a build job's source reference cannot be verified against a trusted signer.
 */
public class SourceVerificationException extends ProvenantException {
    public SourceVerificationException(String message) {
        super(ErrorCode.SOURCE_VERIFICATION_FAILED, message);
    }

    public SourceVerificationException(String message, Throwable cause) {
        super(ErrorCode.SOURCE_VERIFICATION_FAILED, message, cause);
    }
}
