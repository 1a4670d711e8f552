package com.provenant.core.error;

/**
 * Reason codes reported to callers and recorded in the audit log.
 */
public enum ErrorCode {
    // request / lookup
    INVALID_REQUEST,
    INVALID_CONFIG,
    NOT_FOUND,
    CONFLICT,
    UNAUTHORIZED,

    // build
    SOURCE_VERIFICATION_FAILED,
    BUILDER_TIMEOUT,
    BUILDER_FAILED,
    CONTAINER_ERROR,
    NO_CONSENSUS,
    INSUFFICIENT_BUILDERS,

    // signing
    CONSENSUS_REQUIRED,
    AUTHORIZATION_MISMATCH,
    DENIED,
    EXPIRED,
    SIGNATURE_VERIFICATION_FAILED,

    // keys / HSM
    HSM_UNAVAILABLE,
    HSM_TIMEOUT,
    KEY_NOT_FOUND,
    KEY_REVOKED,
    INVALID_KEY,

    // audit
    CHAIN_BROKEN,

    INTERNAL
}
