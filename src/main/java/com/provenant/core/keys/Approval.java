package com.provenant.core.keys;

import com.provenant.core.model.AuthorizationDecision;

import java.time.Instant;

/**
 * Verified contents of an authorizer's signed approval token.
 * Which fields are set depends on {@link #action()}.
 */
public record Approval(
    String authorizerId,
    String action,
    AuthorizationDecision decision,
    String digest,
    String requestId,
    String keyId,
    String role,
    String scope,
    String parentKeyId,
    Instant expiresAt
) {

    public static final String ACTION_SIGN = "sign";
    public static final String ACTION_CREATE_KEY = "create-key";
    public static final String ACTION_REVOKE_KEY = "revoke-key";

    public boolean isApprove() {
        return decision == AuthorizationDecision.APPROVE;
    }
}
