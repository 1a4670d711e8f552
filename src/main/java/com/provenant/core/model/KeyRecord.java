package com.provenant.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.Instant;

/**
 * One key in the signing hierarchy. Holds an opaque handle into the HSM and the public
 * material only; private key bytes never appear here.
 *
 * @param keyId       stable key identifier
 * @param role        hierarchy role
 * @param scope       what the key signs for: repository name or application package id
 * @param hsmHandle   opaque reference into the hardware security module
 * @param publicKey   X.509-encoded public key, base64
 * @param algorithm   signature algorithm (e.g. {@code Ed25519})
 * @param parentKeyId parent in the hierarchy; null for the root
 * @param createdAt   creation time
 * @param state       revocation state
 * @param revokedAt   when the key was revoked; null while active
 */
public record KeyRecord(
    @JsonProperty("key_id") String keyId,
    KeyRole role,
    String scope,
    @JsonProperty("hsm_handle") String hsmHandle,
    @JsonProperty("public_key") String publicKey,
    String algorithm,
    @JsonProperty("parent_key_id") String parentKeyId,
    @JsonProperty("created_at") Instant createdAt,
    KeyState state,
    @JsonProperty("revoked_at") Instant revokedAt
) implements Serializable {

    public KeyRecord withRevoked(Instant when) {
        return new KeyRecord(keyId, role, scope, hsmHandle, publicKey, algorithm,
                parentKeyId, createdAt, KeyState.REVOKED, when);
    }

    @JsonIgnore
    public boolean isRevoked() {
        return state == KeyState.REVOKED;
    }
}
