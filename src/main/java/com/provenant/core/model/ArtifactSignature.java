package com.provenant.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.Instant;

/**
 * Signature over an artifact digest.
 *
 * @param keyId     signing key
 * @param algorithm signature algorithm
 * @param digest    the signed {@code sha256:<hex>} digest
 * @param value     base64 signature over the UTF-8 bytes of {@code digest}
 * @param signedAt  signing time
 */
public record ArtifactSignature(
    @JsonProperty("key_id") String keyId,
    String algorithm,
    String digest,
    String value,
    @JsonProperty("signed_at") Instant signedAt
) implements Serializable {}
