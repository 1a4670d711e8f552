package com.provenant.core.keys;

import java.util.List;

/**
 * Evidence handed to {@link KeyHierarchyManager#sign} that a quorum approved signing
 * {@code digest} with {@code keyId} for signing request {@code requestId}.
 *
 * @param requestId signing request the approvals are bound to
 * @param digest    artifact digest the approvals are bound to
 * @param keyId     key the approvals authorize
 * @param approvals compact JWS approval tokens, one per authorizer
 */
public record QuorumProof(String requestId, String digest, String keyId, List<String> approvals) {

    public QuorumProof {
        approvals = approvals != null ? List.copyOf(approvals) : List.of();
    }
}
