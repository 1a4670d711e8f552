package com.provenant.core.keys;

import com.provenant.core.model.KeyRole;

import java.util.List;

/**
 * A key-creation request together with the approvals of every ceremony participant.
 *
 * @param role        role of the new key
 * @param scope       repository name or application package id the key signs for
 * @param parentKeyId parent key; null only for the root
 * @param approvals   {@code create-key} approval tokens
 */
public record KeyCeremony(KeyRole role, String scope, String parentKeyId, List<String> approvals) {

    public KeyCeremony {
        approvals = approvals != null ? List.copyOf(approvals) : List.of();
    }
}
