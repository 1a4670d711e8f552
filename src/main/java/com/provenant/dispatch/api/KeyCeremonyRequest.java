package com.provenant.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.provenant.core.model.KeyRole;

import java.util.List;

/**
 * Inbound JSON body for POST /api/v1/keys.
 *
 * @param approvals one {@code create-key} approval token per ceremony participant
 */
public record KeyCeremonyRequest(
    KeyRole role,
    String scope,
    @JsonProperty("parent_key_id") String parentKeyId,
    List<String> approvals
) {}
