package com.provenant.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.provenant.core.model.AuthorizationDecision;

/**
 * Inbound JSON body for POST /api/v1/signing-requests/{jobId}/authorize.
 *
 * @param proof compact JWS signed with the authorizer's registered Ed25519 key
 */
public record AuthorizeRequest(
    @JsonProperty("authorizer_id") String authorizerId,
    AuthorizationDecision decision,
    String digest,
    String proof
) {}
