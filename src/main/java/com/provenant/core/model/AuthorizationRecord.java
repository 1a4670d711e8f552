package com.provenant.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.Instant;

/**
 * One authorizer's vote on a signing request.
 *
 * @param authorizerId     registered authorizer identity
 * @param decision         approve or deny
 * @param boundDigest      the artifact digest the vote is bound to
 * @param signingRequestId the request the vote was cast on
 * @param proof            compact JWS signed with the authorizer's key over the vote
 * @param recordedAt       when the vote was accepted
 */
public record AuthorizationRecord(
    @JsonProperty("authorizer_id") String authorizerId,
    AuthorizationDecision decision,
    @JsonProperty("bound_digest") String boundDigest,
    @JsonProperty("signing_request_id") String signingRequestId,
    String proof,
    @JsonProperty("recorded_at") Instant recordedAt
) implements Serializable {}
