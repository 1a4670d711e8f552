package com.provenant.dispatch.api;

import java.util.List;

/**
 * Inbound JSON body for POST /api/v1/keys/{keyId}/revoke.
 */
public record KeyRevocationRequest(
    String reason,
    List<String> approvals
) {}
