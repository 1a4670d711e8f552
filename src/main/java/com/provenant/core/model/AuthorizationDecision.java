package com.provenant.core.model;

public enum AuthorizationDecision {
    APPROVE,
    DENY
}
