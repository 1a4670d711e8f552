package com.provenant.core.model;

public enum VerificationOutcome {
    CONSENSUS,
    NO_CONSENSUS,
    INSUFFICIENT_BUILDERS
}
