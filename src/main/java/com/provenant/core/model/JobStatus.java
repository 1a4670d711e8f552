package com.provenant.core.model;

/**
 * Lifecycle of a build job. {@code VERIFIED}, {@code REJECTED} and {@code TIMED_OUT} are terminal.
 */
public enum JobStatus {
    PENDING,
    BUILDING,
    VERIFYING,
    VERIFIED,
    REJECTED,
    TIMED_OUT;

    public boolean isTerminal() {
        return this == VERIFIED || this == REJECTED || this == TIMED_OUT;
    }
}
