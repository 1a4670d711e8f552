package com.provenant.core.model;

/**
 * Quorum progress as seen by an authorizer.
 */
public enum QuorumState {
    PENDING,
    REACHED,
    FAILED
}
