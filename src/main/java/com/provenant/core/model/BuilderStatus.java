package com.provenant.core.model;

/**
 * Completion status of a single builder attempt.
 */
public enum BuilderStatus {
    SUCCESS,
    FAILED,
    TIMED_OUT
}
