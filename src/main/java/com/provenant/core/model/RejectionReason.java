package com.provenant.core.model;

/**
 * Why a build job ended in {@link JobStatus#REJECTED}.
 */
public enum RejectionReason {
    SOURCE_VERIFICATION_FAILED,
    INSUFFICIENT_BUILDERS,
    NO_CONSENSUS,
    CANCELLED,
    /** The coordinator failed; the cause is in the {@code job.failed} audit entry. */
    INTERNAL_ERROR
}
