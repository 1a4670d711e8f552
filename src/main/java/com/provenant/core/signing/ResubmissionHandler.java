package com.provenant.core.signing;

import com.provenant.core.model.VerificationDecision;

/**
 * Build-side operations an expired signing request can be resubmitted through.
 */
public interface ResubmissionHandler {

    /** Submits a new build job with the same inputs as {@code jobId}; returns the new job id. */
    String rebuild(String jobId);

    /** Re-runs verification over {@code jobId}'s stored builder results, producing a new decision. */
    VerificationDecision reverify(String jobId);
}
