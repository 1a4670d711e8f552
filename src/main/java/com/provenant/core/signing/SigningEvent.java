package com.provenant.core.signing;

import com.provenant.core.model.ArtifactSignature;
import com.provenant.core.model.AuthorizationRecord;

/**
 * Validated inputs to {@link SigningRequestStateMachine}. Validation (proof checks,
 * duplicate detection) happens before an event is constructed.
 */
public sealed interface SigningEvent {

    /** An authorizer's approve or deny vote. */
    record Vote(AuthorizationRecord authorization) implements SigningEvent {}

    /** A recorded approval no longer verifies (expired, or its authorizer was removed). */
    record VoteLapsed(String authorizerId, String reason) implements SigningEvent {}

    /** The key manager produced a signature. */
    record Signed(ArtifactSignature signature) implements SigningEvent {}

    /** The key manager could not sign; the request remains authorized. */
    record SignFailed(String reason) implements SigningEvent {}

    /** Deadline passed or the request was abandoned. */
    record Expire(String reason) implements SigningEvent {}
}
