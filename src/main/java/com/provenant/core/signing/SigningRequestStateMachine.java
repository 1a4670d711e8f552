package com.provenant.core.signing;

import com.provenant.core.error.ErrorCode;
import com.provenant.core.error.ProvenantException;
import com.provenant.core.model.ArtifactSignature;
import com.provenant.core.model.AuthorizationDecision;
import com.provenant.core.model.AuthorizationRecord;
import com.provenant.core.model.SigningRequest;
import com.provenant.core.model.SigningState;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Transition table for signing requests:
 * <pre>
 * AWAITING_QUORUM --vote(approve, count == M)--> AUTHORIZED --signed--> SIGNED
 * AWAITING_QUORUM --vote(deny)--> DENIED
 * AWAITING_QUORUM --vote lapsed--> AWAITING_QUORUM
 * AWAITING_QUORUM --expire--> EXPIRED
 * AUTHORIZED --sign failed--> AUTHORIZED
 * AUTHORIZED --expire--> EXPIRED
 * </pre>
 * Stateless; each call returns the next snapshot.
 */
public final class SigningRequestStateMachine {

    private static final Map<SigningState, Set<Class<? extends SigningEvent>>> ALLOWED =
            new EnumMap<>(SigningState.class);

    static {
        ALLOWED.put(SigningState.AWAITING_QUORUM, Set.of(SigningEvent.Vote.class, SigningEvent.VoteLapsed.class, SigningEvent.Expire.class));
        ALLOWED.put(SigningState.AUTHORIZED,
                Set.of(SigningEvent.Signed.class, SigningEvent.SignFailed.class, SigningEvent.Expire.class));
        ALLOWED.put(SigningState.SIGNED, Set.of());
        ALLOWED.put(SigningState.DENIED, Set.of());
        ALLOWED.put(SigningState.EXPIRED, Set.of());
    }

    private SigningRequestStateMachine() {}

    public static boolean allows(SigningState state, Class<? extends SigningEvent> eventType) {
        return ALLOWED.get(state).contains(eventType);
    }

    public static SigningRequest apply(SigningRequest request, SigningEvent event, Instant now) {
        if (!allows(request.state(), event.getClass())) {
            throw rejected(request, event.getClass());
        }
        if (event instanceof SigningEvent.Vote vote) {
            AuthorizationRecord record = vote.authorization();
            List<AuthorizationRecord> authorizations = new ArrayList<>(request.authorizations());
            authorizations.add(record);
            SigningState next;
            if (record.decision() == AuthorizationDecision.DENY) {
                next = SigningState.DENIED;
            } else if (countApprovals(authorizations) >= request.threshold()) {
                next = SigningState.AUTHORIZED;
            } else {
                next = SigningState.AWAITING_QUORUM;
            }
            String failure = next == SigningState.DENIED ? "denied by " + record.authorizerId() : null;
            return copy(request, next, authorizations, request.signature(), failure, now);
        }
        if (event instanceof SigningEvent.VoteLapsed lapsed) {
            List<AuthorizationRecord> remaining = request.authorizations().stream()
                    .filter(a -> !a.authorizerId().equals(lapsed.authorizerId()))
                    .toList();
            return copy(request, SigningState.AWAITING_QUORUM, remaining, request.signature(),
                    request.failureReason(), now);
        }
        if (event instanceof SigningEvent.Signed signed) {
            return copy(request, SigningState.SIGNED, request.authorizations(), signed.signature(), null, now);
        }
        if (event instanceof SigningEvent.SignFailed failed) {
            return copy(request, SigningState.AUTHORIZED, request.authorizations(), null, failed.reason(), now);
        }
        if (event instanceof SigningEvent.Expire expire) {
            return copy(request, SigningState.EXPIRED, request.authorizations(), null, expire.reason(), now);
        }
        throw new IllegalArgumentException("Unhandled signing event " + event);
    }

    private static long countApprovals(List<AuthorizationRecord> authorizations) {
        return authorizations.stream()
                .filter(a -> a.decision() == AuthorizationDecision.APPROVE)
                .map(AuthorizationRecord::authorizerId)
                .distinct()
                .count();
    }

    /** The error reported when {@code eventType} is not allowed in the request's current state. */
    public static ProvenantException rejected(SigningRequest request, Class<? extends SigningEvent> eventType) {
        String message = "Signing request " + request.requestId() + " is " + request.state()
                + "; cannot apply " + eventType.getSimpleName();
        return switch (request.state()) {
            case DENIED -> new ProvenantException(ErrorCode.DENIED, message);
            case EXPIRED -> new ProvenantException(ErrorCode.EXPIRED, message);
            default -> new ProvenantException(ErrorCode.CONFLICT, message);
        };
    }

    private static SigningRequest copy(SigningRequest r, SigningState state, List<AuthorizationRecord> authorizations,
                                       ArtifactSignature signature, String failureReason,
                                       Instant now) {
        return new SigningRequest(r.requestId(), r.jobId(), r.decisionId(), r.digest(), r.applicationId(),
                r.keyId(), r.threshold(), state, authorizations, r.deadline(), signature, failureReason,
                r.createdAt(), now);
    }
}
