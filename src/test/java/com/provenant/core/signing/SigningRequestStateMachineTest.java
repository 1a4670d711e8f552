package com.provenant.core.signing;

import com.provenant.core.error.ErrorCode;
import com.provenant.core.error.ProvenantException;
import com.provenant.core.model.ArtifactSignature;
import com.provenant.core.model.AuthorizationDecision;
import com.provenant.core.model.AuthorizationRecord;
import com.provenant.core.model.SigningRequest;
import com.provenant.core.model.SigningState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SigningRequestStateMachineTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
    private static final String DIGEST = "sha256:" + "c".repeat(64);

    private static SigningRequest request(SigningState state, int threshold) {
        return new SigningRequest("sr-1", "job-1", "dec-1", DIGEST, "dk.app", "key-1", threshold, state,
                List.of(), NOW.plusSeconds(3600), null, null, NOW, NOW);
    }

    private static SigningEvent.Vote vote(String who, AuthorizationDecision decision) {
        return new SigningEvent.Vote(new AuthorizationRecord(who, decision, DIGEST, "sr-1", "proof", NOW));
    }

    @Test
    @DisplayName("approvals below the threshold keep the request waiting")
    void belowThreshold() {
        SigningRequest next = SigningRequestStateMachine.apply(request(SigningState.AWAITING_QUORUM, 2),
                vote("alice", AuthorizationDecision.APPROVE), NOW);

        assertEquals(SigningState.AWAITING_QUORUM, next.state());
        assertEquals(1, next.authorizations().size());
    }

    @Test
    @DisplayName("reaching the threshold authorizes")
    void reachesThreshold() {
        SigningRequest one = SigningRequestStateMachine.apply(request(SigningState.AWAITING_QUORUM, 2),
                vote("alice", AuthorizationDecision.APPROVE), NOW);
        SigningRequest two = SigningRequestStateMachine.apply(one, vote("bob", AuthorizationDecision.APPROVE), NOW);

        assertEquals(SigningState.AUTHORIZED, two.state());
    }

    @Test
    @DisplayName("a lapsed vote is withdrawn and the request keeps waiting")
    void voteLapsed() {
        SigningRequest one = SigningRequestStateMachine.apply(request(SigningState.AWAITING_QUORUM, 2),
                vote("alice", AuthorizationDecision.APPROVE), NOW);

        SigningRequest next = SigningRequestStateMachine.apply(one,
                new SigningEvent.VoteLapsed("alice", "JWT expired"), NOW);

        assertEquals(SigningState.AWAITING_QUORUM, next.state());
        assertTrue(next.authorizations().isEmpty());
        assertFalse(SigningRequestStateMachine.allows(SigningState.AUTHORIZED, SigningEvent.VoteLapsed.class));
    }

    @Test
    @DisplayName("a deny is terminal and records who denied")
    void deny() {
        SigningRequest denied = SigningRequestStateMachine.apply(request(SigningState.AWAITING_QUORUM, 2),
                vote("bob", AuthorizationDecision.DENY), NOW);

        assertEquals(SigningState.DENIED, denied.state());
        assertTrue(denied.state().isTerminal());
        assertEquals("denied by bob", denied.failureReason());
    }

    @Test
    @DisplayName("a failed signing attempt stays AUTHORIZED")
    void signFailedStaysAuthorized() {
        SigningRequest next = SigningRequestStateMachine.apply(request(SigningState.AUTHORIZED, 2),
                new SigningEvent.SignFailed("HSM_UNAVAILABLE: offline"), NOW);

        assertEquals(SigningState.AUTHORIZED, next.state());
        assertEquals("HSM_UNAVAILABLE: offline", next.failureReason());
    }

    @Test
    @DisplayName("signing from AUTHORIZED records the signature")
    void signed() {
        ArtifactSignature signature = new ArtifactSignature("key-1", "Ed25519", DIGEST, "c2ln", NOW);
        SigningRequest next = SigningRequestStateMachine.apply(request(SigningState.AUTHORIZED, 2),
                new SigningEvent.Signed(signature), NOW);

        assertEquals(SigningState.SIGNED, next.state());
        assertEquals(signature, next.signature());
    }

    @Test
    @DisplayName("terminal states accept nothing")
    void terminalStatesRejectEvents() {
        for (SigningState terminal : List.of(SigningState.SIGNED, SigningState.DENIED, SigningState.EXPIRED)) {
            assertFalse(SigningRequestStateMachine.allows(terminal, SigningEvent.Vote.class));
            assertFalse(SigningRequestStateMachine.allows(terminal, SigningEvent.Expire.class));
        }
        ProvenantException e = assertThrows(ProvenantException.class,
                () -> SigningRequestStateMachine.apply(request(SigningState.EXPIRED, 2),
                        vote("alice", AuthorizationDecision.APPROVE), NOW));
        assertEquals(ErrorCode.EXPIRED, e.code());
    }

    @Test
    @DisplayName("signing cannot skip the quorum")
    void cannotSignWhileWaiting() {
        ArtifactSignature signature = new ArtifactSignature("key-1", "Ed25519", DIGEST, "c2ln", NOW);

        ProvenantException e = assertThrows(ProvenantException.class,
                () -> SigningRequestStateMachine.apply(request(SigningState.AWAITING_QUORUM, 2),
                        new SigningEvent.Signed(signature), NOW));
        assertEquals(ErrorCode.CONFLICT, e.code());
    }
}
