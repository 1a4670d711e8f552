package com.provenant.core.suspension;

import com.provenant.core.error.ErrorCode;
import com.provenant.core.error.ProvenantException;
import com.provenant.core.model.ArtifactSignature;
import com.provenant.core.model.AuditEntry;
import com.provenant.core.model.SignedArtifact;
import com.provenant.core.model.SuspensionRecord;
import com.provenant.support.CoreFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.provenant.core.model.SuspensionRecord.TargetType.APPLICATION;
import static com.provenant.core.model.SuspensionRecord.TargetType.ARTIFACT;
import static org.junit.jupiter.api.Assertions.*;

class SuspensionControllerTest {

    private static final String APP = "dk.digst.mitid";

    private CoreFixture fx;
    private SuspensionAuthorityService authority;
    private InMemorySuspensionStore store;
    private SuspensionController controller;
    private String artifactId;

    @BeforeEach
    void setUp() {
        fx = new CoreFixture();
        authority = new SuspensionAuthorityService(
                SuspensionAuthorityServiceTest.properties(SuspensionAuthorityServiceTest.SECRET), fx.clock);
        store = new InMemorySuspensionStore();
        controller = new SuspensionController(store, authority, fx.artifactRegistry, fx.auditLog, fx.metrics, fx.clock);

        artifactId = CoreFixture.digestOf("apk");
        fx.artifactRegistry.publish(new SignedArtifact(artifactId, APP, "job-1", "sr-1", 3,
                new ArtifactSignature("key-1", "Ed25519", artifactId, "c2ln", CoreFixture.START), CoreFixture.START));
    }

    private String applyToken() {
        return authority.generateToken("security-officer", SuspensionAuthorityService.SCOPE_APPLY);
    }

    private String liftToken() {
        return authority.generateToken("security-officer", SuspensionAuthorityService.SCOPE_LIFT);
    }

    @Nested
    @DisplayName("suspend")
    class SuspendTests {

        @Test
        @DisplayName("a valid token suspends the artifact immediately")
        void suspendsArtifact() {
            SuspensionRecord record = controller.suspend(ARTIFACT, artifactId, "malware report", applyToken());

            assertEquals(SuspensionRecord.Action.SUSPEND, record.action());
            assertEquals("security-officer", record.authority());
            assertTrue(controller.isSuspended(artifactId));

            AuditEntry entry = fx.auditLog.entriesFor("suspension", artifactId).get(0);
            assertEquals("suspension.applied", entry.eventType());
            assertEquals("malware report", entry.payload().get("reason"));
        }

        @Test
        @DisplayName("suspending the application covers its artifacts")
        void applicationSuspensionCoversArtifacts() {
            controller.suspend(APPLICATION, APP, "publisher compromised", applyToken());

            assertTrue(controller.isApplicationSuspended(APP));
            assertTrue(controller.isSuspended(artifactId));
            assertFalse(controller.isSuspended(CoreFixture.digestOf("unrelated")));
        }

        @Test
        @DisplayName("suspending twice is a conflict")
        void alreadySuspended() {
            controller.suspend(ARTIFACT, artifactId, "first", applyToken());

            ProvenantException e = assertThrows(ProvenantException.class,
                    () -> controller.suspend(ARTIFACT, artifactId, "second", applyToken()));
            assertEquals(ErrorCode.CONFLICT, e.code());
        }

        @Test
        @DisplayName("an invalid token is rejected, audited and counted")
        void invalidToken() {
            ProvenantException e = assertThrows(ProvenantException.class,
                    () -> controller.suspend(ARTIFACT, artifactId, "reason", "garbage"));

            assertEquals(ErrorCode.UNAUTHORIZED, e.code());
            assertFalse(controller.isSuspended(artifactId));
            assertEquals("suspension.rejected", fx.auditLog.entriesFor("suspension", artifactId).get(0).eventType());
            assertEquals(1.0, fx.meterRegistry.counter("provenant.security.events",
                    "type", "suspension-rejected").count());
        }

        @Test
        @DisplayName("a blank target id is rejected")
        void blankTarget() {
            ProvenantException e = assertThrows(ProvenantException.class,
                    () -> controller.suspend(ARTIFACT, " ", "reason", applyToken()));
            assertEquals(ErrorCode.INVALID_REQUEST, e.code());
        }
    }

    @Nested
    @DisplayName("lift")
    class LiftTests {

        @Test
        @DisplayName("lifting restores availability and keeps the history")
        void liftsSuspension() {
            controller.suspend(ARTIFACT, artifactId, "investigating", applyToken());
            controller.lift(ARTIFACT, artifactId, "false positive", liftToken());

            assertFalse(controller.isSuspended(artifactId));
            List<SuspensionRecord> history = store.history(ARTIFACT, artifactId);
            assertEquals(List.of(SuspensionRecord.Action.SUSPEND, SuspensionRecord.Action.LIFT),
                    history.stream().map(SuspensionRecord::action).toList());
        }

        @Test
        @DisplayName("an apply-scoped token cannot lift")
        void applyTokenCannotLift() {
            controller.suspend(ARTIFACT, artifactId, "investigating", applyToken());

            assertThrows(ProvenantException.class,
                    () -> controller.lift(ARTIFACT, artifactId, "nope", applyToken()));
            assertTrue(controller.isSuspended(artifactId));
        }

        @Test
        @DisplayName("lifting something not suspended is a conflict")
        void notSuspended() {
            ProvenantException e = assertThrows(ProvenantException.class,
                    () -> controller.lift(ARTIFACT, artifactId, "nothing to lift", liftToken()));
            assertEquals(ErrorCode.CONFLICT, e.code());
        }

        @Test
        @DisplayName("lifting an artifact does not lift its application")
        void levelsAreIndependent() {
            controller.suspend(APPLICATION, APP, "publisher compromised", applyToken());
            controller.suspend(ARTIFACT, artifactId, "bad build", applyToken());
            controller.lift(ARTIFACT, artifactId, "build is fine", liftToken());

            assertTrue(controller.isSuspended(artifactId));
        }
    }
}
