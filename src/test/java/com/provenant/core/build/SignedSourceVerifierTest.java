package com.provenant.core.build;

import com.provenant.core.error.ErrorCode;
import com.provenant.core.error.ProvenantException;
import com.provenant.core.error.SourceVerificationException;
import com.provenant.core.model.SourceReference;
import com.provenant.support.TestAuthorizers;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.security.Signature;
import java.util.Base64;

import static org.junit.jupiter.api.Assertions.*;

class SignedSourceVerifierTest {

    private static final String LOCATOR = "https://git.example.org/mitid.git";
    private static final String REVISION = "4f2a9c1e";

    private KeyPair publisher;
    private SourceProperties properties;

    @BeforeEach
    void setUp() {
        publisher = TestAuthorizers.generate();
        properties = new SourceProperties();
        properties.getTrustedSigners().put("digst", TestAuthorizers.encodePublic(publisher));
    }

    private static String sign(KeyPair pair, String payload) throws GeneralSecurityException {
        Signature signature = Signature.getInstance("Ed25519");
        signature.initSign(pair.getPrivate());
        signature.update(payload.getBytes(StandardCharsets.UTF_8));
        return Base64.getEncoder().encodeToString(signature.sign());
    }

    @Test
    void acceptsTrustedSignature() throws Exception {
        SignedSourceVerifier verifier = new SignedSourceVerifier(properties);
        String sig = sign(publisher, LOCATOR + "\n" + REVISION);

        assertDoesNotThrow(() -> verifier.verify(new SourceReference(LOCATOR, REVISION, "digst", sig)));
    }

    @Test
    void rejectsSignatureOverDifferentRevision() throws Exception {
        SignedSourceVerifier verifier = new SignedSourceVerifier(properties);
        String sig = sign(publisher, LOCATOR + "\n" + "deadbeef");

        assertThrows(SourceVerificationException.class,
                () -> verifier.verify(new SourceReference(LOCATOR, REVISION, "digst", sig)));
    }

    @Test
    void rejectsUnknownSigner() throws Exception {
        SignedSourceVerifier verifier = new SignedSourceVerifier(properties);
        KeyPair stranger = TestAuthorizers.generate();
        String sig = sign(stranger, LOCATOR + "\n" + REVISION);

        SourceVerificationException e = assertThrows(SourceVerificationException.class,
                () -> verifier.verify(new SourceReference(LOCATOR, REVISION, "stranger", sig)));
        assertEquals(ErrorCode.SOURCE_VERIFICATION_FAILED, e.code());
        assertTrue(e.getMessage().contains("not trusted"));
    }

    @Test
    void rejectsKeySwapUnderTrustedName() throws Exception {
        SignedSourceVerifier verifier = new SignedSourceVerifier(properties);
        String sig = sign(TestAuthorizers.generate(), LOCATOR + "\n" + REVISION);

        assertThrows(SourceVerificationException.class,
                () -> verifier.verify(new SourceReference(LOCATOR, REVISION, "digst", sig)));
    }

    @Test
    void rejectsGarbledSignature() {
        SignedSourceVerifier verifier = new SignedSourceVerifier(properties);

        assertThrows(SourceVerificationException.class,
                () -> verifier.verify(new SourceReference(LOCATOR, REVISION, "digst", "%%not-base64%%")));
    }

    @Test
    void rejectsUnsignedSourceByDefault() {
        SignedSourceVerifier verifier = new SignedSourceVerifier(properties);

        SourceVerificationException e = assertThrows(SourceVerificationException.class,
                () -> verifier.verify(new SourceReference(LOCATOR, REVISION, null, null)));
        assertTrue(e.getMessage().contains("not signed"));
    }

    @Test
    void acceptsUnsignedSourceWhenAllowed() {
        properties.setRequireSigned(false);
        SignedSourceVerifier verifier = new SignedSourceVerifier(properties);

        assertDoesNotThrow(() -> verifier.verify(new SourceReference(LOCATOR, REVISION, null, null)));
    }

    @Test
    void requiresCoordinatesEvenWhenUnsignedAllowed() {
        properties.setRequireSigned(false);
        SignedSourceVerifier verifier = new SignedSourceVerifier(properties);

        assertThrows(SourceVerificationException.class,
                () -> verifier.verify(new SourceReference(LOCATOR, " ", null, null)));
        assertThrows(SourceVerificationException.class, () -> verifier.verify(null));
    }

    @Test
    void invalidTrustedKeyIsAConfigError() {
        properties.getTrustedSigners().put("broken", "bm90LWEta2V5");

        ProvenantException e = assertThrows(ProvenantException.class, () -> new SignedSourceVerifier(properties));
        assertEquals(ErrorCode.INVALID_CONFIG, e.code());
    }
}
