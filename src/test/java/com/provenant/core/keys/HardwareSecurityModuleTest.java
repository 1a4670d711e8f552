package com.provenant.core.keys;

import com.provenant.core.error.HsmUnavailableException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.Signature;
import java.security.cert.X509Certificate;
import java.security.spec.ECGenParameterSpec;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class HardwareSecurityModuleTest {

    private static final byte[] DATA = "sha256:00ff".getBytes(StandardCharsets.UTF_8);

    @Nested
    @DisplayName("SimulatedHsm")
    class Simulated {

        private final SimulatedHsm hsm = new SimulatedHsm();

        @Test
        @DisplayName("signatures verify against the generated public key")
        void signsWithGeneratedKey() throws Exception {
            var key = hsm.generateKeyPair("app dk.example");

            byte[] signature = hsm.sign(key.handle(), DATA);

            Signature verifier = Signature.getInstance(key.signatureAlgorithm());
            verifier.initVerify(key.publicKey());
            verifier.update(DATA);
            assertTrue(verifier.verify(signature));
            assertEquals("Ed25519", key.signatureAlgorithm());
        }

        @Test
        @DisplayName("each key gets its own handle")
        void distinctHandles() {
            var first = hsm.generateKeyPair("a");
            var second = hsm.generateKeyPair("b");
            assertNotEquals(first.handle(), second.handle());
            assertNotEquals(first.publicKey(), second.publicKey());
        }

        @Test
        @DisplayName("unknown handle fails closed")
        void unknownHandle() {
            assertThrows(HsmUnavailableException.class, () -> hsm.sign("sim-missing", DATA));
        }

        @Test
        @DisplayName("offline module refuses to sign and to generate")
        void offline() {
            var key = hsm.generateKeyPair("a");
            hsm.setOnline(false);

            assertFalse(hsm.isAvailable());
            assertThrows(HsmUnavailableException.class, () -> hsm.sign(key.handle(), DATA));
            assertThrows(HsmUnavailableException.class, () -> hsm.generateKeyPair("b"));

            hsm.setOnline(true);
            assertNotNull(hsm.sign(key.handle(), DATA));
        }
    }

    @Nested
    @DisplayName("Pkcs11Hsm without a token configuration")
    class UnconfiguredPkcs11 {

        private final Pkcs11Hsm hsm = new Pkcs11Hsm(new HsmProperties.Pkcs11());

        @Test
        void reportsUnavailable() {
            assertFalse(hsm.isAvailable());
            assertEquals("pkcs11", hsm.name());
        }

        @Test
        @DisplayName("never falls back to software keys")
        void failsClosed() {
            assertThrows(HsmUnavailableException.class, () -> hsm.generateKeyPair("root"));
            assertThrows(HsmUnavailableException.class, () -> hsm.sign("repo-signing", DATA));
        }
    }

    @Nested
    @DisplayName("Pkcs11Hsm token entries")
    class TokenEntries {

        @Test
        @DisplayName("aliases are derived from the label and unique per key")
        void aliases() {
            String first = Pkcs11Hsm.aliasFor("app dk.digst.mitid");
            String second = Pkcs11Hsm.aliasFor("app dk.digst.mitid");

            assertTrue(first.startsWith(Pkcs11Hsm.ALIAS_PREFIX + "app-dk-digst-mitid-"));
            assertNotEquals(first, second);
            assertTrue(Pkcs11Hsm.aliasFor("x".repeat(200)).length() < 60);
            assertTrue(Pkcs11Hsm.aliasFor(null).startsWith(Pkcs11Hsm.ALIAS_PREFIX));
        }

        @Test
        @DisplayName("the stored certificate binds the alias to the generated public key")
        void selfSignedCertificate() throws Exception {
            KeyPairGenerator generator = KeyPairGenerator.getInstance("EC");
            generator.initialize(new ECGenParameterSpec("secp256r1"));
            KeyPair pair = generator.generateKeyPair();
            Instant notBefore = Instant.parse("2026-03-01T00:00:00Z");

            X509Certificate certificate = Pkcs11Hsm.selfSignedCertificate(pair, "provenant-root-1a2b3c4d",
                    "SHA256withECDSA", null, notBefore);

            assertEquals("CN=provenant-root-1a2b3c4d", certificate.getSubjectX500Principal().getName());
            assertEquals(pair.getPublic(), certificate.getPublicKey());
            assertEquals(notBefore, certificate.getNotBefore().toInstant());
            certificate.verify(pair.getPublic());
        }
    }

    @Nested
    @DisplayName("HsmConfig")
    class Config {

        private final HsmConfig config = new HsmConfig();

        @Test
        void simulatedProvider() {
            HardwareSecurityModule hsm = config.simulatedHsm();
            assertInstanceOf(SimulatedHsm.class, hsm);
            assertTrue(hsm.isAvailable());
        }

        @Test
        void pkcs11ProviderUsesConfiguredToken() {
            HardwareSecurityModule hsm = config.pkcs11Hsm(new HsmProperties());
            assertInstanceOf(Pkcs11Hsm.class, hsm);
            assertFalse(hsm.isAvailable());
        }
    }
}
