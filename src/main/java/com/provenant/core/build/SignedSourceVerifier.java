package com.provenant.core.build;

import com.provenant.core.error.ErrorCode;
import com.provenant.core.error.ProvenantException;
import com.provenant.core.error.SourceVerificationException;
import com.provenant.core.model.SourceReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.PublicKey;
import java.security.Signature;
import java.security.spec.X509EncodedKeySpec;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Verifies a publisher's Ed25519 signature over {@code locator + "\n" + revision}
 * against the configured trusted signers.
 */
@Component
public class SignedSourceVerifier implements SourceVerifier {

    private static final Logger log = LoggerFactory.getLogger(SignedSourceVerifier.class);

    private final Map<String, PublicKey> trustedSigners = new LinkedHashMap<>();
    private final boolean requireSigned;

    public SignedSourceVerifier(SourceProperties properties) {
        this.requireSigned = properties.isRequireSigned();
        properties.getTrustedSigners().forEach((id, encoded) -> trustedSigners.put(id, decode(id, encoded)));
        if (!requireSigned) {
            log.warn("provenant.source.require-signed is false; unsigned source references will be built");
        }
    }

    @Override
    public void verify(SourceReference source) {
        if (source == null || isBlank(source.locator()) || isBlank(source.revision())) {
            throw new SourceVerificationException("Source locator and revision are required");
        }
        if (!source.isSigned()) {
            if (requireSigned) {
                throw new SourceVerificationException("Source " + source.locator() + "@" + source.revision()
                        + " is not signed");
            }
            log.warn("Accepting unsigned source {}@{}", source.locator(), source.revision());
            return;
        }
        PublicKey key = trustedSigners.get(source.signerId());
        if (key == null) {
            throw new SourceVerificationException("Signer " + source.signerId() + " is not trusted");
        }
        boolean valid;
        try {
            Signature verifier = Signature.getInstance("Ed25519");
            verifier.initVerify(key);
            verifier.update(source.signedPayload().getBytes(StandardCharsets.UTF_8));
            valid = verifier.verify(Base64.getDecoder().decode(source.signature()));
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            throw new SourceVerificationException("Source signature could not be checked: " + e.getMessage(), e);
        }
        if (!valid) {
            throw new SourceVerificationException("Source signature by " + source.signerId() + " does not verify");
        }
        log.debug("Source {}@{} verified (signer {})", source.locator(), source.revision(), source.signerId());
    }

    private static PublicKey decode(String id, String encoded) {
        try {
            byte[] der = Base64.getDecoder().decode(encoded.trim());
            return KeyFactory.getInstance("Ed25519").generatePublic(new X509EncodedKeySpec(der));
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            throw new ProvenantException(ErrorCode.INVALID_CONFIG, "Trusted signer " + id + " has an invalid key", e);
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
