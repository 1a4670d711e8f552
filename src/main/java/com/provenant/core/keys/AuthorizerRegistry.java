package com.provenant.core.keys;

import com.provenant.core.error.ErrorCode;
import com.provenant.core.error.ProvenantException;
import com.provenant.core.signing.QuorumProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.PublicKey;
import java.security.spec.X509EncodedKeySpec;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The configured set of authorizers and their registered Ed25519 public keys.
 */
@Component
public class AuthorizerRegistry {

    private static final Logger log = LoggerFactory.getLogger(AuthorizerRegistry.class);

    private final Map<String, PublicKey> keys;
    private final List<String> ceremonyParticipants;
    private final int threshold;

    public AuthorizerRegistry(QuorumProperties properties) {
        if (properties.getThreshold() < 1) {
            throw new ProvenantException(ErrorCode.INVALID_CONFIG, "provenant.quorum.threshold must be at least 1");
        }
        this.threshold = properties.getThreshold();
        this.keys = new LinkedHashMap<>();
        properties.getAuthorizers().forEach((id, encoded) -> keys.put(id, decode(id, encoded)));
        this.ceremonyParticipants = List.copyOf(properties.getCeremonyParticipants());
        for (String participant : ceremonyParticipants) {
            if (!keys.containsKey(participant)) {
                throw new ProvenantException(ErrorCode.INVALID_CONFIG,
                        "Ceremony participant " + participant + " is not a registered authorizer");
            }
        }
        if (threshold > keys.size()) {
            log.warn("Quorum threshold {} exceeds the {} registered authorizers; no request can be signed",
                    threshold, keys.size());
        }
        log.info("Registered {} authorizers (threshold {}, {} ceremony participants)",
                keys.size(), threshold, ceremonyParticipants.size());
    }

    public Optional<PublicKey> publicKey(String authorizerId) {
        return Optional.ofNullable(keys.get(authorizerId));
    }

    public boolean isRegistered(String authorizerId) {
        return keys.containsKey(authorizerId);
    }

    public Set<String> authorizerIds() {
        return keys.keySet();
    }

    public List<String> ceremonyParticipants() {
        return ceremonyParticipants;
    }

    public int threshold() {
        return threshold;
    }

    static PublicKey decode(String id, String encoded) {
        try {
            byte[] der = Base64.getDecoder().decode(encoded.trim());
            return KeyFactory.getInstance("Ed25519").generatePublic(new X509EncodedKeySpec(der));
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            throw new ProvenantException(ErrorCode.INVALID_CONFIG,
                    "Authorizer " + id + " has an invalid Ed25519 public key", e);
        }
    }
}
