package com.provenant.core.keys;

import com.provenant.core.audit.AuditEvent;
import com.provenant.core.audit.AuditLog;
import com.provenant.core.error.AuthorizationMismatchException;
import com.provenant.core.error.ErrorCode;
import com.provenant.core.error.KeyRevokedException;
import com.provenant.core.error.ProvenantException;
import com.provenant.core.metrics.ProvenantMetrics;
import com.provenant.core.model.ArtifactSignature;
import com.provenant.core.model.KeyRecord;
import com.provenant.core.model.KeyRole;
import com.provenant.core.model.KeyState;
import com.provenant.core.storage.ArtifactDigests;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.PublicKey;
import java.security.Signature;
import java.security.spec.X509EncodedKeySpec;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Base64;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns the signing key hierarchy: root, repository signing keys and per-application
 * signing keys. Private keys stay inside the {@link HardwareSecurityModule}; this class
 * only ever sees handles and public material.
 * <p>
 * Every key operation checks its own authorization evidence, independently of whatever
 * the caller already checked.
 */
@Service
public class KeyHierarchyManager {

    private static final Logger log = LoggerFactory.getLogger(KeyHierarchyManager.class);

    private final KeyRecordStore store;
    private final HardwareSecurityModule hsm;
    private final ApprovalVerifier approvalVerifier;
    private final AuthorizerRegistry authorizers;
    private final AuditLog auditLog;
    private final ProvenantMetrics metrics;
    private final Clock clock;

    /** One signing operation in flight per key. */
    private final ConcurrentHashMap<String, ReentrantLock> keyLocks = new ConcurrentHashMap<>();
    private final Object hierarchyLock = new Object();

    public KeyHierarchyManager(KeyRecordStore store, HardwareSecurityModule hsm,
                               ApprovalVerifier approvalVerifier, AuthorizerRegistry authorizers,
                               AuditLog auditLog, ProvenantMetrics metrics, Clock clock) {
        this.store = store;
        this.hsm = hsm;
        this.approvalVerifier = approvalVerifier;
        this.authorizers = authorizers;
        this.auditLog = auditLog;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Creates a key through the ceremony workflow. Every configured ceremony participant
     * must have approved exactly this role, scope and parent.
     */
    public KeyRecord createKey(KeyCeremony ceremony) {
        Objects.requireNonNull(ceremony.role(), "role");
        if (ceremony.scope() == null || ceremony.scope().isBlank()) {
            throw ProvenantException.invalid("Key scope is required");
        }
        if (authorizers.ceremonyParticipants().isEmpty()) {
            throw new ProvenantException(ErrorCode.INVALID_CONFIG, "No key ceremony participants are configured");
        }

        Set<String> approvedBy = new HashSet<>();
        for (String token : ceremony.approvals()) {
            Approval approval = verifyOrAudit(token, AuditEvent.KEY, ceremony.scope());
            if (!Approval.ACTION_CREATE_KEY.equals(approval.action())
                    || !approval.isApprove()
                    || !ceremony.role().name().equals(approval.role())
                    || !ceremony.scope().equals(approval.scope())
                    || !Objects.equals(ceremony.parentKeyId(), emptyToNull(approval.parentKeyId()))) {
                throw mismatch(AuditEvent.KEY, ceremony.scope(),
                        "Ceremony approval from " + approval.authorizerId() + " does not match the requested key");
            }
            approvedBy.add(approval.authorizerId());
        }
        List<String> missing = authorizers.ceremonyParticipants().stream()
                .filter(p -> !approvedBy.contains(p))
                .toList();
        if (!missing.isEmpty()) {
            throw mismatch(AuditEvent.KEY, ceremony.scope(), "Key ceremony is missing approvals from " + missing);
        }

        synchronized (hierarchyLock) {
            validateHierarchy(ceremony);
            HardwareSecurityModule.GeneratedKey generated =
                    hsm.generateKeyPair(ceremony.role() + ":" + ceremony.scope());
            KeyRecord key = new KeyRecord(
                    "key-" + UUID.randomUUID(),
                    ceremony.role(),
                    ceremony.scope(),
                    generated.handle(),
                    Base64.getEncoder().encodeToString(generated.publicKey().getEncoded()),
                    generated.signatureAlgorithm(),
                    ceremony.parentKeyId(),
                    now(),
                    KeyState.ACTIVE,
                    null);
            store.insert(key);
            Map<String, String> payload = new LinkedHashMap<>();
            payload.put("role", key.role().name());
            payload.put("scope", key.scope());
            payload.put("algorithm", key.algorithm());
            payload.put("parent_key_id", key.parentKeyId() != null ? key.parentKeyId() : "");
            payload.put("approvers", String.join(",", approvedBy.stream().sorted().toList()));
            auditLog.append(AuditEvent.of(AuditEvent.KEY, key.keyId(), "key.created", payload));
            log.info("Created {} key {} for scope {}", key.role(), key.keyId(), key.scope());
            return key;
        }
    }

    /**
     * Signs {@code digest} with {@code keyId} after re-validating the quorum proof.
     *
     * @throws AuthorizationMismatchException if the proof does not authorize exactly this operation
     * @throws KeyRevokedException            if the key or one of its ancestors is revoked
     * @throws com.provenant.core.error.HsmUnavailableException if the HSM cannot sign; there is no fallback
     */
    public ArtifactSignature sign(String keyId, String digest, QuorumProof proof) {
        KeyRecord key = require(keyId);
        if (!ArtifactDigests.isValid(digest)) {
            throw ProvenantException.invalid("Malformed digest: " + digest);
        }
        String entityId = proof.requestId() != null ? proof.requestId() : keyId;
        if (!digest.equals(proof.digest()) || !keyId.equals(proof.keyId())) {
            throw mismatch(AuditEvent.SIGNING_REQUEST, entityId,
                    "Quorum proof is bound to a different digest or key");
        }

        Set<String> approvers = new HashSet<>();
        for (String token : proof.approvals()) {
            Approval approval = verifyOrAudit(token, AuditEvent.SIGNING_REQUEST, entityId);
            if (!Approval.ACTION_SIGN.equals(approval.action())
                    || !approval.isApprove()
                    || !digest.equals(approval.digest())
                    || !keyId.equals(approval.keyId())
                    || !Objects.equals(proof.requestId(), approval.requestId())) {
                throw mismatch(AuditEvent.SIGNING_REQUEST, entityId,
                        "Approval from " + approval.authorizerId() + " is not bound to this digest, key and request");
            }
            approvers.add(approval.authorizerId());
        }
        if (approvers.size() < authorizers.threshold()) {
            throw mismatch(AuditEvent.SIGNING_REQUEST, entityId,
                    "Quorum proof has " + approvers.size() + " of " + authorizers.threshold() + " required approvals");
        }

        requireEffectivelyActive(key);

        ReentrantLock lock = keyLocks.computeIfAbsent(keyId, id -> new ReentrantLock());
        lock.lock();
        try {
            byte[] value = hsm.sign(key.hsmHandle(), digest.getBytes(StandardCharsets.UTF_8));
            log.info("Signed {} with key {} ({} approvals)", digest, keyId, approvers.size());
            return new ArtifactSignature(keyId, key.algorithm(), digest,
                    Base64.getEncoder().encodeToString(value), now());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Revokes {@code keyId}. Requires the configured quorum of {@code revoke-key} approvals.
     * Irreversible; descendants become unusable for new operations.
     */
    public KeyRecord revoke(String keyId, List<String> approvals, String reason) {
        KeyRecord key = require(keyId);
        Set<String> approvers = new HashSet<>();
        for (String token : approvals != null ? approvals : List.<String>of()) {
            Approval approval = verifyOrAudit(token, AuditEvent.KEY, keyId);
            if (!Approval.ACTION_REVOKE_KEY.equals(approval.action())
                    || !approval.isApprove()
                    || !keyId.equals(approval.keyId())) {
                throw mismatch(AuditEvent.KEY, keyId,
                        "Revocation approval from " + approval.authorizerId() + " is not bound to key " + keyId);
            }
            approvers.add(approval.authorizerId());
        }
        if (approvers.size() < authorizers.threshold()) {
            throw mismatch(AuditEvent.KEY, keyId,
                    "Revocation has " + approvers.size() + " of " + authorizers.threshold() + " required approvals");
        }

        synchronized (hierarchyLock) {
            if (key.isRevoked() || !store.markRevoked(key.withRevoked(now()))) {
                throw ProvenantException.conflict("Key " + keyId + " is already revoked");
            }
            KeyRecord revoked = require(keyId);
            auditLog.append(AuditEvent.of(AuditEvent.KEY, keyId, "key.revoked", Map.of(
                    "reason", reason != null ? reason : "",
                    "approvers", String.join(",", approvers.stream().sorted().toList()),
                    "descendants", String.valueOf(descendantsOf(keyId).size()))));
            log.warn("Key {} ({} {}) REVOKED: {}", keyId, key.role(), key.scope(), reason);
            return revoked;
        }
    }

    /**
     * Checks {@code signature} over {@code digest} against the signing key's public
     * material. Revocation does not affect the result.
     */
    public boolean verify(ArtifactSignature signature, String digest) {
        if (signature == null || !Objects.equals(signature.digest(), digest)) {
            return false;
        }
        Optional<KeyRecord> key = store.find(signature.keyId());
        if (key.isEmpty()) {
            return false;
        }
        try {
            PublicKey publicKey = decodePublicKey(key.get());
            Signature verifier = Signature.getInstance(key.get().algorithm());
            verifier.initVerify(publicKey);
            verifier.update(digest.getBytes(StandardCharsets.UTF_8));
            return verifier.verify(Base64.getDecoder().decode(signature.value()));
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            log.warn("Signature verification failed for key {}: {}", signature.keyId(), e.getMessage());
            return false;
        }
    }

    /** The application's active {@link KeyRole#APP_SIGNING} key, if any. */
    public Optional<KeyRecord> findActiveSigningKey(String applicationId) {
        return store.findAll().stream()
                .filter(k -> k.role() == KeyRole.APP_SIGNING)
                .filter(k -> k.scope().equals(applicationId))
                .filter(this::isEffectivelyActive)
                .reduce((first, second) -> second);
    }

    public Optional<KeyRecord> get(String keyId) {
        return store.find(keyId);
    }

    public List<KeyRecord> list() {
        return store.findAll();
    }

    public boolean isEffectivelyActive(String keyId) {
        return store.find(keyId).map(this::isEffectivelyActive).orElse(false);
    }

    public boolean isEffectivelyActive(KeyRecord key) {
        return revokedInChain(key).isEmpty();
    }

    public boolean isHsmAvailable() {
        return hsm.isAvailable();
    }

    public String hsmName() {
        return hsm.name();
    }

    private void validateHierarchy(KeyCeremony ceremony) {
        KeyRole role = ceremony.role();
        if (role == KeyRole.ROOT) {
            if (ceremony.parentKeyId() != null) {
                throw ProvenantException.invalid("A root key has no parent");
            }
            boolean rootExists = store.findAll().stream().anyMatch(k -> k.role() == KeyRole.ROOT);
            if (rootExists) {
                throw ProvenantException.conflict("A root key already exists");
            }
            return;
        }
        if (ceremony.parentKeyId() == null) {
            throw ProvenantException.invalid(role + " key requires a " + role.parentRole() + " parent");
        }
        KeyRecord parent = store.find(ceremony.parentKeyId())
                .orElseThrow(() -> new ProvenantException(ErrorCode.KEY_NOT_FOUND,
                        "Parent key not found: " + ceremony.parentKeyId()));
        if (parent.role() != role.parentRole()) {
            throw ProvenantException.invalid(role + " key requires a " + role.parentRole()
                    + " parent, got " + parent.role());
        }
        requireEffectivelyActive(parent);
    }

    private void requireEffectivelyActive(KeyRecord key) {
        Optional<String> revoked = revokedInChain(key);
        if (revoked.isPresent()) {
            throw new KeyRevokedException(key.keyId(), revoked.get());
        }
    }

    /** First revoked key walking from {@code key} up to the root. */
    private Optional<String> revokedInChain(KeyRecord key) {
        KeyRecord current = key;
        Set<String> seen = new HashSet<>();
        while (current != null && seen.add(current.keyId())) {
            if (current.isRevoked()) {
                return Optional.of(current.keyId());
            }
            current = current.parentKeyId() != null ? store.find(current.parentKeyId()).orElse(null) : null;
        }
        return Optional.empty();
    }

    private List<KeyRecord> descendantsOf(String keyId) {
        List<KeyRecord> all = store.findAll();
        List<KeyRecord> result = new ArrayList<>();
        Set<String> frontier = new HashSet<>(Set.of(keyId));
        boolean grew = true;
        while (grew) {
            grew = false;
            for (KeyRecord k : all) {
                if (k.parentKeyId() != null && frontier.contains(k.parentKeyId()) && frontier.add(k.keyId())) {
                    result.add(k);
                    grew = true;
                }
            }
        }
        return result;
    }

    private KeyRecord require(String keyId) {
        return store.find(keyId).orElseThrow(
                () -> new ProvenantException(ErrorCode.KEY_NOT_FOUND, "Key not found: " + keyId));
    }

    private Approval verifyOrAudit(String token, String entityType, String entityId) {
        try {
            return approvalVerifier.verify(token);
        } catch (AuthorizationMismatchException e) {
            throw mismatch(entityType, entityId, e.getMessage());
        }
    }

    private AuthorizationMismatchException mismatch(String entityType, String entityId, String detail) {
        log.warn("SECURITY: authorization mismatch on {} {}: {}", entityType, entityId, detail);
        metrics.recordSecurityEvent("authorization-mismatch");
        auditLog.append(AuditEvent.of(AuditEvent.SECURITY, entityId, "security.authorization-mismatch",
                Map.of("entity_type", entityType, "detail", detail)));
        return new AuthorizationMismatchException(detail);
    }

    private static PublicKey decodePublicKey(KeyRecord key) throws GeneralSecurityException {
        byte[] der = Base64.getDecoder().decode(key.publicKey());
        return KeyFactory.getInstance(keyFactoryAlgorithm(key.algorithm())).generatePublic(new X509EncodedKeySpec(der));
    }

    private static String keyFactoryAlgorithm(String signatureAlgorithm) {
        if (signatureAlgorithm.endsWith("withECDSA")) {
            return "EC";
        }
        if (signatureAlgorithm.endsWith("withRSA")) {
            return "RSA";
        }
        return signatureAlgorithm;
    }

    private static String emptyToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }
}
