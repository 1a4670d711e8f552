package com.provenant.core.signing;

import com.provenant.core.audit.AuditEvent;
import com.provenant.core.audit.AuditLog;
import com.provenant.core.error.AuthorizationMismatchException;
import com.provenant.core.error.ErrorCode;
import com.provenant.core.error.HsmUnavailableException;
import com.provenant.core.error.KeyRevokedException;
import com.provenant.core.error.ProvenantException;
import com.provenant.core.keys.Approval;
import com.provenant.core.keys.ApprovalVerifier;
import com.provenant.core.keys.AuthorizerRegistry;
import com.provenant.core.keys.KeyHierarchyManager;
import com.provenant.core.keys.QuorumProof;
import com.provenant.core.logging.MdcContext;
import com.provenant.core.metrics.ProvenantMetrics;
import com.provenant.core.model.ArtifactSignature;
import com.provenant.core.model.AuthorizationDecision;
import com.provenant.core.model.AuthorizationRecord;
import com.provenant.core.model.BuilderResult;
import com.provenant.core.model.KeyRecord;
import com.provenant.core.model.QuorumState;
import com.provenant.core.model.SignedArtifact;
import com.provenant.core.model.SigningRequest;
import com.provenant.core.model.SigningState;
import com.provenant.core.model.VerificationDecision;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Collects M-of-N authorizations for consensus artifacts and, once the quorum is reached,
 * has the key manager sign the exact digest that was approved.
 * <p>
 * Requests are keyed by job id. Each request is mutated only while holding its own
 * monitor; requests never wait on each other. Every snapshot is written to the
 * {@link SigningRequestStore} before it becomes visible, and {@link #restore()} reloads
 * them at startup.
 */
@Service
public class QuorumSigningService {

    private static final Logger log = LoggerFactory.getLogger(QuorumSigningService.class);

    private final KeyHierarchyManager keyManager;
    private final ApprovalVerifier approvalVerifier;
    private final AuthorizerRegistry authorizers;
    private final SigningRequestStore requests;
    private final ArtifactRegistry artifactRegistry;
    private final AuditLog auditLog;
    private final ProvenantMetrics metrics;
    private final QuorumProperties properties;
    private final ObjectProvider<ResubmissionHandler> resubmissionHandler;
    private final Clock clock;

    /** Current request per job. */
    private final ConcurrentHashMap<String, Slot> slots = new ConcurrentHashMap<>();
    /** Digest to the job whose request for it is still open. */
    private final ConcurrentHashMap<String, String> openByDigest = new ConcurrentHashMap<>();
    private final Object openLock = new Object();

    private ScheduledExecutorService sweeper;

    public QuorumSigningService(KeyHierarchyManager keyManager, ApprovalVerifier approvalVerifier,
                                AuthorizerRegistry authorizers, SigningRequestStore requests,
                                ArtifactRegistry artifactRegistry, AuditLog auditLog, ProvenantMetrics metrics,
                                QuorumProperties properties, ObjectProvider<ResubmissionHandler> resubmissionHandler,
                                Clock clock) {
        this.keyManager = keyManager;
        this.approvalVerifier = approvalVerifier;
        this.authorizers = authorizers;
        this.requests = requests;
        this.artifactRegistry = artifactRegistry;
        this.auditLog = auditLog;
        this.metrics = metrics;
        this.properties = properties;
        this.resubmissionHandler = resubmissionHandler;
        this.clock = clock;
    }

    @PostConstruct
    void start() {
        restore();
        sweeper = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "signing-expiry-sweep");
            t.setDaemon(true);
            return t;
        });
        long interval = Math.max(1, properties.getSweepIntervalSeconds());
        sweeper.scheduleAtFixedRate(this::sweepSafely, interval, interval, TimeUnit.SECONDS);
    }

    /**
     * Reloads stored requests. Each job's unfinished (or else newest) request becomes
     * current, every stored decision id stays used, and unfinished requests hold their
     * digest again.
     *
     * @return the number of unfinished requests restored
     */
    public int restore() {
        int open = 0;
        synchronized (openLock) {
            for (SigningRequestStore.StoredRequest stored : requests.loadAll()) {
                SigningRequest request = stored.request();
                Slot slot = slots.computeIfAbsent(request.jobId(), id -> new Slot());
                synchronized (slot) {
                    slot.decisionIds.add(request.decisionId());
                    if (slot.request == null || supersedes(request, slot.request)) {
                        slot.request = request;
                        slot.artifactSize = stored.artifactSize();
                    }
                }
            }
            for (Slot slot : slots.values()) {
                synchronized (slot) {
                    if (slot.request != null && !slot.request.state().isTerminal()) {
                        openByDigest.put(slot.request.digest(), slot.request.jobId());
                        open++;
                    }
                }
            }
        }
        if (open > 0) {
            log.info("Restored {} unfinished signing request(s)", open);
        }
        return open;
    }

    /** An unfinished request wins over finished ones; otherwise the newer one does. */
    private static boolean supersedes(SigningRequest candidate, SigningRequest current) {
        if (candidate.state().isTerminal() != current.state().isTerminal()) {
            return !candidate.state().isTerminal();
        }
        return !candidate.createdAt().isBefore(current.createdAt());
    }

    @PreDestroy
    void stopSweeper() {
        if (sweeper != null) {
            sweeper.shutdownNow();
        }
    }

    /**
     * Opens a signing request for a consensus decision, bound to the application's active
     * signing key.
     */
    public SigningRequest open(VerificationDecision decision, String applicationId) {
        if (decision == null || !decision.isConsensus()) {
            throw new ProvenantException(ErrorCode.CONSENSUS_REQUIRED,
                    "Signing requires a CONSENSUS verification decision");
        }
        KeyRecord key = keyManager.findActiveSigningKey(applicationId)
                .orElseThrow(() -> new ProvenantException(ErrorCode.KEY_NOT_FOUND,
                        "No active APP_SIGNING key for application " + applicationId));

        synchronized (openLock) {
            boolean decisionUsed = slots.values().stream()
                    .anyMatch(s -> s.decisionIds.contains(decision.decisionId()));
            if (decisionUsed) {
                throw ProvenantException.conflict("Decision " + decision.decisionId() + " already has a signing request");
            }
            String holder = openByDigest.get(decision.winningDigest());
            if (holder != null && slots.get(holder) != null && !slots.get(holder).request.state().isTerminal()) {
                throw ProvenantException.conflict("Digest " + decision.winningDigest()
                        + " already has an open signing request (job " + holder + ")");
            }

            Instant now = now();
            SigningRequest request = new SigningRequest(
                    "sr-" + UUID.randomUUID(),
                    decision.jobId(),
                    decision.decisionId(),
                    decision.winningDigest(),
                    applicationId,
                    key.keyId(),
                    authorizers.threshold(),
                    SigningState.AWAITING_QUORUM,
                    List.of(),
                    now.plus(Duration.ofMinutes(properties.getDeadlineMinutes())),
                    null,
                    null,
                    now,
                    now);
            Slot slot = slots.computeIfAbsent(decision.jobId(), id -> new Slot());
            synchronized (slot) {
                if (slot.request != null && !slot.request.state().isTerminal()) {
                    throw ProvenantException.conflict("Job " + decision.jobId() + " already has an open signing request");
                }
                long artifactSize = artifactSize(decision);
                requests.save(request, artifactSize);
                slot.request = request;
                slot.artifactSize = artifactSize;
                slot.decisionIds.add(decision.decisionId());
            }
            openByDigest.put(decision.winningDigest(), decision.jobId());

            auditLog.append(AuditEvent.forSigningRequest(request.requestId(), request.jobId(), "signing.opened",
                    Map.of("digest", request.digest(),
                            "decision_id", request.decisionId(),
                            "key_id", request.keyId(),
                            "threshold", String.valueOf(request.threshold()),
                            "deadline", request.deadline().toString())));
            log.info("Opened signing request {} for job {} ({} of {} approvals needed, key {})",
                    request.requestId(), request.jobId(), request.threshold(),
                    authorizers.authorizerIds().size(), request.keyId());
            return request;
        }
    }

    /**
     * Records one authorizer's vote. A deny ends the request; the M-th distinct approval
     * triggers signing. Approvals recorded earlier are re-verified first, and any that no
     * longer verify are withdrawn, so quorum is only reached on proofs that are still live.
     *
     * @return the request after the vote (and after signing, if the vote completed the quorum)
     */
    public SigningRequest authorize(String jobId, String authorizerId, AuthorizationDecision decision,
                                    String boundDigest, String proof) {
        Slot slot = slot(jobId);
        synchronized (slot) {
            SigningRequest request = expireIfOverdue(slot);
            MdcContext.setSigningRequest(jobId, request.requestId());
            try {
                if (request.state() != SigningState.AWAITING_QUORUM) {
                    throw SigningRequestStateMachine.rejected(request, SigningEvent.Vote.class);
                }
                if (!authorizers.isRegistered(authorizerId)) {
                    throw rejectVote(request, authorizerId, "Unknown authorizer " + authorizerId);
                }
                if (!request.digest().equals(boundDigest)) {
                    throw rejectVote(request, authorizerId, "Vote is bound to digest " + boundDigest
                            + " but the request is for " + request.digest());
                }
                Approval approval;
                try {
                    approval = approvalVerifier.verify(proof);
                } catch (AuthorizationMismatchException e) {
                    throw rejectVote(request, authorizerId, e.getMessage());
                }
                if (!authorizerId.equals(approval.authorizerId())
                        || !Approval.ACTION_SIGN.equals(approval.action())
                        || approval.decision() != decision
                        || !request.digest().equals(approval.digest())
                        || !request.keyId().equals(approval.keyId())
                        || !request.requestId().equals(approval.requestId())) {
                    throw rejectVote(request, authorizerId,
                            "Proof does not bind this authorizer, decision, digest, key and request");
                }
                request = withdrawLapsedApprovals(slot);
                boolean alreadyVoted = request.authorizations().stream()
                        .anyMatch(a -> a.authorizerId().equals(authorizerId));
                if (alreadyVoted) {
                    throw ProvenantException.conflict(authorizerId + " has already voted on " + request.requestId());
                }

                AuthorizationRecord record = new AuthorizationRecord(authorizerId, decision, boundDigest,
                        request.requestId(), proof, now());
                SigningRequest next = transition(slot, new SigningEvent.Vote(record));
                auditLog.append(AuditEvent.forSigningRequest(next.requestId(), jobId,
                        "signing.authorization-recorded",
                        Map.of("authorizer_id", authorizerId,
                                "decision", decision.name(),
                                "digest", boundDigest,
                                "approvals", String.valueOf(next.approvals()))));

                if (next.state() == SigningState.DENIED) {
                    auditLog.append(AuditEvent.forSigningRequest(next.requestId(), jobId, "signing.denied",
                            Map.of("authorizer_id", authorizerId)));
                    finish(slot, next);
                    log.warn("Signing request {} DENIED by {}", next.requestId(), authorizerId);
                    return next;
                }
                if (next.state() == SigningState.AUTHORIZED) {
                    auditLog.append(AuditEvent.forSigningRequest(next.requestId(), jobId, "signing.authorized",
                            Map.of("approvals", String.valueOf(next.approvals()))));
                    log.info("Signing request {} reached quorum ({} approvals)", next.requestId(), next.approvals());
                    return attemptSign(slot);
                }
                return next;
            } finally {
                MdcContext.clear();
            }
        }
    }

    /** Retries signing an {@code AUTHORIZED} request whose previous attempt failed. */
    public SigningRequest retrySigning(String jobId) {
        Slot slot = slot(jobId);
        synchronized (slot) {
            SigningRequest request = expireIfOverdue(slot);
            if (request.state() != SigningState.AUTHORIZED) {
                throw SigningRequestStateMachine.rejected(request, SigningEvent.Signed.class);
            }
            MdcContext.setSigningRequest(jobId, request.requestId());
            try {
                return attemptSign(slot);
            } finally {
                MdcContext.clear();
            }
        }
    }

    /** Gives up on an unsigned request. */
    public SigningRequest abandon(String jobId) {
        Slot slot = slot(jobId);
        synchronized (slot) {
            SigningRequest request = expireIfOverdue(slot);
            if (request.state() == SigningState.EXPIRED) {
                return request;
            }
            return expire(slot, "abandoned");
        }
    }

    /**
     * Resubmits an expired request according to the configured policy.
     *
     * @return the job id that now carries the work: a new job for {@code REBUILD}, the same
     *         job for {@code REVERIFY}
     */
    public String resubmit(String jobId) {
        Slot slot = slot(jobId);
        SigningRequest request;
        synchronized (slot) {
            request = expireIfOverdue(slot);
            if (request.state() != SigningState.EXPIRED) {
                throw ProvenantException.conflict("Only EXPIRED signing requests can be resubmitted; "
                        + request.requestId() + " is " + request.state());
            }
        }
        ResubmissionHandler handler = resubmissionHandler.getObject();
        QuorumProperties.ResubmissionPolicy policy = properties.getResubmissionPolicy();
        auditLog.append(AuditEvent.forSigningRequest(request.requestId(), jobId, "signing.resubmitted",
                Map.of("policy", policy.name())));
        log.info("Resubmitting expired signing request {} ({})", request.requestId(), policy);
        if (policy == QuorumProperties.ResubmissionPolicy.REVERIFY) {
            VerificationDecision decision = handler.reverify(jobId);
            open(decision, request.applicationId());
            return jobId;
        }
        return handler.rebuild(jobId);
    }

    /** Expires every unsigned request whose deadline has passed. */
    public int expireOverdue() {
        int expired = 0;
        for (Slot slot : slots.values()) {
            synchronized (slot) {
                SigningRequest before = slot.request;
                if (before != null && expireIfOverdue(slot) != before
                        && slot.request.state() == SigningState.EXPIRED) {
                    expired++;
                }
            }
        }
        if (expired > 0) {
            log.info("Expired {} overdue signing request(s)", expired);
        }
        return expired;
    }

    public Optional<SigningRequest> find(String jobId) {
        Slot slot = slots.get(jobId);
        if (slot == null) {
            return Optional.empty();
        }
        synchronized (slot) {
            return Optional.ofNullable(slot.request == null ? null : expireIfOverdue(slot));
        }
    }

    public SigningRequest get(String jobId) {
        return find(jobId).orElseThrow(() -> ProvenantException.notFound("Signing request for job", jobId));
    }

    public QuorumState quorumState(String jobId) {
        return get(jobId).quorumState();
    }

    private SigningRequest attemptSign(Slot slot) {
        SigningRequest request = slot.request;
        List<String> approvals = request.authorizations().stream()
                .filter(a -> a.decision() == AuthorizationDecision.APPROVE)
                .map(AuthorizationRecord::proof)
                .toList();
        QuorumProof proof = new QuorumProof(request.requestId(), request.digest(), request.keyId(), approvals);
        try {
            ArtifactSignature signature = keyManager.sign(request.keyId(), request.digest(), proof);
            SigningRequest signed = transition(slot, new SigningEvent.Signed(signature));
            auditLog.append(AuditEvent.forSigningRequest(signed.requestId(), signed.jobId(), "signing.signed",
                    Map.of("digest", signed.digest(), "key_id", signed.keyId(), "algorithm", signature.algorithm())));
            finish(slot, signed);
            artifactRegistry.publish(new SignedArtifact(signed.digest(), signed.applicationId(), signed.jobId(),
                    signed.requestId(), slot.artifactSize, signature, signature.signedAt()));
            log.info("Signing request {} SIGNED ({})", signed.requestId(), signed.digest());
            return signed;
        } catch (HsmUnavailableException | KeyRevokedException | AuthorizationMismatchException e) {
            SigningRequest failed = transition(slot, new SigningEvent.SignFailed(e.code() + ": " + e.getMessage()));
            auditLog.append(AuditEvent.forSigningRequest(failed.requestId(), failed.jobId(), "signing.sign-failed",
                    Map.of("error", e.code().name(), "detail", String.valueOf(e.getMessage()))));
            metrics.recordSigningOutcome("sign_failed");
            log.error("Signing request {} could not be signed: {}", failed.requestId(), e.getMessage());
            return failed;
        }
    }

    private SigningRequest withdrawLapsedApprovals(Slot slot) {
        for (AuthorizationRecord existing : slot.request.authorizations()) {
            if (existing.decision() != AuthorizationDecision.APPROVE) {
                continue;
            }
            try {
                approvalVerifier.verify(existing.proof());
            } catch (AuthorizationMismatchException e) {
                SigningRequest pruned = transition(slot,
                        new SigningEvent.VoteLapsed(existing.authorizerId(), e.getMessage()));
                auditLog.append(AuditEvent.forSigningRequest(pruned.requestId(), pruned.jobId(),
                        "signing.authorization-lapsed",
                        Map.of("authorizer_id", existing.authorizerId(),
                                "detail", String.valueOf(e.getMessage()),
                                "approvals", String.valueOf(pruned.approvals()))));
                log.warn("Withdrew lapsed approval from {} on {}: {}",
                        existing.authorizerId(), pruned.requestId(), e.getMessage());
            }
        }
        return slot.request;
    }

    private ProvenantException rejectVote(SigningRequest request, String authorizerId, String detail) {
        log.warn("SECURITY: rejected vote from {} on {}: {}", authorizerId, request.requestId(), detail);
        metrics.recordSecurityEvent("authorization-rejected");
        Map<String, String> payload = new LinkedHashMap<>();
        payload.put("authorizer_id", String.valueOf(authorizerId));
        payload.put("detail", detail);
        auditLog.append(AuditEvent.forSigningRequest(request.requestId(), request.jobId(),
                "signing.authorization-rejected", payload));
        return new AuthorizationMismatchException(detail);
    }

    private SigningRequest expireIfOverdue(Slot slot) {
        SigningRequest request = slot.request;
        if (request == null || request.state().isTerminal() || !now().isAfter(request.deadline())) {
            return request;
        }
        return expire(slot, "deadline passed");
    }

    private SigningRequest expire(Slot slot, String reason) {
        SigningRequest expired = transition(slot, new SigningEvent.Expire(reason));
        auditLog.append(AuditEvent.forSigningRequest(expired.requestId(), expired.jobId(), "signing.expired",
                Map.of("reason", reason)));
        finish(slot, expired);
        log.info("Signing request {} EXPIRED: {}", expired.requestId(), reason);
        return expired;
    }

    private SigningRequest transition(Slot slot, SigningEvent event) {
        SigningRequest next = SigningRequestStateMachine.apply(slot.request, event, now());
        requests.save(next, slot.artifactSize);
        slot.request = next;
        return next;
    }

    private void finish(Slot slot, SigningRequest terminal) {
        openByDigest.remove(terminal.digest(), terminal.jobId());
        metrics.recordSigningOutcome(terminal.state().name().toLowerCase());
    }

    private static long artifactSize(VerificationDecision decision) {
        return decision.agreeing().stream().mapToLong(BuilderResult::artifactSize).findFirst().orElse(-1);
    }

    private Slot slot(String jobId) {
        Slot slot = slots.get(jobId);
        if (slot == null || slot.request == null) {
            throw ProvenantException.notFound("Signing request for job", jobId);
        }
        return slot;
    }

    private void sweepSafely() {
        try {
            expireOverdue();
        } catch (Exception e) {
            log.warn("Signing expiry sweep failed: {}", e.getMessage(), e);
        }
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }

    private static final class Slot {
        SigningRequest request;
        long artifactSize = -1;
        final Set<String> decisionIds = new HashSet<>();
    }
}
