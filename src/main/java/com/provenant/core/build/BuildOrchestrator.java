package com.provenant.core.build;

import com.provenant.core.audit.AuditEvent;
import com.provenant.core.audit.AuditLog;
import com.provenant.core.error.ProvenantException;
import com.provenant.core.error.SourceVerificationException;
import com.provenant.core.events.EventBus;
import com.provenant.core.events.ProvenantEvent;
import com.provenant.core.logging.MdcContext;
import com.provenant.core.metrics.ProvenantMetrics;
import com.provenant.core.model.BuildJob;
import com.provenant.core.model.BuilderResult;
import com.provenant.core.model.BuilderStatus;
import com.provenant.core.model.DiffReport;
import com.provenant.core.model.JobSnapshot;
import com.provenant.core.model.JobStatus;
import com.provenant.core.model.RejectionReason;
import com.provenant.core.model.VerificationDecision;
import com.provenant.core.model.VerificationOutcome;
import com.provenant.core.signing.QuorumSigningService;
import com.provenant.core.signing.ResubmissionHandler;
import com.provenant.core.storage.ArtifactStore;
import com.provenant.core.verification.VerificationEngine;
import com.provenant.sandbox.BuildRequest;
import com.provenant.sandbox.SandboxLease;
import com.provenant.sandbox.SandboxPool;
import com.provenant.sandbox.SandboxProperties;
import com.provenant.sandbox.SandboxTimeoutException;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Runs build jobs: verifies the source, dispatches the job to {@code n} builder nodes in
 * fresh sandboxes, retries failed builders, and hands the collected results to the
 * verification engine. A consensus opens a signing request.
 * <p>
 * Each job gets one coordinator thread; builder attempts run on a bounded pool shared by
 * all jobs. Job state is only mutated while holding the job's monitor.
 */
@Service
public class BuildOrchestrator implements ResubmissionHandler {

    private static final Logger log = LoggerFactory.getLogger(BuildOrchestrator.class);

    private static final Pattern PARAMETER_NAME = Pattern.compile("[A-Z_][A-Z0-9_]*");

    static final String SOURCE_LOCATOR_ENV = "SOURCE_LOCATOR";
    static final String SOURCE_REVISION_ENV = "SOURCE_REVISION";

    private final SandboxPool sandboxPool;
    private final SourceVerifier sourceVerifier;
    private final ArtifactStore artifactStore;
    private final VerificationEngine verificationEngine;
    private final QuorumSigningService signingService;
    private final AuditLog auditLog;
    private final EventBus eventBus;
    private final ProvenantMetrics metrics;
    private final BuildProperties properties;
    private final SandboxProperties sandboxProperties;
    private final Clock clock;

    private final ConcurrentHashMap<String, JobRecord> jobs = new ConcurrentHashMap<>();
    private final ExecutorService coordinators;
    private final ExecutorService builders;

    public BuildOrchestrator(SandboxPool sandboxPool, SourceVerifier sourceVerifier, ArtifactStore artifactStore,
                             VerificationEngine verificationEngine, QuorumSigningService signingService,
                             AuditLog auditLog, EventBus eventBus, ProvenantMetrics metrics,
                             BuildProperties properties, SandboxProperties sandboxProperties, Clock clock) {
        this.sandboxPool = sandboxPool;
        this.sourceVerifier = sourceVerifier;
        this.artifactStore = artifactStore;
        this.verificationEngine = verificationEngine;
        this.signingService = signingService;
        this.auditLog = auditLog;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.properties = properties;
        this.sandboxProperties = sandboxProperties;
        this.clock = clock;
        this.coordinators = Executors.newFixedThreadPool(Math.max(1, properties.getMaxConcurrentJobs()),
                namedThreads("job-coordinator"));
        this.builders = Executors.newFixedThreadPool(Math.max(1, properties.getMaxParallelSandboxes()),
                namedThreads("builder"));
    }

    @PreDestroy
    public void shutdown() {
        coordinators.shutdownNow();
        builders.shutdownNow();
    }

    /**
     * Accepts a build job. The source reference is checked before anything is dispatched;
     * a rejected source still yields a job id, whose job is already {@code REJECTED}.
     *
     * @return the new job id
     * @throws ProvenantException {@code INVALID_REQUEST} if the request is malformed
     */
    public String submit(BuildJobRequest request) {
        return submit(request, null);
    }

    private String submit(BuildJobRequest request, String rebuiltFrom) {
        validate(request);
        BuildJob job = new BuildJob("job-" + UUID.randomUUID(), request.applicationId(), request.source(),
                request.recipeId(), request.recipeParameters(), request.n(), request.k(), now());
        JobRecord record = new JobRecord(job);
        jobs.put(job.jobId(), record);

        MdcContext.setJob(job.jobId());
        try {
            Map<String, String> payload = new LinkedHashMap<>();
            payload.put("application_id", job.applicationId());
            payload.put("locator", job.source().locator());
            payload.put("revision", job.source().revision());
            payload.put("recipe_id", job.recipeId());
            payload.put("n", String.valueOf(job.n()));
            payload.put("k", String.valueOf(job.k()));
            if (rebuiltFrom != null) {
                payload.put("rebuilt_from", rebuiltFrom);
            }
            auditLog.append(AuditEvent.forJob(job.jobId(), "job.submitted", payload));

            try {
                sourceVerifier.verify(job.source());
            } catch (SourceVerificationException e) {
                synchronized (record) {
                    record.reject(RejectionReason.SOURCE_VERIFICATION_FAILED, now());
                }
                auditLog.append(AuditEvent.forJob(job.jobId(), "job.source-rejected",
                        Map.of("detail", String.valueOf(e.getMessage()))));
                metrics.recordJobOutcome("source_rejected");
                log.warn("Job {} rejected: {}", job.jobId(), e.getMessage());
                return job.jobId();
            }

            synchronized (record) {
                record.coordinator = coordinators.submit(() -> coordinate(record));
            }
            log.info("Accepted job {} for {} ({} of {} builders must agree)",
                    job.jobId(), job.applicationId(), job.k(), job.n());
            return job.jobId();
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Cancels a job that has not yet produced a verification decision. Running sandboxes
     * are interrupted and torn down.
     */
    public JobSnapshot cancel(String jobId) {
        JobRecord record = record(jobId);
        synchronized (record) {
            if (record.status.isTerminal() || record.decision != null) {
                throw ProvenantException.conflict("Job " + jobId + " is " + record.status + " and can no longer be cancelled");
            }
            record.reject(RejectionReason.CANCELLED, now());
            record.cancelWork();
            auditLog.append(AuditEvent.forJob(jobId, "job.cancelled", Map.of()));
        }
        metrics.recordJobOutcome("cancelled");
        log.info("Job {} cancelled", jobId);
        return status(jobId);
    }

    public JobSnapshot status(String jobId) {
        JobRecord record = record(jobId);
        synchronized (record) {
            return record.snapshot();
        }
    }

    /** All known jobs, most recently submitted first. */
    public List<JobSnapshot> list() {
        List<JobSnapshot> snapshots = new ArrayList<>();
        for (JobRecord record : jobs.values()) {
            synchronized (record) {
                snapshots.add(record.snapshot());
            }
        }
        snapshots.sort(Comparator.comparing((JobSnapshot s) -> s.job().submittedAt()).reversed());
        return snapshots;
    }

    @Override
    public String rebuild(String jobId) {
        BuildJob previous = record(jobId).job;
        log.info("Rebuilding job {} as a new job", jobId);
        return submit(new BuildJobRequest(previous.applicationId(), previous.source(), previous.recipeId(),
                previous.recipeParameters(), previous.n(), previous.k()), jobId);
    }

    @Override
    public VerificationDecision reverify(String jobId) {
        JobRecord record = record(jobId);
        VerificationDecision decision;
        int round;
        synchronized (record) {
            if (record.decision == null) {
                throw ProvenantException.conflict("Job " + jobId + " has not been verified yet");
            }
            round = ++record.round;
            decision = verificationEngine.verify(jobId, round, record.job.k(), List.copyOf(record.results), now());
            record.decision = decision;
            record.updatedAt = now();
        }
        metrics.recordVerificationOutcome(decision.outcome().name().toLowerCase());
        auditDecision(jobId, decision, round);
        log.info("Re-verified job {} (round {}): {}", jobId, round, decision.outcome());
        return decision;
    }

    private void coordinate(JobRecord record) {
        BuildJob job = record.job;
        MdcContext.setJob(job.jobId());
        try {
            List<String> builderIds = sandboxPool.builderIds().subList(0, job.n());
            List<Future<BuilderResult>> futures;
            synchronized (record) {
                if (record.status.isTerminal()) {
                    return;
                }
                record.status = JobStatus.BUILDING;
                record.updatedAt = now();
                for (String builderId : builderIds) {
                    record.builders.add(builders.submit(() -> runBuilder(record, builderId)));
                }
                futures = List.copyOf(record.builders);
            }
            auditLog.append(AuditEvent.forJob(job.jobId(), "job.dispatched",
                    Map.of("builders", String.join(",", builderIds))));

            long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(properties.getJobTimeoutSeconds());
            for (Future<BuilderResult> future : futures) {
                try {
                    future.get(Math.max(0, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
                } catch (TimeoutException e) {
                    timeOut(record);
                    return;
                } catch (CancellationException e) {
                    log.debug("Builder task for job {} was cancelled", job.jobId());
                } catch (ExecutionException e) {
                    log.error("Builder task for job {} failed unexpectedly", job.jobId(), e.getCause());
                }
            }
            decide(record);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("Coordinator for job {} interrupted", job.jobId());
        } catch (RuntimeException e) {
            log.error("Coordinator for job {} failed: {}", job.jobId(), e.getMessage(), e);
            fail(record, e);
        } finally {
            MdcContext.clear();
        }
    }

    private void decide(JobRecord record) {
        BuildJob job = record.job;
        List<BuilderResult> results;
        synchronized (record) {
            if (record.status.isTerminal()) {
                return;
            }
            record.status = JobStatus.VERIFYING;
            record.updatedAt = now();
            results = List.copyOf(record.results);
        }

        VerificationDecision decision = verificationEngine.verify(job.jobId(), job.k(), results, now());
        synchronized (record) {
            if (record.status.isTerminal()) {
                return;
            }
            record.decision = decision;
            if (decision.isConsensus()) {
                record.status = JobStatus.VERIFIED;
                record.updatedAt = now();
            } else {
                record.reject(decision.outcome() == VerificationOutcome.INSUFFICIENT_BUILDERS
                        ? RejectionReason.INSUFFICIENT_BUILDERS : RejectionReason.NO_CONSENSUS, now());
            }
        }
        metrics.recordVerificationOutcome(decision.outcome().name().toLowerCase());
        auditDecision(job.jobId(), decision, 0);

        if (!decision.isConsensus()) {
            Map<String, String> payload = new LinkedHashMap<>();
            payload.put("reason", decision.outcome().name());
            payload.put("decision_id", decision.decisionId());
            if (!decision.diffReports().isEmpty()) {
                payload.put("diff_reports", diffReportIds(decision));
            }
            auditLog.append(AuditEvent.forJob(job.jobId(), "job.rejected", payload));
            metrics.recordJobOutcome("rejected");
            log.warn("Job {} REJECTED: {} ({} diff report(s))", job.jobId(), decision.outcome(),
                    decision.diffReports().size());
            return;
        }
        auditLog.append(AuditEvent.forJob(job.jobId(), "job.verified",
                Map.of("digest", decision.winningDigest(), "decision_id", decision.decisionId())));
        metrics.recordJobOutcome("verified");
        log.info("Job {} VERIFIED: {} agreed on {}", job.jobId(), decision.agreeing().size(), decision.winningDigest());

        try {
            signingService.open(decision, job.applicationId());
        } catch (ProvenantException e) {
            log.error("Could not open a signing request for job {}: {}", job.jobId(), e.getMessage());
            auditLog.append(AuditEvent.forJob(job.jobId(), "job.signing-not-opened",
                    Map.of("error", e.code().name(), "detail", String.valueOf(e.getMessage()))));
        }
    }

    private void timeOut(JobRecord record) {
        synchronized (record) {
            if (record.status.isTerminal()) {
                return;
            }
            record.status = JobStatus.TIMED_OUT;
            record.updatedAt = now();
            record.builders.forEach(f -> f.cancel(true));
            auditLog.append(AuditEvent.forJob(record.job.jobId(), "job.timed-out",
                    Map.of("timeout_seconds", String.valueOf(properties.getJobTimeoutSeconds()))));
        }
        metrics.recordJobOutcome("timed_out");
        log.warn("Job {} TIMED_OUT after {}s", record.job.jobId(), properties.getJobTimeoutSeconds());
    }

    /**
     * Ends a job whose coordinator hit an unexpected error. A job that already reached a
     * terminal state keeps it.
     */
    private void fail(JobRecord record, RuntimeException cause) {
        synchronized (record) {
            if (record.status.isTerminal()) {
                return;
            }
            record.reject(RejectionReason.INTERNAL_ERROR, now());
            record.cancelBuilders();
            try {
                auditLog.append(AuditEvent.forJob(record.job.jobId(), "job.failed",
                        Map.of("error", cause.getClass().getSimpleName(), "detail", String.valueOf(cause.getMessage()))));
            } catch (RuntimeException auditFailure) {
                log.error("Could not record the failure of job {} in the audit log", record.job.jobId(), auditFailure);
            }
        }
        metrics.recordJobOutcome("failed");
    }

    private BuilderResult runBuilder(JobRecord record, String builderId) {
        BuilderResult last = null;
        for (int attempt = 0; attempt <= properties.getRetriesPerBuilder(); attempt++) {
            if (Thread.currentThread().isInterrupted() || isTerminal(record)) {
                break;
            }
            last = runAttempt(record.job, builderId, attempt);
            if (!recordResult(record, last) || last.isSuccess()) {
                break;
            }
            if (attempt < properties.getRetriesPerBuilder()) {
                log.warn("Builder {} attempt {} for job {} {}; retrying in a new sandbox",
                        builderId, attempt, record.job.jobId(), last.status());
            }
        }
        return last;
    }

    BuilderResult runAttempt(BuildJob job, String builderId, int attempt) {
        MdcContext.setBuilder(job.jobId(), builderId, attempt);
        long start = System.nanoTime();
        String sandboxId = null;
        String logRef = null;
        try {
            BuildProperties.Recipe recipe = recipe(job.recipeId());
            Path outputDir = artifactStore.newWorkDirectory(job.jobId() + "-" + builderId + "-" + attempt);
            BuildRequest request = new BuildRequest(job.jobId(), builderId, attempt, recipe.getImage(),
                    recipe.getCommand(), environment(job, recipe), outputDir, recipe.getNetworkAllowlist(),
                    sandboxProperties.getMemoryLimitMb(), sandboxProperties.getCpuCount());

            eventBus.publish(ProvenantEvent.progress("builder.started", AuditEvent.BUILD_JOB, job.jobId(), job.jobId(),
                    Map.of("builder_id", builderId, "attempt", attempt), Instant.now()));

            try (SandboxLease lease = sandboxPool.acquire(request)) {
                sandboxId = lease.sandboxId();
                int exitCode;
                try {
                    exitCode = lease.awaitExit(properties.getBuilderTimeoutSeconds());
                } catch (SandboxTimeoutException e) {
                    logRef = storeLog(job, builderId, attempt, lease);
                    return result(job, builderId, attempt, BuilderStatus.TIMED_OUT, null, -1, start,
                            logRef, sandboxId, e.getMessage());
                }
                logRef = storeLog(job, builderId, attempt, lease);
                if (exitCode != 0) {
                    return result(job, builderId, attempt, BuilderStatus.FAILED, null, -1, start,
                            logRef, sandboxId, "exit code " + exitCode);
                }
                Path artifact = lease.outputDir().resolve(recipe.getArtifactPath()).normalize();
                if (!artifact.startsWith(lease.outputDir()) || !Files.isRegularFile(artifact)) {
                    return result(job, builderId, attempt, BuilderStatus.FAILED, null, -1, start,
                            logRef, sandboxId, "artifact " + recipe.getArtifactPath() + " was not produced");
                }
                String digest = artifactStore.put(artifact);
                return result(job, builderId, attempt, BuilderStatus.SUCCESS, digest, artifactStore.size(digest),
                        start, logRef, sandboxId, null);
            }
        } catch (RuntimeException e) {
            log.warn("Builder {} attempt {} for job {} failed: {}", builderId, attempt, job.jobId(), e.getMessage());
            return result(job, builderId, attempt, BuilderStatus.FAILED, null, -1, start,
                    logRef, sandboxId, e.getMessage());
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Appends an attempt to the job and audits it. Attempts that finish after the job went
     * terminal (cancelled, timed out) are dropped.
     *
     * @return false if the job was already terminal
     */
    private boolean recordResult(JobRecord record, BuilderResult result) {
        metrics.recordBuilderAttempt(result.status().name().toLowerCase(), result.durationMs());
        Map<String, String> payload = new LinkedHashMap<>();
        payload.put("builder_id", result.builderId());
        payload.put("attempt", String.valueOf(result.attempt()));
        payload.put("status", result.status().name());
        if (result.digest() != null) {
            payload.put("digest", result.digest());
        }
        if (result.detail() != null) {
            payload.put("detail", result.detail());
        }
        synchronized (record) {
            if (record.status.isTerminal()) {
                log.debug("Dropping {} attempt {} of {} job {}", result.builderId(), result.attempt(),
                        record.status, result.jobId());
                return false;
            }
            record.results.add(result);
            record.updatedAt = now();
            auditLog.append(AuditEvent.forJob(result.jobId(), "builder.completed", payload));
        }
        return true;
    }

    private void auditDecision(String jobId, VerificationDecision decision, int round) {
        Map<String, String> payload = new LinkedHashMap<>();
        payload.put("decision_id", decision.decisionId());
        payload.put("outcome", decision.outcome().name());
        if (decision.winningDigest() != null) {
            payload.put("winning_digest", decision.winningDigest());
        }
        payload.put("agreeing", String.valueOf(decision.agreeing().size()));
        payload.put("disagreeing", String.valueOf(decision.disagreeing().size()));
        if (!decision.diffReports().isEmpty()) {
            payload.put("diff_reports", diffReportIds(decision));
        }
        if (round > 0) {
            payload.put("round", String.valueOf(round));
        }
        auditLog.append(AuditEvent.forJob(jobId, "verification.decided", payload));
    }

    private static String diffReportIds(VerificationDecision decision) {
        return decision.diffReports().stream().map(DiffReport::reportId).collect(Collectors.joining(","));
    }

    private String storeLog(BuildJob job, String builderId, int attempt, SandboxLease lease) {
        try {
            return artifactStore.writeLog(job.jobId(), builderId, attempt, lease.output());
        } catch (RuntimeException e) {
            log.warn("Could not store build log for {} attempt {}: {}", builderId, attempt, e.getMessage());
            return null;
        }
    }

    private BuilderResult result(BuildJob job, String builderId, int attempt, BuilderStatus status, String digest,
                                 long size, long startNanos, String logRef, String sandboxId, String detail) {
        long durationMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
        return new BuilderResult(job.jobId(), builderId, attempt, status, digest, size, durationMs,
                logRef, sandboxId, detail, now());
    }

    private Map<String, String> environment(BuildJob job, BuildProperties.Recipe recipe) {
        Map<String, String> env = new LinkedHashMap<>(recipe.getEnv());
        env.putAll(job.recipeParameters());
        env.put(SOURCE_LOCATOR_ENV, job.source().locator());
        env.put(SOURCE_REVISION_ENV, job.source().revision());
        return env;
    }

    private void validate(BuildJobRequest request) {
        if (request == null) {
            throw ProvenantException.invalid("Build job request is required");
        }
        if (request.applicationId() == null || request.applicationId().isBlank()) {
            throw ProvenantException.invalid("application_id is required");
        }
        if (request.source() == null || request.source().locator() == null || request.source().revision() == null) {
            throw ProvenantException.invalid("source.locator and source.revision are required");
        }
        recipe(request.recipeId());
        if (request.n() < 1 || request.k() < 1 || request.k() > request.n()) {
            throw ProvenantException.invalid("Require 1 <= k <= n (got n=" + request.n() + ", k=" + request.k() + ")");
        }
        if (request.n() > sandboxPool.size()) {
            throw ProvenantException.invalid("n=" + request.n() + " exceeds the " + sandboxPool.size()
                    + " configured builder node(s)");
        }
        for (String name : request.recipeParameters().keySet()) {
            if (!PARAMETER_NAME.matcher(name).matches()
                    || name.equals(SOURCE_LOCATOR_ENV) || name.equals(SOURCE_REVISION_ENV)
                    || name.startsWith("PROVENANT_")) {
                throw ProvenantException.invalid("Invalid recipe parameter name: " + name);
            }
        }
    }

    private BuildProperties.Recipe recipe(String recipeId) {
        BuildProperties.Recipe recipe = recipeId != null ? properties.getRecipes().get(recipeId) : null;
        if (recipe == null || recipe.getImage() == null) {
            throw ProvenantException.invalid("Unknown recipe: " + recipeId);
        }
        return recipe;
    }

    private boolean isTerminal(JobRecord record) {
        synchronized (record) {
            return record.status.isTerminal();
        }
    }

    private JobRecord record(String jobId) {
        JobRecord record = jobs.get(jobId);
        if (record == null) {
            throw ProvenantException.notFound("Job", jobId);
        }
        return record;
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    private static final class JobRecord {
        final BuildJob job;
        JobStatus status = JobStatus.PENDING;
        RejectionReason reason;
        final List<BuilderResult> results = new ArrayList<>();
        VerificationDecision decision;
        Instant updatedAt;
        Future<?> coordinator;
        final List<Future<BuilderResult>> builders = new ArrayList<>();
        int round;

        JobRecord(BuildJob job) {
            this.job = job;
            this.updatedAt = job.submittedAt();
        }

        void reject(RejectionReason rejectionReason, Instant at) {
            status = JobStatus.REJECTED;
            reason = rejectionReason;
            updatedAt = at;
        }

        void cancelBuilders() {
            builders.forEach(f -> f.cancel(true));
        }

        void cancelWork() {
            cancelBuilders();
            if (coordinator != null) {
                coordinator.cancel(true);
            }
        }

        JobSnapshot snapshot() {
            return new JobSnapshot(job, status, reason, results, decision, updatedAt);
        }
    }
}
