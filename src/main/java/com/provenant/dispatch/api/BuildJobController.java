package com.provenant.dispatch.api;

import com.provenant.core.audit.AuditLog;
import com.provenant.core.build.BuildOrchestrator;
import com.provenant.core.model.AuditEntry;
import com.provenant.core.model.JobSnapshot;
import com.provenant.core.signing.QuorumSigningService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.List;
import java.util.Map;

/**
 * REST controller for build job lifecycle operations.
 */
@RestController
@RequestMapping("/api/v1/build-jobs")
public class BuildJobController {

    private static final Logger log = LoggerFactory.getLogger(BuildJobController.class);

    private final BuildOrchestrator orchestrator;
    private final QuorumSigningService signingService;
    private final AuditLog auditLog;
    private final SseStreamingService sseStreamingService;

    public BuildJobController(BuildOrchestrator orchestrator, QuorumSigningService signingService,
                              AuditLog auditLog, SseStreamingService sseStreamingService) {
        this.orchestrator = orchestrator;
        this.signingService = signingService;
        this.auditLog = auditLog;
        this.sseStreamingService = sseStreamingService;
    }

    /**
     * POST /api/v1/build-jobs: Submit a build job. Builds run asynchronously.
     */
    @PostMapping
    public ResponseEntity<Map<String, String>> submit(@RequestBody BuildJobRequestBody body) {
        String jobId = orchestrator.submit(body.toRequest());
        JobSnapshot snapshot = orchestrator.status(jobId);
        log.info("Accepted build job {} for {}", jobId, body.applicationId());
        return ResponseEntity.accepted().body(Map.of(
                "job_id", jobId,
                "state", snapshot.status().name()));
    }

    /**
     * GET /api/v1/build-jobs: Summaries of all known jobs.
     */
    @GetMapping
    public List<Map<String, String>> list() {
        return orchestrator.list().stream()
                .map(s -> Map.of(
                        "job_id", s.job().jobId(),
                        "application_id", s.job().applicationId(),
                        "state", s.status().name()))
                .toList();
    }

    /**
     * GET /api/v1/build-jobs/{jobId}: Job state, builder results, decision and signing request.
     */
    @GetMapping("/{jobId}")
    public BuildJobResponse get(@PathVariable String jobId) {
        JobSnapshot snapshot = orchestrator.status(jobId);
        List<Long> sequences = auditLog.entriesForJob(jobId).stream()
                .map(AuditEntry::sequence)
                .toList();
        return BuildJobResponse.from(snapshot, signingService.find(jobId).orElse(null), sequences);
    }

    /**
     * POST /api/v1/build-jobs/{jobId}/cancel: Cancel a job that has not been decided yet.
     */
    @PostMapping("/{jobId}/cancel")
    public Map<String, String> cancel(@PathVariable String jobId) {
        JobSnapshot snapshot = orchestrator.cancel(jobId);
        return Map.of("job_id", jobId, "state", snapshot.status().name());
    }

    /**
     * GET /api/v1/build-jobs/{jobId}/events: SSE stream of the job's audit entries, replayed
     * from the start (or after {@code Last-Event-ID}) and then followed live.
     */
    @GetMapping(value = "/{jobId}/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public ResponseEntity<SseEmitter> events(@PathVariable String jobId,
                                             @RequestHeader(value = "Last-Event-ID", required = false) Long lastEventId) {
        orchestrator.status(jobId);
        return ResponseEntity.ok(sseStreamingService.createEmitter(jobId, lastEventId));
    }
}
