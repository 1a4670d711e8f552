package com.provenant.dispatch.api;

import com.provenant.core.error.ProvenantException;
import com.provenant.core.model.SigningRequest;
import com.provenant.core.signing.QuorumSigningService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * REST controller for quorum authorization of signing requests, addressed by job id.
 */
@RestController
@RequestMapping("/api/v1/signing-requests")
public class SigningRequestController {

    private final QuorumSigningService signingService;

    public SigningRequestController(QuorumSigningService signingService) {
        this.signingService = signingService;
    }

    @PostMapping("/{jobId}/authorize")
    public Map<String, String> authorize(@PathVariable String jobId, @RequestBody AuthorizeRequest body) {
        if (body.authorizerId() == null || body.decision() == null || body.digest() == null || body.proof() == null) {
            throw ProvenantException.invalid("authorizer_id, decision, digest and proof are required");
        }
        SigningRequest request = signingService.authorize(jobId, body.authorizerId(), body.decision(),
                body.digest(), body.proof());
        return Map.of(
                "quorum_state", request.quorumState().name(),
                "signing_state", request.state().name());
    }

    @GetMapping("/{jobId}")
    public SigningRequest get(@PathVariable String jobId) {
        return signingService.get(jobId);
    }

    @PostMapping("/{jobId}/retry")
    public SigningRequest retry(@PathVariable String jobId) {
        return signingService.retrySigning(jobId);
    }

    @PostMapping("/{jobId}/abandon")
    public SigningRequest abandon(@PathVariable String jobId) {
        return signingService.abandon(jobId);
    }

    /**
     * Resubmits an expired request; answers with the job that now carries the work.
     */
    @PostMapping("/{jobId}/resubmit")
    public Map<String, String> resubmit(@PathVariable String jobId) {
        return Map.of("job_id", signingService.resubmit(jobId));
    }
}
