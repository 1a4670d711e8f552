package com.provenant.core.verification;

import com.provenant.core.model.BuilderResult;
import com.provenant.core.model.DiffReport;
import com.provenant.core.model.VerificationDecision;
import com.provenant.core.model.VerificationOutcome;
import com.provenant.core.storage.ArtifactDigests;
import com.provenant.core.storage.ArtifactStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Decides whether independent builders reproduced the same artifact.
 * <p>
 * Deterministic: the same job id, threshold and results always produce the same decision,
 * including its id, so an auditor can re-run it offline. Only the latest attempt of each
 * builder is considered; only successful attempts with a digest count toward agreement.
 * Diff reports are diagnostic and never influence the outcome.
 */
@Service
public class VerificationEngine {

    private static final Logger log = LoggerFactory.getLogger(VerificationEngine.class);

    private final ArtifactStore artifactStore;
    private final int maxDiffRanges;

    public VerificationEngine(ArtifactStore artifactStore, VerificationProperties properties) {
        this.artifactStore = artifactStore;
        this.maxDiffRanges = properties.getMaxDiffRanges();
    }

    public VerificationDecision verify(String jobId, int k, List<BuilderResult> results, Instant decidedAt) {
        return verify(jobId, 0, k, results, decidedAt);
    }

    /**
     * @param round 0 for the first verification of a job; incremented each time the same
     *              results are re-verified so every round yields a distinct decision id
     */
    public VerificationDecision verify(String jobId, int round, int k, List<BuilderResult> results,
                                       Instant decidedAt) {
        if (k < 1) {
            throw new IllegalArgumentException("k must be at least 1, got " + k);
        }
        List<BuilderResult> finals = latestPerBuilder(results);
        List<BuilderResult> successes = finals.stream().filter(BuilderResult::isSuccess).toList();
        String decisionId = decisionId(jobId, round, k, finals);

        if (successes.size() < k) {
            log.info("Job {}: {} of {} required builders succeeded", jobId, successes.size(), k);
            return new VerificationDecision(decisionId, jobId, VerificationOutcome.INSUFFICIENT_BUILDERS,
                    null, k, List.of(), successes, List.of(), decidedAt);
        }

        // digest -> results, ordered by digest for stable pairings
        Map<String, List<BuilderResult>> groups = new TreeMap<>();
        for (BuilderResult r : successes) {
            groups.computeIfAbsent(r.digest(), d -> new ArrayList<>()).add(r);
        }
        int largest = groups.values().stream().mapToInt(List::size).max().orElse(0);
        List<String> largestDigests = groups.entrySet().stream()
                .filter(e -> e.getValue().size() == largest)
                .map(Map.Entry::getKey)
                .toList();

        if (largest < k || largestDigests.size() > 1) {
            List<String> digests = new ArrayList<>(groups.keySet());
            List<DiffReport> reports = new ArrayList<>();
            for (int i = 0; i < digests.size(); i++) {
                for (int j = i + 1; j < digests.size(); j++) {
                    reports.add(diffReport(groups, digests.get(i), digests.get(j)));
                }
            }
            log.warn("Job {}: NO CONSENSUS ({} distinct digests, largest group {} of required {})",
                    jobId, groups.size(), largest, k);
            return new VerificationDecision(decisionId, jobId, VerificationOutcome.NO_CONSENSUS,
                    null, k, List.of(), successes, reports, decidedAt);
        }

        String winner = largestDigests.get(0);
        List<BuilderResult> agreeing = groups.get(winner);
        List<BuilderResult> disagreeing = successes.stream().filter(r -> !winner.equals(r.digest())).toList();
        List<DiffReport> reports = new ArrayList<>();
        for (String dissent : groups.keySet()) {
            if (!dissent.equals(winner)) {
                reports.add(diffReport(groups, winner, dissent));
            }
        }
        log.info("Job {}: CONSENSUS on {} ({} of {} successful builders agree, {} required)",
                jobId, winner, agreeing.size(), successes.size(), k);
        return new VerificationDecision(decisionId, jobId, VerificationOutcome.CONSENSUS,
                winner, k, agreeing, disagreeing, reports, decidedAt);
    }

    /** Highest attempt per builder, ordered by builder id. */
    static List<BuilderResult> latestPerBuilder(List<BuilderResult> results) {
        Map<String, BuilderResult> latest = new TreeMap<>();
        for (BuilderResult r : results) {
            latest.merge(r.builderId(), r, (a, b) -> b.attempt() > a.attempt() ? b : a);
        }
        return List.copyOf(latest.values());
    }

    static String decisionId(String jobId, int round, int k, List<BuilderResult> finals) {
        StringBuilder material = new StringBuilder(jobId).append('|').append(k);
        if (round > 0) {
            material.append("|round=").append(round);
        }
        finals.stream()
                .sorted(Comparator.comparing(BuilderResult::builderId))
                .forEach(r -> material.append('|').append(r.builderId())
                        .append(':').append(r.attempt())
                        .append(':').append(r.status())
                        .append(':').append(r.digest()));
        return "dec-" + ArtifactDigests.sha256Hex(material.toString().getBytes(StandardCharsets.UTF_8))
                .substring(0, 32);
    }

    private DiffReport diffReport(Map<String, List<BuilderResult>> groups, String left, String right) {
        long leftSize = groups.get(left).get(0).artifactSize();
        long rightSize = groups.get(right).get(0).artifactSize();
        String reportId = "diff-" + ArtifactDigests.sha256Hex(
                (left + "|" + right).getBytes(StandardCharsets.UTF_8)).substring(0, 16);

        Optional<Path> leftPath = artifactStore.locate(left);
        Optional<Path> rightPath = artifactStore.locate(right);
        if (leftPath.isEmpty() || rightPath.isEmpty()) {
            return new DiffReport(reportId, left, right, leftSize, rightSize, List.of(), false);
        }
        try (InputStream a = Files.newInputStream(leftPath.get());
             InputStream b = Files.newInputStream(rightPath.get())) {
            BinaryDiffer.Result diff = BinaryDiffer.diff(a, b, maxDiffRanges);
            return new DiffReport(reportId, left, right, leftSize, rightSize, diff.deltas(), diff.truncated());
        } catch (IOException e) {
            log.warn("Could not diff {} against {}: {}", left, right, e.getMessage());
            return new DiffReport(reportId, left, right, leftSize, rightSize, List.of(), false);
        }
    }
}
