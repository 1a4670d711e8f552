package com.provenant.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;

/**
 * Binary-level comparison of two disagreeing artifacts. Diagnostic only.
 *
 * @param reportId    deterministic id derived from the two digests
 * @param leftDigest  digest of the first artifact (lexicographically smaller, or the consensus winner)
 * @param rightDigest digest of the second artifact
 * @param leftSize    size of the first artifact, -1 if its bytes were unavailable
 * @param rightSize   size of the second artifact, -1 if its bytes were unavailable
 * @param deltas      differing byte ranges in ascending offset order
 * @param truncated   true when more ranges differ than the configured cap
 */
public record DiffReport(
    @JsonProperty("report_id") String reportId,
    @JsonProperty("left_digest") String leftDigest,
    @JsonProperty("right_digest") String rightDigest,
    @JsonProperty("left_size") long leftSize,
    @JsonProperty("right_size") long rightSize,
    List<ByteRangeDelta> deltas,
    boolean truncated
) implements Serializable {

    public DiffReport {
        deltas = deltas != null ? List.copyOf(deltas) : List.of();
    }
}
