package com.provenant.core.audit;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Result of recomputing a range of the audit hash chain.
 *
 * @param valid               true when every entry in range hashes and links correctly
 * @param entriesChecked      number of entries examined before stopping
 * @param firstBrokenSequence first sequence that failed; null when valid
 * @param detail              human-readable description of the failure; null when valid
 */
public record ChainVerification(
    boolean valid,
    @JsonProperty("entries_checked") long entriesChecked,
    @JsonProperty("first_broken_sequence") Long firstBrokenSequence,
    String detail
) {

    public static ChainVerification ok(long entriesChecked) {
        return new ChainVerification(true, entriesChecked, null, null);
    }

    public static ChainVerification broken(long entriesChecked, long sequence, String detail) {
        return new ChainVerification(false, entriesChecked, sequence, detail);
    }
}
