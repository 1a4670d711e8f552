package com.provenant.core.signing;

import com.provenant.core.model.SigningRequest;

import java.util.List;

/**
 * Durable home of signing requests and the votes cast on them, so pending quorums and the
 * one-open-request-per-digest rule survive a restart.
 */
public interface SigningRequestStore {

    /**
     * Writes the current snapshot of a request, replacing any earlier snapshot and its votes.
     *
     * @param artifactSize size of the artifact to be published once signed, or -1 if unknown
     */
    void save(SigningRequest request, long artifactSize);

    /** Every stored request with its votes, oldest first. */
    List<StoredRequest> loadAll();

    record StoredRequest(SigningRequest request, long artifactSize) {}
}
