package com.provenant.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * Pinned source input for a build job, as handed over by source ingress.
 *
 * @param locator   repository URL the builders clone from
 * @param revision  commit hash or tag the build is pinned to
 * @param signerId  identity of the publisher who signed the revision; nullable when unsigned
 * @param signature base64 signature over {@link #signedPayload()}; nullable when unsigned
 */
public record SourceReference(
    String locator,
    String revision,
    @JsonProperty("signer_id") String signerId,
    String signature
) implements Serializable {

    @JsonIgnore
    public boolean isSigned() {
        return signerId != null && !signerId.isBlank()
                && signature != null && !signature.isBlank();
    }

    /** The exact bytes a publisher signs: locator and revision separated by a newline. */
    public String signedPayload() {
        return locator + "\n" + revision;
    }
}
