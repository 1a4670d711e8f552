package com.provenant.core.verification;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "provenant.verification")
public class VerificationProperties {

    /** Differing byte ranges recorded per diff report before it is marked truncated. */
    private int maxDiffRanges = 64;

    public int getMaxDiffRanges() { return maxDiffRanges; }
    public void setMaxDiffRanges(int maxDiffRanges) { this.maxDiffRanges = maxDiffRanges; }
}
