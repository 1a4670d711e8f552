package com.provenant.core.signing;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "provenant.quorum")
public class QuorumProperties {

    /** Number of distinct approvals (M) required to sign or revoke. */
    private int threshold = 2;
    private int deadlineMinutes = 1440;
    private int sweepIntervalSeconds = 60;
    private ResubmissionPolicy resubmissionPolicy = ResubmissionPolicy.REBUILD;

    /** Authorizer id to base64 X.509 Ed25519 public key. */
    private Map<String, String> authorizers = new LinkedHashMap<>();

    /** Authorizers who must all approve a key ceremony. */
    private List<String> ceremonyParticipants = new ArrayList<>();

    public enum ResubmissionPolicy { REBUILD, REVERIFY }

    public int getThreshold() { return threshold; }
    public void setThreshold(int threshold) { this.threshold = threshold; }
    public int getDeadlineMinutes() { return deadlineMinutes; }
    public void setDeadlineMinutes(int deadlineMinutes) { this.deadlineMinutes = deadlineMinutes; }
    public int getSweepIntervalSeconds() { return sweepIntervalSeconds; }
    public void setSweepIntervalSeconds(int sweepIntervalSeconds) { this.sweepIntervalSeconds = sweepIntervalSeconds; }
    public ResubmissionPolicy getResubmissionPolicy() { return resubmissionPolicy; }
    public void setResubmissionPolicy(ResubmissionPolicy resubmissionPolicy) { this.resubmissionPolicy = resubmissionPolicy; }
    public Map<String, String> getAuthorizers() { return authorizers; }
    public void setAuthorizers(Map<String, String> authorizers) { this.authorizers = authorizers; }
    public List<String> getCeremonyParticipants() { return ceremonyParticipants; }
    public void setCeremonyParticipants(List<String> ceremonyParticipants) { this.ceremonyParticipants = ceremonyParticipants; }
}
