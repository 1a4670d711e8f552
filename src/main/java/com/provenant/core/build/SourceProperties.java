package com.provenant.core.build;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "provenant.source")
public class SourceProperties {

    /** Reject unsigned source references. */
    private boolean requireSigned = true;

    /** Publisher id to base64 X.509 Ed25519 public key. */
    private Map<String, String> trustedSigners = new LinkedHashMap<>();

    public boolean isRequireSigned() { return requireSigned; }
    public void setRequireSigned(boolean requireSigned) { this.requireSigned = requireSigned; }
    public Map<String, String> getTrustedSigners() { return trustedSigners; }
    public void setTrustedSigners(Map<String, String> trustedSigners) { this.trustedSigners = trustedSigners; }
}
