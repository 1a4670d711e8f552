package com.provenant.core.suspension;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "provenant.suspension")
public class SuspensionProperties {

    /** HMAC secret for suspension authority tokens; at least 32 bytes. */
    private String authoritySecret;
    private int tokenTtlSeconds = 900;
    private String issuer = "provenant-suspension-authority";

    public String getAuthoritySecret() { return authoritySecret; }
    public void setAuthoritySecret(String authoritySecret) { this.authoritySecret = authoritySecret; }
    public int getTokenTtlSeconds() { return tokenTtlSeconds; }
    public void setTokenTtlSeconds(int tokenTtlSeconds) { this.tokenTtlSeconds = tokenTtlSeconds; }
    public String getIssuer() { return issuer; }
    public void setIssuer(String issuer) { this.issuer = issuer; }
}
