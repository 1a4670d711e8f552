package com.provenant.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Provenant-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setJob(String jobId) {
        MDC.put("jobId", jobId);
    }

    public static void setBuilder(String jobId, String builderId, int attempt) {
        MDC.put("jobId", jobId);
        MDC.put("builderId", builderId);
        MDC.put("attempt", String.valueOf(attempt));
    }

    public static void setSigningRequest(String jobId, String signingRequestId) {
        if (jobId != null) {
            MDC.put("jobId", jobId);
        }
        MDC.put("signingRequestId", signingRequestId);
    }

    public static void clear() {
        MDC.remove("jobId");
        MDC.remove("builderId");
        MDC.remove("attempt");
        MDC.remove("signingRequestId");
    }
}
