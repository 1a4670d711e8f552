package com.provenant.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for the build, verification and signing pipeline.
 */
@Service
public class ProvenantMetrics {

    private final MeterRegistry registry;

    public ProvenantMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordJobOutcome(String outcome) {
        Counter.builder("provenant.jobs.total")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordBuilderAttempt(String status, long ms) {
        Timer.builder("provenant.builder.duration")
                .tag("status", status)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordVerificationOutcome(String outcome) {
        Counter.builder("provenant.verification.outcomes")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordSigningOutcome(String state) {
        Counter.builder("provenant.signing.outcomes")
                .tag("state", state)
                .register(registry)
                .increment();
    }

    /**
     * Records a security-relevant event such as an authorization mismatch or a rejected
     * suspension token. Alerting keys off this counter.
     *
     * @param type short event type, e.g. "authorization-mismatch"
     */
    public void recordSecurityEvent(String type) {
        Counter.builder("provenant.security.events")
                .description("Security-relevant rejections")
                .tag("type", type)
                .register(registry)
                .increment();
    }

    public void recordAuditAppend() {
        Counter.builder("provenant.audit.appends")
                .register(registry)
                .increment();
    }

    public void recordChainBreak() {
        Counter.builder("provenant.audit.chain_breaks")
                .description("Audit hash-chain verifications that found a broken link")
                .register(registry)
                .increment();
    }
}
