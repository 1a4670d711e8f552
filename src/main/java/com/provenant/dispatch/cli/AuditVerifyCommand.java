package com.provenant.dispatch.cli;

import com.provenant.core.audit.AuditLog;
import com.provenant.core.audit.ChainVerification;
import com.provenant.core.model.AuditEntry;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.concurrent.Callable;

/**
 * CLI command: provenant audit-verify [--from N] [--to M]
 * <p>
 * Recomputes the audit hash chain. Exit code 0 when intact, 1 when a link is broken.
 */
@Command(name = "audit-verify", mixinStandardHelpOptions = true,
        description = "Verify the audit log hash chain")
@Component
public class AuditVerifyCommand implements Callable<Integer> {

    @Option(names = "--from", defaultValue = "0", description = "First sequence (default: ${DEFAULT-VALUE})")
    private long from;

    @Option(names = "--to", description = "Last sequence; defaults to the chain head")
    private Long to;

    private final AuditLog auditLog;

    public AuditVerifyCommand(AuditLog auditLog) {
        this.auditLog = auditLog;
    }

    @Override
    public Integer call() {
        long toSeq = to != null ? to : auditLog.head().map(AuditEntry::sequence).orElse(-1L);
        if (toSeq < from) {
            ConsoleOutput.info("Audit log has no entries in range " + from + ".." + toSeq);
            return 0;
        }
        ChainVerification result = auditLog.inspectChain(from, toSeq);
        if (result.valid()) {
            ConsoleOutput.success("Audit chain intact (" + result.entriesChecked() + " entries, "
                    + from + ".." + toSeq + ")");
            return 0;
        }
        ConsoleOutput.error("Audit chain BROKEN at sequence " + result.firstBrokenSequence() + ": " + result.detail());
        return 1;
    }
}
