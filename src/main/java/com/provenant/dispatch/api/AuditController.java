package com.provenant.dispatch.api;

import com.provenant.core.audit.AuditLog;
import com.provenant.core.audit.ChainVerification;
import com.provenant.core.error.ProvenantException;
import com.provenant.core.model.AuditEntry;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Read access to the audit hash chain.
 */
@RestController
@RequestMapping("/api/v1/audit")
public class AuditController {

    private final AuditLog auditLog;

    public AuditController(AuditLog auditLog) {
        this.auditLog = auditLog;
    }

    /**
     * GET /api/v1/audit/verify?from=&to=: Recompute the chain. 409 if a link is broken.
     * Without bounds the whole chain is checked.
     */
    @GetMapping("/verify")
    public ResponseEntity<ChainVerification> verify(@RequestParam(name = "from", required = false) Long from,
                                                    @RequestParam(name = "to", required = false) Long to) {
        long fromSeq = from != null ? from : 0;
        long toSeq = to != null ? to : auditLog.head().map(AuditEntry::sequence).orElse(-1L);
        if (fromSeq < 0 || (toSeq >= 0 && toSeq < fromSeq)) {
            throw ProvenantException.invalid("Invalid range " + fromSeq + ".." + toSeq);
        }
        if (toSeq < 0) {
            return ResponseEntity.ok(ChainVerification.ok(0));
        }
        ChainVerification result = auditLog.inspectChain(fromSeq, toSeq);
        return result.valid()
                ? ResponseEntity.ok(result)
                : ResponseEntity.status(HttpStatus.CONFLICT).body(result);
    }

    /**
     * GET /api/v1/audit/{fromSeq}/{toSeq}: Entries in sequence order, both bounds inclusive.
     */
    @GetMapping("/{fromSeq}/{toSeq}")
    public List<AuditEntry> range(@PathVariable long fromSeq, @PathVariable long toSeq) {
        if (fromSeq < 0 || toSeq < fromSeq) {
            throw ProvenantException.invalid("Invalid range " + fromSeq + ".." + toSeq);
        }
        return auditLog.range(fromSeq, toSeq);
    }
}
