package com.provenant.dispatch.api;

import com.provenant.core.error.ProvenantException;
import com.provenant.core.keys.KeyCeremony;
import com.provenant.core.keys.KeyHierarchyManager;
import com.provenant.core.model.KeyRecord;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Key hierarchy administration. Responses carry public material and HSM handles only.
 */
@RestController
@RequestMapping("/api/v1/keys")
public class KeyController {

    private final KeyHierarchyManager keyManager;

    public KeyController(KeyHierarchyManager keyManager) {
        this.keyManager = keyManager;
    }

    @PostMapping
    public ResponseEntity<KeyRecord> create(@RequestBody KeyCeremonyRequest body) {
        if (body.role() == null || body.scope() == null || body.scope().isBlank()) {
            throw ProvenantException.invalid("role and scope are required");
        }
        KeyRecord key = keyManager.createKey(new KeyCeremony(body.role(), body.scope(), body.parentKeyId(),
                body.approvals()));
        return ResponseEntity.status(HttpStatus.CREATED).body(key);
    }

    @PostMapping("/{keyId}/revoke")
    public KeyRecord revoke(@PathVariable String keyId, @RequestBody KeyRevocationRequest body) {
        if (body.reason() == null || body.reason().isBlank()) {
            throw ProvenantException.invalid("reason is required");
        }
        return keyManager.revoke(keyId, body.approvals() != null ? body.approvals() : List.of(), body.reason());
    }

    @GetMapping
    public List<KeyRecord> list() {
        return keyManager.list();
    }

    @GetMapping("/{keyId}")
    public KeyRecord get(@PathVariable String keyId) {
        return keyManager.get(keyId).orElseThrow(() -> ProvenantException.notFound("Key", keyId));
    }
}
