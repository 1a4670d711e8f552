package com.provenant.core.keys;

import com.provenant.core.model.KeyRecord;

import java.util.List;
import java.util.Optional;

public interface KeyRecordStore {

    void insert(KeyRecord key);

    /** Marks an active key revoked. Returns false if it was not active. */
    boolean markRevoked(KeyRecord revoked);

    Optional<KeyRecord> find(String keyId);

    List<KeyRecord> findAll();
}
