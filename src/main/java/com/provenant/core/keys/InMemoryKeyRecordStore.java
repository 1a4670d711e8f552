package com.provenant.core.keys;

import com.provenant.core.model.KeyRecord;
import com.provenant.core.model.KeyState;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryKeyRecordStore implements KeyRecordStore {

    private final ConcurrentHashMap<String, KeyRecord> keys = new ConcurrentHashMap<>();

    @Override
    public void insert(KeyRecord key) {
        if (keys.putIfAbsent(key.keyId(), key) != null) {
            throw new IllegalStateException("Key " + key.keyId() + " already exists");
        }
    }

    @Override
    public boolean markRevoked(KeyRecord revoked) {
        KeyRecord current = keys.get(revoked.keyId());
        return current != null && current.state() == KeyState.ACTIVE
                && keys.replace(revoked.keyId(), current, revoked);
    }

    @Override
    public Optional<KeyRecord> find(String keyId) {
        return Optional.ofNullable(keys.get(keyId));
    }

    @Override
    public List<KeyRecord> findAll() {
        var all = new ArrayList<>(keys.values());
        all.sort(Comparator.comparing(KeyRecord::createdAt).thenComparing(KeyRecord::keyId));
        return all;
    }
}
