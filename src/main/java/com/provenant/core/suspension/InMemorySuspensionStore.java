package com.provenant.core.suspension;

import com.provenant.core.model.SuspensionRecord;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public class InMemorySuspensionStore implements SuspensionStore {

    private final List<SuspensionRecord> records = new ArrayList<>();

    @Override
    public synchronized void append(SuspensionRecord record) {
        records.add(record);
    }

    @Override
    public synchronized Optional<SuspensionRecord> latest(SuspensionRecord.TargetType targetType, String targetId) {
        for (int i = records.size() - 1; i >= 0; i--) {
            SuspensionRecord r = records.get(i);
            if (r.targetType() == targetType && r.targetId().equals(targetId)) {
                return Optional.of(r);
            }
        }
        return Optional.empty();
    }

    @Override
    public synchronized List<SuspensionRecord> history(SuspensionRecord.TargetType targetType, String targetId) {
        return records.stream()
                .filter(r -> r.targetType() == targetType && r.targetId().equals(targetId))
                .toList();
    }
}
