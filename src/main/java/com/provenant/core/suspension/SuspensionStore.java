package com.provenant.core.suspension;

import com.provenant.core.model.SuspensionRecord;

import java.util.List;
import java.util.Optional;

/**
 * Append-only storage for suspension decisions.
 */
public interface SuspensionStore {

    void append(SuspensionRecord record);

    /** Most recent decision for the target, if any. */
    Optional<SuspensionRecord> latest(SuspensionRecord.TargetType targetType, String targetId);

    List<SuspensionRecord> history(SuspensionRecord.TargetType targetType, String targetId);
}
