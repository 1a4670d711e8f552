package com.provenant.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.Instant;

/**
 * An append-only suspension or lift decision.
 *
 * @param recordId   unique id
 * @param targetType artifact or whole application
 * @param targetId   artifact id (digest) or application package id
 * @param action     suspend or lift
 * @param reason     operator-supplied reason
 * @param authority  subject of the authority token that authorized the action
 * @param recordedAt when the decision took effect
 */
public record SuspensionRecord(
    @JsonProperty("record_id") String recordId,
    @JsonProperty("target_type") TargetType targetType,
    @JsonProperty("target_id") String targetId,
    Action action,
    String reason,
    String authority,
    @JsonProperty("recorded_at") Instant recordedAt
) implements Serializable {

    public enum TargetType { ARTIFACT, APPLICATION }

    public enum Action { SUSPEND, LIFT }
}
