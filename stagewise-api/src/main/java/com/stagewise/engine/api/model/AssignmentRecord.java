package com.stagewise.engine.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Audit entry for a committed sequencing decision.
 *
 * @param decisionPointId node whose children were ordered, selected or picked
 * @param value           committed branch id, comma-joined order or pick list
 * @param reason          human-readable reason reported by the sequencer
 * @param assignedAt      when the decision was committed
 */
public record AssignmentRecord(
        @JsonProperty("decision_point_id") String decisionPointId,
        @JsonProperty("value") String value,
        @JsonProperty("reason") String reason,
        @JsonProperty("assigned_at") Instant assignedAt
) {
}
