/*
 * Copyright (c) 2025 Stagewise Navigation Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.stagewise.engine.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Accumulated variables of one session that visibility rules can read.
 *
 * <p>Namespaces: {@code participant} (demographics and identity fields),
 * {@code environment} (device, browser, screen), {@code urlParams},
 * {@code responses} (submitted payloads keyed by unit id) and {@code scores}.
 * Committed assignments are read from the {@link SessionState}; the context
 * only keeps their audit history.
 */
public record ParticipantContext(
        @JsonProperty("session_id") String sessionId,
        @JsonProperty("experiment_id") String experimentId,
        @JsonProperty("user_id") String userId,
        @JsonProperty("participant") Map<String, Object> participant,
        @JsonProperty("environment") Map<String, Object> environment,
        @JsonProperty("url_params") Map<String, Object> urlParams,
        @JsonProperty("responses") Map<String, Object> responses,
        @JsonProperty("scores") Map<String, Object> scores,
        @JsonProperty("assignment_history") List<AssignmentRecord> assignmentHistory,
        @JsonProperty("version") long version,
        @JsonProperty("updated_at") Instant updatedAt
) {
    public ParticipantContext {
        participant = frozen(participant);
        environment = frozen(environment);
        urlParams = frozen(urlParams);
        responses = frozen(responses);
        scores = frozen(scores);
        assignmentHistory = assignmentHistory == null
                ? List.of() : Collections.unmodifiableList(new ArrayList<>(assignmentHistory));
    }

    public static ParticipantContext empty(String sessionId, String experimentId) {
        return new ParticipantContext(sessionId, experimentId, null, null, null, null,
                null, null, null, 0L, null);
    }

    public ParticipantContext withResponse(String unitId, Map<String, Object> payload) {
        Map<String, Object> updated = new LinkedHashMap<>(responses);
        updated.put(unitId, payload == null ? Map.of() : payload);
        return copy(participant, updated, scores, assignmentHistory);
    }

    public ParticipantContext withoutResponses(Collection<String> unitIds) {
        Map<String, Object> updated = new LinkedHashMap<>(responses);
        unitIds.forEach(updated::remove);
        return copy(participant, updated, scores, assignmentHistory);
    }

    public ParticipantContext withParticipantValues(Map<String, Object> values) {
        Map<String, Object> updated = new LinkedHashMap<>(participant);
        updated.putAll(values);
        return copy(updated, responses, scores, assignmentHistory);
    }

    public ParticipantContext withScore(String name, Object value) {
        Map<String, Object> updated = new LinkedHashMap<>(scores);
        updated.put(name, value);
        return copy(participant, responses, updated, assignmentHistory);
    }

    public ParticipantContext withAssignments(List<AssignmentRecord> records) {
        if (records.isEmpty()) {
            return this;
        }
        List<AssignmentRecord> updated = new ArrayList<>(assignmentHistory);
        updated.addAll(records);
        return copy(participant, responses, scores, updated);
    }

    public ParticipantContext withVersion(long newVersion, Instant at) {
        return new ParticipantContext(sessionId, experimentId, userId, participant, environment,
                urlParams, responses, scores, assignmentHistory, newVersion, at);
    }

    private ParticipantContext copy(Map<String, Object> newParticipant, Map<String, Object> newResponses,
                                    Map<String, Object> newScores, List<AssignmentRecord> newHistory) {
        return new ParticipantContext(sessionId, experimentId, userId, newParticipant, environment,
                urlParams, newResponses, newScores, newHistory, version, updatedAt);
    }

    private static Map<String, Object> frozen(Map<String, Object> source) {
        return source == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }
}
