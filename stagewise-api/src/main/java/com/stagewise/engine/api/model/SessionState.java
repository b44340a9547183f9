/*
 * Copyright (c) 2025 Stagewise Navigation Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.stagewise.engine.api.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Persisted navigation state of one participant run.
 *
 * <p>Everything the engine needs to reproduce the visible unit list is stored
 * here: the definition version, committed {@code assignments}, the
 * {@code pickLedger}, the completed units and the {@code randomizationSeed}.
 * Recomputing visibility from these fields is idempotent, which is what makes
 * recovery after a crash or reconnect correct.
 *
 * <p>Instances are immutable; the engine derives new states through
 * {@link #toBuilder()}. {@code version} is the optimistic-locking version of
 * the stored document.
 */
public record SessionState(
        @JsonProperty("session_id") String sessionId,
        @JsonProperty("experiment_id") String experimentId,
        @JsonProperty("definition_version") int definitionVersion,
        @JsonProperty("user_id") String userId,
        @JsonProperty("status") SessionStatus status,
        @JsonProperty("current_unit_id") String currentUnitId,
        @JsonProperty("return_unit_id") String returnUnitId,
        @JsonProperty("return_expires_at") Instant returnExpiresAt,
        @JsonProperty("visible_unit_ids") List<String> visibleUnitIds,
        @JsonProperty("completed_unit_ids") Set<String> completedUnitIds,
        @JsonProperty("completed_block_ids") Map<String, Set<String>> completedBlockIds,
        @JsonProperty("completed_stage_ids") Set<String> completedStageIds,
        @JsonProperty("completed_phase_ids") Set<String> completedPhaseIds,
        @JsonProperty("unit_status") Map<String, UnitStatus> unitStatus,
        @JsonProperty("assignments") Map<String, String> assignments,
        @JsonProperty("pick_ledger") Map<String, List<Object>> pickLedger,
        @JsonProperty("quota_decisions") Map<String, QuotaDecision> quotaDecisions,
        @JsonProperty("recorded_completions") Set<String> recordedCompletions,
        @JsonProperty("randomization_seed") long randomizationSeed,
        @JsonProperty("data") Map<String, Map<String, Object>> data,
        @JsonProperty("version") long version,
        @JsonProperty("created_at") Instant createdAt,
        @JsonProperty("updated_at") Instant updatedAt
) {
    public SessionState {
        if (status == null) status = SessionStatus.ACTIVE;
        visibleUnitIds = visibleUnitIds == null ? List.of() : List.copyOf(visibleUnitIds);
        completedUnitIds = frozenSet(completedUnitIds);
        completedBlockIds = frozenSetMap(completedBlockIds);
        completedStageIds = frozenSet(completedStageIds);
        completedPhaseIds = frozenSet(completedPhaseIds);
        unitStatus = frozenMap(unitStatus);
        assignments = frozenMap(assignments);
        pickLedger = frozenListMap(pickLedger);
        quotaDecisions = frozenMap(quotaDecisions);
        recordedCompletions = frozenSet(recordedCompletions);
        data = frozenMap(data);
    }

    @JsonIgnore
    public boolean isActive() {
        return status == SessionStatus.ACTIVE;
    }

    @JsonIgnore
    public boolean isCompleted(String unitId) {
        return completedUnitIds.contains(unitId);
    }

    /**
     * Status of a unit, {@link UnitStatus#PENDING} when never touched.
     */
    public UnitStatus statusOf(String unitId) {
        return unitStatus.getOrDefault(unitId, UnitStatus.PENDING);
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    public static Builder builder() {
        return new Builder();
    }

    private static <T> Set<T> frozenSet(Set<T> source) {
        return source == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(source));
    }

    private static <K, V> Map<K, V> frozenMap(Map<K, V> source) {
        return source == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }

    private static Map<String, Set<String>> frozenSetMap(Map<String, Set<String>> source) {
        if (source == null) {
            return Map.of();
        }
        Map<String, Set<String>> copy = new LinkedHashMap<>();
        source.forEach((key, value) -> copy.put(key, frozenSet(value)));
        return Collections.unmodifiableMap(copy);
    }

    private static Map<String, List<Object>> frozenListMap(Map<String, List<Object>> source) {
        if (source == null) {
            return Map.of();
        }
        Map<String, List<Object>> copy = new LinkedHashMap<>();
        source.forEach((key, value) -> copy.put(key,
                value == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(value))));
        return Collections.unmodifiableMap(copy);
    }

    /**
     * Mutable working copy. Collection accessors return the live collections
     * being built so callers can update them in place.
     */
    public static final class Builder {
        private String sessionId;
        private String experimentId;
        private int definitionVersion;
        private String userId;
        private SessionStatus status = SessionStatus.ACTIVE;
        private String currentUnitId;
        private String returnUnitId;
        private Instant returnExpiresAt;
        private List<String> visibleUnitIds = new ArrayList<>();
        private final Set<String> completedUnitIds = new LinkedHashSet<>();
        private final Map<String, Set<String>> completedBlockIds = new LinkedHashMap<>();
        private final Set<String> completedStageIds = new LinkedHashSet<>();
        private final Set<String> completedPhaseIds = new LinkedHashSet<>();
        private final Map<String, UnitStatus> unitStatus = new LinkedHashMap<>();
        private final Map<String, String> assignments = new LinkedHashMap<>();
        private final Map<String, List<Object>> pickLedger = new LinkedHashMap<>();
        private final Map<String, QuotaDecision> quotaDecisions = new LinkedHashMap<>();
        private final Set<String> recordedCompletions = new LinkedHashSet<>();
        private long randomizationSeed;
        private final Map<String, Map<String, Object>> data = new LinkedHashMap<>();
        private long version;
        private Instant createdAt;
        private Instant updatedAt;

        private Builder() {
        }

        private Builder(SessionState state) {
            this.sessionId = state.sessionId;
            this.experimentId = state.experimentId;
            this.definitionVersion = state.definitionVersion;
            this.userId = state.userId;
            this.status = state.status;
            this.currentUnitId = state.currentUnitId;
            this.returnUnitId = state.returnUnitId;
            this.returnExpiresAt = state.returnExpiresAt;
            this.visibleUnitIds = new ArrayList<>(state.visibleUnitIds);
            this.completedUnitIds.addAll(state.completedUnitIds);
            state.completedBlockIds.forEach((stage, blocks) ->
                    this.completedBlockIds.put(stage, new LinkedHashSet<>(blocks)));
            this.completedStageIds.addAll(state.completedStageIds);
            this.completedPhaseIds.addAll(state.completedPhaseIds);
            this.unitStatus.putAll(state.unitStatus);
            this.assignments.putAll(state.assignments);
            state.pickLedger.forEach((variable, values) ->
                    this.pickLedger.put(variable, new ArrayList<>(values)));
            this.quotaDecisions.putAll(state.quotaDecisions);
            this.recordedCompletions.addAll(state.recordedCompletions);
            this.randomizationSeed = state.randomizationSeed;
            this.data.putAll(state.data);
            this.version = state.version;
            this.createdAt = state.createdAt;
            this.updatedAt = state.updatedAt;
        }

        public Builder sessionId(String sessionId) {
            this.sessionId = sessionId;
            return this;
        }

        public Builder experimentId(String experimentId) {
            this.experimentId = experimentId;
            return this;
        }

        public Builder definitionVersion(int definitionVersion) {
            this.definitionVersion = definitionVersion;
            return this;
        }

        public Builder userId(String userId) {
            this.userId = userId;
            return this;
        }

        public Builder status(SessionStatus status) {
            this.status = status;
            return this;
        }

        public Builder currentUnitId(String currentUnitId) {
            this.currentUnitId = currentUnitId;
            return this;
        }

        public Builder returnPoint(String returnUnitId, Instant expiresAt) {
            this.returnUnitId = returnUnitId;
            this.returnExpiresAt = expiresAt;
            return this;
        }

        public Builder visibleUnitIds(List<String> visibleUnitIds) {
            this.visibleUnitIds = new ArrayList<>(visibleUnitIds);
            return this;
        }

        public Builder randomizationSeed(long randomizationSeed) {
            this.randomizationSeed = randomizationSeed;
            return this;
        }

        public Builder version(long version) {
            this.version = version;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public String sessionId() {
            return sessionId;
        }

        public String currentUnitId() {
            return currentUnitId;
        }

        public List<String> visibleUnitIds() {
            return visibleUnitIds;
        }

        public Set<String> completedUnitIds() {
            return completedUnitIds;
        }

        public Map<String, Set<String>> completedBlockIds() {
            return completedBlockIds;
        }

        public Set<String> completedStageIds() {
            return completedStageIds;
        }

        public Set<String> completedPhaseIds() {
            return completedPhaseIds;
        }

        public Map<String, UnitStatus> unitStatus() {
            return unitStatus;
        }

        public Map<String, String> assignments() {
            return assignments;
        }

        public Map<String, List<Object>> pickLedger() {
            return pickLedger;
        }

        public Map<String, QuotaDecision> quotaDecisions() {
            return quotaDecisions;
        }

        public Set<String> recordedCompletions() {
            return recordedCompletions;
        }

        public Map<String, Map<String, Object>> data() {
            return data;
        }

        public long randomizationSeed() {
            return randomizationSeed;
        }

        public SessionState build() {
            return new SessionState(sessionId, experimentId, definitionVersion, userId, status,
                    currentUnitId, returnUnitId, returnExpiresAt, visibleUnitIds, completedUnitIds,
                    completedBlockIds, completedStageIds, completedPhaseIds, unitStatus, assignments,
                    pickLedger, quotaDecisions, recordedCompletions, randomizationSeed, data,
                    version, createdAt, updatedAt);
        }
    }
}
