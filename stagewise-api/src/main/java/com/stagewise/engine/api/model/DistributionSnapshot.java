package com.stagewise.engine.api.model;

import com.stagewise.engine.api.store.CounterSnapshot;

import java.time.Instant;
import java.util.Map;

/**
 * Per-branch counters of one decision point, for admin dashboards.
 */
public record DistributionSnapshot(
        String experimentId,
        String decisionPointId,
        Map<String, CounterSnapshot> branches,
        CounterSnapshot totals,
        Instant generatedAt
) {
    public DistributionSnapshot {
        branches = Map.copyOf(branches);
    }

    public static DistributionSnapshot of(String experimentId, String decisionPointId,
                                          Map<String, CounterSnapshot> branches, Instant generatedAt) {
        long started = 0;
        long completed = 0;
        long active = 0;
        for (CounterSnapshot snapshot : branches.values()) {
            started += snapshot.started();
            completed += snapshot.completed();
            active += snapshot.active();
        }
        return new DistributionSnapshot(experimentId, decisionPointId, branches,
                new CounterSnapshot(started, completed, active), generatedAt);
    }
}
