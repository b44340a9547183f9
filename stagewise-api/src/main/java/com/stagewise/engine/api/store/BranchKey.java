package com.stagewise.engine.api.store;

import java.util.Objects;

/**
 * Identifies one branch of one decision point of one experiment. Shared by
 * distribution counters and capacity reservations.
 */
public record BranchKey(String experimentId, String decisionPointId, String branchId) {

    public BranchKey {
        Objects.requireNonNull(experimentId, "experimentId");
        Objects.requireNonNull(decisionPointId, "decisionPointId");
        Objects.requireNonNull(branchId, "branchId");
    }

    @Override
    public String toString() {
        return experimentId + ":" + decisionPointId + ":" + branchId;
    }
}
