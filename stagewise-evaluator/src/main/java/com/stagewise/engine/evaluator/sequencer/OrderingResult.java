package com.stagewise.engine.evaluator.sequencer;

import com.stagewise.engine.api.store.BranchKey;
import com.stagewise.engine.compiler.model.ExperimentNode;

import java.util.List;

/**
 * Outcome of an ordering decision.
 *
 * @param children    the ordered children, or the single selected child
 * @param assignment  token to persist for the decision point: the selected
 *                    child id, or comma-joined ids of a realized order;
 *                    {@code null} when nothing needs to be persisted
 * @param reason      human-readable explanation, logged and kept for audit
 * @param restored    whether the result was restored from {@code assignment}
 * @param countedKey  distribution counter incremented by this decision,
 *                    {@code null} if none
 */
public record OrderingResult(
        List<ExperimentNode> children,
        String assignment,
        String reason,
        boolean restored,
        BranchKey countedKey
) {
    public OrderingResult {
        children = List.copyOf(children);
    }

    static OrderingResult of(List<ExperimentNode> children, String reason) {
        return new OrderingResult(children, null, reason, false, null);
    }
}
