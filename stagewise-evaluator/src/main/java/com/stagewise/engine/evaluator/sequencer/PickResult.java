package com.stagewise.engine.evaluator.sequencer;

import com.stagewise.engine.compiler.model.ExperimentNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of a pick-N-of-M decision.
 *
 * @param picked       picked children in definition order; may be empty when
 *                     pick conditions exclude every candidate
 * @param pickedIds    ids to persist for the decision point
 * @param reason       human-readable explanation
 * @param ledgerDelta  pick-assign values contributed by the picked children
 * @param restored     whether the picks were restored from a stored list
 */
public record PickResult(
        List<ExperimentNode> picked,
        List<String> pickedIds,
        String reason,
        Map<String, List<Object>> ledgerDelta,
        boolean restored
) {
    public PickResult {
        picked = List.copyOf(picked);
        pickedIds = List.copyOf(pickedIds);
        ledgerDelta = ledgerDelta == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(ledgerDelta));
    }

    public boolean isEmpty() {
        return picked.isEmpty();
    }
}
