package com.stagewise.engine.api.model;

import java.util.List;
import java.util.Map;

/**
 * Result of starting a session.
 *
 * @param state          persisted session state
 * @param firstUnitId    unit to present first, null if nothing is visible
 * @param visibleUnitIds flattened visible path
 * @param assignments    decisions committed while walking the tree
 * @param progress       completion progress
 */
public record InitializeResult(
        SessionState state,
        String firstUnitId,
        List<String> visibleUnitIds,
        Map<String, String> assignments,
        Progress progress
) {
}
