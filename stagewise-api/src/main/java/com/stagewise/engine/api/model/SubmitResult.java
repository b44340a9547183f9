package com.stagewise.engine.api.model;

import java.util.List;
import java.util.Set;

/**
 * Result of a submission.
 *
 * @param state            persisted session state after the submission
 * @param nextUnitId       first visible unit not yet completed, null when complete
 * @param visibleUnitIds   recomputed visible path
 * @param completedUnitIds completed leaf units
 * @param lockedItems      completed items that can no longer be revisited
 * @param complete         whether every visible unit is completed
 * @param progress         completion progress
 */
public record SubmitResult(
        SessionState state,
        String nextUnitId,
        List<String> visibleUnitIds,
        Set<String> completedUnitIds,
        LockedItems lockedItems,
        boolean complete,
        Progress progress
) {
}
