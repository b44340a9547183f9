package com.stagewise.engine.api.model;

import java.util.List;

/**
 * Completed items that may no longer be revisited, grouped by tree level.
 */
public record LockedItems(
        List<String> phases,
        List<String> stages,
        List<String> blocks,
        List<String> tasks
) {
    public LockedItems {
        phases = List.copyOf(phases);
        stages = List.copyOf(stages);
        blocks = List.copyOf(blocks);
        tasks = List.copyOf(tasks);
    }

    public static LockedItems empty() {
        return new LockedItems(List.of(), List.of(), List.of(), List.of());
    }

    public boolean contains(String id) {
        return phases.contains(id) || stages.contains(id) || blocks.contains(id) || tasks.contains(id);
    }

    public boolean isEmpty() {
        return phases.isEmpty() && stages.isEmpty() && blocks.isEmpty() && tasks.isEmpty();
    }
}
