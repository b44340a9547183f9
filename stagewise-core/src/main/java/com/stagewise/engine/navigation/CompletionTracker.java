package com.stagewise.engine.navigation;

import com.stagewise.engine.api.model.LockedItems;
import com.stagewise.engine.api.model.Progress;
import com.stagewise.engine.api.model.SessionState;
import com.stagewise.engine.compiler.model.ExperimentModel;
import com.stagewise.engine.compiler.model.ExperimentNode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Container completion, locks and progress of a session.
 *
 * <p>A phase, stage or block is complete when it has at least one visible
 * unit and every visible unit beneath it is completed. Hidden and skipped
 * units do not hold a container open.
 */
final class CompletionTracker {

    private final ExperimentModel model;

    CompletionTracker(ExperimentModel model) {
        this.model = model;
    }

    /**
     * Rebuilds the completed phase, stage and block sets of {@code state}
     * from its visible and completed units.
     */
    void recompute(SessionState.Builder state) {
        Map<String, int[]> counts = new LinkedHashMap<>();
        for (String unitId : state.visibleUnitIds()) {
            boolean done = state.completedUnitIds().contains(unitId);
            // a leaf phase or stage counts as its own container
            for (ExperimentNode ancestor : model.chainTo(unitId)) {
                int[] count = counts.computeIfAbsent(ancestor.id(), k -> new int[2]);
                count[0]++;
                if (done) {
                    count[1]++;
                }
            }
        }

        state.completedPhaseIds().clear();
        state.completedStageIds().clear();
        state.completedBlockIds().clear();
        counts.forEach((id, count) -> {
            if (count[0] == 0 || count[0] != count[1]) {
                return;
            }
            ExperimentNode node = model.getNode(id);
            switch (node.level()) {
                case PHASE -> state.completedPhaseIds().add(id);
                case STAGE -> state.completedStageIds().add(id);
                case BLOCK -> state.completedBlockIds()
                        .computeIfAbsent(node.parentId(), k -> new LinkedHashSet<>()).add(id);
                default -> {
                }
            }
        });
    }

    boolean isCompleted(SessionState state, ExperimentNode node) {
        if (node.isLeaf()) {
            return state.completedUnitIds().contains(node.id());
        }
        return switch (node.level()) {
            case EXPERIMENT -> !state.visibleUnitIds().isEmpty()
                    && state.completedUnitIds().containsAll(state.visibleUnitIds());
            case PHASE -> state.completedPhaseIds().contains(node.id());
            case STAGE -> state.completedStageIds().contains(node.id());
            case BLOCK -> state.completedBlockIds().getOrDefault(node.parentId(), Set.of()).contains(node.id());
            default -> false;
        };
    }

    /**
     * A completed item is locked when it, or a completed ancestor, forbids
     * jumping back once completed.
     */
    boolean isLocked(SessionState state, String id) {
        if (!isCompleted(state, model.getNode(id))) {
            return false;
        }
        for (ExperimentNode node : model.chainTo(id)) {
            if (!node.allowJumpToCompleted() && isCompleted(state, node)) {
                return true;
            }
        }
        return false;
    }

    LockedItems lockedItems(SessionState state) {
        List<String> phases = new ArrayList<>();
        List<String> stages = new ArrayList<>();
        List<String> blocks = new ArrayList<>();
        List<String> tasks = new ArrayList<>();
        for (ExperimentNode node : model.nodes()) {
            if (node == model.root() || !isLocked(state, node.id())) {
                continue;
            }
            switch (node.level()) {
                case PHASE -> phases.add(node.id());
                case STAGE -> stages.add(node.id());
                case BLOCK -> blocks.add(node.id());
                case TASK -> tasks.add(node.id());
                default -> {
                }
            }
        }
        return new LockedItems(phases, stages, blocks, tasks);
    }

    static Progress progress(SessionState state) {
        int completed = 0;
        for (String unitId : state.visibleUnitIds()) {
            if (state.completedUnitIds().contains(unitId)) {
                completed++;
            }
        }
        return Progress.of(completed, state.visibleUnitIds().size());
    }

    /**
     * First visible unit that is not completed, {@code null} when none is left.
     */
    static String firstPending(SessionState.Builder state) {
        for (String unitId : state.visibleUnitIds()) {
            if (!state.completedUnitIds().contains(unitId)) {
                return unitId;
            }
        }
        return null;
    }
}
