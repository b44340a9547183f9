package com.stagewise.engine.compiler.model;

/**
 * Depth of a node in the definition tree.
 */
public enum NodeLevel {
    EXPERIMENT,
    PHASE,
    STAGE,
    BLOCK,
    TASK;

    /**
     * Level of this level's children; {@code null} for tasks.
     */
    public NodeLevel childLevel() {
        return switch (this) {
            case EXPERIMENT -> PHASE;
            case PHASE -> STAGE;
            case STAGE -> BLOCK;
            case BLOCK -> TASK;
            case TASK -> null;
        };
    }

    /**
     * How balanced and weighted policies act on this level's children:
     * the root and phases choose one branch, stages and blocks order all of
     * their children.
     */
    public DecisionMode childDecisionMode() {
        return switch (this) {
            case EXPERIMENT, PHASE -> DecisionMode.SELECT;
            case STAGE, BLOCK, TASK -> DecisionMode.ORDER;
        };
    }
}
