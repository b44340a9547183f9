package com.stagewise.engine.compiler.model;

/**
 * Whether a decision point commits a single branch or a full ordering.
 */
public enum DecisionMode {
    /** balanced / weighted commit exactly one child (between-subjects). */
    SELECT,
    /** balanced / weighted produce a permutation of all children (within-subjects). */
    ORDER
}
