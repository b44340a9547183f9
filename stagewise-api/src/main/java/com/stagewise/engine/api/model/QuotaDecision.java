package com.stagewise.engine.api.model;

/**
 * Outcome of the quota check for one node within a session. Stored so that a
 * recomputation of the visible units never re-checks capacity.
 */
public enum QuotaDecision {
    /** A hold is reserved and not yet converted. */
    RESERVED,
    /** The hold was converted into a permanent completion. */
    CONSUMED,
    /** The quota was full; the node is excluded for this session. */
    SKIPPED
}
