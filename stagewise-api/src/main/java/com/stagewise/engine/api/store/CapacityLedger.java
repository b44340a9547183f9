/*
 * Copyright (c) 2025 Stagewise Navigation Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.stagewise.engine.api.store;

import com.stagewise.engine.api.model.QuotaStatus;

import java.time.Duration;

/**
 * Two-phase slot reservation per branch.
 *
 * <p>{@link #tryReserve} creates an expiring hold if the branch still has
 * room, {@link #tryComplete} turns the hold (or a bare completion) into a
 * permanent increment, and {@link #release} drops an unconsumed hold. Holds
 * of participants who abandon expire on their own, so they never permanently
 * consume quota.
 */
public interface CapacityLedger {

    /**
     * Atomically checks {@code completed < limit} and creates a hold.
     * Returns true without a new hold if the session already holds one.
     */
    boolean tryReserve(BranchKey key, String sessionId, long limit, Duration holdTtl);

    /**
     * Increments the completion counter and removes the session's hold.
     *
     * @return completion count after the increment
     */
    long tryComplete(BranchKey key, String sessionId);

    void release(BranchKey key, String sessionId);

    boolean holds(BranchKey key, String sessionId);

    QuotaStatus status(BranchKey key, long limit);

    /**
     * Clears the completion counter and all holds of the branch.
     */
    void reset(BranchKey key);
}
