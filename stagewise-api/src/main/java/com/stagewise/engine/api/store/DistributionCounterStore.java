/*
 * Copyright (c) 2025 Stagewise Navigation Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.stagewise.engine.api.store;

import java.time.Instant;
import java.util.Map;

/**
 * Persisted per-branch counters shared by all participants.
 *
 * <p>Every mutating operation is a single atomic operation against the store.
 * Callers never read a value and write back a derived one; conditional
 * increments go through {@link #incrementIf}.
 *
 * <p>Records are created on first touch and only removed by
 * {@link #reset(String, String)}.
 *
 * @throws com.stagewise.engine.api.exceptions.StoreUnavailableException from any
 *         method when the backing store cannot be reached
 */
public interface DistributionCounterStore {

    /**
     * Current values, {@link CounterSnapshot#zero()} for an untouched branch.
     */
    CounterSnapshot get(BranchKey key);

    /**
     * All touched branches of a decision point, keyed by branch id.
     */
    Map<String, CounterSnapshot> getAll(String experimentId, String decisionPointId);

    /**
     * Increments the field and returns the new value.
     */
    long incrementAndGet(BranchKey key, CounterField field);

    /**
     * Increments the field only if its current value satisfies the condition.
     *
     * @return true if the increment happened
     */
    boolean incrementIf(BranchKey key, CounterField field, CounterCondition condition);

    default boolean compareAndIncrement(BranchKey key, CounterField field, long expected) {
        return incrementIf(key, field, CounterCondition.equalTo(expected));
    }

    /**
     * Takes back one earlier increment of the field. Only used to undo the
     * writes of a request that failed before it was committed; the value never
     * drops below zero.
     */
    void decrement(BranchKey key, CounterField field);

    /**
     * Records that the session currently occupies the branch.
     */
    void markActive(BranchKey key, String sessionId, Instant since);

    /**
     * Removes the session's active marker. No-op if absent.
     */
    void clearActive(BranchKey key, String sessionId);

    /**
     * Drops active markers older than {@code cutoff} across the experiment and
     * decrements {@code started_count} of the affected branches by the number of
     * markers dropped.
     *
     * @return number of markers dropped
     */
    int sweepStaleActive(String experimentId, Instant cutoff);

    /**
     * Deletes every counter record of the decision point.
     */
    void reset(String experimentId, String decisionPointId);
}
