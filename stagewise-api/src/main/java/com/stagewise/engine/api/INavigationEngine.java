/*
 * Copyright (c) 2025 Stagewise Navigation Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.stagewise.engine.api;

import com.stagewise.engine.api.model.DistributionSnapshot;
import com.stagewise.engine.api.model.InitializeResult;
import com.stagewise.engine.api.model.InvalidationPreview;
import com.stagewise.engine.api.model.JumpResult;
import com.stagewise.engine.api.model.QuotaStatus;
import com.stagewise.engine.api.model.SessionView;
import com.stagewise.engine.api.model.StartRequest;
import com.stagewise.engine.api.model.SubmitResult;

import java.util.List;
import java.util.Map;

/**
 * Contract of the experiment navigation engine.
 *
 * <p>One engine instance serves one compiled experiment definition. It
 * decides which unit a participant sees next, commits branching decisions
 * exactly once per participant, enforces per-branch capacity and supports
 * recovery of a session from its persisted state.
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * INavigationEngine engine = // obtain from EngineFactory
 *
 * InitializeResult start = engine.initialize(StartRequest.of("session-42"));
 * String unit = start.firstUnitId();
 *
 * SubmitResult next = engine.submit("session-42", unit, Map.of("age", 31));
 * if (next.complete()) {
 *     // participant is done
 * }
 * }</pre>
 *
 * <h2>Errors</h2>
 * <ul>
 *   <li>{@link com.stagewise.engine.api.exceptions.NavigationException} for rejected
 *       requests; no state is changed</li>
 *   <li>{@link com.stagewise.engine.api.exceptions.StoreUnavailableException} when a
 *       backing store is unreachable</li>
 * </ul>
 *
 * <h2>Thread Safety</h2>
 * <p>Implementations are thread-safe. Requests for different sessions run
 * concurrently; requests for the same session are serialized by optimistic
 * versioning of the stored state.
 */
public interface INavigationEngine {

    /**
     * Starts a session: draws its seed, walks the definition and presents the
     * first visible unit.
     */
    InitializeResult initialize(StartRequest request);

    /**
     * Submits the payload of the current unit and computes the next one.
     *
     * @param sessionId session to advance
     * @param unitId    must equal the session's current unit
     * @param payload   submitted field values
     */
    SubmitResult submit(String sessionId, String unitId, Map<String, Object> payload);

    /**
     * Moves the session to a reference unit, a completed unlocked unit, or the
     * next pending unit. Jumping to an editable unit whose edits invalidate
     * dependents un-completes those dependents.
     */
    JumpResult jump(String sessionId, String targetUnitId);

    /**
     * Returns from a jump to the recorded return point, or to the first pending
     * unit when the return point is gone.
     */
    SessionView resume(String sessionId);

    /**
     * Current state, read from cache first and durable storage second.
     */
    SessionView getState(String sessionId);

    /**
     * Marks the session abandoned and releases its capacity and active holds.
     */
    void abandon(String sessionId);

    /**
     * Records a computed score under {@code scores.<name>}.
     */
    void recordScore(String sessionId, String name, Object value);

    /**
     * Units whose visibility depends, transitively, on data of {@code unitId},
     * in topological order.
     */
    List<String> getDependents(String unitId);

    /**
     * Units whose data the visibility of {@code unitId} depends on.
     */
    List<String> getDependencies(String unitId);

    InvalidationPreview wouldInvalidate(String unitId);

    DistributionSnapshot distributionSnapshot(String decisionPointId);

    QuotaStatus quotaStatus(String nodeId);

    /**
     * Administrative reset of every counter of a decision point. Audited.
     */
    void resetDistribution(String decisionPointId, String actor);

    /**
     * Administrative reset of a node's quota. Audited.
     */
    void resetQuota(String nodeId, String actor);

    /**
     * Sweeps active markers older than the configured timeout.
     *
     * @return number of markers dropped
     */
    int sweepStaleHolds();
}
