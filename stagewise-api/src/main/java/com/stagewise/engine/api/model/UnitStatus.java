package com.stagewise.engine.api.model;

/**
 * Lifecycle of a unit within one session.
 *
 * <p>{@code PENDING -> IN_PROGRESS -> COMPLETED}; {@code INVALIDATED} is only
 * reached from {@code COMPLETED} through an invalidation cascade, and
 * {@code SKIPPED} when a full quota skips the unit.
 */
public enum UnitStatus {
    PENDING,
    IN_PROGRESS,
    COMPLETED,
    SKIPPED,
    INVALIDATED
}
