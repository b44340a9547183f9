package com.stagewise.engine.api.model;

/**
 * Read-only view of a session used for recovery and resume.
 */
public record SessionView(SessionState state, LockedItems lockedItems, Progress progress) {
}
