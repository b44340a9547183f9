/*
 * Copyright (c) 2025 Stagewise Navigation Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.stagewise.engine.api.exceptions;

import java.util.List;

/**
 * A navigation request was rejected.
 *
 * <p>Rejections are raised before any session state is mutated, so the caller
 * can report the reason and the persisted session stays as it was.
 */
public class NavigationException extends RuntimeException {

    public enum Reason {
        UNKNOWN_SESSION,
        SESSION_NOT_ACTIVE,
        STALE_SUBMISSION,
        UNKNOWN_UNIT,
        VALIDATION_FAILED,
        JUMP_NOT_ALLOWED,
        UNIT_LOCKED,
        NOT_EDITABLE,
        QUOTA_FULL,
        CONCURRENT_MODIFICATION
    }

    private final Reason reason;
    private final List<String> details;

    public NavigationException(Reason reason, String message) {
        this(reason, message, List.of());
    }

    public NavigationException(Reason reason, String message, List<String> details) {
        super(message);
        this.reason = reason;
        this.details = List.copyOf(details);
    }

    public Reason getReason() {
        return reason;
    }

    public List<String> getDetails() {
        return details;
    }
}
