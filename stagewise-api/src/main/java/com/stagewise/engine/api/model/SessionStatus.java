package com.stagewise.engine.api.model;

public enum SessionStatus {
    ACTIVE,
    COMPLETED,
    ABANDONED
}
