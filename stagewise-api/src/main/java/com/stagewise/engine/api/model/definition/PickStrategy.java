package com.stagewise.engine.api.model.definition;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Strategy used when picking a subset of children.
 */
public enum PickStrategy {
    RANDOM("random"),
    ROUND_ROBIN("round_robin"),
    WEIGHTED_RANDOM("weighted_random");

    private final String wireName;

    PickStrategy(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static PickStrategy fromValue(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (PickStrategy candidate : values()) {
            if (candidate.wireName.equals(normalized)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown PickStrategy: " + value);
    }
}
