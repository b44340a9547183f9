package com.stagewise.engine.api.model.definition;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * How the children of a node are ordered or selected.
 */
public enum OrderingMode {
    SEQUENTIAL("sequential"),
    RANDOMIZED("randomized"),
    BALANCED("balanced"),
    WEIGHTED("weighted"),
    LATIN_SQUARE("latin_square");

    private final String wireName;

    OrderingMode(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static OrderingMode fromValue(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (OrderingMode candidate : values()) {
            if (candidate.wireName.equals(normalized)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown OrderingMode: " + value);
    }
}
