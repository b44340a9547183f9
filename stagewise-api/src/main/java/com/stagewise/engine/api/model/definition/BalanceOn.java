package com.stagewise.engine.api.model.definition;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Which counter drives least-filled selection.
 */
public enum BalanceOn {
    STARTED("started"),
    COMPLETED("completed");

    private final String wireName;

    BalanceOn(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static BalanceOn fromValue(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (BalanceOn candidate : values()) {
            if (candidate.wireName.equals(normalized)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown BalanceOn: " + value);
    }
}
