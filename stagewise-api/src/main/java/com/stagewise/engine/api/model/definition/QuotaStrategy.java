package com.stagewise.engine.api.model.definition;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * What happens when a node's quota is exhausted.
 */
public enum QuotaStrategy {
    SKIP_IF_FULL("skip_if_full"),
    BLOCK("block");

    private final String wireName;

    QuotaStrategy(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static QuotaStrategy fromValue(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (QuotaStrategy candidate : values()) {
            if (candidate.wireName.equals(normalized)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown QuotaStrategy: " + value);
    }
}
