package com.stagewise.engine.api.model.definition;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Operator of a pick condition. {@code ==} is accepted as an alias of
 * {@code in}, {@code !=} as an alias of {@code not_in}.
 */
public enum PickOperator {
    IN("in"),
    NOT_IN("not_in");

    private final String wireName;

    PickOperator(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static PickOperator fromValue(String value) {
        if (value == null) {
            return null;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "in", "==" -> IN;
            case "not_in", "!=" -> NOT_IN;
            default -> throw new IllegalArgumentException("Unknown pick operator: " + value);
        };
    }
}
