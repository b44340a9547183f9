package com.stagewise.engine.api.store;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Point-in-time values of a distribution counter record.
 */
public record CounterSnapshot(
        @JsonProperty("started") long started,
        @JsonProperty("completed") long completed,
        @JsonProperty("active") long active
) {
    private static final CounterSnapshot ZERO = new CounterSnapshot(0, 0, 0);

    public static CounterSnapshot zero() {
        return ZERO;
    }

    public long valueOf(CounterField field) {
        return switch (field) {
            case STARTED -> started;
            case COMPLETED -> completed;
        };
    }
}
