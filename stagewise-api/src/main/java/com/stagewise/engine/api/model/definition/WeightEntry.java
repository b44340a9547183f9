package com.stagewise.engine.api.model.definition;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Integer weight of one child, referenced by id.
 */
public record WeightEntry(
        @JsonProperty("id") String id,
        @JsonProperty("value") @JsonAlias("weight") Integer value
) {
    public WeightEntry {
        if (value == null) value = 1;
    }
}
