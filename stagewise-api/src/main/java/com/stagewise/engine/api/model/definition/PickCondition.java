package com.stagewise.engine.api.model.definition;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Filter applied to pick candidates against the session's pick ledger.
 *
 * @param variable pick-assign variable to inspect
 * @param operator {@code in} requires overlap with the ledger, {@code not_in} forbids it
 */
public record PickCondition(
        @JsonProperty("variable") String variable,
        @JsonProperty("operator") PickOperator operator
) {
    public PickCondition {
        if (operator == null) operator = PickOperator.NOT_IN;
    }
}
