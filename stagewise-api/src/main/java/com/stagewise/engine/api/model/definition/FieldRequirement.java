package com.stagewise.engine.api.model.definition;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Requirement on one field of a submitted payload.
 *
 * @param field             payload key
 * @param required          whether the key must be present and non-blank
 * @param enabled           disabled fields are not validated
 * @param validation        optional regular expression the value must match entirely
 * @param validationMessage message reported when the expression does not match
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FieldRequirement(
        @JsonProperty("field") @JsonAlias("id") String field,
        @JsonProperty("required") Boolean required,
        @JsonProperty("enabled") Boolean enabled,
        @JsonProperty("validation") String validation,
        @JsonProperty("validation_message") String validationMessage
) {
    public FieldRequirement {
        if (required == null) required = true;
        if (enabled == null) enabled = true;
        if (validationMessage == null) validationMessage = "Invalid format";
    }
}
