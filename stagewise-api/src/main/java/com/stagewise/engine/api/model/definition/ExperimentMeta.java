package com.stagewise.engine.api.model.definition;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ExperimentMeta(
        @JsonProperty("id") String id,
        @JsonProperty("version") Integer version,
        @JsonProperty("name") String name
) {
    public ExperimentMeta {
        if (version == null) version = 1;
    }
}
