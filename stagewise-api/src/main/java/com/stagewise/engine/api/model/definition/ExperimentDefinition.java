package com.stagewise.engine.api.model.definition;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Authored experiment: metadata, optional rules over the phase list, and the
 * phase tree.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * {
 *   "meta": {"id": "memory_study", "version": 2},
 *   "phases": [
 *     {"id": "intro", "type": "consent"},
 *     {"id": "main", "rules": {"ordering": "balanced"},
 *      "stages": [{"id": "cond_a", "type": "task"}, {"id": "cond_b", "type": "task"}]}
 *   ]
 * }
 * }</pre>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ExperimentDefinition(
        @JsonProperty("meta") ExperimentMeta meta,
        @JsonProperty("rules") RulesConfig rules,
        @JsonProperty("phases") List<NodeDefinition> phases
) {
    public ExperimentDefinition {
        if (rules == null) rules = RulesConfig.none();
        phases = phases == null ? List.of() : List.copyOf(phases);
    }
}
