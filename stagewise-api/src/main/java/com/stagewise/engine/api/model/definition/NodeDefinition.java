package com.stagewise.engine.api.model.definition;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One authored node of the definition tree (phase, stage, block or task).
 *
 * <p>Only the child list matching the node's depth is read: {@code stages} on
 * phases, {@code blocks} on stages, {@code tasks} on blocks. A node with a
 * {@code type} and no children is a leaf at whatever depth it sits.
 * Content properties the engine does not interpret (question text, media,
 * etc.) are ignored.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record NodeDefinition(
        @JsonProperty("id") String id,
        @JsonProperty("label") String label,
        @JsonProperty("type") String type,
        @JsonProperty("rules") RulesConfig rules,
        @JsonProperty("ui") Map<String, Object> ui,
        @JsonProperty("pick_assigns") Map<String, Object> pickAssigns,
        @JsonProperty("allow_jump_to_completed") Boolean allowJumpToCompleted,
        @JsonProperty("reference") Boolean reference,
        @JsonProperty("editable_after_submit") Boolean editableAfterSubmit,
        @JsonProperty("invalidates_dependents") Boolean invalidatesDependents,
        @JsonProperty("fields") @JsonAlias("questions") List<FieldRequirement> fields,
        @JsonProperty("stages") List<NodeDefinition> stages,
        @JsonProperty("blocks") List<NodeDefinition> blocks,
        @JsonProperty("tasks") List<NodeDefinition> tasks
) {
    public NodeDefinition {
        if (rules == null) rules = RulesConfig.none();
        ui = ui == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(ui));
        pickAssigns = pickAssigns == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(pickAssigns));
        if (allowJumpToCompleted == null) allowJumpToCompleted = true;
        if (reference == null) reference = false;
        if (editableAfterSubmit == null) editableAfterSubmit = false;
        if (invalidatesDependents == null) invalidatesDependents = true;
        fields = fields == null ? List.of() : List.copyOf(fields);
        stages = stages == null ? List.of() : List.copyOf(stages);
        blocks = blocks == null ? List.of() : List.copyOf(blocks);
        tasks = tasks == null ? List.of() : List.copyOf(tasks);
    }

    /**
     * Convenience factory for a leaf node.
     */
    public static NodeDefinition leaf(String id, String type) {
        return new NodeDefinition(id, null, type, null, null, null, null, null,
                null, null, null, null, null, null);
    }
}
