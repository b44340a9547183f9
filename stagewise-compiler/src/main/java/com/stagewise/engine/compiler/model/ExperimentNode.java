package com.stagewise.engine.compiler.model;

import com.stagewise.engine.api.model.definition.FieldRequirement;
import com.stagewise.engine.api.model.definition.RulesConfig;
import com.stagewise.engine.compiler.expression.Expression;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Compiled, immutable node of the definition tree.
 *
 * <p>All four levels share this type and are told apart by {@link #level()}.
 * A node without children is a leaf unit that participants see and submit.
 */
public final class ExperimentNode {

    private final String id;
    private final String label;
    private final String type;
    private final NodeLevel level;
    private final String parentId;
    private final int definitionOrder;
    private final RulesConfig rules;
    private final Expression visibility;
    private final Map<String, Object> pickAssigns;
    private final boolean allowJumpToCompleted;
    private final boolean reference;
    private final boolean editableAfterSubmit;
    private final boolean invalidatesDependents;
    private final List<FieldRequirement> fields;
    private final List<ExperimentNode> children;

    private ExperimentNode(Builder builder) {
        this.id = builder.id;
        this.label = builder.label;
        this.type = builder.type;
        this.level = builder.level;
        this.parentId = builder.parentId;
        this.definitionOrder = builder.definitionOrder;
        this.rules = builder.rules == null ? RulesConfig.none() : builder.rules;
        this.visibility = builder.visibility;
        this.pickAssigns = Collections.unmodifiableMap(new LinkedHashMap<>(builder.pickAssigns));
        this.allowJumpToCompleted = builder.allowJumpToCompleted;
        this.reference = builder.reference;
        this.editableAfterSubmit = builder.editableAfterSubmit;
        this.invalidatesDependents = builder.invalidatesDependents;
        this.fields = List.copyOf(builder.fields);
        this.children = List.copyOf(builder.children);
    }

    public static Builder builder(String id, NodeLevel level) {
        return new Builder(id, level);
    }

    public String id() {
        return id;
    }

    public String label() {
        return label;
    }

    public String type() {
        return type;
    }

    public NodeLevel level() {
        return level;
    }

    /**
     * Id of the parent node, {@code null} for the experiment root.
     */
    public String parentId() {
        return parentId;
    }

    /**
     * Pre-order position in the definition, used for stable tie-breaking.
     */
    public int definitionOrder() {
        return definitionOrder;
    }

    public RulesConfig rules() {
        return rules;
    }

    /**
     * Compiled visibility rule, {@code null} when the node is always visible.
     */
    public Expression visibility() {
        return visibility;
    }

    public Map<String, Object> pickAssigns() {
        return pickAssigns;
    }

    public boolean allowJumpToCompleted() {
        return allowJumpToCompleted;
    }

    public boolean isReference() {
        return reference;
    }

    public boolean isEditableAfterSubmit() {
        return editableAfterSubmit;
    }

    public boolean invalidatesDependents() {
        return invalidatesDependents;
    }

    public List<FieldRequirement> fields() {
        return fields;
    }

    public List<ExperimentNode> children() {
        return children;
    }

    public boolean isLeaf() {
        return children.isEmpty();
    }

    public DecisionMode decisionMode() {
        return level.childDecisionMode();
    }

    /**
     * Pick-assign values this node contributes when picked: its own
     * {@code pick_assigns} when it declares any, otherwise the union of its
     * descendants' values in definition order without duplicates. Computed
     * on demand from the immutable tree.
     */
    public Map<String, List<Object>> effectivePickAssigns() {
        Map<String, List<Object>> result = new LinkedHashMap<>();
        collectPickAssigns(this, result);
        return result;
    }

    private static void collectPickAssigns(ExperimentNode node, Map<String, List<Object>> out) {
        if (!node.pickAssigns.isEmpty()) {
            node.pickAssigns.forEach((variable, value) -> {
                List<Object> values = out.computeIfAbsent(variable, k -> new ArrayList<>());
                if (!values.contains(value)) {
                    values.add(value);
                }
            });
            return;
        }
        for (ExperimentNode child : node.children) {
            collectPickAssigns(child, out);
        }
    }

    /**
     * Leaf units beneath this node in definition order; the node itself if it
     * is a leaf.
     */
    public List<ExperimentNode> leafDescendants() {
        List<ExperimentNode> leaves = new ArrayList<>();
        collectLeaves(this, leaves);
        return leaves;
    }

    private static void collectLeaves(ExperimentNode node, Collection<ExperimentNode> out) {
        if (node.isLeaf()) {
            out.add(node);
            return;
        }
        for (ExperimentNode child : node.children) {
            collectLeaves(child, out);
        }
    }

    @Override
    public String toString() {
        return level + "[" + id + "]";
    }

    public static final class Builder {
        private final String id;
        private final NodeLevel level;
        private String label;
        private String type;
        private String parentId;
        private int definitionOrder;
        private RulesConfig rules;
        private Expression visibility;
        private Map<String, Object> pickAssigns = Map.of();
        private boolean allowJumpToCompleted = true;
        private boolean reference;
        private boolean editableAfterSubmit;
        private boolean invalidatesDependents = true;
        private List<FieldRequirement> fields = List.of();
        private final List<ExperimentNode> children = new ArrayList<>();

        private Builder(String id, NodeLevel level) {
            this.id = id;
            this.level = level;
        }

        public Builder label(String label) {
            this.label = label;
            return this;
        }

        public Builder type(String type) {
            this.type = type;
            return this;
        }

        public Builder parentId(String parentId) {
            this.parentId = parentId;
            return this;
        }

        public Builder definitionOrder(int definitionOrder) {
            this.definitionOrder = definitionOrder;
            return this;
        }

        public Builder rules(RulesConfig rules) {
            this.rules = rules;
            return this;
        }

        public Builder visibility(Expression visibility) {
            this.visibility = visibility;
            return this;
        }

        public Builder pickAssigns(Map<String, Object> pickAssigns) {
            this.pickAssigns = pickAssigns;
            return this;
        }

        public Builder allowJumpToCompleted(boolean allow) {
            this.allowJumpToCompleted = allow;
            return this;
        }

        public Builder reference(boolean reference) {
            this.reference = reference;
            return this;
        }

        public Builder editableAfterSubmit(boolean editable) {
            this.editableAfterSubmit = editable;
            return this;
        }

        public Builder invalidatesDependents(boolean invalidates) {
            this.invalidatesDependents = invalidates;
            return this;
        }

        public Builder fields(List<FieldRequirement> fields) {
            this.fields = fields;
            return this;
        }

        public Builder child(ExperimentNode child) {
            this.children.add(child);
            return this;
        }

        public ExperimentNode build() {
            return new ExperimentNode(this);
        }
    }
}
