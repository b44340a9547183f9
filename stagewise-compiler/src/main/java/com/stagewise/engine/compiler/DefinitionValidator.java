package com.stagewise.engine.compiler;

import com.stagewise.engine.api.model.definition.ExperimentDefinition;
import com.stagewise.engine.api.model.definition.FieldRequirement;
import com.stagewise.engine.api.model.definition.NodeDefinition;
import com.stagewise.engine.api.model.definition.PickCondition;
import com.stagewise.engine.api.model.definition.RulesConfig;
import com.stagewise.engine.api.model.definition.WeightEntry;
import com.stagewise.engine.compiler.expression.ExpressionParser;
import com.stagewise.engine.compiler.expression.ExpressionSyntaxException;
import com.stagewise.engine.compiler.model.NodeLevel;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import java.util.stream.Collectors;

/**
 * Structural validation of an authored definition. Collects every problem
 * instead of stopping at the first one.
 */
final class DefinitionValidator {

    private static final Logger logger = Logger.getLogger(DefinitionValidator.class.getName());

    private final ExpressionParser parser;

    DefinitionValidator(ExpressionParser parser) {
        this.parser = parser;
    }

    List<String> validate(ExperimentDefinition definition) {
        List<String> errors = new ArrayList<>();
        if (definition == null) {
            errors.add("Definition is empty");
            return errors;
        }
        Set<String> seenIds = new HashSet<>();
        if (definition.meta() == null || isBlank(definition.meta().id())) {
            errors.add("Missing 'meta.id' (experiment ID)");
        } else {
            seenIds.add(definition.meta().id());
        }
        if (definition.phases().isEmpty()) {
            errors.add("Missing 'phases' - experiment needs at least one phase");
            return errors;
        }

        validateRules("Experiment", definition.rules(), definition.phases(), errors);
        for (int i = 0; i < definition.phases().size(); i++) {
            validateNode(definition.phases().get(i), NodeLevel.PHASE, "Phase[" + i + "]", seenIds, errors);
        }
        return errors;
    }

    private void validateNode(NodeDefinition node, NodeLevel level, String path,
                              Set<String> seenIds, List<String> errors) {
        String prefix = path;
        if (isBlank(node.id())) {
            errors.add(prefix + ": Missing 'id'");
        } else {
            prefix = path + " '" + node.id() + "'";
            if (!seenIds.add(node.id())) {
                errors.add(prefix + ": Duplicate ID '" + node.id() + "'");
            }
        }

        List<NodeDefinition> children = DefinitionCompiler.childrenAt(node, level);
        checkMisplacedChildren(node, level, prefix, errors);
        if (children.isEmpty() && isBlank(node.type())) {
            errors.add(prefix + ": Node has neither children nor a 'type'");
        }

        validateRules(prefix, node.rules(), children, errors);
        validateFields(prefix, node.fields(), errors);

        NodeLevel childLevel = level.childLevel();
        String childName = childLevel == null ? "" : capitalize(childLevel.name());
        for (int i = 0; i < children.size(); i++) {
            validateNode(children.get(i), childLevel, path + "." + childName + "[" + i + "]", seenIds, errors);
        }
    }

    private void validateRules(String prefix, RulesConfig rules, List<NodeDefinition> children,
                               List<String> errors) {
        if (rules.visibility() != null) {
            try {
                parser.parse(rules.visibility());
            } catch (ExpressionSyntaxException e) {
                errors.add(prefix + ": Invalid visibility rule: " + e.getMessage());
            }
        }
        if (rules.pickCount() != null) {
            if (rules.pickCount() < 1) {
                errors.add(prefix + ": 'pick_count' must be at least 1, got " + rules.pickCount());
            } else if (rules.pickCount() >= children.size() && !children.isEmpty()) {
                logger.fine(prefix + ": pick_count " + rules.pickCount()
                        + " covers all " + children.size() + " children; all are used");
            }
        }
        Set<String> childIds = children.stream()
                .map(NodeDefinition::id)
                .filter(id -> id != null)
                .collect(Collectors.toSet());
        checkWeights(prefix, "weights", rules.weights(), childIds, errors);
        checkWeights(prefix, "pick_weights", rules.pickWeights(), childIds, errors);
        for (PickCondition condition : rules.pickConditions()) {
            if (isBlank(condition.variable())) {
                errors.add(prefix + ": Pick condition without 'variable'");
            }
        }
        if (rules.quota() != null && rules.quota() < 1) {
            errors.add(prefix + ": 'quota' must be at least 1, got " + rules.quota());
        }
    }

    private static void checkWeights(String prefix, String property, List<WeightEntry> weights,
                                     Set<String> childIds, List<String> errors) {
        for (WeightEntry entry : weights) {
            if (isBlank(entry.id()) || !childIds.contains(entry.id())) {
                errors.add(prefix + ": '" + property + "' references unknown child '" + entry.id() + "'");
            }
            if (entry.value() < 1) {
                errors.add(prefix + ": '" + property + "' for '" + entry.id() + "' must be positive");
            }
        }
    }

    private static void validateFields(String prefix, List<FieldRequirement> fields, List<String> errors) {
        for (FieldRequirement field : fields) {
            if (isBlank(field.field())) {
                errors.add(prefix + ": Field requirement without 'field'");
                continue;
            }
            if (field.validation() != null) {
                try {
                    Pattern.compile(field.validation());
                } catch (PatternSyntaxException e) {
                    errors.add(prefix + ": Invalid validation pattern for '" + field.field() + "': "
                            + e.getDescription());
                }
            }
        }
    }

    private static void checkMisplacedChildren(NodeDefinition node, NodeLevel level, String prefix,
                                               List<String> errors) {
        boolean misplaced = switch (level) {
            case PHASE -> !node.blocks().isEmpty() || !node.tasks().isEmpty();
            case STAGE -> !node.stages().isEmpty() || !node.tasks().isEmpty();
            case BLOCK -> !node.stages().isEmpty() || !node.blocks().isEmpty();
            case TASK -> !node.stages().isEmpty() || !node.blocks().isEmpty() || !node.tasks().isEmpty();
            case EXPERIMENT -> false;
        };
        if (misplaced) {
            errors.add(prefix + ": Children listed under the wrong key for a " + level.name().toLowerCase());
        }
    }

    private static String capitalize(String name) {
        return name.charAt(0) + name.substring(1).toLowerCase();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
