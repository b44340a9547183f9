/*
 * Copyright (c) 2025 Stagewise Navigation Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.stagewise.engine.evaluator;

import com.stagewise.engine.compiler.expression.Comparison;
import com.stagewise.engine.compiler.expression.Expression;
import com.stagewise.engine.compiler.expression.ExpressionParser;
import com.stagewise.engine.compiler.expression.Invalid;
import com.stagewise.engine.compiler.expression.ListLiteral;
import com.stagewise.engine.compiler.expression.Literal;
import com.stagewise.engine.compiler.expression.Logical;
import com.stagewise.engine.compiler.expression.Membership;
import com.stagewise.engine.compiler.expression.Not;
import com.stagewise.engine.compiler.expression.PathRef;
import com.stagewise.engine.compiler.expression.Truthy;
import com.stagewise.engine.compiler.model.ExperimentModel;
import com.stagewise.engine.compiler.model.ExperimentNode;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Evaluates compiled visibility rules against an {@link EvaluationContext}.
 *
 * <h2>Path resolution</h2>
 * <ul>
 * <li>{@code participant.*}, {@code scores.*}, {@code assignments.*},
 * {@code environment.*} read the namespace of the same name</li>
 * <li>{@code session.*} and {@code responses.*} read submitted payloads keyed
 * by unit id; {@code url_params.*} and {@code url.*} read query parameters</li>
 * <li>any other path is read as {@code unitId.field} from submitted payloads,
 * then from participant fields</li>
 * </ul>
 *
 * <h2>Failure handling</h2>
 * <p>Evaluation never throws. A rule that cannot be evaluated is logged and
 * treated as visible, so a broken rule over-shows content instead of hiding
 * it from a live session.
 *
 * <p>Stateless and thread-safe.
 */
public class RuleEvaluator {

    private static final Logger logger = Logger.getLogger(RuleEvaluator.class.getName());

    private final ExpressionParser parser;

    public RuleEvaluator() {
        this(new ExpressionParser());
    }

    public RuleEvaluator(ExpressionParser parser) {
        this.parser = parser;
    }

    /**
     * Parses and evaluates a rule string. An absent rule is {@code true}.
     */
    public boolean evaluate(String rule, EvaluationContext context) {
        return evaluate(parser.parseLenient(rule), context);
    }

    /**
     * Evaluates a compiled rule. {@code null} means always visible.
     */
    public boolean evaluate(Expression expression, EvaluationContext context) {
        if (expression == null) {
            return true;
        }
        try {
            return test(expression, context);
        } catch (RuntimeException e) {
            logger.warning("Error evaluating visibility rule " + expression + ": " + e.getMessage());
            return true;
        }
    }

    /**
     * Applies rules outermost first and stops at the first one that hides.
     * {@code null} entries are always visible.
     */
    public boolean evaluateWithInheritance(List<Expression> chain, EvaluationContext context) {
        for (Expression rule : chain) {
            if (!evaluate(rule, context)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Whether {@code nodeId} and all of its ancestors are visible.
     */
    public boolean isVisible(ExperimentModel model, String nodeId, EvaluationContext context) {
        List<Expression> chain = new ArrayList<>();
        for (ExperimentNode node : model.chainTo(nodeId)) {
            chain.add(node.visibility());
        }
        return evaluateWithInheritance(chain, context);
    }

    private boolean test(Expression expression, EvaluationContext context) {
        if (expression instanceof Logical logical) {
            if (logical.kind() == Logical.Kind.AND) {
                for (Expression operand : logical.operands()) {
                    if (!test(operand, context)) {
                        return false;
                    }
                }
                return true;
            }
            for (Expression operand : logical.operands()) {
                if (test(operand, context)) {
                    return true;
                }
            }
            return false;
        }
        if (expression instanceof Not not) {
            return !test(not.operand(), context);
        }
        if (expression instanceof Comparison comparison) {
            return Values.compare(value(comparison.left(), context), comparison.operator(),
                    value(comparison.right(), context));
        }
        if (expression instanceof Membership membership) {
            return testMembership(membership, context);
        }
        if (expression instanceof Truthy truthy) {
            return Values.truthy(value(truthy.operand(), context));
        }
        if (expression instanceof Invalid invalid) {
            logger.warning("Invalid visibility rule '" + invalid.source() + "' (" + invalid.error()
                    + "), treating as visible");
            return true;
        }
        return Values.truthy(value(expression, context));
    }

    private boolean testMembership(Membership membership, EvaluationContext context) {
        Object left = value(membership.left(), context);
        Object right = value(membership.right(), context);
        return switch (membership.operator()) {
            case CONTAINS -> contains(left, right);
            case IN -> isIn(left, right);
            case NOT_IN -> !isIn(left, right);
        };
    }

    private static boolean contains(Object container, Object item) {
        if (container instanceof Collection<?> values) {
            return anyEqual(values, item);
        }
        if (container instanceof String text) {
            return item != null && lower(text).contains(lower(String.valueOf(item)));
        }
        if (container instanceof Map<?, ?> map) {
            return item != null && map.containsKey(String.valueOf(item));
        }
        return false;
    }

    private static boolean isIn(Object item, Object container) {
        if (container instanceof Collection<?> values) {
            return anyEqual(values, item);
        }
        if (container instanceof String text) {
            return item != null && lower(text).contains(lower(String.valueOf(item)));
        }
        return false;
    }

    private static boolean anyEqual(Collection<?> values, Object item) {
        for (Object candidate : values) {
            if (Values.looselyEqual(candidate, item)) {
                return true;
            }
        }
        return false;
    }

    private Object value(Expression expression, EvaluationContext context) {
        if (expression instanceof Literal literal) {
            return literal.value();
        }
        if (expression instanceof PathRef path) {
            return resolve(path, context);
        }
        if (expression instanceof ListLiteral list) {
            List<Object> values = new ArrayList<>(list.items().size());
            for (Expression item : list.items()) {
                values.add(value(item, context));
            }
            return values;
        }
        return test(expression, context);
    }

    private static Object resolve(PathRef path, EvaluationContext context) {
        List<String> segments = path.segments();
        String first = segments.get(0);
        List<String> rest = segments.subList(1, segments.size());
        switch (first.toLowerCase(Locale.ROOT)) {
            case "url_params":
            case "url":
                return nested(context.urlParams(), rest);
            case "session":
            case "responses":
                return nested(context.responses(), rest);
            case "participant":
                return nested(context.participant(), rest);
            case "scores":
                return nested(context.scores(), rest);
            case "assignments":
                return nested(context.assignments(), rest);
            case "environment":
                return nested(context.environment(), rest);
            default:
                break;
        }

        if (context.responses().containsKey(first)) {
            return nested(context.responses().get(first), rest);
        }
        if (context.participant().containsKey(first)) {
            return nested(context.participant(), segments);
        }
        return null;
    }

    private static Object nested(Object root, List<String> path) {
        Object current = root;
        for (String part : path) {
            if (!(current instanceof Map<?, ?> map)) {
                return null;
            }
            current = map.get(part);
            if (current == null) {
                return null;
            }
        }
        return current;
    }

    private static String lower(String value) {
        return value.toLowerCase(Locale.ROOT);
    }
}
