package com.stagewise.engine.compiler.expression;

import java.util.Collection;

/**
 * Bare operand without an operator; true when the resolved value is truthy
 * (non-null, non-false, non-zero, non-empty).
 */
public record Truthy(Expression operand) implements Expression {

    @Override
    public void collectPaths(Collection<PathRef> out) {
        operand.collectPaths(out);
    }
}
