package com.stagewise.engine.compiler.expression;

import java.util.Collection;

public record Comparison(Expression left, ComparisonOperator operator, Expression right) implements Expression {

    @Override
    public void collectPaths(Collection<PathRef> out) {
        left.collectPaths(out);
        right.collectPaths(out);
    }
}
