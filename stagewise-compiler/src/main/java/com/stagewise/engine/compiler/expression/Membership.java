package com.stagewise.engine.compiler.expression;

import java.util.Collection;

public record Membership(Expression left, MembershipOperator operator, Expression right) implements Expression {

    @Override
    public void collectPaths(Collection<PathRef> out) {
        left.collectPaths(out);
        right.collectPaths(out);
    }
}
