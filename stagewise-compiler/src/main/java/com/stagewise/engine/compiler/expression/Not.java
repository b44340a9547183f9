package com.stagewise.engine.compiler.expression;

import java.util.Collection;

public record Not(Expression operand) implements Expression {

    @Override
    public void collectPaths(Collection<PathRef> out) {
        operand.collectPaths(out);
    }
}
