package com.stagewise.engine.compiler.expression;

import java.util.Collection;
import java.util.List;

/**
 * N-ary conjunction or disjunction, evaluated left to right with
 * short-circuiting.
 */
public record Logical(Kind kind, List<Expression> operands) implements Expression {

    public enum Kind {
        AND,
        OR
    }

    public Logical {
        operands = List.copyOf(operands);
    }

    @Override
    public void collectPaths(Collection<PathRef> out) {
        operands.forEach(operand -> operand.collectPaths(out));
    }
}
