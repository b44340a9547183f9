package com.stagewise.engine.compiler.expression;

import java.util.Collection;

/**
 * Constant operand: a string, a {@code Long}, a {@code Double}, a
 * {@code Boolean} or {@code null}.
 */
public record Literal(Object value) implements Expression {

    public static final Literal TRUE = new Literal(Boolean.TRUE);
    public static final Literal FALSE = new Literal(Boolean.FALSE);
    public static final Literal NULL = new Literal(null);

    @Override
    public void collectPaths(Collection<PathRef> out) {
    }
}
