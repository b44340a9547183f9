package com.stagewise.engine.compiler.expression;

import java.util.Collection;

/**
 * Placeholder for source text that could not be parsed. Evaluates to visible.
 */
public record Invalid(String source, String error) implements Expression {

    @Override
    public void collectPaths(Collection<PathRef> out) {
    }
}
