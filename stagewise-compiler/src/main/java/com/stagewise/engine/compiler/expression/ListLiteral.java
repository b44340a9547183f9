package com.stagewise.engine.compiler.expression;

import java.util.Collection;
import java.util.List;

/**
 * Inline list such as {@code ['a', 'b', 3]}, used on the right side of
 * {@code in} / {@code not_in}.
 */
public record ListLiteral(List<Expression> items) implements Expression {

    public ListLiteral {
        items = List.copyOf(items);
    }

    @Override
    public void collectPaths(Collection<PathRef> out) {
        items.forEach(item -> item.collectPaths(out));
    }
}
