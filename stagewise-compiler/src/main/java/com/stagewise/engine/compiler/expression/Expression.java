package com.stagewise.engine.compiler.expression;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Node of a compiled visibility expression.
 *
 * <p>Expressions are parsed once when a definition is compiled and are
 * immutable afterwards, so a single tree is shared by every evaluation.
 */
public interface Expression {

    /**
     * Adds every path reference in this subtree to {@code out}.
     */
    void collectPaths(Collection<PathRef> out);

    default List<PathRef> paths() {
        List<PathRef> out = new ArrayList<>();
        collectPaths(out);
        return out;
    }
}
