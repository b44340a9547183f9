package com.stagewise.engine.compiler.expression;

import java.util.Collection;
import java.util.List;

/**
 * Dotted reference into the evaluation context, e.g. {@code participant.age}
 * or {@code consent.agreed}.
 */
public record PathRef(String raw, List<String> segments) implements Expression {

    public PathRef {
        segments = List.copyOf(segments);
    }

    public static PathRef of(String raw) {
        return new PathRef(raw, List.of(raw.split("\\.")));
    }

    public String head() {
        return segments.get(0);
    }

    @Override
    public void collectPaths(Collection<PathRef> out) {
        out.add(this);
    }
}
