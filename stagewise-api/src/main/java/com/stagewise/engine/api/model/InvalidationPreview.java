package com.stagewise.engine.api.model;

import java.util.List;

/**
 * Units an edit of {@code unitId} would invalidate, in topological order.
 */
public record InvalidationPreview(String unitId, List<String> affectedUnitIds, int count) {

    public InvalidationPreview {
        affectedUnitIds = List.copyOf(affectedUnitIds);
    }

    public boolean wouldInvalidate() {
        return count > 0;
    }
}
