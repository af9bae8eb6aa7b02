package com.customdim.core.model;

import java.util.Objects;

/**
 * Immutable identity of a configured dimension. Fixed at creation; the (siteId, scope, index)
 * triple is never rebound to another dimension.
 */
public record DimensionIdentity(long id, int siteId, Scope scope, int index) {
    public DimensionIdentity {
        Objects.requireNonNull(scope, "scope");
        if (index < 1) {
            throw new IllegalArgumentException("index must be positive: " + index);
        }
    }

    /** Physical column in the scope's log table this dimension writes to. */
    public String column() {
        return "custom_dimension_" + index;
    }
}
