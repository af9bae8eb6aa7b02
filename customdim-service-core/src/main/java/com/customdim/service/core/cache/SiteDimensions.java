package com.customdim.service.core.cache;

import com.customdim.core.model.CustomDimension;
import com.customdim.core.model.Scope;
import java.time.Instant;
import java.util.List;

/** Immutable per-site projection of the configuration store read by the tracker. */
public record SiteDimensions(int siteId, List<CustomDimension> dimensions, Instant loadedAt) {
    public SiteDimensions {
        dimensions = List.copyOf(dimensions);
    }

    /** Active dimensions of a scope in id order. */
    public List<CustomDimension> active(Scope scope) {
        return dimensions.stream()
                .filter(d -> d.active() && d.scope() == scope)
                .toList();
    }
}
