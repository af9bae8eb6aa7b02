package com.customdim.core.model;

import java.util.List;
import java.util.Objects;

/** A configured custom dimension: its identity plus its current settings. */
public record CustomDimension(DimensionIdentity identity, DimensionSettings settings) {
    public CustomDimension {
        Objects.requireNonNull(identity, "identity");
        Objects.requireNonNull(settings, "settings");
    }

    public long id() {
        return identity.id();
    }

    public int siteId() {
        return identity.siteId();
    }

    public Scope scope() {
        return identity.scope();
    }

    public int index() {
        return identity.index();
    }

    public String name() {
        return settings.name();
    }

    public boolean active() {
        return settings.active();
    }

    public boolean caseSensitive() {
        return settings.caseSensitive();
    }

    public List<ExtractionRule> extractions() {
        return settings.extractions();
    }

    /** Same identity, new settings. Identity fields cannot change through an update. */
    public CustomDimension withSettings(DimensionSettings next) {
        return new CustomDimension(identity, next);
    }
}
