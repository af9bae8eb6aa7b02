package com.customdim.core.model;

import java.util.List;

/**
 * Mutable part of a dimension's configuration. Replaced as a whole on update; extraction order is
 * significant and kept as given.
 */
public record DimensionSettings(String name, boolean active, List<ExtractionRule> extractions, boolean caseSensitive) {
    public DimensionSettings {
        extractions = extractions == null ? List.of() : List.copyOf(extractions);
    }
}
