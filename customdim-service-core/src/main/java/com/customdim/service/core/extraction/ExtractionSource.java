package com.customdim.service.core.extraction;

import java.util.Optional;

/**
 * A tracked attribute custom dimension values can be extracted from. Implementations are Spring
 * beans picked up by {@link ExtractionSourceRegistry}; their {@code @Order} defines the listing
 * order exposed to API callers.
 */
public interface ExtractionSource {

    /** Identifier stored in extraction rules, e.g. {@code url}. */
    String id();

    /** Human readable name for pickers. */
    String displayName();

    PatternKind patternKind();

    /**
     * Applies an already validated pattern to the request.
     *
     * @return the extracted value, empty when the source has no value or the pattern does not match
     */
    Optional<String> extract(TrackingRequest request, String pattern, boolean caseSensitive);
}
