package com.customdim.service.core.tracker;

import com.customdim.core.model.CustomDimension;
import com.customdim.core.model.Scope;
import com.customdim.service.core.cache.GeneralDimensionCache;
import com.customdim.service.core.cache.SiteDimensionCache;
import com.customdim.service.core.extraction.ExtractionEvaluator;
import com.customdim.service.core.extraction.TrackingRequest;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.SortedSet;
import org.springframework.stereotype.Component;

/**
 * Resolves the custom dimension columns a tracked hit writes. Reads only the tracker caches, never
 * the store directly.
 */
@Component
public class TrackerDimensionValues {

    private final SiteDimensionCache siteCache;
    private final GeneralDimensionCache generalCache;
    private final ExtractionEvaluator evaluator;

    public TrackerDimensionValues(
            SiteDimensionCache siteCache, GeneralDimensionCache generalCache, ExtractionEvaluator evaluator) {
        this.siteCache = siteCache;
        this.generalCache = generalCache;
        this.evaluator = evaluator;
    }

    /**
     * Column to value for each active dimension of the scope that has a value. An explicit
     * {@code dimension<id>} value sent by the client takes precedence over extractions.
     */
    public Map<String, String> resolve(int siteId, Scope scope, TrackingRequest request) {
        Map<String, String> values = new LinkedHashMap<>();
        for (CustomDimension dimension : siteCache.get(siteId).active(scope)) {
            valueFor(dimension, request).ifPresent(v -> values.put(dimension.identity().column(), v));
        }
        return values;
    }

    /** Slot indexes of the scope that at least one site actively writes. */
    public SortedSet<Integer> activeIndexes(Scope scope) {
        return generalCache.current().activeIndexes(scope);
    }

    private Optional<String> valueFor(CustomDimension dimension, TrackingRequest request) {
        String explicit = request.explicitValues().get("dimension" + dimension.id());
        if (explicit != null && !explicit.isBlank()) {
            return Optional.of(evaluator.truncate(explicit.trim()));
        }
        return evaluator.extract(dimension, request);
    }
}
