package com.customdim.service.core.extraction;

import com.customdim.core.model.CustomDimension;
import com.customdim.core.model.ExtractionRule;
import com.customdim.service.core.config.CustomDimensionsProperties;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Ingestion-time evaluation of a dimension's extraction rules. Rules are tried in configured
 * order; the first one yielding a non-blank value wins.
 */
@Slf4j
@Component
public class ExtractionEvaluator {

    private final ExtractionSourceRegistry registry;
    private final int maxValueLength;

    public ExtractionEvaluator(ExtractionSourceRegistry registry, CustomDimensionsProperties properties) {
        this.registry = registry;
        this.maxValueLength = properties.getTracker().getMaxValueLength();
    }

    public Optional<String> extract(CustomDimension dimension, TrackingRequest request) {
        for (ExtractionRule rule : dimension.extractions()) {
            Optional<ExtractionSource> source = registry.find(rule.dimension());
            if (source.isEmpty()) {
                // stored before the source was unregistered
                log.debug("Skipping extraction with unknown source '{}' on dimension {}", rule.dimension(), dimension.id());
                continue;
            }
            Optional<String> value = source.get()
                    .extract(request, rule.pattern(), dimension.caseSensitive())
                    .map(String::trim)
                    .filter(v -> !v.isEmpty());
            if (value.isPresent()) {
                return value.map(this::truncate);
            }
        }
        return Optional.empty();
    }

    public String truncate(String value) {
        return value.length() > maxValueLength ? value.substring(0, maxValueLength) : value;
    }
}
