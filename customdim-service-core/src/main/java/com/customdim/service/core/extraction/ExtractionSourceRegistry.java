package com.customdim.service.core.extraction;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Closed, startup-time registry of the sources extraction rules may read from. Built once from the
 * {@link ExtractionSource} beans in their declared order.
 */
@Component
public class ExtractionSourceRegistry {

    private final Map<String, ExtractionSource> sources;

    public ExtractionSourceRegistry(List<ExtractionSource> sources) {
        Map<String, ExtractionSource> byId = new LinkedHashMap<>();
        for (ExtractionSource source : sources) {
            ExtractionSource previous = byId.putIfAbsent(source.id(), source);
            if (previous != null) {
                throw new IllegalStateException("Duplicate extraction source id '" + source.id() + "': "
                        + previous.getClass().getName() + " and " + source.getClass().getName());
            }
        }
        this.sources = Collections.unmodifiableMap(byId);
    }

    /** Ordered mapping of source id to display name. */
    public Map<String, String> getSupportedSourceDimensions() {
        Map<String, String> out = new LinkedHashMap<>();
        sources.forEach((id, source) -> out.put(id, source.displayName()));
        return out;
    }

    public Optional<ExtractionSource> find(String id) {
        return Optional.ofNullable(id == null ? null : sources.get(id));
    }
}
