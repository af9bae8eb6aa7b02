package com.customdim.service.core.report;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One row of an archived report.
 *
 * @param subtableId id of the row's subtable in the archive, {@code null} if it has none
 * @param subtable inlined subtable, only present for expanded reads
 */
public record ReportRow(
        String label, Map<String, Object> columns, Map<String, Object> metadata, Long subtableId, ReportTable subtable) {
    public ReportRow {
        columns = columns == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(columns));
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public ReportRow withMetadata(String key, Object value) {
        Map<String, Object> next = new LinkedHashMap<>(metadata);
        next.put(key, value);
        return new ReportRow(label, columns, next, subtableId, subtable);
    }

    public ReportRow withSubtable(ReportTable next) {
        return new ReportRow(label, columns, metadata, subtableId, next);
    }
}
