package com.customdim.service.core.report;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;

public record ReportTable(List<ReportRow> rows, Map<String, Object> metadata) {
    public ReportTable {
        rows = rows == null ? List.of() : List.copyOf(rows);
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static ReportTable empty() {
        return new ReportTable(List.of(), Map.of());
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public ReportTable mapRows(UnaryOperator<ReportRow> fn) {
        return new ReportTable(rows.stream().map(fn).toList(), metadata);
    }

    public ReportTable withMetadata(Map<String, Object> extra) {
        Map<String, Object> next = new LinkedHashMap<>(metadata);
        next.putAll(extra);
        return new ReportTable(rows, next);
    }
}
