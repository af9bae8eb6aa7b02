package com.customdim.service.core.report;

import com.customdim.core.model.CustomDimension;
import com.customdim.service.core.dimension.DimensionConfigurationService;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Fetches archived custom dimension reports and annotates them with segment metadata so every row
 * can be drilled into.
 */
@Slf4j
@Service
public class CustomDimensionReportService {

    static final String RECORD_PREFIX = "CustomDimensions_";

    private final DimensionConfigurationService dimensions;
    private final ArchiveReader archiveReader;

    public CustomDimensionReportService(DimensionConfigurationService dimensions, ArchiveReader archiveReader) {
        this.dimensions = dimensions;
        this.archiveReader = archiveReader;
    }

    public static String recordName(long idDimension) {
        return RECORD_PREFIX + idDimension;
    }

    public static String segmentName(long idDimension) {
        return "dimension" + idDimension;
    }

    /**
     * Report of an active dimension. Fails with {@code NOT_FOUND} or {@code INACTIVE} before the
     * archive is touched.
     */
    public ReportTable getCustomDimension(
            long idDimension,
            int siteId,
            String period,
            String date,
            String segment,
            boolean expanded,
            Long subtableId) {
        CustomDimension dimension = dimensions.checkActive(idDimension, siteId);
        String record = recordName(idDimension);

        ReportTable table = archiveReader.read(
                new ArchiveQuery(record, siteId, period, date, segment, expanded, subtableId));

        if (subtableId != null && !table.isEmpty()) {
            ReportTable parent =
                    archiveReader.read(new ArchiveQuery(record, siteId, period, date, segment, false, null));
            for (ReportRow row : parent.rows()) {
                if (subtableId.equals(row.subtableId())) {
                    return annotateSubtable(table, idDimension, row.label());
                }
            }
            log.debug("No parent row found for subtable {} of {} site {}", subtableId, record, siteId);
            return table;
        }
        return annotate(table, dimension);
    }

    private ReportTable annotate(ReportTable table, CustomDimension dimension) {
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("idDimension", dimension.id());
        meta.put("name", dimension.name());
        meta.put("scope", dimension.scope().value());
        meta.put("index", dimension.index());
        return table.withMetadata(meta).mapRows(row -> {
            ReportRow annotated = row.label() == null
                    ? row
                    : row.withMetadata("segment", segmentName(dimension.id()) + "==" + encode(row.label()));
            if (annotated.subtable() != null && row.label() != null) {
                annotated = annotated.withSubtable(annotateSubtable(annotated.subtable(), dimension.id(), row.label()));
            }
            return annotated;
        });
    }

    private ReportTable annotateSubtable(ReportTable table, long idDimension, String parentLabel) {
        String segment = segmentName(idDimension) + "==" + encode(parentLabel);
        return table.mapRows(row -> row.withMetadata("parentLabel", parentLabel).withMetadata("segment", segment));
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
