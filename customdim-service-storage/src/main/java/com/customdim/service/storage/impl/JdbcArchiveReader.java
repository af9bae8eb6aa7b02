package com.customdim.service.storage.impl;

import com.customdim.core.error.CustomDimensionException;
import com.customdim.service.core.report.ArchiveQuery;
import com.customdim.service.core.report.ArchiveReader;
import com.customdim.service.core.report.ReportRow;
import com.customdim.service.core.report.ReportTable;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Component;

/**
 * Reads report rows written by the archiving job. Root tables have {@code table_id = 0}; a row's
 * {@code subtable_id} points at the {@code table_id} of its subtable.
 */
@Component
public class JdbcArchiveReader implements ArchiveReader {

    private static final Logger log = LoggerFactory.getLogger(JdbcArchiveReader.class);
    private static final TypeReference<Map<String, Object>> COLUMNS = new TypeReference<>() {};
    private static final long ROOT_TABLE = 0L;

    private static final String SELECT_SQL =
            """
        select label, columns::text as columns, subtable_id
          from archive_report_rows
         where record_name = :record_name
           and site_id = :site_id
           and period = :period
           and date_range = :date_range
           and segment = :segment
           and table_id = :table_id
         order by row_order
        """;

    private final NamedParameterJdbcTemplate jdbc;
    private final ObjectMapper mapper;

    public JdbcArchiveReader(NamedParameterJdbcTemplate jdbc, ObjectMapper mapper) {
        this.jdbc = jdbc;
        this.mapper = mapper;
    }

    @Override
    public ReportTable read(ArchiveQuery query) {
        long tableId = query.subtableId() == null ? ROOT_TABLE : query.subtableId();
        return readTable(query, tableId);
    }

    private ReportTable readTable(ArchiveQuery query, long tableId) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("record_name", query.recordName())
                .addValue("site_id", query.siteId())
                .addValue("period", query.period())
                .addValue("date_range", query.date())
                .addValue("segment", query.segment() == null ? "" : query.segment())
                .addValue("table_id", tableId);
        List<ReportRow> rows;
        try {
            rows = jdbc.query(SELECT_SQL, params, (rs, rowNum) -> {
                long subtable = rs.getLong("subtable_id");
                Long subtableId = rs.wasNull() ? null : subtable;
                return new ReportRow(rs.getString("label"), parseColumns(rs.getString("columns")), Map.of(), subtableId, null);
            });
        } catch (DataAccessException e) {
            log.error("Failed to read archive {} site={} period={} date={}", query.recordName(), query.siteId(),
                    query.period(), query.date(), e);
            throw CustomDimensionException.persistenceFailure("Failed to read archived report " + query.recordName(), e);
        }
        if (!query.expanded()) {
            return new ReportTable(rows, Map.of());
        }
        List<ReportRow> expanded = new ArrayList<>(rows.size());
        for (ReportRow row : rows) {
            expanded.add(row.subtableId() == null ? row : row.withSubtable(readTable(query, row.subtableId())));
        }
        return new ReportTable(expanded, Map.of());
    }

    private Map<String, Object> parseColumns(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            Map<String, Object> columns = mapper.readValue(json, COLUMNS);
            return columns == null ? Map.of() : columns;
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Archived row columns are not valid JSON", e);
        }
    }
}
