package com.customdim.service.core.report;

/**
 * Coordinates of an archived report.
 *
 * @param segment segment definition, {@code null} for all visits
 * @param subtableId subtable to read instead of the root table, {@code null} for the root
 */
public record ArchiveQuery(
        String recordName, int siteId, String period, String date, String segment, boolean expanded, Long subtableId) {}
