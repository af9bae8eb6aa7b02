package com.customdim.service.core.report;

/** Read access to pre-aggregated report records produced by the archiving job. */
public interface ArchiveReader {

    /** Returns an empty table when nothing was archived for the query. */
    ReportTable read(ArchiveQuery query);
}
