package com.customdim.service.core.api;

import com.customdim.core.model.CustomDimension;
import com.customdim.core.model.ExtractionRule;
import com.customdim.core.model.Scope;
import com.customdim.service.core.access.AccessControl;
import com.customdim.service.core.allocation.IndexAllocator;
import com.customdim.service.core.dimension.DimensionConfigurationService;
import com.customdim.service.core.extraction.ExtractionSourceRegistry;
import com.customdim.service.core.report.CustomDimensionReportService;
import com.customdim.service.core.report.ReportTable;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Service;

/**
 * Public operations for managing custom dimensions and fetching their reports. Each call checks
 * the caller's access first.
 *
 * <p>Custom dimensions cannot be deleted, only deactivated, so their slots are never freed. Check
 * {@link #getAvailableScopes(int)} before creating one.
 */
@Service
public class CustomDimensionsApi {

    private final AccessControl access;
    private final DimensionConfigurationService dimensions;
    private final IndexAllocator allocator;
    private final ExtractionSourceRegistry extractionSources;
    private final CustomDimensionReportService reports;

    public CustomDimensionsApi(
            AccessControl access,
            DimensionConfigurationService dimensions,
            IndexAllocator allocator,
            ExtractionSourceRegistry extractionSources,
            CustomDimensionReportService reports) {
        this.access = access;
        this.dimensions = dimensions;
        this.allocator = allocator;
        this.extractionSources = extractionSources;
        this.reports = reports;
    }

    /** Report of an active dimension. Requires view access. */
    public ReportTable getCustomDimension(
            long idDimension,
            int idSite,
            String period,
            String date,
            String segment,
            boolean expanded,
            Long idSubtable) {
        access.checkUserHasViewAccess(idSite);
        return reports.getCustomDimension(idDimension, idSite, period, date, segment, expanded, idSubtable);
    }

    /**
     * Configures a new dimension in the next free slot of the scope. Requires admin access.
     *
     * @param active 0/1 flag
     * @param extractions rules in evaluation order, may be empty
     * @param caseSensitive 0/1 flag or {@code null} for case sensitive matching
     * @return the id of the new dimension
     */
    public long configureNewCustomDimension(
            int idSite, String name, String scope, Object active, List<ExtractionRule> extractions, Object caseSensitive) {
        access.checkUserHasAdminAccess(idSite);
        return dimensions
                .createDimension(idSite, name, scope, active, extractions, caseSensitive)
                .id();
    }

    /**
     * Replaces all mutable values of an existing dimension; pass the current values for anything
     * that should stay. Requires admin access.
     */
    public void configureExistingCustomDimension(
            long idDimension,
            int idSite,
            String name,
            Object active,
            List<ExtractionRule> extractions,
            Object caseSensitive) {
        access.checkUserHasAdminAccess(idSite);
        dimensions.updateDimension(idDimension, idSite, name, active, extractions, caseSensitive);
    }

    public List<CustomDimension> getConfiguredCustomDimensions(int idSite) {
        access.checkUserHasAdminAccess(idSite);
        return dimensions.getCustomDimensionsForSite(idSite);
    }

    public List<ScopeAvailability> getAvailableScopes(int idSite) {
        access.checkUserHasAdminAccess(idSite);
        List<ScopeAvailability> scopes = new ArrayList<>();
        for (Scope scope : Scope.values()) {
            int available = allocator.getInstalledSlotCount(scope);
            int used = dimensions.getCustomDimensionsHavingScope(idSite, scope).size();
            scopes.add(new ScopeAvailability(scope.value(), available, used, Math.max(0, available - used)));
        }
        return scopes;
    }

    public List<ExtractionDimensionOption> getAvailableExtractionDimensions() {
        access.checkUserHasSomeAdminAccess();
        List<ExtractionDimensionOption> options = new ArrayList<>();
        extractionSources
                .getSupportedSourceDimensions()
                .forEach((value, name) -> options.add(new ExtractionDimensionOption(value, name)));
        return options;
    }
}
