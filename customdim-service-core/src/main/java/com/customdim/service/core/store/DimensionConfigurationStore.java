package com.customdim.service.core.store;

import com.customdim.core.model.CustomDimension;
import com.customdim.core.model.DimensionSettings;
import com.customdim.core.model.Scope;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Authoritative mapping of dimension id to site, scope, slot and settings. Storage failures
 * surface as {@code PERSISTENCE_FAILURE} custom dimension exceptions.
 */
public interface DimensionConfigurationStore {

    /**
     * Persists a new dimension bound to (siteId, scope, index) and mints its id.
     *
     * @throws SlotConflictException if another dimension already holds the slot
     */
    long configureNewDimension(int siteId, Scope scope, int index, DimensionSettings settings);

    /**
     * Replaces name, active flag, case sensitivity and extractions. Identity columns are never written.
     *
     * @throws com.customdim.core.error.CustomDimensionException {@code NOT_FOUND} if (idDimension, siteId)
     *     does not resolve
     */
    void configureExistingDimension(long idDimension, int siteId, DimensionSettings settings);

    /** All dimensions of a site, any scope, active or not, ordered by id. */
    List<CustomDimension> getCustomDimensionsForSite(int siteId);

    /** Dimensions of a site in the given scope, active or not, ordered by id. */
    List<CustomDimension> getCustomDimensionsHavingScope(int siteId, Scope scope);

    Optional<CustomDimension> getCustomDimension(long idDimension, int siteId);

    /** Slot indexes held by at least one active dimension of any site, per scope. */
    Map<Scope, Set<Integer>> getActiveIndexesInUse();
}
