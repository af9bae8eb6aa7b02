package com.customdim.service.core.dimension;

import com.customdim.core.error.CustomDimensionException;
import com.customdim.core.model.CustomDimension;
import com.customdim.core.model.DimensionIdentity;
import com.customdim.core.model.DimensionSettings;
import com.customdim.core.model.ExtractionRule;
import com.customdim.core.model.Scope;
import com.customdim.service.core.allocation.IndexAllocator;
import com.customdim.service.core.cache.TrackerCacheInvalidator;
import com.customdim.service.core.config.CustomDimensionsProperties;
import com.customdim.service.core.extraction.ExtractionRulesValidator;
import com.customdim.service.core.store.DimensionConfigurationStore;
import com.customdim.service.core.store.SlotConflictException;
import com.customdim.service.core.validation.ActiveFlagValidator;
import com.customdim.service.core.validation.DimensionNameValidator;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Creates and updates custom dimensions. Every input is validated before anything is written,
 * and the tracker caches are dropped after each successful write.
 */
@Slf4j
@Service
public class DimensionConfigurationService {

    private final DimensionConfigurationStore store;
    private final IndexAllocator allocator;
    private final DimensionNameValidator nameValidator;
    private final ActiveFlagValidator flagValidator;
    private final ExtractionRulesValidator extractionValidator;
    private final TrackerCacheInvalidator cacheInvalidator;
    private final int maxAttempts;

    public DimensionConfigurationService(
            DimensionConfigurationStore store,
            IndexAllocator allocator,
            DimensionNameValidator nameValidator,
            ActiveFlagValidator flagValidator,
            ExtractionRulesValidator extractionValidator,
            TrackerCacheInvalidator cacheInvalidator,
            CustomDimensionsProperties properties) {
        this.store = store;
        this.allocator = allocator;
        this.nameValidator = nameValidator;
        this.flagValidator = flagValidator;
        this.extractionValidator = extractionValidator;
        this.cacheInvalidator = cacheInvalidator;
        this.maxAttempts = Math.max(1, properties.getAllocation().getMaxAttempts());
    }

    /**
     * Validates the configuration, binds the dimension to the next free slot of (siteId, scope) and
     * persists it. A slot taken concurrently between allocation and insert triggers a fresh
     * allocation.
     *
     * @param caseSensitive 0/1 flag, {@code null} for the default (case sensitive)
     */
    public CustomDimension createDimension(
            int siteId, String name, String scope, Object active, List<ExtractionRule> extractions, Object caseSensitive) {
        DimensionSettings settings = validateSettings(name, active, extractions, caseSensitive);
        Scope validScope = Scope.validate(scope);

        SlotConflictException lastConflict = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            int index = allocator.getNextIndex(siteId, validScope);
            try {
                long id = store.configureNewDimension(siteId, validScope, index, settings);
                CustomDimension created =
                        new CustomDimension(new DimensionIdentity(id, siteId, validScope, index), settings);
                log.info(
                        "Configured custom dimension id={} site={} scope={} index={} name='{}'",
                        id,
                        siteId,
                        validScope,
                        index,
                        settings.name());
                cacheInvalidator.invalidate(siteId);
                return created;
            } catch (SlotConflictException e) {
                lastConflict = e;
                log.warn(
                        "Slot {} of scope {} for site {} taken concurrently (attempt {}/{}), allocating again",
                        index,
                        validScope,
                        siteId,
                        attempt,
                        maxAttempts);
            }
        }
        throw CustomDimensionException.persistenceFailure(
                "Could not allocate a custom dimension slot for site " + siteId + " scope " + validScope + " after "
                        + maxAttempts + " attempts",
                lastConflict);
    }

    /** Replaces name, active flag, case sensitivity and extractions of an existing dimension. */
    public CustomDimension updateDimension(
            long idDimension,
            int siteId,
            String name,
            Object active,
            List<ExtractionRule> extractions,
            Object caseSensitive) {
        CustomDimension existing = checkExists(idDimension, siteId);
        DimensionSettings settings = validateSettings(name, active, extractions, caseSensitive);

        store.configureExistingDimension(idDimension, siteId, settings);
        log.info(
                "Updated custom dimension id={} site={} active={} extractions={}",
                idDimension,
                siteId,
                settings.active(),
                settings.extractions().size());
        cacheInvalidator.invalidate(siteId);
        return existing.withSettings(settings);
    }

    public List<CustomDimension> getCustomDimensionsForSite(int siteId) {
        return store.getCustomDimensionsForSite(siteId);
    }

    public List<CustomDimension> getCustomDimensionsHavingScope(int siteId, Scope scope) {
        return store.getCustomDimensionsHavingScope(siteId, scope);
    }

    public Optional<CustomDimension> find(long idDimension, int siteId) {
        return store.getCustomDimension(idDimension, siteId);
    }

    public boolean exists(long idDimension, int siteId) {
        return find(idDimension, siteId).isPresent();
    }

    public boolean isActive(long idDimension, int siteId) {
        return find(idDimension, siteId).map(CustomDimension::active).orElse(false);
    }

    public CustomDimension checkExists(long idDimension, int siteId) {
        return find(idDimension, siteId).orElseThrow(() -> CustomDimensionException.notFound(idDimension, siteId));
    }

    public CustomDimension checkActive(long idDimension, int siteId) {
        CustomDimension dimension = checkExists(idDimension, siteId);
        if (!dimension.active()) {
            throw CustomDimensionException.inactive(idDimension, siteId);
        }
        return dimension;
    }

    private DimensionSettings validateSettings(
            String name, Object active, List<ExtractionRule> extractions, Object caseSensitive) {
        String validName = nameValidator.validate(name);
        boolean validActive = flagValidator.validate(active);
        List<ExtractionRule> validExtractions = extractionValidator.validate(extractions);
        boolean validCaseSensitive = caseSensitive == null || flagValidator.validate(caseSensitive, "caseSensitive");
        return new DimensionSettings(validName, validActive, validExtractions, validCaseSensitive);
    }
}
