package com.customdim.service.core.cache;

import com.customdim.service.core.config.CustomDimensionsProperties;
import com.customdim.service.core.store.DimensionConfigurationStore;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import java.time.Clock;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Cache-aside view of each site's dimensions for the ingestion path. Entries are replaced whole,
 * so readers see either the old or the new snapshot.
 */
@Slf4j
@Component
public class SiteDimensionCache {

    private final LoadingCache<Integer, SiteDimensions> cache;

    public SiteDimensionCache(DimensionConfigurationStore store, CustomDimensionsProperties properties, Clock clock) {
        CustomDimensionsProperties.Cache cfg = properties.getCache();
        this.cache = Caffeine.newBuilder()
                .maximumSize(cfg.getSiteMaximumSize())
                .expireAfterWrite(cfg.getSiteTtl())
                .recordStats()
                .build(siteId -> {
                    SiteDimensions loaded =
                            new SiteDimensions(siteId, store.getCustomDimensionsForSite(siteId), clock.instant());
                    log.debug("Loaded {} custom dimensions for site {}", loaded.dimensions().size(), siteId);
                    return loaded;
                });
        log.info(
                "Initialized site custom dimension cache size={} ttl={}", cfg.getSiteMaximumSize(), cfg.getSiteTtl());
    }

    public SiteDimensions get(int siteId) {
        return cache.get(siteId);
    }

    public void invalidate(int siteId) {
        cache.invalidate(siteId);
    }

    public void invalidateAll() {
        cache.invalidateAll();
    }
}
