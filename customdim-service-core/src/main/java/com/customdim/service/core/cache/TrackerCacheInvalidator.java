package com.customdim.service.core.cache;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Drops the tracker caches after a configuration write. Failures are logged and swallowed: the
 * write already happened and stale entries expire or get replaced on the next write.
 */
@Slf4j
@Component
public class TrackerCacheInvalidator {

    private final SiteDimensionCache siteCache;
    private final GeneralDimensionCache generalCache;

    public TrackerCacheInvalidator(SiteDimensionCache siteCache, GeneralDimensionCache generalCache) {
        this.siteCache = siteCache;
        this.generalCache = generalCache;
    }

    public void invalidate(int siteId) {
        try {
            siteCache.invalidate(siteId);
        } catch (RuntimeException e) {
            log.warn(
                    "Degraded consistency: failed to invalidate custom dimension cache of site {}, tracker may use stale slots",
                    siteId,
                    e);
        }
        try {
            generalCache.invalidate();
        } catch (RuntimeException e) {
            log.warn(
                    "Degraded consistency: failed to invalidate general custom dimension cache after change on site {}",
                    siteId,
                    e);
        }
    }
}
