package com.customdim.service.core.cache;

import com.customdim.service.core.store.DimensionConfigurationStore;
import java.time.Clock;
import java.util.concurrent.atomic.AtomicReference;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Lazily rebuilt {@link GeneralDimensions} snapshot held in a single AtomicReference. Readers never
 * block; a load that races with an invalidation is discarded instead of published.
 */
@Slf4j
@Component
public class GeneralDimensionCache {

    private final DimensionConfigurationStore store;
    private final Clock clock;
    private final AtomicReference<Slot> ref = new AtomicReference<>(new Slot(0L, null));

    public GeneralDimensionCache(DimensionConfigurationStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    public GeneralDimensions current() {
        Slot slot = ref.get();
        if (slot.snapshot() != null) {
            return slot.snapshot();
        }
        GeneralDimensions loaded = GeneralDimensions.of(store.getActiveIndexesInUse(), clock.instant());
        if (!ref.compareAndSet(slot, new Slot(slot.generation(), loaded))) {
            log.debug("General custom dimension snapshot invalidated while loading, not publishing it");
        }
        return loaded;
    }

    public void invalidate() {
        ref.updateAndGet(s -> new Slot(s.generation() + 1, null));
    }

    private record Slot(long generation, GeneralDimensions snapshot) {}
}
