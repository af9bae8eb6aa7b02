package com.customdim.service.core.allocation;

import com.customdim.core.error.CustomDimensionException;
import com.customdim.core.error.ErrorCode;
import com.customdim.core.model.CustomDimension;
import com.customdim.core.model.Scope;
import com.customdim.service.core.store.DimensionConfigurationStore;
import java.util.HashSet;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Picks the slot a new dimension binds to. Slots held by deactivated dimensions stay taken; a slot
 * is never handed out twice for the same site and scope.
 *
 * <p>The result is only a proposal. Atomicity comes from the store's unique (site, scope, index)
 * constraint, see {@link com.customdim.service.core.store.SlotConflictException}.
 */
@Component
public class IndexAllocator {

    private final InstalledSlots installedSlots;
    private final DimensionConfigurationStore store;

    public IndexAllocator(InstalledSlots installedSlots, DimensionConfigurationStore store) {
        this.installedSlots = installedSlots;
        this.store = store;
    }

    public int getInstalledSlotCount(Scope scope) {
        return installedSlots.count(scope);
    }

    /**
     * Smallest installed slot not used by any dimension of (siteId, scope).
     *
     * @throws CustomDimensionException {@link ErrorCode#NO_SLOTS_AVAILABLE} when every slot is used
     */
    public int getNextIndex(int siteId, Scope scope) {
        Set<Integer> used = new HashSet<>();
        for (CustomDimension dimension : store.getCustomDimensionsHavingScope(siteId, scope)) {
            used.add(dimension.index());
        }
        for (int index : installedSlots.indexes(scope)) {
            if (!used.contains(index)) {
                return index;
            }
        }
        throw new CustomDimensionException(
                ErrorCode.NO_SLOTS_AVAILABLE,
                "scope",
                "All " + installedSlots.count(scope) + " custom dimension slots of scope '" + scope
                        + "' are in use for site " + siteId);
    }
}
