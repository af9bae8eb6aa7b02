package com.customdim.service.core.allocation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.customdim.core.error.CustomDimensionException;
import com.customdim.core.error.ErrorCode;
import com.customdim.core.model.DimensionSettings;
import com.customdim.core.model.Scope;
import com.customdim.service.core.store.InMemoryDimensionConfigurationStore;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class IndexAllocatorTest {

    private final InMemoryDimensionConfigurationStore store = new InMemoryDimensionConfigurationStore();
    private final IndexAllocator allocator =
            new IndexAllocator(InstalledSlots.fixed(Map.of(Scope.VISIT, 5, Scope.ACTION, 3)), store);

    @Test
    void reportsInstalledCapacityPerScope() {
        assertThat(allocator.getInstalledSlotCount(Scope.VISIT)).isEqualTo(5);
        assertThat(allocator.getInstalledSlotCount(Scope.ACTION)).isEqualTo(3);
    }

    @Test
    void fillsSlotsInOrderThenRunsOut() {
        List<Integer> assigned = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            int index = allocator.getNextIndex(1, Scope.ACTION);
            store.configureNewDimension(1, Scope.ACTION, index, settings(true));
            assigned.add(index);
        }

        assertThat(assigned).containsExactly(1, 2, 3);
        assertThatThrownBy(() -> allocator.getNextIndex(1, Scope.ACTION))
                .isInstanceOf(CustomDimensionException.class)
                .extracting(e -> ((CustomDimensionException) e).getErrorCode())
                .isEqualTo(ErrorCode.NO_SLOTS_AVAILABLE);
    }

    @Test
    void fillsGapsSmallestFirst() {
        store.configureNewDimension(1, Scope.VISIT, 1, settings(true));
        store.configureNewDimension(1, Scope.VISIT, 3, settings(true));

        assertThat(allocator.getNextIndex(1, Scope.VISIT)).isEqualTo(2);
    }

    @Test
    void deactivatedDimensionsKeepTheirSlot() {
        for (int i = 1; i <= 3; i++) {
            store.configureNewDimension(1, Scope.ACTION, i, settings(false));
        }

        assertThatThrownBy(() -> allocator.getNextIndex(1, Scope.ACTION))
                .isInstanceOf(CustomDimensionException.class)
                .hasMessageContaining("in use");
    }

    @Test
    void slotsAreCountedPerSiteAndScope() {
        store.configureNewDimension(1, Scope.VISIT, 1, settings(true));
        store.configureNewDimension(2, Scope.ACTION, 1, settings(true));

        assertThat(allocator.getNextIndex(2, Scope.VISIT)).isEqualTo(1);
        assertThat(allocator.getNextIndex(1, Scope.ACTION)).isEqualTo(1);
        assertThat(allocator.getNextIndex(1, Scope.VISIT)).isEqualTo(2);
    }

    private static DimensionSettings settings(boolean active) {
        return new DimensionSettings("dim", active, List.of(), true);
    }
}
