package com.customdim.service.core.dimension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

import com.customdim.core.error.CustomDimensionException;
import com.customdim.core.error.ErrorCode;
import com.customdim.core.error.InvalidExtractionException;
import com.customdim.core.model.CustomDimension;
import com.customdim.core.model.DimensionSettings;
import com.customdim.core.model.ExtractionRule;
import com.customdim.core.model.Scope;
import com.customdim.service.core.CustomDimensionsFixture;
import com.customdim.service.core.cache.SiteDimensionCache;
import com.customdim.service.core.cache.TrackerCacheInvalidator;
import com.customdim.service.core.store.InMemoryDimensionConfigurationStore;
import com.customdim.service.core.store.SlotConflictException;
import com.customdim.service.core.validation.ActiveFlagValidator;
import com.customdim.service.core.validation.DimensionNameValidator;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class DimensionConfigurationServiceTest {

    private ExecutorService executor;

    @AfterEach
    void shutdown() {
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    @Test
    void createBindsNextFreeSlotAndMintsIds() {
        CustomDimensionsFixture fx = new CustomDimensionsFixture(new InMemoryDimensionConfigurationStore(), 5, 5);

        CustomDimension first = fx.service.createDimension(1, "Author", "action", 1, List.of(), null);
        CustomDimension second = fx.service.createDimension(1, "Category", "action", "0", List.of(), 0);
        CustomDimension visit = fx.service.createDimension(1, "Plan", "visit", true, List.of(), null);

        assertThat(first.index()).isEqualTo(1);
        assertThat(second.index()).isEqualTo(2);
        assertThat(visit.index()).isEqualTo(1);
        assertThat(second.active()).isFalse();
        assertThat(second.caseSensitive()).isFalse();
        assertThat(first.caseSensitive()).isTrue();
        assertThat(Set.of(first.id(), second.id(), visit.id())).hasSize(3);
    }

    @Test
    void fillsEveryInstalledSlotThenFailsWithNoSlotsAvailable() {
        CustomDimensionsFixture fx = new CustomDimensionsFixture(new InMemoryDimensionConfigurationStore(), 3, 3);
        List<Integer> indexes = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            indexes.add(fx.service.createDimension(9, "d" + i, "visit", 1, List.of(), null).index());
        }

        assertThat(indexes).containsExactly(1, 2, 3);
        assertThatThrownBy(() -> fx.service.createDimension(9, "d3", "visit", 1, List.of(), null))
                .isInstanceOf(CustomDimensionException.class)
                .extracting(e -> ((CustomDimensionException) e).getErrorCode())
                .isEqualTo(ErrorCode.NO_SLOTS_AVAILABLE);
    }

    @Test
    void deactivatedDimensionKeepsItsIndex() {
        CustomDimensionsFixture fx = new CustomDimensionsFixture(new InMemoryDimensionConfigurationStore(), 2, 2);
        CustomDimension created = fx.service.createDimension(1, "Author", "visit", 1, List.of(), null);

        fx.service.updateDimension(created.id(), 1, "Author", 0, List.of(), null);
        CustomDimension next = fx.service.createDimension(1, "Other", "visit", 1, List.of(), null);

        CustomDimension reloaded = fx.service.checkExists(created.id(), 1);
        assertThat(reloaded.index()).isEqualTo(created.index());
        assertThat(reloaded.active()).isFalse();
        assertThat(next.index()).isNotEqualTo(created.index());
    }

    @Test
    void updateReplacesSettingsAndKeepsIdentity() {
        CustomDimensionsFixture fx = new CustomDimensionsFixture(new InMemoryDimensionConfigurationStore(), 5, 5);
        CustomDimension created = fx.service.createDimension(
                3, "Author", "action", 1, List.of(new ExtractionRule("url", "/author/(\\w+)")), null);

        CustomDimension updated = fx.service.updateDimension(
                created.id(), 3, "Writer", "0", List.of(new ExtractionRule("action_name", "by (.*)")), "0");

        assertThat(updated.identity()).isEqualTo(created.identity());
        CustomDimension stored = fx.service.checkExists(created.id(), 3);
        assertThat(stored.identity()).isEqualTo(created.identity());
        assertThat(stored.name()).isEqualTo("Writer");
        assertThat(stored.active()).isFalse();
        assertThat(stored.caseSensitive()).isFalse();
        assertThat(stored.extractions()).containsExactly(new ExtractionRule("action_name", "by (.*)"));
    }

    @Test
    void extractionOrderSurvivesStoreRoundTrip() {
        CustomDimensionsFixture fx = new CustomDimensionsFixture(new InMemoryDimensionConfigurationStore(), 5, 5);
        List<ExtractionRule> rules = List.of(new ExtractionRule("urlparam", "a"), new ExtractionRule("url", "b(.*)"));

        CustomDimension created = fx.service.createDimension(1, "Campaign", "visit", 1, rules, null);

        assertThat(fx.service.getCustomDimensionsForSite(1))
                .singleElement()
                .satisfies(d -> assertThat(d.extractions()).containsExactlyElementsOf(rules));
        assertThat(created.extractions()).containsExactlyElementsOf(rules);
    }

    @Test
    void updateOfUnknownOrForeignDimensionFailsWithNotFound() {
        CustomDimensionsFixture fx = new CustomDimensionsFixture(new InMemoryDimensionConfigurationStore(), 5, 5);
        CustomDimension created = fx.service.createDimension(1, "Author", "visit", 1, List.of(), null);

        assertThatThrownBy(() -> fx.service.updateDimension(created.id(), 2, "x", 1, List.of(), null))
                .isInstanceOf(CustomDimensionException.class)
                .extracting(e -> ((CustomDimensionException) e).getErrorCode())
                .isEqualTo(ErrorCode.NOT_FOUND);
        assertThatThrownBy(() -> fx.service.updateDimension(999L, 1, "x", 1, List.of(), null))
                .isInstanceOf(CustomDimensionException.class)
                .extracting(e -> ((CustomDimensionException) e).getErrorCode())
                .isEqualTo(ErrorCode.NOT_FOUND);
    }

    @Test
    void validationFailuresWriteNothing() {
        InMemoryDimensionConfigurationStore store = new InMemoryDimensionConfigurationStore();
        CustomDimensionsFixture fx = new CustomDimensionsFixture(store, 5, 5);

        assertThatThrownBy(() -> fx.service.createDimension(1, "", "visit", 1, List.of(), null))
                .extracting(e -> ((CustomDimensionException) e).getErrorCode())
                .isEqualTo(ErrorCode.INVALID_NAME);
        assertThatThrownBy(() -> fx.service.createDimension(1, "n", "session", 1, List.of(), null))
                .extracting(e -> ((CustomDimensionException) e).getErrorCode())
                .isEqualTo(ErrorCode.INVALID_SCOPE);
        assertThatThrownBy(() -> fx.service.createDimension(1, "n", "visit", 3, List.of(), null))
                .extracting(e -> ((CustomDimensionException) e).getErrorCode())
                .isEqualTo(ErrorCode.INVALID_ACTIVE_FLAG);
        assertThatThrownBy(() -> fx.service.createDimension(
                        1, "n", "visit", 1, List.of(new ExtractionRule("url", "no-group")), null))
                .isInstanceOf(InvalidExtractionException.class);

        assertThat(store.insertCount()).isZero();
    }

    @Test
    void activeAndExistenceChecks() {
        CustomDimensionsFixture fx = new CustomDimensionsFixture(new InMemoryDimensionConfigurationStore(), 5, 5);
        CustomDimension active = fx.service.createDimension(1, "On", "visit", 1, List.of(), null);
        CustomDimension inactive = fx.service.createDimension(1, "Off", "visit", 0, List.of(), null);

        assertThat(fx.service.exists(active.id(), 1)).isTrue();
        assertThat(fx.service.exists(active.id(), 2)).isFalse();
        assertThat(fx.service.isActive(active.id(), 1)).isTrue();
        assertThat(fx.service.isActive(inactive.id(), 1)).isFalse();
        assertThat(fx.service.checkActive(active.id(), 1)).isEqualTo(active);
        assertThatThrownBy(() -> fx.service.checkActive(inactive.id(), 1))
                .extracting(e -> ((CustomDimensionException) e).getErrorCode())
                .isEqualTo(ErrorCode.INACTIVE);
        assertThatThrownBy(() -> fx.service.checkActive(12345L, 1))
                .extracting(e -> ((CustomDimensionException) e).getErrorCode())
                .isEqualTo(ErrorCode.NOT_FOUND);
    }

    @Test
    void slotConflictTriggersAnotherAllocation() {
        AtomicInteger conflicts = new AtomicInteger(1);
        InMemoryDimensionConfigurationStore store = new InMemoryDimensionConfigurationStore() {
            @Override
            public long configureNewDimension(int siteId, Scope scope, int index, DimensionSettings settings) {
                if (conflicts.getAndDecrement() > 0) {
                    // another request wins slot 1 between allocation and insert
                    super.configureNewDimension(siteId, scope, index, settings);
                    throw new SlotConflictException(siteId, scope, index, null);
                }
                return super.configureNewDimension(siteId, scope, index, settings);
            }
        };
        CustomDimensionsFixture fx = new CustomDimensionsFixture(store, 5, 5);

        CustomDimension created = fx.service.createDimension(1, "Late", "visit", 1, List.of(), null);

        assertThat(created.index()).isEqualTo(2);
        assertThat(store.all()).extracting(CustomDimension::index).containsExactly(1, 2);
    }

    @Test
    void persistentConflictsSurfaceAsPersistenceFailure() {
        InMemoryDimensionConfigurationStore store = new InMemoryDimensionConfigurationStore() {
            @Override
            public long configureNewDimension(int siteId, Scope scope, int index, DimensionSettings settings) {
                throw new SlotConflictException(siteId, scope, index, null);
            }
        };
        CustomDimensionsFixture fx = new CustomDimensionsFixture(store, 5, 5);

        assertThatThrownBy(() -> fx.service.createDimension(1, "n", "visit", 1, List.of(), null))
                .isInstanceOf(CustomDimensionException.class)
                .hasCauseInstanceOf(SlotConflictException.class)
                .extracting(e -> ((CustomDimensionException) e).getErrorCode())
                .isEqualTo(ErrorCode.PERSISTENCE_FAILURE);
    }

    @Test
    void concurrentCreatesForTheLastSlotYieldOneSuccessAndOneNoSlotsAvailable() throws Exception {
        AtomicBoolean racing = new AtomicBoolean(false);
        CountDownLatch bothAllocated = new CountDownLatch(2);
        InMemoryDimensionConfigurationStore store = new InMemoryDimensionConfigurationStore() {
            @Override
            public long configureNewDimension(int siteId, Scope scope, int index, DimensionSettings settings) {
                if (racing.get()) {
                    bothAllocated.countDown();
                    try {
                        bothAllocated.await(5, TimeUnit.SECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                }
                return super.configureNewDimension(siteId, scope, index, settings);
            }
        };
        store.configureNewDimension(1, Scope.VISIT, 1, new DimensionSettings("taken", false, List.of(), true));
        racing.set(true);
        CustomDimensionsFixture fx = new CustomDimensionsFixture(store, 2, 2);
        executor = Executors.newFixedThreadPool(2);

        Callable<CustomDimension> create = () -> fx.service.createDimension(1, "race", "visit", 1, List.of(), null);
        List<Future<CustomDimension>> futures = List.of(executor.submit(create), executor.submit(create));

        int successes = 0;
        List<ErrorCode> failures = new ArrayList<>();
        for (Future<CustomDimension> future : futures) {
            try {
                assertThat(future.get(10, TimeUnit.SECONDS).index()).isEqualTo(2);
                successes++;
            } catch (ExecutionException e) {
                failures.add(((CustomDimensionException) e.getCause()).getErrorCode());
            }
        }

        assertThat(successes).isEqualTo(1);
        assertThat(failures).containsExactly(ErrorCode.NO_SLOTS_AVAILABLE);
        assertThat(store.all()).extracting(CustomDimension::index).containsExactlyInAnyOrder(1, 2);
    }

    @Test
    void cacheInvalidationFailureDoesNotFailTheWrite() {
        InMemoryDimensionConfigurationStore store = new InMemoryDimensionConfigurationStore();
        CustomDimensionsFixture fx = new CustomDimensionsFixture(store, 5, 5);
        SiteDimensionCache brokenCache = mock(SiteDimensionCache.class);
        doThrow(new IllegalStateException("cache node down")).when(brokenCache).invalidate(anyInt());
        DimensionConfigurationService service = new DimensionConfigurationService(
                store,
                fx.allocator,
                new DimensionNameValidator(fx.properties),
                new ActiveFlagValidator(),
                fx.extractionValidator,
                new TrackerCacheInvalidator(brokenCache, fx.generalCache),
                fx.properties);

        CustomDimension created = service.createDimension(1, "ok", "visit", 1, List.of(), null);

        assertThat(created.id()).isPositive();
        assertThat(store.insertCount()).isEqualTo(1);
        verify(brokenCache).invalidate(1);
    }
}
