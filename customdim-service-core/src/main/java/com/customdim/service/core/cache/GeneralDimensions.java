package com.customdim.service.core.cache;

import com.customdim.core.model.Scope;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Process-wide snapshot: which slot indexes are held by an active dimension of any site, per
 * scope. Ingestion uses it to decide which log columns to write.
 */
public record GeneralDimensions(Map<Scope, SortedSet<Integer>> activeIndexes, Instant loadedAt) {

    public static GeneralDimensions of(Map<Scope, Set<Integer>> indexes, Instant loadedAt) {
        Map<Scope, SortedSet<Integer>> copy = new EnumMap<>(Scope.class);
        for (Scope scope : Scope.values()) {
            copy.put(scope, Collections.unmodifiableSortedSet(new TreeSet<>(indexes.getOrDefault(scope, Set.of()))));
        }
        return new GeneralDimensions(Collections.unmodifiableMap(copy), loadedAt);
    }

    public SortedSet<Integer> activeIndexes(Scope scope) {
        return activeIndexes.get(scope);
    }
}
