package com.customdim.service.core.allocation;

import com.customdim.core.model.Scope;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Physical slot capacity per scope, i.e. which {@code custom_dimension_<n>} columns exist. Fixed
 * by the storage schema; never derived from configured dimensions.
 */
public interface InstalledSlots {

    /** Installed slot indexes of a scope in ascending order. */
    SortedSet<Integer> indexes(Scope scope);

    default int count(Scope scope) {
        return indexes(scope).size();
    }

    /** Slots {@code 1..n} per scope. */
    static InstalledSlots fixed(Map<Scope, Integer> counts) {
        Map<Scope, SortedSet<Integer>> byScope = new EnumMap<>(Scope.class);
        for (Scope scope : Scope.values()) {
            SortedSet<Integer> indexes = new TreeSet<>();
            int n = counts.getOrDefault(scope, 0);
            for (int i = 1; i <= n; i++) {
                indexes.add(i);
            }
            byScope.put(scope, Collections.unmodifiableSortedSet(indexes));
        }
        return byScope::get;
    }
}
