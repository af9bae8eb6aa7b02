package com.customdim.service.storage.impl;

import com.customdim.core.error.CustomDimensionException;
import com.customdim.core.model.Scope;
import com.customdim.service.core.allocation.InstalledSlots;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

/**
 * Discovers installed slots from the {@code custom_dimension_<n>} columns of each scope's log
 * table. Read once on first use; adding slots requires a restart.
 */
@Slf4j
@Component
public class JdbcInstalledSlots implements InstalledSlots {

    private static final Pattern COLUMN = Pattern.compile("custom_dimension_(\\d+)");

    private final JdbcTemplate jdbc;
    private volatile Map<Scope, SortedSet<Integer>> installed;

    public JdbcInstalledSlots(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public SortedSet<Integer> indexes(Scope scope) {
        Map<Scope, SortedSet<Integer>> snapshot = installed;
        if (snapshot == null) {
            synchronized (this) {
                snapshot = installed;
                if (snapshot == null) {
                    snapshot = load();
                    installed = snapshot;
                }
            }
        }
        return snapshot.get(scope);
    }

    private Map<Scope, SortedSet<Integer>> load() {
        Map<Scope, SortedSet<Integer>> byScope = new EnumMap<>(Scope.class);
        for (Scope scope : Scope.values()) {
            SortedSet<Integer> indexes = new TreeSet<>();
            for (String column : columns(scope.logTable())) {
                Matcher m = COLUMN.matcher(column);
                if (m.matches()) {
                    indexes.add(Integer.parseInt(m.group(1)));
                }
            }
            byScope.put(scope, Collections.unmodifiableSortedSet(indexes));
            log.info("Installed custom dimension slots scope={} table={} slots={}", scope, scope.logTable(), indexes);
        }
        return Collections.unmodifiableMap(byScope);
    }

    private List<String> columns(String table) {
        try {
            return jdbc.queryForList(
                    """
                    SELECT column_name FROM information_schema.columns
                    WHERE table_schema = current_schema() AND table_name = ? AND column_name LIKE 'custom_dimension_%'
                    """,
                    String.class,
                    table);
        } catch (DataAccessException e) {
            throw CustomDimensionException.persistenceFailure("Unable to read installed slots of " + table, e);
        }
    }
}
