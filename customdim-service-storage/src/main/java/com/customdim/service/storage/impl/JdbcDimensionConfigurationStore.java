package com.customdim.service.storage.impl;

import com.customdim.core.error.CustomDimensionException;
import com.customdim.core.model.CustomDimension;
import com.customdim.core.model.DimensionIdentity;
import com.customdim.core.model.DimensionSettings;
import com.customdim.core.model.Scope;
import com.customdim.service.core.store.DimensionConfigurationStore;
import com.customdim.service.core.store.SlotConflictException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

/**
 * PostgreSQL backed configuration store. The unique (site_id, scope, slot_index) constraint makes
 * concurrent inserts for the same slot fail for all but one caller.
 */
@Repository
public class JdbcDimensionConfigurationStore implements DimensionConfigurationStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcDimensionConfigurationStore.class);

    private static final String INSERT_SQL =
            """
        insert into custom_dimensions(
              site_id, name, scope, slot_index, active, case_sensitive, extractions
        ) values (
              :site_id, :name, :scope, :slot_index, :active, :case_sensitive, cast(:extractions as jsonb)
        )
        returning id
        """;

    private static final String UPDATE_SQL =
            """
        update custom_dimensions
           set name = :name,
               active = :active,
               case_sensitive = :case_sensitive,
               extractions = cast(:extractions as jsonb),
               updated_at = now()
         where id = :id and site_id = :site_id
        """;

    private static final String SELECT_COLUMNS =
            "select id, site_id, name, scope, slot_index, active, case_sensitive, extractions::text as extractions"
                    + " from custom_dimensions";

    private final NamedParameterJdbcTemplate jdbc;
    private final ExtractionsJson extractionsJson;
    private final RowMapper<CustomDimension> rowMapper = this::mapRow;

    public JdbcDimensionConfigurationStore(NamedParameterJdbcTemplate jdbc, ObjectMapper mapper) {
        this.jdbc = jdbc;
        this.extractionsJson = new ExtractionsJson(mapper);
    }

    @Override
    public long configureNewDimension(int siteId, Scope scope, int index, DimensionSettings settings) {
        MapSqlParameterSource params = settingsParams(settings)
                .addValue("site_id", siteId)
                .addValue("scope", scope.value())
                .addValue("slot_index", index);
        try {
            Long id = jdbc.queryForObject(INSERT_SQL, params, Long.class);
            if (id == null) {
                throw CustomDimensionException.persistenceFailure("Insert returned no id for site " + siteId, null);
            }
            return id;
        } catch (DuplicateKeyException e) {
            log.debug("Slot conflict site={} scope={} index={}", siteId, scope, index);
            throw new SlotConflictException(siteId, scope, index, e);
        } catch (DataAccessException e) {
            log.error("Failed to insert custom dimension for site {} scope {} index {}", siteId, scope, index, e);
            throw CustomDimensionException.persistenceFailure("Failed to store custom dimension", e);
        }
    }

    @Override
    public void configureExistingDimension(long idDimension, int siteId, DimensionSettings settings) {
        MapSqlParameterSource params =
                settingsParams(settings).addValue("id", idDimension).addValue("site_id", siteId);
        int updated;
        try {
            updated = jdbc.update(UPDATE_SQL, params);
        } catch (DataAccessException e) {
            log.error("Failed to update custom dimension {} of site {}", idDimension, siteId, e);
            throw CustomDimensionException.persistenceFailure("Failed to update custom dimension", e);
        }
        if (updated == 0) {
            throw CustomDimensionException.notFound(idDimension, siteId);
        }
    }

    @Override
    public List<CustomDimension> getCustomDimensionsForSite(int siteId) {
        return query(() -> jdbc.query(
                SELECT_COLUMNS + " where site_id = :site_id order by id",
                new MapSqlParameterSource("site_id", siteId),
                rowMapper));
    }

    @Override
    public List<CustomDimension> getCustomDimensionsHavingScope(int siteId, Scope scope) {
        return query(() -> jdbc.query(
                SELECT_COLUMNS + " where site_id = :site_id and scope = :scope order by id",
                new MapSqlParameterSource()
                        .addValue("site_id", siteId)
                        .addValue("scope", scope.value()),
                rowMapper));
    }

    @Override
    public Optional<CustomDimension> getCustomDimension(long idDimension, int siteId) {
        List<CustomDimension> rows = query(() -> jdbc.query(
                SELECT_COLUMNS + " where id = :id and site_id = :site_id",
                new MapSqlParameterSource().addValue("id", idDimension).addValue("site_id", siteId),
                rowMapper));
        return rows.stream().findFirst();
    }

    @Override
    public Map<Scope, Set<Integer>> getActiveIndexesInUse() {
        List<SlotRow> rows = query(() -> jdbc.query(
                "select distinct scope, slot_index from custom_dimensions where active = true",
                new MapSqlParameterSource(),
                (rs, rowNum) -> new SlotRow(Scope.validate(rs.getString("scope")), rs.getInt("slot_index"))));
        Map<Scope, Set<Integer>> out = new EnumMap<>(Scope.class);
        for (SlotRow row : rows) {
            out.computeIfAbsent(row.scope(), s -> new HashSet<>()).add(row.index());
        }
        return out;
    }

    private MapSqlParameterSource settingsParams(DimensionSettings settings) {
        return new MapSqlParameterSource()
                .addValue("name", settings.name())
                .addValue("active", settings.active())
                .addValue("case_sensitive", settings.caseSensitive())
                .addValue("extractions", extractionsJson.write(settings.extractions()), Types.VARCHAR);
    }

    private CustomDimension mapRow(ResultSet rs, int rowNum) throws SQLException {
        DimensionIdentity identity = new DimensionIdentity(
                rs.getLong("id"),
                rs.getInt("site_id"),
                Scope.validate(rs.getString("scope")),
                rs.getInt("slot_index"));
        DimensionSettings settings = new DimensionSettings(
                rs.getString("name"),
                rs.getBoolean("active"),
                extractionsJson.read(rs.getString("extractions")),
                rs.getBoolean("case_sensitive"));
        return new CustomDimension(identity, settings);
    }

    private static <T> T query(Supplier<T> call) {
        try {
            return call.get();
        } catch (DataAccessException e) {
            log.error("Failed to read custom dimension configuration", e);
            throw CustomDimensionException.persistenceFailure("Failed to read custom dimension configuration", e);
        }
    }

    private record SlotRow(Scope scope, int index) {}
}
