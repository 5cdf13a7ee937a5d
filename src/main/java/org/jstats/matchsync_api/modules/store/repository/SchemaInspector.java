package org.jstats.matchsync_api.modules.store.repository;

import org.jspecify.annotations.NullMarked;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reports which of the sync tables exist in the connected database.
 */
@Repository
@NullMarked
public class SchemaInspector {

    public static final List<String> TABLES = List.of("team", "team_stats", "fixture");

    private final NamedParameterJdbcTemplate jdbc;

    public SchemaInspector(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    /**
     * @return table name to presence, in {@link #TABLES} order
     */
    public Map<String, Boolean> tablesPresent() {
        var sql = """
                SELECT LOWER(table_name)
                FROM information_schema.tables
                WHERE LOWER(table_name) IN (:names)
                  AND LOWER(table_schema) NOT IN ('information_schema', 'pg_catalog')
                """;
        var found = new HashSet<>(jdbc.queryForList(sql, new MapSqlParameterSource("names", TABLES), String.class));
        Map<String, Boolean> result = new LinkedHashMap<>();
        TABLES.forEach(t -> result.put(t, found.contains(t)));
        return result;
    }
}
