package org.jstats.matchsync_api.modules.store.repository;

import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;
import org.jstats.matchsync_api.modules.store.model.TeamSummary;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

@Repository
@NullMarked
public class TeamRepository {

    private final NamedParameterJdbcTemplate jdbc;

    public TeamRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public Optional<Long> findIdByName(String name) {
        var sql = """
                SELECT id
                FROM team
                WHERE name = :name
                """;
        var params = new MapSqlParameterSource("name", name);
        final var id = jdbc.query(sql, params, rs -> rs.next() ? rs.getLong(1) : null);
        return Optional.ofNullable(id);
    }

    public long insert(String name, @Nullable String fullName, OffsetDateTime createdAt) {
        final var sql = """
                INSERT INTO team (name, full_name, created_at)
                VALUES (:name, :fullName, :createdAt)
                """;
        final var params = new MapSqlParameterSource()
                .addValue("name", name)
                .addValue("fullName", fullName)
                .addValue("createdAt", createdAt);
        var keys = new GeneratedKeyHolder();
        jdbc.update(sql, params, keys, new String[]{"id"});
        return Objects.requireNonNull(keys.getKey(), "no id generated for team " + name).longValue();
    }

    /**
     * Returns the id of the team with this name, creating it with the name as full name if absent.
     */
    public long ensureTeam(String name, OffsetDateTime now) {
        return findIdByName(name).orElseGet(() -> insert(name, name, now));
    }

    public List<TeamSummary> listWithFixtureCounts() {
        var sql = """
                SELECT t.id, t.name, t.full_name,
                       (SELECT COUNT(*)
                        FROM fixture f
                        WHERE f.home_team_id = t.id OR f.away_team_id = t.id) AS matches_count
                FROM team t
                ORDER BY t.name
                """;
        return jdbc.query(sql, (rs, i) -> new TeamSummary(
                rs.getLong("id"),
                rs.getString("name"),
                rs.getString("full_name"),
                rs.getLong("matches_count")));
    }

    public long count() {
        var n = jdbc.queryForObject("SELECT COUNT(*) FROM team", new MapSqlParameterSource(), Long.class);
        return n == null ? 0 : n;
    }
}
