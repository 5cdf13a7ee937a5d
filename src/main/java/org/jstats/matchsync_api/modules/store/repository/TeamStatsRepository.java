package org.jstats.matchsync_api.modules.store.repository;

import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;
import org.jstats.matchsync_api.modules.sources.model.TeamStatistics;
import org.jstats.matchsync_api.modules.store.model.TeamStatsSnapshot;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.Objects;
import java.util.Optional;

/**
 * Append-only: snapshots are inserted and read, never updated or deleted.
 */
@Repository
@NullMarked
public class TeamStatsRepository {

    private final NamedParameterJdbcTemplate jdbc;

    public TeamStatsRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    /**
     * Stores a new snapshot; null rating and counters take the column defaults (75.0 and 0).
     */
    public long insertSnapshot(TeamStatistics stats, OffsetDateTime createdAt) {
        final var sql = """
                INSERT INTO team_stats
                  (rating, errors, red_cards, shots, matches_played, wins, draws, losses,
                   goals_for, goals_against, created_at)
                VALUES
                  (:rating, :errors, :redCards, :shots, :matchesPlayed, :wins, :draws, :losses,
                   :goalsFor, :goalsAgainst, :createdAt)
                """;
        final var params = new MapSqlParameterSource()
                .addValue("rating", orDefault(stats.rating(), TeamStatistics.DEFAULT_RATING))
                .addValue("errors", orZero(stats.errors()))
                .addValue("redCards", orZero(stats.redCards()))
                .addValue("shots", orZero(stats.shots()))
                .addValue("matchesPlayed", stats.matchesPlayed())
                .addValue("wins", stats.wins())
                .addValue("draws", stats.draws())
                .addValue("losses", stats.losses())
                .addValue("goalsFor", stats.goalsFor())
                .addValue("goalsAgainst", stats.goalsAgainst())
                .addValue("createdAt", createdAt);
        var keys = new GeneratedKeyHolder();
        jdbc.update(sql, params, keys, new String[]{"id"});
        return Objects.requireNonNull(keys.getKey(), "no id generated for statistics of " + stats.team()).longValue();
    }

    public Optional<TeamStatsSnapshot> findById(long id) {
        var sql = """
                SELECT id, rating, errors, red_cards, shots, matches_played, wins, draws, losses,
                       goals_for, goals_against, created_at
                FROM team_stats
                WHERE id = :id
                """;
        var rows = jdbc.query(sql, new MapSqlParameterSource("id", id), (rs, i) -> new TeamStatsSnapshot(
                rs.getLong("id"),
                rs.getDouble("rating"),
                rs.getInt("errors"),
                rs.getInt("red_cards"),
                rs.getInt("shots"),
                rs.getInt("matches_played"),
                rs.getInt("wins"),
                rs.getInt("draws"),
                rs.getInt("losses"),
                rs.getInt("goals_for"),
                rs.getInt("goals_against"),
                rs.getObject("created_at", OffsetDateTime.class)));
        return rows.stream().findFirst();
    }

    public long count() {
        var n = jdbc.queryForObject("SELECT COUNT(*) FROM team_stats", new MapSqlParameterSource(), Long.class);
        return n == null ? 0 : n;
    }

    private static double orDefault(@Nullable Double value, double fallback) {
        return value == null ? fallback : value;
    }

    private static int orZero(@Nullable Integer value) {
        return value == null ? 0 : value;
    }
}
