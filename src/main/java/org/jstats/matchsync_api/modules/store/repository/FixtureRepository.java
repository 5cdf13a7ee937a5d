package org.jstats.matchsync_api.modules.store.repository;

import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;
import org.jstats.matchsync_api.modules.store.model.FixtureQuery;
import org.jstats.matchsync_api.modules.store.model.FixtureRow;
import org.jstats.matchsync_api.modules.store.model.FixtureView;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Repository
@NullMarked
public class FixtureRepository {

    private static final String VIEW_COLUMNS = """
            SELECT f.id, f.match_date, f.season, f.league,
                   home_t.name AS home_team, away_t.name AS away_team,
                   f.home_goals, f.away_goals, f.home_odds, f.away_odds
            FROM fixture f
            JOIN team home_t ON home_t.id = f.home_team_id
            JOIN team away_t ON away_t.id = f.away_team_id
            """;

    private static final RowMapper<FixtureView> VIEW_MAPPER = (rs, i) -> new FixtureView(
            rs.getLong("id"),
            rs.getObject("match_date", LocalDate.class),
            rs.getInt("season"),
            rs.getString("league"),
            rs.getString("home_team"),
            rs.getString("away_team"),
            nullableInt(rs, "home_goals"),
            nullableInt(rs, "away_goals"),
            nullableDouble(rs, "home_odds"),
            nullableDouble(rs, "away_odds"));

    private final NamedParameterJdbcTemplate jdbc;

    public FixtureRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public boolean exists(long id) {
        var sql = """
                SELECT 1
                FROM fixture
                WHERE id = :id
                """;
        final var exists = jdbc.query(sql, new MapSqlParameterSource("id", id),
                rs -> rs.next() ? Boolean.TRUE : Boolean.FALSE);
        return Boolean.TRUE.equals(exists);
    }

    public void insert(FixtureRow row) {
        final var sql = """
                INSERT INTO fixture
                  (id, match_date, season, league, home_team_id, away_team_id, home_goals, away_goals,
                   home_odds, away_odds, home_stats_id, away_stats_id, updated_at)
                VALUES
                  (:id, :matchDate, :season, :league, :homeTeamId, :awayTeamId, :homeGoals, :awayGoals,
                   :homeOdds, :awayOdds, :homeStatsId, :awayStatsId, :updatedAt)
                """;
        jdbc.update(sql, params(row));
    }

    /**
     * Overwrites every mutable column of an existing fixture.
     *
     * @return number of rows changed, 0 when the fixture does not exist
     */
    public int update(FixtureRow row) {
        final var sql = """
                UPDATE fixture
                SET match_date = :matchDate,
                    season = :season,
                    league = :league,
                    home_team_id = :homeTeamId,
                    away_team_id = :awayTeamId,
                    home_goals = :homeGoals,
                    away_goals = :awayGoals,
                    home_odds = :homeOdds,
                    away_odds = :awayOdds,
                    home_stats_id = :homeStatsId,
                    away_stats_id = :awayStatsId,
                    updated_at = :updatedAt
                WHERE id = :id
                """;
        return jdbc.update(sql, params(row));
    }

    public Optional<FixtureRow> findById(long id) {
        var sql = """
                SELECT id, match_date, season, league, home_team_id, away_team_id, home_goals, away_goals,
                       home_odds, away_odds, home_stats_id, away_stats_id, updated_at
                FROM fixture
                WHERE id = :id
                """;
        var rows = jdbc.query(sql, new MapSqlParameterSource("id", id), (rs, i) -> new FixtureRow(
                rs.getLong("id"),
                rs.getObject("match_date", LocalDate.class),
                rs.getInt("season"),
                rs.getString("league"),
                rs.getLong("home_team_id"),
                rs.getLong("away_team_id"),
                nullableInt(rs, "home_goals"),
                nullableInt(rs, "away_goals"),
                nullableDouble(rs, "home_odds"),
                nullableDouble(rs, "away_odds"),
                nullableLong(rs, "home_stats_id"),
                nullableLong(rs, "away_stats_id"),
                rs.getObject("updated_at", OffsetDateTime.class)));
        return rows.stream().findFirst();
    }

    /**
     * Most recent fixtures first.
     */
    public List<FixtureView> findPage(FixtureQuery query) {
        var params = new MapSqlParameterSource()
                .addValue("limit", query.limit())
                .addValue("offset", query.offset());
        var sql = VIEW_COLUMNS + where(query, params) + """
                ORDER BY f.match_date DESC, f.id DESC
                LIMIT :limit OFFSET :offset
                """;
        return jdbc.query(sql, params, VIEW_MAPPER);
    }

    public long countMatching(FixtureQuery query) {
        var params = new MapSqlParameterSource();
        var sql = """
                SELECT COUNT(*)
                FROM fixture f
                JOIN team home_t ON home_t.id = f.home_team_id
                JOIN team away_t ON away_t.id = f.away_team_id
                """ + where(query, params);
        var n = jdbc.queryForObject(sql, params, Long.class);
        return n == null ? 0 : n;
    }

    public long count() {
        var n = jdbc.queryForObject("SELECT COUNT(*) FROM fixture", new MapSqlParameterSource(), Long.class);
        return n == null ? 0 : n;
    }

    /**
     * @return season year to fixture count, ascending by season
     */
    public Map<String, Long> countBySeason() {
        var sql = """
                SELECT season, COUNT(*) AS fixtures
                FROM fixture
                GROUP BY season
                ORDER BY season
                """;
        Map<String, Long> counts = new LinkedHashMap<>();
        RowCallbackHandler collect = rs -> counts.put(String.valueOf(rs.getInt("season")), rs.getLong("fixtures"));
        jdbc.query(sql, collect);
        return counts;
    }

    public Optional<OffsetDateTime> lastUpdated() {
        var sql = "SELECT MAX(updated_at) FROM fixture";
        return Optional.ofNullable(jdbc.queryForObject(sql, new MapSqlParameterSource(), OffsetDateTime.class));
    }

    private static String where(FixtureQuery query, MapSqlParameterSource params) {
        List<String> conditions = new ArrayList<>();
        if (query.season() != null) {
            conditions.add("f.season = :season");
            params.addValue("season", query.season());
        }
        if (query.team() != null) {
            conditions.add("(home_t.name = :team OR away_t.name = :team)");
            params.addValue("team", query.team());
        }
        return conditions.isEmpty() ? "" : "WHERE " + String.join(" AND ", conditions) + "\n";
    }

    private static MapSqlParameterSource params(FixtureRow row) {
        return new MapSqlParameterSource()
                .addValue("id", row.id())
                .addValue("matchDate", row.matchDate())
                .addValue("season", row.season())
                .addValue("league", row.league())
                .addValue("homeTeamId", row.homeTeamId())
                .addValue("awayTeamId", row.awayTeamId())
                .addValue("homeGoals", row.homeGoals())
                .addValue("awayGoals", row.awayGoals())
                .addValue("homeOdds", row.homeOdds())
                .addValue("awayOdds", row.awayOdds())
                .addValue("homeStatsId", row.homeStatsId())
                .addValue("awayStatsId", row.awayStatsId())
                .addValue("updatedAt", row.updatedAt());
    }

    private static @Nullable Integer nullableInt(ResultSet rs, String column) throws SQLException {
        int value = rs.getInt(column);
        return rs.wasNull() ? null : value;
    }

    private static @Nullable Long nullableLong(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : value;
    }

    private static @Nullable Double nullableDouble(ResultSet rs, String column) throws SQLException {
        double value = rs.getDouble(column);
        return rs.wasNull() ? null : value;
    }
}
