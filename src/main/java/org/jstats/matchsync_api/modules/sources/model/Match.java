package org.jstats.matchsync_api.modules.sources.model;

import org.jspecify.annotations.Nullable;

import java.time.LocalDate;

/**
 * Provider-agnostic representation of one fixture before it is persisted.
 *
 * @param id         provider-assigned identifier, stable across repeated fetches of the same fixture
 * @param date       calendar date of kick-off
 * @param season     4-digit season year, e.g. "2024" for 2024-25
 * @param league     league display name
 * @param homeTeam   home team name
 * @param awayTeam   away team name
 * @param homeGoals  full-time home goals, null when not played
 * @param awayGoals  full-time away goals, null when not played
 * @param homeOdds   market odds favouring the home side
 * @param awayOdds   market odds favouring the away side
 * @param homeStats  per-match statistics of the home side
 * @param awayStats  per-match statistics of the away side
 */
public record Match(
        long id,
        @Nullable LocalDate date,
        @Nullable String season,
        @Nullable String league,
        @Nullable String homeTeam,
        @Nullable String awayTeam,
        @Nullable Integer homeGoals,
        @Nullable Integer awayGoals,
        @Nullable Double homeOdds,
        @Nullable Double awayOdds,
        SideStats homeStats,
        SideStats awayStats
) {

    public Match {
        homeStats = homeStats == null ? SideStats.UNKNOWN : homeStats;
        awayStats = awayStats == null ? SideStats.UNKNOWN : awayStats;
    }

    /**
     * Match with only the fields every provider reports.
     */
    public static Match basic(long id, @Nullable LocalDate date, @Nullable String season, @Nullable String league,
                              @Nullable String homeTeam, @Nullable String awayTeam,
                              @Nullable Integer homeGoals, @Nullable Integer awayGoals) {
        return new Match(id, date, season, league, homeTeam, awayTeam, homeGoals, awayGoals,
                null, null, SideStats.UNKNOWN, SideStats.UNKNOWN);
    }

    public boolean hasScore() {
        return homeGoals != null && awayGoals != null;
    }

    /**
     * Per-side match statistics; every field is null when the provider does not report it.
     */
    public record SideStats(
            @Nullable Double rating,
            @Nullable Integer errors,
            @Nullable Integer redCards,
            @Nullable Integer shots
    ) {
        public static final SideStats UNKNOWN = new SideStats(null, null, null, null);
    }
}
