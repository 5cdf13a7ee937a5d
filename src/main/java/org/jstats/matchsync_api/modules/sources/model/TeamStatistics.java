package org.jstats.matchsync_api.modules.sources.model;

import org.jspecify.annotations.Nullable;

/**
 * Season statistics of one team as reported by a standings endpoint.
 * <p>
 * Standings tables do not carry rating, errors, red cards or shots, so those stay null
 * unless a provider reports them; the store applies its column defaults.
 */
public record TeamStatistics(
        String team,
        String season,
        int matchesPlayed,
        int wins,
        int draws,
        int losses,
        int goalsFor,
        int goalsAgainst,
        @Nullable Double rating,
        @Nullable Integer errors,
        @Nullable Integer redCards,
        @Nullable Integer shots
) {

    public static final double DEFAULT_RATING = 75.0;

    /**
     * Statistics used when no provider could supply real ones: rating 75.0, everything else 0.
     */
    public static TeamStatistics defaults(String team, String season) {
        return new TeamStatistics(team, season, 0, 0, 0, 0, 0, 0, DEFAULT_RATING, 0, 0, 0);
    }
}
