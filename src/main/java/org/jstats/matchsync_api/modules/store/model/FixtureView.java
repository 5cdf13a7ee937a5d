package org.jstats.matchsync_api.modules.store.model;

import org.jspecify.annotations.Nullable;

import java.time.LocalDate;

/**
 * A fixture joined with its team names, as listed to clients.
 */
public record FixtureView(
        long id,
        LocalDate date,
        int season,
        @Nullable String league,
        String homeTeam,
        String awayTeam,
        @Nullable Integer homeGoals,
        @Nullable Integer awayGoals,
        @Nullable Double homeOdds,
        @Nullable Double awayOdds) {
}
