package org.jstats.matchsync_api.modules.store.model;

import org.jspecify.annotations.Nullable;

import java.time.LocalDate;
import java.time.OffsetDateTime;

/**
 * A fixture as stored, with team and statistics references.
 */
public record FixtureRow(
        long id,
        LocalDate matchDate,
        int season,
        @Nullable String league,
        long homeTeamId,
        long awayTeamId,
        @Nullable Integer homeGoals,
        @Nullable Integer awayGoals,
        @Nullable Double homeOdds,
        @Nullable Double awayOdds,
        @Nullable Long homeStatsId,
        @Nullable Long awayStatsId,
        OffsetDateTime updatedAt) {
}
