package org.jstats.matchsync_api.modules.store.model;

import java.time.OffsetDateTime;

/**
 * A persisted, immutable statistics row. Absent values were stored with their column defaults.
 */
public record TeamStatsSnapshot(
        long id,
        double rating,
        int errors,
        int redCards,
        int shots,
        int matchesPlayed,
        int wins,
        int draws,
        int losses,
        int goalsFor,
        int goalsAgainst,
        OffsetDateTime createdAt) {
}
