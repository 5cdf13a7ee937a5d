package org.jstats.matchsync_api.modules.sync.model;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Outcome of synchronizing one or more seasons. {@code errors} holds one message per failed record,
 * in processing order.
 */
public record SyncSummary(
        OffsetDateTime updatedAt,
        List<String> seasons,
        int totalMatches,
        int newMatches,
        int updatedMatches,
        int skippedMatches,
        boolean forceUpdate,
        List<String> errors) {

    public SyncSummary {
        seasons = List.copyOf(seasons);
        errors = List.copyOf(errors);
    }

    public static SyncSummary empty(OffsetDateTime updatedAt, List<String> seasons, boolean forceUpdate) {
        return new SyncSummary(updatedAt, seasons, 0, 0, 0, 0, forceUpdate, List.of());
    }

    /**
     * Adds the counters and errors of {@code other}; seasons are unioned in encounter order and the
     * later timestamp wins.
     */
    public SyncSummary merge(SyncSummary other) {
        var mergedSeasons = new LinkedHashSet<>(seasons);
        mergedSeasons.addAll(other.seasons);
        var mergedErrors = new ArrayList<>(errors);
        mergedErrors.addAll(other.errors);
        return new SyncSummary(
                updatedAt.isAfter(other.updatedAt) ? updatedAt : other.updatedAt,
                List.copyOf(mergedSeasons),
                totalMatches + other.totalMatches,
                newMatches + other.newMatches,
                updatedMatches + other.updatedMatches,
                skippedMatches + other.skippedMatches,
                forceUpdate || other.forceUpdate,
                mergedErrors);
    }
}
