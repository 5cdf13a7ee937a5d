package org.jstats.matchsync_api.modules.store.model;

import org.jspecify.annotations.Nullable;

import java.time.OffsetDateTime;
import java.util.Map;

/**
 * @param fixturesBySeason season year to fixture count, ascending by season
 * @param lastUpdated      latest fixture write, or null for an empty store
 */
public record DatabaseStats(
        long totalTeams,
        long totalFixtures,
        Map<String, Long> fixturesBySeason,
        @Nullable OffsetDateTime lastUpdated) {
}
