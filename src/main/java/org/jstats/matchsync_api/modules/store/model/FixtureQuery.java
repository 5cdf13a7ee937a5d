package org.jstats.matchsync_api.modules.store.model;

import org.jspecify.annotations.Nullable;

/**
 * @param season exact season filter, or null for all seasons
 * @param team   exact team name playing either side, or null for all teams
 */
public record FixtureQuery(@Nullable Integer season, @Nullable String team, int limit, int offset) {

    public static final int MAX_LIMIT = 1000;

    public FixtureQuery {
        if (limit < 1 || limit > MAX_LIMIT) {
            throw new IllegalArgumentException("limit must be between 1 and " + MAX_LIMIT);
        }
        if (offset < 0) {
            throw new IllegalArgumentException("offset must not be negative");
        }
        team = team == null || team.isBlank() ? null : team;
    }
}
