package org.jstats.matchsync_api.modules.sync.model;

import org.jstats.matchsync_api.modules.store.model.TeamSummary;

import java.util.List;

public record TeamList(List<TeamSummary> teams, int totalCount) {

    public static TeamList of(List<TeamSummary> teams) {
        return new TeamList(teams, teams.size());
    }
}
