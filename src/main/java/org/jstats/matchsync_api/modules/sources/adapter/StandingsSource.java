package org.jstats.matchsync_api.modules.sources.adapter;

import org.jstats.matchsync_api.modules.sources.model.TeamStatistics;

import java.util.List;

/**
 * A provider that can report the league standings of a season.
 */
public interface StandingsSource {

    String providerName();

    boolean isConfigured();

    /**
     * @return one entry per team of the season's overall table
     * @throws SourceUnavailableException when the standings could not be fetched
     */
    List<TeamStatistics> fetchStandings(String season);
}
