package org.jstats.matchsync_api.modules.sources.adapter;

/**
 * No standings entry matched the requested team name exactly.
 */
public class TeamNotFoundException extends RuntimeException {

    public TeamNotFoundException(String team, String season) {
        super("Team " + team + " not found in " + season + " standings");
    }
}
