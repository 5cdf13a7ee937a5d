package org.jstats.matchsync_api.support;

import org.jstats.matchsync_api.modules.sources.model.Match;

import java.time.LocalDate;

public final class Matches {

    private Matches() {
    }

    public static Match played(long id, String season, String home, String away, int homeGoals, int awayGoals) {
        return new Match(id, LocalDate.of(Integer.parseInt(season), 9, 1), season, "Premier League",
                home, away, homeGoals, awayGoals, 1.9, 2.2, null, null);
    }

    public static Match scheduled(long id, String season, String home, String away) {
        return Match.basic(id, LocalDate.of(Integer.parseInt(season), 12, 26), season, "Premier League",
                home, away, null, null);
    }
}
