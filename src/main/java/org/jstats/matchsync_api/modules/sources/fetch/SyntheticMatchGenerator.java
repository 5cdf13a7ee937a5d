package org.jstats.matchsync_api.modules.sources.fetch;

import org.jstats.matchsync_api.modules.sources.model.Match;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Fabricated but deterministically shaped season used when no provider delivers data.
 */
public class SyntheticMatchGenerator {

    private static final Logger log = LoggerFactory.getLogger(SyntheticMatchGenerator.class);

    public static final String LEAGUE = "Premier League";
    public static final int MATCH_COUNT = 50;

    // Keeps synthetic ids clear of provider id ranges and distinct per season
    static final long ID_BASE = 90_000_000L;

    static final List<String> TEAMS = List.of(
            "Arsenal", "Chelsea", "Liverpool", "Manchester City", "Manchester United",
            "Tottenham", "Newcastle", "Brighton", "Aston Villa", "West Ham",
            "Crystal Palace", "Fulham", "Wolves", "Everton", "Brentford",
            "Nottingham Forest", "Bournemouth", "Sheffield United", "Burnley", "Luton Town");

    private static final Match.SideStats HOME_STATS = new Match.SideStats(75.5, 2, 0, 12);
    private static final Match.SideStats AWAY_STATS = new Match.SideStats(72.3, 3, 0, 8);

    private final Clock clock;

    public SyntheticMatchGenerator(Clock clock) {
        this.clock = clock;
    }

    /**
     * @throws IllegalArgumentException when {@code season} is not a year
     */
    public List<Match> generate(String season) {
        log.warn("Using synthetic data for season {}: no provider returned matches", season);
        long year = parseYear(season);
        LocalDate today = LocalDate.now(clock);

        List<Match> matches = new ArrayList<>(MATCH_COUNT);
        for (int i = 0; i < MATCH_COUNT; i++) {
            String home = TEAMS.get(i % TEAMS.size());
            String away = TEAMS.get((i + 1) % TEAMS.size());
            if (home.equals(away)) {
                continue;
            }
            matches.add(new Match(
                    ID_BASE + year * 100 + i,
                    today.minusDays(i),
                    season,
                    LEAGUE,
                    home,
                    away,
                    2,
                    1,
                    1.8,
                    2.1,
                    HOME_STATS,
                    AWAY_STATS));
        }
        return matches;
    }

    private static long parseYear(String season) {
        try {
            return Long.parseLong(season);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("season must be a year, got " + season, e);
        }
    }
}
