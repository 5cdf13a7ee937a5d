package org.jstats.matchsync_api.modules.sources.adapter;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Response shapes of the FootyStats (football-data-api.com) API.
 * Unknown numeric values are reported as -1 and missing odds as 0.
 */
public final class FootyStatsPayload {

    private FootyStatsPayload() {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record LeagueMatches(boolean success, String message, List<Item> data) {
        public LeagueMatches {
            data = data == null ? List.of() : data;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Item(
            long id,
            @JsonProperty("home_name") String homeName,
            @JsonProperty("away_name") String awayName,
            @JsonProperty("date_unix") Long dateUnix,
            String status,
            Integer homeGoalCount,
            Integer awayGoalCount,
            @JsonProperty("odds_ft_1") Double oddsHome,
            @JsonProperty("odds_ft_2") Double oddsAway,
            @JsonProperty("team_a_shots") Integer homeShots,
            @JsonProperty("team_b_shots") Integer awayShots,
            @JsonProperty("team_a_red_cards") Integer homeRedCards,
            @JsonProperty("team_b_red_cards") Integer awayRedCards
    ) {
        public boolean complete() {
            return "complete".equalsIgnoreCase(status);
        }
    }
}
