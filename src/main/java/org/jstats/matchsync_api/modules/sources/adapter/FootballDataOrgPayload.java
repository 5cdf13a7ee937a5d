package org.jstats.matchsync_api.modules.sources.adapter;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * Response shapes of the football-data.org v4 API, reduced to the fields we map.
 */
public final class FootballDataOrgPayload {

    private FootballDataOrgPayload() {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Matches(List<Match> matches) {
        public Matches {
            matches = matches == null ? List.of() : matches;
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Match(
            long id,
            OffsetDateTime utcDate,
            String status,
            Team homeTeam,
            Team awayTeam,
            Score score,
            Odds odds
    ) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Team(
            Long id,
            String name,
            String shortName,
            String tla
    ) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Score(String winner, Goals fullTime) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Goals(Integer home, Integer away) {
    }

    // Only filled with the odds add-on; otherwise the object carries a "msg" field
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Odds(Double homeWin, Double draw, Double awayWin) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Standings(List<Standing> standings) {
        public Standings {
            standings = standings == null ? List.of() : standings;
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Standing(String stage, String type, List<TableRow> table) {
        public Standing {
            table = table == null ? List.of() : table;
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record TableRow(
            int position,
            Team team,
            int playedGames,
            int won,
            int draw,
            int lost,
            int points,
            int goalsFor,
            int goalsAgainst
    ) {
    }
}
