package org.jstats.matchsync_api.modules.sources.adapter;

import org.jstats.matchsync_api.modules.sources.config.SourceCredentials;
import org.jstats.matchsync_api.modules.sources.config.SourceProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.time.LocalDate;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class FootyStatsAdapterTests {

    private static final String BASE = "https://fs.test";

    MockRestServiceServer server;
    FootyStatsAdapter adapter;

    @BeforeEach
    void setUp() {
        var builder = RestClient.builder().baseUrl(BASE);
        server = MockRestServiceServer.bindTo(builder).build();
        var fs = new SourceProperties.FootyStats(BASE, "Premier League", false, Map.of("2024", 12325L));
        adapter = new FootyStatsAdapter(
                builder.build(),
                new SourceCredentials(Map.of(FootyStatsAdapter.PROVIDER, "fs-key")),
                new SourceProperties(null, null, null, null, null, Map.of(), null, null, fs));
    }

    @Test
    void fetch_mapsOddsShotsAndCards_andKeepsUnplayedScoresEmpty() {
        server.expect(requestTo(BASE + "/league-matches?key=fs-key&league_id=12325"))
                .andRespond(withSuccess("""
                        {"success": true, "data": [
                          {"id": 7465231, "home_name": "Arsenal", "away_name": "Wolverhampton Wanderers",
                           "date_unix": 1723906800, "status": "complete", "homeGoalCount": 2, "awayGoalCount": 0,
                           "odds_ft_1": 1.3, "odds_ft_2": 9.5, "team_a_shots": 18, "team_b_shots": 9,
                           "team_a_red_cards": 0, "team_b_red_cards": 1},
                          {"id": 7465999, "home_name": "Chelsea", "away_name": "Fulham",
                           "date_unix": 1748185200, "status": "incomplete", "homeGoalCount": 0, "awayGoalCount": 0,
                           "odds_ft_1": 0, "odds_ft_2": 0, "team_a_shots": -1, "team_b_shots": -1,
                           "team_a_red_cards": -1, "team_b_red_cards": -1}
                        ]}
                        """, MediaType.APPLICATION_JSON));

        var matches = adapter.fetch("2024");

        assertEquals(2, matches.size());
        var played = matches.get(0);
        assertEquals(7465231L, played.id());
        assertEquals(LocalDate.of(2024, 8, 17), played.date());
        assertEquals(2, played.homeGoals());
        assertEquals(0, played.awayGoals());
        assertEquals(1.3, played.homeOdds());
        assertEquals(9.5, played.awayOdds());
        assertEquals(18, played.homeStats().shots());
        assertEquals(1, played.awayStats().redCards());

        var upcoming = matches.get(1);
        assertFalse(upcoming.hasScore());
        assertNull(upcoming.homeOdds());
        assertNull(upcoming.homeStats().shots());
        server.verify();
    }

    @Test
    void fetch_unmappedSeason_failsWithoutNetworkCall() {
        var ex = assertThrows(SourceUnavailableException.class, () -> adapter.fetch("1999"));
        assertTrue(ex.getMessage().contains("1999"));
        server.verify();
    }

    @Test
    void fetch_unsuccessfulResponse_isFailure() {
        server.expect(requestTo(BASE + "/league-matches?key=fs-key&league_id=12325"))
                .andRespond(withSuccess("{\"success\": false, \"message\": \"Invalid key\"}",
                        MediaType.APPLICATION_JSON));

        var ex = assertThrows(SourceUnavailableException.class, () -> adapter.fetch("2024"));
        assertTrue(ex.getMessage().contains("Invalid key"));
    }
}
