package org.jstats.matchsync_api.modules.sync.service;

import org.jstats.matchsync_api.modules.sources.adapter.SourceUnavailableException;
import org.jstats.matchsync_api.modules.sources.adapter.TeamNotFoundException;
import org.jstats.matchsync_api.modules.sources.fetch.FetchOrchestrator;
import org.jstats.matchsync_api.modules.sources.fetch.SyntheticMatchGenerator;
import org.jstats.matchsync_api.modules.sources.model.Match;
import org.jstats.matchsync_api.modules.sources.model.TeamStatistics;
import org.jstats.matchsync_api.modules.store.repository.FixtureRepository;
import org.jstats.matchsync_api.modules.store.repository.StoreException;
import org.jstats.matchsync_api.modules.store.repository.TeamRepository;
import org.jstats.matchsync_api.modules.store.repository.TeamStatsRepository;
import org.jstats.matchsync_api.support.Matches;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.jdbc.JdbcTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.boot.test.mock.mockito.SpyBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@JdbcTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@ActiveProfiles("test")
@Transactional(propagation = Propagation.NOT_SUPPORTED)
@Import({TeamRepository.class, TeamStatsRepository.class, FixtureRepository.class, SyncEngine.class,
        SyncEngineIntegrationTests.FixedClock.class})
class SyncEngineIntegrationTests {

    static final Instant NOW = Instant.parse("2024-10-01T12:00:00Z");

    @TestConfiguration(proxyBeanMethods = false)
    static class FixedClock {
        @Bean
        Clock clock() {
            return Clock.fixed(NOW, ZoneOffset.UTC);
        }
    }

    @MockBean
    FetchOrchestrator fetch;

    @SpyBean
    FixtureRepository fixtures;

    @Autowired
    TeamRepository teams;

    @Autowired
    TeamStatsRepository stats;

    @Autowired
    NamedParameterJdbcTemplate jdbc;

    @Autowired
    SyncEngine engine;

    @BeforeEach
    void setUp() {
        var none = new MapSqlParameterSource();
        jdbc.update("DELETE FROM fixture", none);
        jdbc.update("DELETE FROM team_stats", none);
        jdbc.update("DELETE FROM team", none);
        doAnswer(inv -> {
            throw new TeamNotFoundException(inv.getArgument(0), inv.getArgument(1));
        }).when(fetch).fetchTeamStatistics(anyString(), anyString());
    }

    @AfterEach
    void clearInterrupt() {
        Thread.interrupted();
    }

    private static List<Match> threeMatches() {
        return List.of(
                Matches.played(101L, "2024", "Arsenal", "Chelsea", 2, 1),
                Matches.played(102L, "2024", "Liverpool", "Arsenal", 0, 0),
                Matches.scheduled(103L, "2024", "Chelsea", "Liverpool"));
    }

    private long count(String table) {
        var n = jdbc.queryForObject("SELECT COUNT(*) FROM " + table, new MapSqlParameterSource(), Long.class);
        return n == null ? 0 : n;
    }

    @Test
    void threeNewFixtures_areInsertedWithTeamsAndSnapshots() {
        var summary = engine.syncSeason("2024", threeMatches(), false);

        assertEquals(List.of("2024"), summary.seasons());
        assertEquals(3, summary.totalMatches());
        assertEquals(3, summary.newMatches());
        assertEquals(0, summary.updatedMatches());
        assertEquals(0, summary.skippedMatches());
        assertTrue(summary.errors().isEmpty());
        assertEquals(3, count("fixture"));
        assertEquals(3, count("team"));
        assertEquals(6, count("team_stats"));

        var scheduled = fixtures.findById(103L).orElseThrow();
        assertNull(scheduled.homeGoals());
        assertNull(scheduled.awayGoals());
        assertEquals(2024, scheduled.season());
    }

    @Test
    void secondRunWithoutForce_skipsEverything_andWritesNothing() {
        engine.syncSeason("2024", threeMatches(), false);

        var again = engine.syncSeason("2024", threeMatches(), false);

        assertEquals(0, again.newMatches());
        assertEquals(0, again.updatedMatches());
        assertEquals(3, again.skippedMatches());
        assertEquals(3, count("fixture"));
        assertEquals(3, count("team"));
        assertEquals(6, count("team_stats"));
    }

    @Test
    void storedFixture_resentMalformed_isSkippedWithoutForce() {
        engine.syncSeason("2024", List.of(Matches.played(9101L, "2024", "Arsenal", "Chelsea", 2, 1)), false);

        var resent = engine.syncSeason("2024",
                List.of(Match.basic(9101L, null, "2024", "Premier League", "Arsenal", "Chelsea", 2, 1)), false);

        assertEquals(1, resent.skippedMatches());
        assertEquals(List.of(), resent.errors());
        assertEquals(1, count("fixture"));

        var forced = engine.syncSeason("2024",
                List.of(Match.basic(9101L, null, "2024", "Premier League", "Arsenal", "Chelsea", 2, 1)), true);

        assertEquals(0, forced.updatedMatches());
        assertEquals(1, forced.errors().size());
        assertTrue(forced.errors().get(0).contains("match date is missing"));
    }

    @Test
    void forcedRun_updatesInPlace_withoutDuplicates() {
        engine.syncSeason("2024", threeMatches(), false);
        var rescored = List.of(
                Matches.played(101L, "2024", "Arsenal", "Chelsea", 3, 1),
                Matches.played(102L, "2024", "Liverpool", "Arsenal", 0, 0),
                Matches.played(103L, "2024", "Chelsea", "Liverpool", 1, 2));

        var summary = engine.syncSeason("2024", rescored, true);

        assertEquals(0, summary.newMatches());
        assertEquals(3, summary.updatedMatches());
        assertTrue(summary.forceUpdate());
        assertEquals(3, count("fixture"));
        assertEquals(3, count("team"));
        assertEquals(12, count("team_stats"));
        assertEquals(3, fixtures.findById(101L).orElseThrow().homeGoals());
        assertEquals(2, fixtures.findById(103L).orElseThrow().awayGoals());
    }

    @Test
    void syntheticSeason_isFullyReferential() {
        var synthetic = new SyntheticMatchGenerator(Clock.fixed(NOW, ZoneOffset.UTC)).generate("2024");

        var summary = engine.syncSeason("2024", synthetic, false);

        assertEquals(50, summary.newMatches());
        assertEquals(50, count("fixture"));
        assertEquals(20, count("team"));
        assertEquals(100, count("team_stats"));
        var orphans = jdbc.queryForObject("""
                SELECT COUNT(*)
                FROM fixture f
                LEFT JOIN team ht ON ht.id = f.home_team_id
                LEFT JOIN team awt ON awt.id = f.away_team_id
                LEFT JOIN team_stats hs ON hs.id = f.home_stats_id
                LEFT JOIN team_stats aws ON aws.id = f.away_stats_id
                WHERE ht.id IS NULL OR awt.id IS NULL OR hs.id IS NULL OR aws.id IS NULL
                """, new MapSqlParameterSource(), Long.class);
        assertEquals(0L, orphans);
    }

    @Test
    void missingStatistics_fallBackToDefaults_andFoundStatisticsAreStored() {
        doReturn(new TeamStatistics("Arsenal", "2024", 7, 5, 1, 1, 14, 6, null, null, null, null))
                .when(fetch).fetchTeamStatistics(eq("Arsenal"), eq("2024"));
        doThrow(new SourceUnavailableException("football-data-org", "HTTP 503"))
                .when(fetch).fetchTeamStatistics(eq("Chelsea"), eq("2024"));

        engine.syncSeason("2024", List.of(Matches.played(101L, "2024", "Arsenal", "Chelsea", 2, 1)), false);

        var row = fixtures.findById(101L).orElseThrow();
        var home = stats.findById(row.homeStatsId()).orElseThrow();
        var away = stats.findById(row.awayStatsId()).orElseThrow();
        assertEquals(5, home.wins());
        assertEquals(14, home.goalsFor());
        assertEquals(75.0, home.rating());
        assertEquals(0, away.matchesPlayed());
        assertEquals(75.0, away.rating());
    }

    @Test
    void failingRecords_areReported_andDoNotStopTheBatch() {
        var longLeague = "L".repeat(150);
        var batch = List.of(
                Matches.played(201L, "2024", "Fulham", "Brentford", 1, 0),
                Matches.played(202L, "2024", "Fulham", "Fulham", 1, 0),
                new Match(203L, LocalDate.of(2024, 9, 1), "2024", longLeague, "Ipswich", "Leicester",
                        1, 1, null, null, null, null),
                Matches.played(204L, "2024", "Brentford", "Fulham", 2, 2));

        var summary = engine.syncSeason("2024", batch, false);

        assertEquals(4, summary.totalMatches());
        assertEquals(2, summary.newMatches());
        assertEquals(2, summary.errors().size());
        assertTrue(summary.errors().get(0).startsWith("Failed to process match 202: "));
        assertTrue(summary.errors().get(1).startsWith("Failed to process match 203: "));
        assertEquals(2, count("fixture"));
        // the failed record's teams were rolled back with it
        assertTrue(teams.findIdByName("Ipswich").isEmpty());
        assertTrue(teams.findIdByName("Leicester").isEmpty());
        assertEquals(4, count("team_stats"));
    }

    @Test
    void invalidRecords_areRejected() {
        var batch = List.of(
                Match.basic(0L, LocalDate.of(2024, 9, 1), "2024", "PL", "A", "B", null, null),
                Match.basic(301L, null, "2024", "PL", "A", "B", null, null),
                Match.basic(302L, LocalDate.of(2024, 9, 1), "24", "PL", "A", "B", null, null),
                Match.basic(303L, LocalDate.of(2024, 9, 1), "2024", "PL", " ", "B", null, null),
                Match.basic(304L, LocalDate.of(2024, 9, 1), "2024", "PL", "A", "B", 1, null),
                Match.basic(305L, LocalDate.of(2024, 9, 1), "2024", "PL", "A", "B", -1, 0));

        var summary = engine.syncSeason("2024", batch, false);

        assertEquals(0, summary.newMatches());
        assertEquals(6, summary.errors().size());
        assertEquals(0, count("team"));
    }

    @Test
    void interruption_cancelsAndRollsBackTheWholeSeason() {
        doAnswer(inv -> {
            Thread.currentThread().interrupt();
            throw new TeamNotFoundException(inv.getArgument(0), inv.getArgument(1));
        }).when(fetch).fetchTeamStatistics(anyString(), anyString());

        assertThrows(SyncCancelledException.class, () -> engine.syncSeason("2024", threeMatches(), false));
        Thread.interrupted();

        assertEquals(0, count("fixture"));
        assertEquals(0, count("team"));
        assertEquals(0, count("team_stats"));
    }

    @Test
    void storeFailure_rollsBackTheWholeSeason_andPropagates() {
        doCallRealMethod()
                .doThrow(new DataAccessResourceFailureException("connection lost"))
                .when(fixtures).insert(any());

        var ex = assertThrows(StoreException.class, () -> engine.syncSeason("2024", threeMatches(), false));

        assertInstanceOf(DataAccessResourceFailureException.class, ex.getCause());
        assertEquals(0, count("fixture"));
        assertEquals(0, count("team"));
    }

    @Test
    void emptySeason_writesNothing() {
        var summary = engine.syncSeason("2024", List.of(), false);

        assertEquals(0, summary.totalMatches());
        assertEquals(List.of("2024"), summary.seasons());
        verifyNoInteractions(fetch);
    }
}
