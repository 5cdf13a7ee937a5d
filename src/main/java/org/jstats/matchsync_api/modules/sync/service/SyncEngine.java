package org.jstats.matchsync_api.modules.sync.service;

import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;
import org.jstats.matchsync_api.modules.sources.fetch.FetchOrchestrator;
import org.jstats.matchsync_api.modules.sources.model.Match;
import org.jstats.matchsync_api.modules.sources.model.TeamStatistics;
import org.jstats.matchsync_api.modules.store.model.FixtureRow;
import org.jstats.matchsync_api.modules.store.repository.FixtureRepository;
import org.jstats.matchsync_api.modules.store.repository.StoreException;
import org.jstats.matchsync_api.modules.store.repository.TeamRepository;
import org.jstats.matchsync_api.modules.store.repository.TeamStatsRepository;
import org.jstats.matchsync_api.modules.sync.model.SyncSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Writes one season of matches into the store.
 * <p>
 * The season runs in a single transaction and each record in a savepoint inside it. A record that
 * fails rolls back to its savepoint and is reported in the summary. A store or transaction failure,
 * or an interrupt of the calling thread, rolls the whole season back and propagates.
 * <p>
 * Team statistics are looked up while the season transaction is open; the orchestrator's standings
 * cache keeps that to about one provider call per season.
 */
@Service
@NullMarked
public class SyncEngine {

    private static final Logger log = LoggerFactory.getLogger(SyncEngine.class);

    private static final Pattern SEASON = Pattern.compile("^\\d{4}$");

    private final TeamRepository teams;
    private final TeamStatsRepository teamStats;
    private final FixtureRepository fixtures;
    private final FetchOrchestrator fetch;
    private final Clock clock;
    private final TransactionTemplate seasonTx;
    private final TransactionTemplate recordTx;

    public SyncEngine(
            TeamRepository teams,
            TeamStatsRepository teamStats,
            FixtureRepository fixtures,
            FetchOrchestrator fetch,
            Clock clock,
            PlatformTransactionManager txManager) {
        this.teams = teams;
        this.teamStats = teamStats;
        this.fixtures = fixtures;
        this.fetch = fetch;
        this.clock = clock;
        this.seasonTx = new TransactionTemplate(txManager);
        this.recordTx = new TransactionTemplate(txManager);
        this.recordTx.setPropagationBehavior(TransactionDefinition.PROPAGATION_NESTED);
    }

    /**
     * @throws StoreException         when the store fails; nothing of the season is kept
     * @throws SyncCancelledException when the thread was interrupted; nothing of the season is kept
     */
    public SyncSummary syncSeason(String season, List<Match> matches, boolean forceUpdate) {
        var startedAt = OffsetDateTime.now(clock);
        if (matches.isEmpty()) {
            log.warn("No matches found for season {}", season);
            return SyncSummary.empty(startedAt, List.of(season), forceUpdate);
        }

        log.info("Synchronizing {} matches for season {} (forceUpdate={})", matches.size(), season, forceUpdate);
        try {
            var summary = Objects.requireNonNull(
                    seasonTx.execute(status -> runSeason(season, matches, forceUpdate, startedAt)));
            log.info("Season {} done: {} new, {} updated, {} skipped, {} errors",
                    season, summary.newMatches(), summary.updatedMatches(),
                    summary.skippedMatches(), summary.errors().size());
            return summary;
        } catch (SyncCancelledException e) {
            log.warn("Season {} cancelled, changes rolled back", season);
            throw e;
        } catch (DataAccessException | TransactionException e) {
            log.error("Season {} failed on the store, changes rolled back: {}", season, e.getMessage());
            throw new StoreException("Failed to update season " + season, e);
        }
    }

    private SyncSummary runSeason(String season, List<Match> matches, boolean forceUpdate, OffsetDateTime startedAt) {
        int inserted = 0;
        int updated = 0;
        int skipped = 0;
        List<String> errors = new ArrayList<>();

        for (Match match : matches) {
            if (Thread.currentThread().isInterrupted()) {
                throw new SyncCancelledException(season);
            }
            try {
                var outcome = Objects.requireNonNull(recordTx.execute(status -> syncRecord(match, forceUpdate)));
                switch (outcome) {
                    case INSERTED -> inserted++;
                    case UPDATED -> updated++;
                    case SKIPPED -> skipped++;
                }
            } catch (RecordSyncException | DataIntegrityViolationException e) {
                recordFailure(match, e, errors);
            } catch (DataAccessException | TransactionException e) {
                throw e;
            } catch (RuntimeException e) {
                recordFailure(match, e, errors);
            }
        }
        return new SyncSummary(startedAt, List.of(season), matches.size(),
                inserted, updated, skipped, forceUpdate, errors);
    }

    private void recordFailure(Match match, RuntimeException e, List<String> errors) {
        var message = "Failed to process match " + match.id() + ": " + e.getMessage();
        log.warn(message);
        errors.add(message);
    }

    private Outcome syncRecord(Match match, boolean forceUpdate) {
        boolean exists = fixtures.exists(match.id());
        if (exists && !forceUpdate) {
            return Outcome.SKIPPED;
        }
        validate(match);

        var now = OffsetDateTime.now(clock);
        var season = Objects.requireNonNull(match.season());
        var homeName = Objects.requireNonNull(match.homeTeam());
        var awayName = Objects.requireNonNull(match.awayTeam());

        long homeTeamId = teams.ensureTeam(homeName, now);
        long awayTeamId = teams.ensureTeam(awayName, now);
        long homeStatsId = teamStats.insertSnapshot(statisticsFor(homeName, season), now);
        long awayStatsId = teamStats.insertSnapshot(statisticsFor(awayName, season), now);

        var row = new FixtureRow(
                match.id(),
                Objects.requireNonNull(match.date()),
                Integer.parseInt(season),
                match.league(),
                homeTeamId,
                awayTeamId,
                match.homeGoals(),
                match.awayGoals(),
                match.homeOdds(),
                match.awayOdds(),
                homeStatsId,
                awayStatsId,
                now);
        if (exists) {
            fixtures.update(row);
            return Outcome.UPDATED;
        }
        fixtures.insert(row);
        return Outcome.INSERTED;
    }

    private TeamStatistics statisticsFor(String team, String season) {
        try {
            return fetch.fetchTeamStatistics(team, season);
        } catch (RuntimeException e) {
            log.debug("No statistics for {} in {}, using defaults: {}", team, season, e.getMessage());
            return TeamStatistics.defaults(team, season);
        }
    }

    static void validate(Match match) {
        if (match.id() <= 0) {
            throw new RecordSyncException("id must be positive");
        }
        if (isBlank(match.homeTeam()) || isBlank(match.awayTeam())) {
            throw new RecordSyncException("both team names are required");
        }
        if (Objects.equals(match.homeTeam(), match.awayTeam())) {
            throw new RecordSyncException("home and away team are both " + match.homeTeam());
        }
        if (match.date() == null) {
            throw new RecordSyncException("match date is missing");
        }
        if (match.season() == null || !SEASON.matcher(match.season()).matches()) {
            throw new RecordSyncException("season must be a 4-digit year, got " + match.season());
        }
        if ((match.homeGoals() == null) != (match.awayGoals() == null)) {
            throw new RecordSyncException("goals must be given for both sides or neither");
        }
        if (match.hasScore() && (match.homeGoals() < 0 || match.awayGoals() < 0)) {
            throw new RecordSyncException("goals must not be negative");
        }
    }

    private static boolean isBlank(@Nullable String value) {
        return value == null || value.isBlank();
    }

    private enum Outcome {
        INSERTED, UPDATED, SKIPPED
    }
}
