package org.jstats.matchsync_api.modules.sync.service;

import org.jspecify.annotations.NullMarked;
import org.jstats.matchsync_api.modules.sources.config.SourceCredentials;
import org.jstats.matchsync_api.modules.sources.fetch.FetchOrchestrator;
import org.jstats.matchsync_api.modules.sources.model.Match;
import org.jstats.matchsync_api.modules.store.model.DatabaseStats;
import org.jstats.matchsync_api.modules.store.model.FixturePage;
import org.jstats.matchsync_api.modules.store.model.FixtureQuery;
import org.jstats.matchsync_api.modules.store.model.TeamSummary;
import org.jstats.matchsync_api.modules.store.repository.FixtureRepository;
import org.jstats.matchsync_api.modules.store.repository.SchemaInspector;
import org.jstats.matchsync_api.modules.store.repository.StoreException;
import org.jstats.matchsync_api.modules.store.repository.TeamRepository;
import org.jstats.matchsync_api.modules.sync.config.SyncProperties;
import org.jstats.matchsync_api.modules.sync.model.EndpointReport;
import org.jstats.matchsync_api.modules.sync.model.EndpointReport.DataFetchCheck;
import org.jstats.matchsync_api.modules.sync.model.EndpointReport.DatabaseCheck;
import org.jstats.matchsync_api.modules.sync.model.EndpointReport.SampleMatch;
import org.jstats.matchsync_api.modules.sync.model.EndpointReport.Status;
import org.jstats.matchsync_api.modules.sync.model.SyncSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;

/**
 * Entry point for updating and inspecting the local fixture store.
 */
@Service
@NullMarked
public class DataSyncService {

    private static final Logger log = LoggerFactory.getLogger(DataSyncService.class);

    private final FetchOrchestrator fetch;
    private final SyncEngine engine;
    private final TeamRepository teams;
    private final FixtureRepository fixtures;
    private final SchemaInspector schema;
    private final SourceCredentials credentials;
    private final SyncProperties properties;
    private final Clock clock;

    public DataSyncService(
            FetchOrchestrator fetch,
            SyncEngine engine,
            TeamRepository teams,
            FixtureRepository fixtures,
            SchemaInspector schema,
            SourceCredentials credentials,
            SyncProperties properties,
            Clock clock) {
        this.fetch = fetch;
        this.engine = engine;
        this.teams = teams;
        this.fixtures = fixtures;
        this.schema = schema;
        this.credentials = credentials;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Fetches and stores the given seasons, defaulting to the current year. Several seasons are
     * fetched in one bulk pass over exactly those seasons; each season is then committed on its own.
     *
     * @throws StoreException         when the store fails; seasons committed before the failure are kept
     * @throws SyncCancelledException when interrupted; the season in progress is rolled back
     */
    public SyncSummary updateData(List<String> seasons, boolean forceUpdate) {
        var requested = seasons.isEmpty()
                ? List.of(String.valueOf(LocalDate.now(clock).getYear()))
                : List.copyOf(new LinkedHashSet<>(seasons));
        log.info("Updating seasons {} (forceUpdate={})", requested, forceUpdate);

        var summary = SyncSummary.empty(OffsetDateTime.now(clock), requested, forceUpdate);
        if (requested.size() > 1) {
            var bulk = fetch.fetchBulk(requested);
            for (String season : requested) {
                summary = summary.merge(engine.syncSeason(season, bulk.getOrDefault(season, List.of()), forceUpdate));
            }
        } else {
            var season = requested.get(0);
            summary = summary.merge(engine.syncSeason(season, fetch.fetchSeason(season), forceUpdate));
        }

        log.info("Data update completed: {} matches, {} new, {} updated, {} skipped, {} errors",
                summary.totalMatches(), summary.newMatches(), summary.updatedMatches(),
                summary.skippedMatches(), summary.errors().size());
        return summary;
    }

    /**
     * @throws StoreException when the store cannot be queried
     */
    public DatabaseStats getDatabaseStats() {
        try {
            return new DatabaseStats(
                    teams.count(),
                    fixtures.count(),
                    fixtures.countBySeason(),
                    fixtures.lastUpdated().orElse(null));
        } catch (DataAccessException e) {
            log.error("Failed to get database stats: {}", e.getMessage());
            throw new StoreException("Failed to get database stats", e);
        }
    }

    /**
     * Probes the store, every provider and one season fetch. Never throws.
     */
    public EndpointReport testEndpoints() {
        var database = checkDatabase();
        var connections = fetch.testConnections();
        var dataFetch = checkDataFetch();
        boolean overall = database.status() == Status.OK
                && connections.containsValue(Boolean.TRUE)
                && dataFetch.status() == Status.OK;
        return new EndpointReport(OffsetDateTime.now(clock), database, connections, dataFetch, overall);
    }

    /**
     * @throws StoreException when the store cannot be queried
     */
    public List<TeamSummary> listTeams() {
        try {
            return teams.listWithFixtureCounts();
        } catch (DataAccessException e) {
            log.error("Failed to list teams: {}", e.getMessage());
            throw new StoreException("Failed to list teams", e);
        }
    }

    /**
     * @throws StoreException when the store cannot be queried
     */
    public FixturePage listFixtures(FixtureQuery query) {
        try {
            var page = fixtures.findPage(query);
            var total = fixtures.countMatching(query);
            return FixturePage.of(page, total, query);
        } catch (DataAccessException e) {
            log.error("Failed to list fixtures: {}", e.getMessage());
            throw new StoreException("Failed to list fixtures", e);
        }
    }

    /**
     * @return provider name to whether a credential is configured, in priority order
     */
    public Map<String, Boolean> configuredProviders() {
        Map<String, Boolean> result = new LinkedHashMap<>();
        fetch.providerNames().forEach(p -> result.put(p, credentials.isConfigured(p)));
        return result;
    }

    private DatabaseCheck checkDatabase() {
        try {
            var present = schema.tablesPresent();
            List<String> found = new ArrayList<>();
            List<String> missing = new ArrayList<>();
            for (Entry<String, Boolean> e : present.entrySet()) {
                (e.getValue() ? found : missing).add(e.getKey());
            }
            if (!missing.isEmpty()) {
                return new DatabaseCheck(Status.ERROR, "Missing tables: " + missing, found);
            }
            return new DatabaseCheck(Status.OK, "Database structure is valid", found);
        } catch (RuntimeException e) {
            log.warn("Database check failed: {}", e.getMessage());
            return new DatabaseCheck(Status.ERROR, "Database error: " + e.getMessage(), List.of());
        }
    }

    private DataFetchCheck checkDataFetch() {
        try {
            List<Match> matches = fetch.fetchSeason(properties.probeSeason());
            if (matches.isEmpty()) {
                return new DataFetchCheck(Status.WARNING, "No matches fetched, but no errors occurred", null);
            }
            var first = matches.get(0);
            return new DataFetchCheck(
                    Status.OK,
                    "Successfully fetched " + matches.size() + " matches",
                    new SampleMatch(first.homeTeam(), first.awayTeam(), first.date()));
        } catch (RuntimeException e) {
            log.warn("Data fetch check failed: {}", e.getMessage());
            return new DataFetchCheck(Status.ERROR, "Data fetch error: " + e.getMessage(), null);
        }
    }
}
