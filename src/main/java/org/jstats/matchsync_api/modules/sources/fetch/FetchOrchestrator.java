package org.jstats.matchsync_api.modules.sources.fetch;

import org.jstats.matchsync_api.modules.sources.adapter.SourceAdapter;
import org.jstats.matchsync_api.modules.sources.adapter.SourceUnavailableException;
import org.jstats.matchsync_api.modules.sources.adapter.StandingsSource;
import org.jstats.matchsync_api.modules.sources.adapter.TeamNotFoundException;
import org.jstats.matchsync_api.modules.sources.model.Match;
import org.jstats.matchsync_api.modules.sources.model.TeamStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Walks the providers in priority order until one delivers a non-empty season, falling back to
 * synthetic data, and spaces out consecutive calls to high-volume providers.
 * <p>
 * The rate-limit bookkeeping belongs to this instance. Callers are expected to run one fetch at a
 * time; concurrent callers get correct results but no spacing guarantee between each other.
 */
public class FetchOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(FetchOrchestrator.class);

    private final List<SourceAdapter> adapters;
    private final StandingsSource standings;
    private final boolean standingsHighVolume;
    private final SyntheticMatchGenerator synthetic;
    private final Clock clock;
    private final Pacer pacer;
    private final FetchSettings settings;

    private final Map<String, Instant> lastCallAt = new ConcurrentHashMap<>();
    private final Map<String, CachedStandings> standingsBySeason = new ConcurrentHashMap<>();

    public FetchOrchestrator(
            List<SourceAdapter> adapters,
            StandingsSource standings,
            SyntheticMatchGenerator synthetic,
            Clock clock,
            Pacer pacer,
            FetchSettings settings) {
        this.adapters = List.copyOf(adapters);
        this.standings = standings;
        this.standingsHighVolume = adapters.stream()
                .anyMatch(a -> a.providerName().equals(standings.providerName()) && a.highVolume());
        this.synthetic = synthetic;
        this.clock = clock;
        this.pacer = pacer;
        this.settings = settings;
    }

    public List<String> providerNames() {
        return adapters.stream().map(SourceAdapter::providerName).toList();
    }

    /**
     * When every provider fails or returns nothing the synthetic season is returned.
     *
     * @throws IllegalArgumentException when the synthetic fallback is needed and the season is not a year
     */
    public List<Match> fetchSeason(String season) {
        for (SourceAdapter adapter : adapters) {
            var provider = adapter.providerName();
            if (!adapter.isConfigured()) {
                log.debug("Skipping {} for season {}: no credential", provider, season);
                continue;
            }
            try {
                awaitTurn(provider, adapter.highVolume());
                var matches = adapter.fetch(season);
                if (!matches.isEmpty()) {
                    log.info("Season {}: using {} matches from {}", season, matches.size(), provider);
                    return matches;
                }
                log.warn("Season {}: {} returned no matches", season, provider);
            } catch (SourceUnavailableException e) {
                log.warn("Season {}: {} unavailable: {}", season, provider, e.getMessage());
            } catch (RuntimeException e) {
                log.error("Season {}: unexpected failure from {}", season, provider, e);
            }
        }
        return synthetic.generate(season);
    }

    /**
     * Fetches {@code startYear..endYear} inclusive. See {@link #fetchBulk(List)}.
     */
    public Map<String, List<Match>> fetchBulk(int startYear, int endYear) {
        List<String> seasons = new ArrayList<>();
        for (int year = startYear; year <= endYear; year++) {
            seasons.add(String.valueOf(year));
        }
        return fetchBulk(seasons);
    }

    /**
     * Fetches exactly the given seasons in order, pausing between consecutive seasons. A season
     * that fails outright maps to an empty list; an interrupt stops further fetching and leaves the
     * remaining seasons empty with the interrupt flag restored.
     */
    public Map<String, List<Match>> fetchBulk(List<String> seasons) {
        Map<String, List<Match>> result = new LinkedHashMap<>();
        boolean interrupted = false;
        for (String season : seasons) {
            if (result.containsKey(season)) {
                continue;
            }
            if (interrupted) {
                result.put(season, List.of());
                continue;
            }
            if (!result.isEmpty()) {
                try {
                    pacer.pause(settings.seasonPause());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.warn("Bulk fetch interrupted before season {}", season);
                    interrupted = true;
                    result.put(season, List.of());
                    continue;
                }
            }
            try {
                result.put(season, fetchSeason(season));
            } catch (RuntimeException e) {
                log.error("Bulk fetch of season {} failed", season, e);
                result.put(season, List.of());
            }
        }
        if (log.isInfoEnabled()) {
            var sizes = new LinkedHashMap<String, Integer>();
            result.forEach((season, matches) -> sizes.put(season, matches.size()));
            log.info("Bulk fetch of {} finished: {}", seasons, sizes);
        }
        return result;
    }

    /**
     * Looks a team up by exact name in the season standings. Standings tables are cached per season
     * so that a sync run costs one standings request per season rather than one per team.
     *
     * @throws SourceUnavailableException when the standings cannot be fetched
     * @throws TeamNotFoundException when no table entry carries that exact name
     */
    public TeamStatistics fetchTeamStatistics(String teamName, String season) {
        return standingsFor(season).stream()
                .filter(row -> teamName.equals(row.team()))
                .findFirst()
                .orElseThrow(() -> new TeamNotFoundException(teamName, season));
    }

    /**
     * Pings each provider in priority order. Never throws; any failure reports {@code false}.
     */
    public Map<String, Boolean> testConnections() {
        Map<String, Boolean> results = new LinkedHashMap<>();
        for (SourceAdapter adapter : adapters) {
            var provider = adapter.providerName();
            boolean reachable;
            try {
                if (adapter.isConfigured()) {
                    awaitTurn(provider, adapter.highVolume());
                }
                reachable = adapter.ping();
            } catch (RuntimeException e) {
                log.warn("Connectivity check of {} failed: {}", provider, e.getMessage());
                reachable = false;
            }
            log.info("Provider {} reachable: {}", provider, reachable);
            results.put(provider, reachable);
        }
        return results;
    }

    private List<TeamStatistics> standingsFor(String season) {
        var now = clock.instant();
        var cached = standingsBySeason.get(season);
        if (cached != null && cached.fetchedAt().plus(settings.standingsTtl()).isAfter(now)) {
            return cached.table();
        }
        var provider = standings.providerName();
        if (!standings.isConfigured()) {
            throw new SourceUnavailableException(provider, "no API credential configured");
        }
        awaitTurn(provider, standingsHighVolume);
        var table = standings.fetchStandings(season);
        standingsBySeason.put(season, new CachedStandings(table, clock.instant()));
        return table;
    }

    private void awaitTurn(String provider, boolean highVolume) {
        if (!highVolume) {
            return;
        }
        var last = lastCallAt.get(provider);
        if (last != null) {
            var wait = Duration.between(clock.instant(), last.plus(settings.minCallSpacing()));
            if (!wait.isNegative() && !wait.isZero()) {
                log.debug("Rate limiting {}: waiting {} ms", provider, wait.toMillis());
                try {
                    pacer.pause(wait);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new SourceUnavailableException(provider, "interrupted while rate limiting", e);
                }
            }
        }
        lastCallAt.put(provider, clock.instant());
    }

    private record CachedStandings(List<TeamStatistics> table, Instant fetchedAt) {
    }
}
