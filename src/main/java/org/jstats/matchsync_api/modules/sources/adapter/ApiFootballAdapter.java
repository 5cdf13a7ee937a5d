package org.jstats.matchsync_api.modules.sources.adapter;

import org.jstats.matchsync_api.modules.sources.config.SourceCredentials;
import org.jstats.matchsync_api.modules.sources.config.SourceProperties;
import org.jstats.matchsync_api.modules.sources.model.Match;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.util.List;

/**
 * API-Football v3 through RapidAPI. Second in line after football-data.org.
 */
@Component
public class ApiFootballAdapter extends AbstractSourceAdapter {

    public static final String PROVIDER = "api-football";

    private static final String KEY_HEADER = "X-RapidAPI-Key";
    private static final String HOST_HEADER = "X-RapidAPI-Host";
    private static final String FIXTURES_EP = "/v3/fixtures";
    private static final String STATUS_EP = "/v3/status";

    private final SourceProperties.ApiFootball settings;

    public ApiFootballAdapter(
            @Qualifier("apiFootball") RestClient http,
            SourceCredentials credentials,
            SourceProperties properties) {
        super(http, credentials);
        this.settings = properties.apiFootball();
    }

    @Override
    public String providerName() {
        return PROVIDER;
    }

    @Override
    public boolean highVolume() {
        return settings.highVolume();
    }

    /**
     * GET /v3/fixtures?league={leagueId}&season={season}
     * <p>
     * API-Football answers quota and key problems with HTTP 200 and a populated
     * {@code errors} element, which is treated as a failure.
     */
    @Override
    public List<Match> fetch(String season) {
        var key = requireKey();
        var body = call(FIXTURES_EP, () -> http.get()
                .uri(u -> u.path(FIXTURES_EP)
                        .queryParam("league", settings.leagueId())
                        .queryParam("season", season)
                        .build())
                .header(KEY_HEADER, key)
                .header(HOST_HEADER, settings.host())
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .onStatus(HttpStatusCode::isError, failOnStatus(FIXTURES_EP))
                .body(ApiFootballPayload.Fixtures.class));

        if (body.hasErrors()) {
            log.warn("API-Football reported errors for season {}: {}", season, body.errors());
            throw new SourceUnavailableException(PROVIDER, "errors in response: " + body.errors());
        }

        var matches = body.response().stream()
                .map(item -> toMatch(item, season))
                .toList();
        log.info("Fetched {} matches for season {} from API-Football", matches.size(), season);
        return matches;
    }

    @Override
    public boolean ping() {
        if (!isConfigured()) {
            return false;
        }
        var key = requireKey();
        return http.get()
                .uri(u -> u.path(STATUS_EP).build())
                .header(KEY_HEADER, key)
                .header(HOST_HEADER, settings.host())
                .exchange((req, res) -> res.getStatusCode().value() == 200);
    }

    private Match toMatch(ApiFootballPayload.Item item, String season) {
        var fixture = item.fixture();
        var teams = item.teams();
        var goals = item.goals();
        var league = item.league() != null && item.league().name() != null
                ? item.league().name()
                : settings.league();
        return Match.basic(
                fixture == null ? 0L : fixture.id(),
                fixture == null || fixture.date() == null ? null : fixture.date().toLocalDate(),
                season,
                league,
                teams == null || teams.home() == null ? null : teams.home().name(),
                teams == null || teams.away() == null ? null : teams.away().name(),
                goals == null ? null : goals.home(),
                goals == null ? null : goals.away());
    }
}
