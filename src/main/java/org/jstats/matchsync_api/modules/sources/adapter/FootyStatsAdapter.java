package org.jstats.matchsync_api.modules.sources.adapter;

import org.jstats.matchsync_api.modules.sources.config.SourceCredentials;
import org.jstats.matchsync_api.modules.sources.config.SourceProperties;
import org.jstats.matchsync_api.modules.sources.model.Match;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

/**
 * FootyStats. Last real source before synthetic data; the only one reporting shots and red cards.
 */
@Component
public class FootyStatsAdapter extends AbstractSourceAdapter {

    public static final String PROVIDER = "footystats";

    private static final String MATCHES_EP = "/league-matches";
    private static final String LEAGUES_EP = "/league-list";

    private final SourceProperties.FootyStats settings;

    public FootyStatsAdapter(
            @Qualifier("footyStats") RestClient http,
            SourceCredentials credentials,
            SourceProperties properties) {
        super(http, credentials);
        this.settings = properties.footyStats();
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
     * GET /league-matches?key={key}&league_id={seasonId}
     */
    @Override
    public List<Match> fetch(String season) {
        var key = requireKey();
        var seasonId = settings.seasonIds().get(season);
        if (seasonId == null) {
            throw new SourceUnavailableException(PROVIDER, "no FootyStats season id configured for " + season);
        }

        var body = call(MATCHES_EP, () -> http.get()
                .uri(u -> u.path(MATCHES_EP)
                        .queryParam("key", key)
                        .queryParam("league_id", seasonId)
                        .build())
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .onStatus(HttpStatusCode::isError, failOnStatus(MATCHES_EP))
                .body(FootyStatsPayload.LeagueMatches.class));

        if (!body.success()) {
            log.warn("FootyStats rejected request for season {}: {}", season, body.message());
            throw new SourceUnavailableException(PROVIDER, "unsuccessful response: " + body.message());
        }

        var matches = body.data().stream()
                .map(item -> toMatch(item, season))
                .toList();
        log.info("Fetched {} matches for season {} from FootyStats", matches.size(), season);
        return matches;
    }

    @Override
    public boolean ping() {
        if (!isConfigured()) {
            return false;
        }
        var key = requireKey();
        return http.get()
                .uri(u -> u.path(LEAGUES_EP).queryParam("key", key).build())
                .exchange((req, res) -> res.getStatusCode().value() == 200);
    }

    private Match toMatch(FootyStatsPayload.Item item, String season) {
        boolean played = item.complete();
        var date = item.dateUnix() == null
                ? null
                : Instant.ofEpochSecond(item.dateUnix()).atOffset(ZoneOffset.UTC).toLocalDate();
        return new Match(
                item.id(),
                date,
                season,
                settings.league(),
                item.homeName(),
                item.awayName(),
                played ? known(item.homeGoalCount()) : null,
                played ? known(item.awayGoalCount()) : null,
                odds(item.oddsHome()),
                odds(item.oddsAway()),
                new Match.SideStats(null, null, known(item.homeRedCards()), known(item.homeShots())),
                new Match.SideStats(null, null, known(item.awayRedCards()), known(item.awayShots())));
    }

    private static Integer known(Integer value) {
        return value == null || value < 0 ? null : value;
    }

    private static Double odds(Double value) {
        return value == null || value <= 0 ? null : value;
    }
}
