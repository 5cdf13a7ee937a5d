package org.jstats.matchsync_api.modules.sources.adapter;

import org.jstats.matchsync_api.modules.sources.config.SourceCredentials;
import org.jstats.matchsync_api.modules.sources.config.SourceProperties;
import org.jstats.matchsync_api.modules.sources.model.Match;
import org.jstats.matchsync_api.modules.sources.model.TeamStatistics;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.util.List;

/**
 * football-data.org v4. Highest-priority match source and the standings source.
 */
@Component
public class FootballDataOrgAdapter extends AbstractSourceAdapter implements StandingsSource {

    public static final String PROVIDER = "football-data-org";

    private static final String AUTH_HEADER = "X-Auth-Token";
    private static final String MATCHES_EP = "/v4/competitions/{code}/matches";
    private static final String STANDINGS_EP = "/v4/competitions/{code}/standings";
    private static final String COMPETITIONS_EP = "/v4/competitions";

    private final SourceProperties.FootballDataOrg settings;

    public FootballDataOrgAdapter(
            @Qualifier("footballDataOrg") RestClient http,
            SourceCredentials credentials,
            SourceProperties properties) {
        super(http, credentials);
        this.settings = properties.footballDataOrg();
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
     * GET /v4/competitions/{code}/matches?season={season}
     */
    @Override
    public List<Match> fetch(String season) {
        var key = requireKey();
        var body = call(MATCHES_EP, () -> http.get()
                .uri(u -> u.path(MATCHES_EP).queryParam("season", season).build(settings.competition()))
                .header(AUTH_HEADER, key)
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .onStatus(HttpStatusCode::isError, failOnStatus(MATCHES_EP))
                .body(FootballDataOrgPayload.Matches.class));

        var fixtures = body.matches() == null ? List.<FootballDataOrgPayload.Match>of() : body.matches();
        var matches = fixtures.stream()
                .map(m -> toMatch(m, season))
                .toList();
        log.info("Fetched {} matches for season {} from football-data.org", matches.size(), season);
        return matches;
    }

    @Override
    public boolean ping() {
        if (!isConfigured()) {
            return false;
        }
        var key = requireKey();
        return http.get()
                .uri(u -> u.path(COMPETITIONS_EP).build())
                .header(AUTH_HEADER, key)
                .exchange((req, res) -> res.getStatusCode().value() == 200);
    }

    /**
     * GET /v4/competitions/{code}/standings?season={season}, reduced to the TOTAL table.
     */
    @Override
    public List<TeamStatistics> fetchStandings(String season) {
        var key = requireKey();
        var body = call(STANDINGS_EP, () -> http.get()
                .uri(u -> u.path(STANDINGS_EP).queryParam("season", season).build(settings.competition()))
                .header(AUTH_HEADER, key)
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .onStatus(HttpStatusCode::isError, failOnStatus(STANDINGS_EP))
                .body(FootballDataOrgPayload.Standings.class));

        var rows = body.standings() == null ? List.<FootballDataOrgPayload.TableRow>of() : body.standings().stream()
                .filter(s -> s.type() == null || "TOTAL".equals(s.type()))
                .findFirst()
                .map(FootballDataOrgPayload.Standing::table)
                .orElse(List.of());
        var table = rows.stream()
                .filter(row -> row.team() != null && row.team().name() != null)
                .map(row -> new TeamStatistics(
                        row.team().name(),
                        season,
                        row.playedGames(),
                        row.won(),
                        row.draw(),
                        row.lost(),
                        row.goalsFor(),
                        row.goalsAgainst(),
                        null, null, null, null))
                .toList();
        log.info("Fetched {} standings rows for season {} from football-data.org", table.size(), season);
        return table;
    }

    private Match toMatch(FootballDataOrgPayload.Match m, String season) {
        var fullTime = m.score() == null ? null : m.score().fullTime();
        var odds = m.odds();
        return new Match(
                m.id(),
                m.utcDate() == null ? null : m.utcDate().toLocalDate(),
                season,
                settings.league(),
                m.homeTeam() == null ? null : m.homeTeam().name(),
                m.awayTeam() == null ? null : m.awayTeam().name(),
                fullTime == null ? null : fullTime.home(),
                fullTime == null ? null : fullTime.away(),
                odds == null ? null : odds.homeWin(),
                odds == null ? null : odds.awayWin(),
                Match.SideStats.UNKNOWN,
                Match.SideStats.UNKNOWN);
    }
}
