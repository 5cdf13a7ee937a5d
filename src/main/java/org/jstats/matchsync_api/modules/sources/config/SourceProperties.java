package org.jstats.matchsync_api.modules.sources.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

@ConfigurationProperties(prefix = "matchsync.sources")
public record SourceProperties(
        String userAgent,
        @DurationUnit(ChronoUnit.MILLIS) Duration connectTimeout,
        @DurationUnit(ChronoUnit.MILLIS) Duration readTimeout,
        Duration minCallSpacing,
        Duration seasonPause,
        Map<String, String> credentials,
        FootballDataOrg footballDataOrg,
        ApiFootball apiFootball,
        FootyStats footyStats) {

    public SourceProperties {
        userAgent = userAgent == null ? "MatchSync/1.0" : userAgent;
        minCallSpacing = minCallSpacing == null ? Duration.ofSeconds(1) : minCallSpacing;
        seasonPause = seasonPause == null ? Duration.ofSeconds(2) : seasonPause;
        credentials = credentials == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(credentials));
        footballDataOrg = footballDataOrg == null
                ? new FootballDataOrg(null, null, null, true, null) : footballDataOrg;
        apiFootball = apiFootball == null
                ? new ApiFootball(null, null, 0, null, true) : apiFootball;
        footyStats = footyStats == null
                ? new FootyStats(null, null, false, null) : footyStats;
    }

    public record FootballDataOrg(
            String baseUrl,
            String competition,
            String league,
            boolean highVolume,
            Duration standingsTtl) {

        public FootballDataOrg {
            baseUrl = baseUrl == null ? "https://api.football-data.org" : baseUrl;
            competition = competition == null ? "PL" : competition;
            league = league == null ? "Premier League" : league;
            standingsTtl = standingsTtl == null ? Duration.ofMinutes(5) : standingsTtl;
        }
    }

    public record ApiFootball(
            String baseUrl,
            String host,
            int leagueId,
            String league,
            boolean highVolume) {

        public ApiFootball {
            baseUrl = baseUrl == null ? "https://api-football-v1.p.rapidapi.com" : baseUrl;
            host = host == null ? "api-football-v1.p.rapidapi.com" : host;
            leagueId = leagueId <= 0 ? 39 : leagueId;
            league = league == null ? "Premier League" : league;
        }
    }

    /**
     * FootyStats addresses a league season by its own numeric id, hence the season map.
     */
    public record FootyStats(
            String baseUrl,
            String league,
            boolean highVolume,
            Map<String, Long> seasonIds) {

        public FootyStats {
            baseUrl = baseUrl == null ? "https://api.football-data-api.com" : baseUrl;
            league = league == null ? "Premier League" : league;
            seasonIds = seasonIds == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(seasonIds));
        }
    }
}
