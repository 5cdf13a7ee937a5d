package org.jstats.matchsync_api.modules.sources.config;

import org.jstats.matchsync_api.modules.sources.adapter.ApiFootballAdapter;
import org.jstats.matchsync_api.modules.sources.adapter.FootballDataOrgAdapter;
import org.jstats.matchsync_api.modules.sources.adapter.FootyStatsAdapter;
import org.jstats.matchsync_api.modules.sources.adapter.SourceAdapter;
import org.jstats.matchsync_api.modules.sources.fetch.FetchOrchestrator;
import org.jstats.matchsync_api.modules.sources.fetch.FetchSettings;
import org.jstats.matchsync_api.modules.sources.fetch.Pacer;
import org.jstats.matchsync_api.modules.sources.fetch.SyntheticMatchGenerator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.List;

@Configuration
public class FetchConfig {

    @Bean
    SyntheticMatchGenerator syntheticMatchGenerator(Clock clock) {
        return new SyntheticMatchGenerator(clock);
    }

    /**
     * Priority order: football-data.org, API-Football, FootyStats.
     */
    @Bean
    FetchOrchestrator fetchOrchestrator(
            FootballDataOrgAdapter footballDataOrg,
            ApiFootballAdapter apiFootball,
            FootyStatsAdapter footyStats,
            SyntheticMatchGenerator synthetic,
            SourceCredentials credentials,
            SourceProperties p,
            Clock clock,
            Pacer pacer) {
        List<SourceAdapter> adapters = List.of(footballDataOrg, apiFootball, footyStats);
        credentials.logStatus(adapters.stream().map(SourceAdapter::providerName).toList());
        return new FetchOrchestrator(
                adapters,
                footballDataOrg,
                synthetic,
                clock,
                pacer,
                new FetchSettings(p.minCallSpacing(), p.seasonPause(), p.footballDataOrg().standingsTtl()));
    }
}
