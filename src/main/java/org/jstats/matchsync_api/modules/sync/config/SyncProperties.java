package org.jstats.matchsync_api.modules.sync.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * @param probeSeason     season fetched by the endpoint self-test
 * @param maxSeasons      upper bound on seasons accepted by one update request
 * @param version         reported by the health endpoint
 */
@ConfigurationProperties(prefix = "matchsync.sync")
public record SyncProperties(String probeSeason, int maxSeasons, String version) {

    public SyncProperties {
        probeSeason = probeSeason == null ? "2024" : probeSeason;
        maxSeasons = maxSeasons <= 0 ? 10 : maxSeasons;
        version = version == null ? "1.0.0" : version;
    }
}
