package org.jstats.matchsync_api.modules.sources.fetch;

import java.time.Duration;

/**
 * @param minCallSpacing minimum gap between two calls to the same high-volume provider
 * @param seasonPause    pause between seasons of a bulk fetch
 * @param standingsTtl   how long a fetched standings table is reused
 */
public record FetchSettings(Duration minCallSpacing, Duration seasonPause, Duration standingsTtl) {
}
