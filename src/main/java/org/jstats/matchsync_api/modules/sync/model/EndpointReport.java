package org.jstats.matchsync_api.modules.sync.model;

import com.fasterxml.jackson.annotation.JsonValue;
import org.jspecify.annotations.Nullable;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Result of probing the store, every provider and one season fetch.
 *
 * @param overallStatus database ok, at least one provider reachable and the probe fetch ok
 */
public record EndpointReport(
        OffsetDateTime timestamp,
        DatabaseCheck database,
        Map<String, Boolean> apiConnections,
        DataFetchCheck dataFetch,
        boolean overallStatus) {

    public enum Status {
        OK, WARNING, ERROR;

        @JsonValue
        public String json() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public record DatabaseCheck(Status status, String message, List<String> tables) {
    }

    public record DataFetchCheck(Status status, String message, @Nullable SampleMatch sampleMatch) {
    }

    public record SampleMatch(@Nullable String homeTeam, @Nullable String awayTeam, @Nullable LocalDate date) {
    }
}
