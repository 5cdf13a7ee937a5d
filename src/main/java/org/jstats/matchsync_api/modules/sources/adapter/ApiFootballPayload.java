package org.jstats.matchsync_api.modules.sources.adapter;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * Response shapes of API-Football v3 (RapidAPI).
 */
public final class ApiFootballPayload {

    private ApiFootballPayload() {
    }

    /**
     * {@code errors} is an empty array on success and an object keyed by error type on failure.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Fixtures(JsonNode errors, Integer results, List<Item> response) {
        public Fixtures {
            response = response == null ? List.of() : response;
        }

        public boolean hasErrors() {
            return errors != null && !errors.isNull() && errors.size() > 0;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Item(Fixture fixture, League league, Teams teams, Goals goals) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Fixture(long id, OffsetDateTime date, String timezone) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record League(Long id, String name, Integer season) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Teams(Team home, Team away) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Team(Long id, String name) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Goals(Integer home, Integer away) {
    }
}
