package org.jstats.matchsync_api.modules.sync.model;

import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * @param seasons     4-digit season years; absent or empty means the current season
 * @param forceUpdate rewrite fixtures that are already stored
 */
public record DataUpdateRequest(
        @Nullable
        @Size(max = 10, message = "at most 10 seasons may be updated per request")
        List<@Pattern(regexp = "^\\d{4}$", message = "season must be a 4-digit year") String> seasons,
        @Nullable Boolean forceUpdate) {

    public List<String> seasonsOrEmpty() {
        return seasons == null ? List.of() : seasons;
    }

    public boolean force() {
        return Boolean.TRUE.equals(forceUpdate);
    }
}
