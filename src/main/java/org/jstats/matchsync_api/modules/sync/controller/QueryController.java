package org.jstats.matchsync_api.modules.sync.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import org.jstats.matchsync_api.modules.store.model.FixturePage;
import org.jstats.matchsync_api.modules.store.model.FixtureQuery;
import org.jstats.matchsync_api.modules.sync.model.TeamList;
import org.jstats.matchsync_api.modules.sync.service.DataSyncService;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@Tag(name = "Store Queries", description = "Read teams and fixtures from the local store.")
@Validated
@RestController
@RequestMapping("/api")
public class QueryController {

    private final DataSyncService syncService;

    public QueryController(DataSyncService syncService) {
        this.syncService = syncService;
    }

    @Operation(summary = "All teams with their fixture counts, by name")
    @GetMapping("/teams")
    public TeamList teams() {
        return TeamList.of(syncService.listTeams());
    }

    /**
     * Example:
     * GET /api/fixtures?season=2024&team=Arsenal&limit=20
     */
    @Operation(
            summary = "Fixtures, most recent first",
            responses = {
                    @ApiResponse(responseCode = "200", description = "OK"),
                    @ApiResponse(responseCode = "400", description = "Bad Request",
                            content = @Content(mediaType = "application/problem+json")),
                    @ApiResponse(responseCode = "503", description = "Store unavailable",
                            content = @Content(mediaType = "application/problem+json"))
            }
    )
    @GetMapping("/fixtures")
    public FixturePage fixtures(
            @RequestParam(name = "season", required = false)
            @Pattern(regexp = "^\\d{4}$", message = "season must be a 4-digit year")
            String season,
            @RequestParam(name = "team", required = false)
            @Size(max = 50, message = "team must be at most 50 characters")
            String team,
            @RequestParam(name = "limit", defaultValue = "100")
            @Min(value = 1, message = "limit must be at least 1")
            @Max(value = FixtureQuery.MAX_LIMIT, message = "limit must be at most 1000")
            int limit,
            @RequestParam(name = "offset", defaultValue = "0")
            @Min(value = 0, message = "offset must not be negative")
            int offset) {

        var query = new FixtureQuery(season == null ? null : Integer.valueOf(season), team, limit, offset);
        return syncService.listFixtures(query);
    }
}
