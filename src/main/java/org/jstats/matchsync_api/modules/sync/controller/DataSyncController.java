package org.jstats.matchsync_api.modules.sync.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.jstats.matchsync_api.modules.store.model.DatabaseStats;
import org.jstats.matchsync_api.modules.sync.config.SyncProperties;
import org.jstats.matchsync_api.modules.sync.model.DataUpdateRequest;
import org.jstats.matchsync_api.modules.sync.model.EndpointReport;
import org.jstats.matchsync_api.modules.sync.model.HealthResponse;
import org.jstats.matchsync_api.modules.sync.model.SyncSummary;
import org.jstats.matchsync_api.modules.sync.service.DataSyncService;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;

import static org.springframework.http.HttpStatus.BAD_REQUEST;

@Tag(name = "Data Synchronization", description = "Update the fixture store from external providers and inspect it.")
@Validated
@RestController
@RequestMapping("/api")
public class DataSyncController {

    private final DataSyncService syncService;
    private final SyncProperties properties;
    private final Clock clock;

    public DataSyncController(DataSyncService syncService, SyncProperties properties, Clock clock) {
        this.syncService = syncService;
        this.properties = properties;
        this.clock = clock;
    }

    @Operation(summary = "Liveness check")
    @GetMapping("/health")
    public HealthResponse health() {
        return new HealthResponse("healthy", OffsetDateTime.now(clock), properties.version());
    }

    @Operation(
            summary = "Probe store and providers",
            description = "Checks the schema, pings every provider and fetches one probe season.")
    @GetMapping("/status")
    public EndpointReport status() {
        return syncService.testEndpoints();
    }

    /**
     * Example:
     * POST /api/data/update {"seasons": ["2023", "2024"], "forceUpdate": false}
     */
    @Operation(
            summary = "Synchronize seasons",
            description = "Fetches the given seasons (default: current year) and writes them to the store.",
            responses = {
                    @ApiResponse(responseCode = "200", description = "OK",
                            content = @Content(mediaType = "application/json",
                                    schema = @Schema(implementation = SyncSummary.class))),
                    @ApiResponse(responseCode = "400", description = "Bad Request",
                            content = @Content(mediaType = "application/problem+json")),
                    @ApiResponse(responseCode = "409", description = "Synchronization cancelled",
                            content = @Content(mediaType = "application/problem+json")),
                    @ApiResponse(responseCode = "503", description = "Store unavailable",
                            content = @Content(mediaType = "application/problem+json"))
            }
    )
    @PostMapping("/data/update")
    public SyncSummary update(@Valid @RequestBody(required = false) DataUpdateRequest request) {
        List<String> seasons = request == null ? List.of() : request.seasonsOrEmpty();
        if (seasons.size() > properties.maxSeasons()) {
            throw new ResponseStatusException(BAD_REQUEST,
                    "at most %d seasons may be updated per request".formatted(properties.maxSeasons()));
        }
        return syncService.updateData(seasons, request != null && request.force());
    }

    @Operation(summary = "Store statistics",
            responses = {
                    @ApiResponse(responseCode = "200", description = "OK"),
                    @ApiResponse(responseCode = "503", description = "Store unavailable",
                            content = @Content(mediaType = "application/problem+json"))
            })
    @GetMapping("/data/stats")
    public DatabaseStats stats() {
        return syncService.getDatabaseStats();
    }

    @Operation(summary = "Which providers have a credential configured")
    @GetMapping("/config")
    public Map<String, Boolean> config() {
        return syncService.configuredProviders();
    }
}
