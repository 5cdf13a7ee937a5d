package org.jstats.matchsync_api.modules.sync.model;

import java.time.OffsetDateTime;

public record HealthResponse(String status, OffsetDateTime timestamp, String version) {
}
