package org.jstats.matchsync_api.modules.store.model;

import org.jspecify.annotations.Nullable;

public record TeamSummary(long id, String name, @Nullable String fullName, long matchesCount) {
}
