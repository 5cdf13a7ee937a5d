package org.jstats.matchsync_api.modules.store.model;

import java.util.List;

public record FixturePage(List<FixtureView> fixtures, long totalCount, int limit, int offset, boolean hasMore) {

    public static FixturePage of(List<FixtureView> fixtures, long totalCount, FixtureQuery query) {
        return new FixturePage(
                fixtures,
                totalCount,
                query.limit(),
                query.offset(),
                (long) query.offset() + fixtures.size() < totalCount);
    }
}
