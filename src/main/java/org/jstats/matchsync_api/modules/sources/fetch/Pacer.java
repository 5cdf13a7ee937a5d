package org.jstats.matchsync_api.modules.sources.fetch;

import java.time.Duration;

/**
 * Blocks the calling thread for a while. Production code sleeps; tests advance a clock.
 */
@FunctionalInterface
public interface Pacer {

    void pause(Duration duration) throws InterruptedException;

    static Pacer sleeping() {
        return duration -> {
            if (!duration.isNegative() && !duration.isZero()) {
                Thread.sleep(duration.toMillis());
            }
        };
    }
}
