package org.jstats.matchsync_api.modules.sync.service;

/**
 * The synchronizing thread was interrupted; the season in progress was rolled back.
 */
public class SyncCancelledException extends RuntimeException {

    public SyncCancelledException(String season) {
        super("Synchronization of season " + season + " was cancelled");
    }
}
