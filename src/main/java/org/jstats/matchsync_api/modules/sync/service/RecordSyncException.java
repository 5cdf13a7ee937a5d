package org.jstats.matchsync_api.modules.sync.service;

/**
 * One record could not be written. Recorded in the summary; the batch continues.
 */
public class RecordSyncException extends RuntimeException {

    public RecordSyncException(String message) {
        super(message);
    }
}
