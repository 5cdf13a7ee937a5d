package org.jstats.matchsync_api.modules.store.repository;

/**
 * The store could not be read or written: lost connection, failed transaction, missing schema.
 * Aborts the batch in progress.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
