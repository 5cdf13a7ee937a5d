package org.jstats.matchsync_api.modules.sources.adapter;

/**
 * A provider could not deliver a result: missing credential, network failure,
 * error status or an unparsable body. Callers recover by trying the next source.
 */
public class SourceUnavailableException extends RuntimeException {

    private final String provider;

    public SourceUnavailableException(String provider, String message) {
        super(provider + ": " + message);
        this.provider = provider;
    }

    public SourceUnavailableException(String provider, String message, Throwable cause) {
        super(provider + ": " + message, cause);
        this.provider = provider;
    }

    public String provider() {
        return provider;
    }
}
