package org.jstats.matchsync_api.modules.sources.adapter;

import org.jstats.matchsync_api.modules.sources.config.SourceCredentials;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.converter.HttpMessageConversionException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.function.Supplier;

/**
 * Shared plumbing for HTTP adapters: credential lookup and translation of every
 * transport, status and parse failure into {@link SourceUnavailableException}.
 */
abstract class AbstractSourceAdapter implements SourceAdapter {

    private static final int PREVIEW_LIMIT = 500;

    protected final Logger log = LoggerFactory.getLogger(getClass());

    protected final RestClient http;
    private final SourceCredentials credentials;

    AbstractSourceAdapter(RestClient http, SourceCredentials credentials) {
        this.http = http;
        this.credentials = credentials;
    }

    protected String requireKey() {
        return credentials.keyFor(providerName())
                .orElseThrow(() -> new SourceUnavailableException(providerName(), "no API credential configured"));
    }

    @Override
    public boolean isConfigured() {
        return credentials.isConfigured(providerName());
    }

    /**
     * Runs one request, returning its non-null body.
     */
    protected <T> T call(String endpoint, Supplier<T> request) {
        if (log.isDebugEnabled()) {
            log.debug("Calling {} GET {}", providerName(), endpoint);
        }
        try {
            T body = request.get();
            if (body == null) {
                throw new SourceUnavailableException(providerName(), "empty body from " + endpoint);
            }
            return body;
        } catch (SourceUnavailableException e) {
            throw e;
        } catch (ResourceAccessException io) {
            log.error("I/O error calling {} {}: {}", providerName(), endpoint, io.getMessage());
            throw new SourceUnavailableException(providerName(), "I/O error calling " + endpoint, io);
        } catch (HttpMessageConversionException conv) {
            var cause = conv.getCause();
            var msg = (cause instanceof com.fasterxml.jackson.core.JsonProcessingException jp)
                    ? jp.getOriginalMessage()
                    : conv.getMessage();
            log.error("Failed to parse {} JSON for {}: {}", providerName(), endpoint, msg);
            throw new SourceUnavailableException(providerName(), "unparsable response from " + endpoint, conv);
        } catch (RestClientException ex) {
            log.error("Request to {} {} failed: {}", providerName(), endpoint, ex.getMessage());
            throw new SourceUnavailableException(providerName(), "request to " + endpoint + " failed", ex);
        }
    }

    /**
     * Status handler for {@code onStatus(HttpStatusCode::isError, ...)}.
     */
    protected RestClient.ResponseSpec.ErrorHandler failOnStatus(String endpoint) {
        return (req, res) -> {
            int status = res.getStatusCode().value();
            var preview = preview(res.getBody());
            log.warn("{} responded HTTP {} for {}. Body: {}", providerName(), status, endpoint, preview);
            throw new SourceUnavailableException(providerName(), "HTTP " + status + " from " + endpoint);
        };
    }

    private static String preview(InputStream body) {
        if (body == null) {
            return "";
        }
        try {
            byte[] bytes = body.readNBytes(PREVIEW_LIMIT);
            return new String(bytes, StandardCharsets.UTF_8);
        } catch (IOException e) {
            return "<unreadable body: " + e.getMessage() + ">";
        }
    }
}
