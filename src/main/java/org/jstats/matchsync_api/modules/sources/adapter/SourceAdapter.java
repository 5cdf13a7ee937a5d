package org.jstats.matchsync_api.modules.sources.adapter;

import org.jstats.matchsync_api.modules.sources.model.Match;

import java.util.List;

/**
 * One external match-data provider, translated into canonical {@link Match} values.
 */
public interface SourceAdapter {

    /**
     * Stable provider key, also used as the key of the credentials map (e.g. "football-data-org").
     */
    String providerName();

    /**
     * Whether consecutive calls to this provider must be spaced out by the orchestrator.
     */
    boolean highVolume();

    /**
     * Whether a credential is present; an unconfigured adapter fails every fetch without a network call.
     */
    boolean isConfigured();

    /**
     * Fetches every fixture of a season.
     *
     * @param season 4-digit season year
     * @return the complete, possibly empty, list of fixtures; never a partial list
     * @throws SourceUnavailableException on missing credentials, network, status or parse failures
     */
    List<Match> fetch(String season);

    /**
     * Issues a lightweight request and reports whether the provider answered successfully.
     */
    boolean ping();
}
