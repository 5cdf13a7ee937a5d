package org.jstats.matchsync_api.modules.sources.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Provider name to API credential. A provider whose credential is blank or an
 * unresolved placeholder counts as not configured.
 */
public class SourceCredentials {

    private static final Logger log = LoggerFactory.getLogger(SourceCredentials.class);

    private static final Pattern PLACEHOLDER = Pattern.compile("^\\$\\{([^}:]+)(:[^}]*)?}$");

    private final Map<String, String> keys;

    public SourceCredentials(Map<String, String> configured) {
        var resolved = new LinkedHashMap<String, String>();
        configured.forEach((provider, raw) -> {
            String key = resolve(raw);
            if (StringUtils.hasText(key)) {
                resolved.put(provider, key);
            }
        });
        this.keys = Map.copyOf(resolved);
    }

    public static SourceCredentials none() {
        return new SourceCredentials(Map.of());
    }

    public Optional<String> keyFor(String provider) {
        return Optional.ofNullable(keys.get(provider));
    }

    public boolean isConfigured(String provider) {
        return keys.containsKey(provider);
    }

    public boolean isEmpty() {
        return keys.isEmpty();
    }

    /**
     * Logs which providers have a credential, with non-secret diagnostics only.
     */
    public void logStatus(Collection<String> providers) {
        if (keys.isEmpty()) {
            log.warn("No provider API keys configured; synthetic data will be used for every fetch");
            return;
        }
        for (String provider : providers) {
            var key = keys.get(provider);
            if (key == null) {
                log.info("Provider {} has no API key configured and will be skipped", provider);
            } else {
                int len = key.length();
                String tail = len >= 2 ? key.substring(len - 2) : "??";
                log.info("Provider {} API key resolved (len={}, endsWith=**{})", provider, len, tail);
            }
        }
    }

    private static String resolve(String configured) {
        if (!StringUtils.hasText(configured)) {
            return null;
        }
        var trimmed = configured.trim();
        if (!trimmed.startsWith("${")) {
            return trimmed;
        }
        // Placeholder left unresolved by Spring: fall back to system property, then environment
        Matcher m = PLACEHOLDER.matcher(trimmed);
        if (!m.matches()) {
            return null;
        }
        String var = m.group(1);
        String fromSysProp = System.getProperty(var);
        if (StringUtils.hasText(fromSysProp)) {
            return fromSysProp.trim();
        }
        String fromEnv = System.getenv(var);
        if (StringUtils.hasText(fromEnv)) {
            return fromEnv.trim();
        }
        return null;
    }
}
