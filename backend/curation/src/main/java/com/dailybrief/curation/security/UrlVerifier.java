package com.dailybrief.curation.security;

import com.dailybrief.curation.config.SourceConfig;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Checks that an item's link points at one of its source's known domains.
 * Sources without configured domains cannot be verified and always pass.
 */
public class UrlVerifier {
    private static final Logger LOGGER = Logger.getLogger(UrlVerifier.class.getName());

    private final Map<String, List<String>> domainsBySource;

    public UrlVerifier(Map<String, List<String>> domainsBySource) {
        this.domainsBySource = Map.copyOf(domainsBySource);
    }

    public static UrlVerifier fromSources(List<SourceConfig> sources) {
        Map<String, List<String>> domains = new HashMap<>();
        for (SourceConfig source : sources) {
            if (!source.domains().isEmpty()) {
                domains.put(source.id(), source.domains().stream()
                        .map(domain -> domain.toLowerCase(Locale.ROOT))
                        .toList());
            }
        }
        return new UrlVerifier(domains);
    }

    public boolean verify(String url, String sourceId) {
        List<String> expected = domainsBySource.get(sourceId);
        if (url == null || url.isBlank() || expected == null) {
            return true;
        }
        String host = hostOf(url);
        for (String domain : expected) {
            if (host.equals(domain) || host.endsWith("." + domain)) {
                return true;
            }
        }
        LOGGER.warning("URL domain mismatch for " + sourceId + ": expected " + expected + ", got '" + host + "'");
        return false;
    }

    private static String hostOf(String url) {
        try {
            String host = new URI(url.trim()).getHost();
            return host == null ? "" : host.toLowerCase(Locale.ROOT);
        } catch (URISyntaxException e) {
            return "";
        }
    }
}
