package com.soldlistings.scraper;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Canonicalizes listing URLs and remembers which ones were already visited during one run.
 * <p>
 * Canonical form: absolute http(s) URL against the configured base host, with query string and
 * fragment removed. Canonicalization is idempotent. State is per run and never persisted.
 */
public final class DedupRegistry {

    private final String baseUrl;
    private final Set<String> seen = new LinkedHashSet<>();

    /**
     * @param baseUrl absolute base used for relative links, e.g. {@code https://www.ebay.co.uk}
     * @throws ConfigurationException if the base URL is malformed
     */
    public DedupRegistry(String baseUrl) {
        ScraperConfig.requireHttpUrl("base URL", baseUrl);
        String trimmed = baseUrl.trim();
        this.baseUrl = trimmed.endsWith("/") ? trimmed.substring(0, trimmed.length() - 1) : trimmed;
    }

    /**
     * @param url raw link as found on the page (absolute, protocol-relative or relative)
     * @return canonical URL, or null for a blank link
     */
    public String canonicalize(String url) {
        if (url == null || url.isBlank()) {
            return null;
        }
        String absolute = absolutize(url.trim());
        int cut = indexOfAny(absolute, '?', '#');
        return cut >= 0 ? absolute.substring(0, cut) : absolute;
    }

    /**
     * @return true if the canonical form of {@code url} was already recorded
     */
    public boolean hasSeen(String url) {
        String canonical = canonicalize(url);
        return canonical != null && seen.contains(canonical);
    }

    /**
     * Records the canonical form of {@code url}.
     * @return true if it was not recorded before
     */
    public boolean record(String url) {
        String canonical = canonicalize(url);
        return canonical != null && seen.add(canonical);
    }

    public int size() {
        return seen.size();
    }

    private String absolutize(String url) {
        if (url.startsWith("//")) {
            return "https:" + url;
        }
        String lower = url.toLowerCase(Locale.ROOT);
        if (lower.startsWith("http://") || lower.startsWith("https://")) {
            return url;
        }
        return url.startsWith("/") ? baseUrl + url : baseUrl + "/" + url;
    }

    private static int indexOfAny(String s, char a, char b) {
        int ia = s.indexOf(a);
        int ib = s.indexOf(b);
        if (ia < 0) return ib;
        if (ib < 0) return ia;
        return Math.min(ia, ib);
    }
}
