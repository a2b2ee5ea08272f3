package com.soldlistings.scraper;

import java.net.URI;
import java.time.Duration;
import java.util.Locale;

/**
 * Immutable scraper configuration.
 * <p>
 * Every value can be supplied through an environment variable or, when the variable is absent,
 * a JVM system property of the same name (see {@link #fromEnvironment()}). Unset keys fall back
 * to the defaults declared on {@link Builder}.
 * <p>
 * Keys:
 * <ul>
 *   <li>{@code SCRAPER_BASE_URL} - marketplace host used for search URLs and to absolutize relative links.</li>
 *   <li>{@code SCRAPER_PAGE_SIZE}, {@code SCRAPER_SORT_ORDER} - fixed results-page filters.</li>
 *   <li>{@code SCRAPER_MAX_ATTEMPTS}, {@code SCRAPER_BACKOFF_UNIT_MS} - retry policy.</li>
 *   <li>{@code SCRAPER_LISTING_TIMEOUT_MS}, {@code SCRAPER_DETAIL_TIMEOUT_MS} - navigation timeouts.</li>
 *   <li>{@code SCRAPER_PER_PAGE_VISIT_CAP} - ceiling on detail pages visited per results page.</li>
 *   <li>{@code SCRAPER_JITTER_MIN_MS}, {@code SCRAPER_JITTER_MAX_MS}, {@code SCRAPER_DETAIL_DELAY_MS} - pacing.</li>
 *   <li>{@code SCRAPER_SECONDARY_RATE} - approximate USD to GBP rate used while parsing prices.</li>
 *   <li>{@code SCRAPER_EXCHANGE_RATE} - default GBP to USD display rate.</li>
 *   <li>{@code SCRAPER_SMOKE_URL}, {@code SCRAPER_BLOCK_RESOURCES}, {@code SCRAPER_PROXY}, {@code SCRAPER_PRODUCTION_MODE}.</li>
 * </ul>
 *
 * @author Sold Listings Scraper Team
 * @since 1.0
 */
public final class ScraperConfig {

    private final String baseUrl;
    private final int pageSize;
    private final int sortOrder;
    private final int maxAttempts;
    private final Duration backoffUnit;
    private final int listingTimeoutMs;
    private final int detailTimeoutMs;
    private final int perPageVisitCap;
    private final Duration jitterMin;
    private final Duration jitterMax;
    private final Duration detailDelay;
    private final int scrollSteps;
    private final double secondaryRate;
    private final double exchangeRate;
    private final String smokeUrl;
    private final boolean blockResources;
    private final String proxyServer;
    private final boolean productionMode;

    private ScraperConfig(Builder b) {
        this.baseUrl = stripTrailingSlash(b.baseUrl);
        this.pageSize = b.pageSize;
        this.sortOrder = b.sortOrder;
        this.maxAttempts = b.maxAttempts;
        this.backoffUnit = b.backoffUnit;
        this.listingTimeoutMs = b.listingTimeoutMs;
        this.detailTimeoutMs = b.detailTimeoutMs;
        this.perPageVisitCap = b.perPageVisitCap;
        this.jitterMin = b.jitterMin;
        this.jitterMax = b.jitterMax;
        this.detailDelay = b.detailDelay;
        this.scrollSteps = b.scrollSteps;
        this.secondaryRate = b.secondaryRate;
        this.exchangeRate = b.exchangeRate;
        this.smokeUrl = b.smokeUrl;
        this.blockResources = b.blockResources;
        this.proxyServer = b.proxyServer == null || b.proxyServer.isBlank() ? null : b.proxyServer.trim();
        this.productionMode = b.productionMode;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static ScraperConfig defaults() {
        return builder().build();
    }

    /**
     * Resolves every key from the environment first, then from system properties, then from defaults.
     * @return validated configuration
     * @throws ConfigurationException if any value is malformed
     */
    public static ScraperConfig fromEnvironment() {
        Builder defaults = new Builder();
        return builder()
            .baseUrl(envOrProp("SCRAPER_BASE_URL", defaults.baseUrl))
            .pageSize(intValue("SCRAPER_PAGE_SIZE", defaults.pageSize))
            .sortOrder(intValue("SCRAPER_SORT_ORDER", defaults.sortOrder))
            .maxAttempts(intValue("SCRAPER_MAX_ATTEMPTS", defaults.maxAttempts))
            .backoffUnit(Duration.ofMillis(intValue("SCRAPER_BACKOFF_UNIT_MS", (int) defaults.backoffUnit.toMillis())))
            .listingTimeoutMs(intValue("SCRAPER_LISTING_TIMEOUT_MS", defaults.listingTimeoutMs))
            .detailTimeoutMs(intValue("SCRAPER_DETAIL_TIMEOUT_MS", defaults.detailTimeoutMs))
            .perPageVisitCap(intValue("SCRAPER_PER_PAGE_VISIT_CAP", defaults.perPageVisitCap))
            .jitter(Duration.ofMillis(intValue("SCRAPER_JITTER_MIN_MS", (int) defaults.jitterMin.toMillis())),
                Duration.ofMillis(intValue("SCRAPER_JITTER_MAX_MS", (int) defaults.jitterMax.toMillis())))
            .detailDelay(Duration.ofMillis(intValue("SCRAPER_DETAIL_DELAY_MS", (int) defaults.detailDelay.toMillis())))
            .secondaryRate(doubleValue("SCRAPER_SECONDARY_RATE", defaults.secondaryRate))
            .exchangeRate(doubleValue("SCRAPER_EXCHANGE_RATE", defaults.exchangeRate))
            .smokeUrl(envOrProp("SCRAPER_SMOKE_URL", defaults.smokeUrl))
            .blockResources(Boolean.parseBoolean(envOrProp("SCRAPER_BLOCK_RESOURCES", Boolean.toString(defaults.blockResources))))
            .proxyServer(envOrProp("SCRAPER_PROXY", null))
            .productionMode(Boolean.parseBoolean(envOrProp("SCRAPER_PRODUCTION_MODE", "false")))
            .build();
    }

    static String envOrProp(String key, String defaultVal) {
        String ev = System.getenv(key);
        if (ev != null && !ev.isBlank()) return ev.trim();
        String prop = System.getProperty(key);
        return prop != null && !prop.isBlank() ? prop.trim() : defaultVal;
    }

    private static int intValue(String key, int defaultVal) {
        String raw = envOrProp(key, null);
        if (raw == null) return defaultVal;
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            throw new ConfigurationException(key + " must be an integer but was '" + raw + "'", e);
        }
    }

    private static double doubleValue(String key, double defaultVal) {
        String raw = envOrProp(key, null);
        if (raw == null) return defaultVal;
        try {
            return Double.parseDouble(raw);
        } catch (NumberFormatException e) {
            throw new ConfigurationException(key + " must be a number but was '" + raw + "'", e);
        }
    }

    /**
     * Checks that {@code url} is an absolute http(s) URL with a host.
     * @throws ConfigurationException otherwise
     */
    static URI requireHttpUrl(String name, String url) {
        if (url == null || url.isBlank()) {
            throw new ConfigurationException(name + " must not be blank");
        }
        URI uri;
        try {
            uri = URI.create(url.trim());
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(name + " is not a valid URL: " + url, e);
        }
        String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
        if (!scheme.equals("http") && !scheme.equals("https")) {
            throw new ConfigurationException(name + " must use http or https: " + url);
        }
        if (uri.getHost() == null || uri.getHost().isBlank()) {
            throw new ConfigurationException(name + " has no host: " + url);
        }
        return uri;
    }

    private static String stripTrailingSlash(String url) {
        String trimmed = url.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }

    public String baseUrl() { return baseUrl; }
    public int pageSize() { return pageSize; }
    public int sortOrder() { return sortOrder; }
    public int maxAttempts() { return maxAttempts; }
    public Duration backoffUnit() { return backoffUnit; }
    public int listingTimeoutMs() { return listingTimeoutMs; }
    public int detailTimeoutMs() { return detailTimeoutMs; }
    public int perPageVisitCap() { return perPageVisitCap; }
    public Duration jitterMin() { return jitterMin; }
    public Duration jitterMax() { return jitterMax; }
    public Duration detailDelay() { return detailDelay; }
    public int scrollSteps() { return scrollSteps; }
    public double secondaryRate() { return secondaryRate; }
    public double exchangeRate() { return exchangeRate; }
    public String smokeUrl() { return smokeUrl; }
    public boolean blockResources() { return blockResources; }
    public String proxyServer() { return proxyServer; }
    public boolean productionMode() { return productionMode; }

    public Builder toBuilder() {
        return builder()
            .baseUrl(baseUrl)
            .pageSize(pageSize)
            .sortOrder(sortOrder)
            .maxAttempts(maxAttempts)
            .backoffUnit(backoffUnit)
            .listingTimeoutMs(listingTimeoutMs)
            .detailTimeoutMs(detailTimeoutMs)
            .perPageVisitCap(perPageVisitCap)
            .jitter(jitterMin, jitterMax)
            .detailDelay(detailDelay)
            .scrollSteps(scrollSteps)
            .secondaryRate(secondaryRate)
            .exchangeRate(exchangeRate)
            .smokeUrl(smokeUrl)
            .blockResources(blockResources)
            .proxyServer(proxyServer)
            .productionMode(productionMode);
    }

    public static final class Builder {
        private String baseUrl = "https://www.ebay.co.uk";
        private int pageSize = 50;
        private int sortOrder = 13;
        private int maxAttempts = 2;
        private Duration backoffUnit = Duration.ofSeconds(1);
        private int listingTimeoutMs = 45_000;
        private int detailTimeoutMs = 30_000;
        private int perPageVisitCap = 10;
        private Duration jitterMin = Duration.ofMillis(1_000);
        private Duration jitterMax = Duration.ofMillis(3_000);
        private Duration detailDelay = Duration.ofMillis(2_000);
        private int scrollSteps = 3;
        private double secondaryRate = 0.78;
        private double exchangeRate = ScrapeRequest.DEFAULT_EXCHANGE_RATE;
        private String smokeUrl = "https://example.com";
        private boolean blockResources = true;
        private String proxyServer;
        private boolean productionMode;

        private Builder() {}

        public Builder baseUrl(String baseUrl) { this.baseUrl = baseUrl; return this; }
        public Builder pageSize(int pageSize) { this.pageSize = pageSize; return this; }
        public Builder sortOrder(int sortOrder) { this.sortOrder = sortOrder; return this; }
        public Builder maxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; return this; }
        public Builder backoffUnit(Duration backoffUnit) { this.backoffUnit = backoffUnit; return this; }
        public Builder listingTimeoutMs(int listingTimeoutMs) { this.listingTimeoutMs = listingTimeoutMs; return this; }
        public Builder detailTimeoutMs(int detailTimeoutMs) { this.detailTimeoutMs = detailTimeoutMs; return this; }
        public Builder perPageVisitCap(int perPageVisitCap) { this.perPageVisitCap = perPageVisitCap; return this; }
        public Builder jitter(Duration min, Duration max) { this.jitterMin = min; this.jitterMax = max; return this; }
        public Builder detailDelay(Duration detailDelay) { this.detailDelay = detailDelay; return this; }
        public Builder scrollSteps(int scrollSteps) { this.scrollSteps = scrollSteps; return this; }
        public Builder secondaryRate(double secondaryRate) { this.secondaryRate = secondaryRate; return this; }
        public Builder exchangeRate(double exchangeRate) { this.exchangeRate = exchangeRate; return this; }
        public Builder smokeUrl(String smokeUrl) { this.smokeUrl = smokeUrl; return this; }
        public Builder blockResources(boolean blockResources) { this.blockResources = blockResources; return this; }
        public Builder proxyServer(String proxyServer) { this.proxyServer = proxyServer; return this; }
        public Builder productionMode(boolean productionMode) { this.productionMode = productionMode; return this; }

        /**
         * Validates and freezes the configuration.
         * @throws ConfigurationException if any value is out of range
         */
        public ScraperConfig build() {
            requireHttpUrl("SCRAPER_BASE_URL", baseUrl);
            requireHttpUrl("SCRAPER_SMOKE_URL", smokeUrl);
            requirePositive("SCRAPER_PAGE_SIZE", pageSize);
            requirePositive("SCRAPER_MAX_ATTEMPTS", maxAttempts);
            requirePositive("SCRAPER_LISTING_TIMEOUT_MS", listingTimeoutMs);
            requirePositive("SCRAPER_DETAIL_TIMEOUT_MS", detailTimeoutMs);
            requirePositive("SCRAPER_PER_PAGE_VISIT_CAP", perPageVisitCap);
            if (sortOrder < 0) throw new ConfigurationException("SCRAPER_SORT_ORDER must not be negative");
            if (scrollSteps < 0) throw new ConfigurationException("scrollSteps must not be negative");
            requireNonNegative("SCRAPER_BACKOFF_UNIT_MS", backoffUnit);
            requireNonNegative("SCRAPER_JITTER_MIN_MS", jitterMin);
            requireNonNegative("SCRAPER_JITTER_MAX_MS", jitterMax);
            requireNonNegative("SCRAPER_DETAIL_DELAY_MS", detailDelay);
            if (jitterMin.compareTo(jitterMax) > 0) {
                throw new ConfigurationException("SCRAPER_JITTER_MIN_MS must not exceed SCRAPER_JITTER_MAX_MS");
            }
            if (!(secondaryRate > 0) || Double.isInfinite(secondaryRate)) {
                throw new ConfigurationException("SCRAPER_SECONDARY_RATE must be a positive number");
            }
            if (!(exchangeRate > 0) || Double.isInfinite(exchangeRate)) {
                throw new ConfigurationException("SCRAPER_EXCHANGE_RATE must be a positive number");
            }
            return new ScraperConfig(this);
        }

        private static void requirePositive(String key, int value) {
            if (value <= 0) throw new ConfigurationException(key + " must be positive but was " + value);
        }

        private static void requireNonNegative(String key, Duration value) {
            if (value == null || value.isNegative()) throw new ConfigurationException(key + " must not be negative");
        }
    }
}
