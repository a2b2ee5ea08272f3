package com.soldlistings.scraper;

/**
 * Launch and context options for one browser session.
 *
 * @param headless         run without a visible window
 * @param mobile           emulate a phone viewport and user agent
 * @param proxyServer      proxy server URL, or null
 * @param blockResources   abort image, media, font and stylesheet loads
 * @param defaultTimeoutMs default timeout for element queries
 * @param navigationTimeoutMs default navigation timeout
 */
public record SessionOptions(
    boolean headless,
    boolean mobile,
    String proxyServer,
    boolean blockResources,
    int defaultTimeoutMs,
    int navigationTimeoutMs
) {
    public static SessionOptions from(ScraperConfig config, boolean headless, boolean mobile) {
        return new SessionOptions(
            headless,
            mobile,
            config.proxyServer(),
            config.blockResources(),
            config.listingTimeoutMs(),
            Math.max(config.listingTimeoutMs(), config.detailTimeoutMs())
        );
    }
}
