package com.soldlistings.scraper;

/**
 * Entry point for sold-listing scrapes.
 * <p>
 * Implementations never throw for runtime failures; every outcome, including rejected input,
 * is reported through {@link RunResult}.
 */
public interface ScraperServiceInterface {

    /**
     * Runs a scrape with retries.
     * @param request search parameters (already clamped)
     * @return the run outcome, never null
     */
    RunResult scrape(ScrapeRequest request);

    /**
     * Convenience overload matching the command-line surface.
     * @param query free-text search query
     * @param pages number of results pages to walk
     * @param perPage cap on items collected over the run
     * @param headless run without a visible window
     * @param exchangeRate base-to-display conversion rate
     * @param mobile emulate a phone
     * @param smoke run the liveness check instead of extraction
     * @return the run outcome, never null
     */
    default RunResult scrape(String query, int pages, int perPage, boolean headless, double exchangeRate,
                             boolean mobile, boolean smoke) {
        return scrape(new ScrapeRequest(query, pages, perPage, headless, exchangeRate, mobile, smoke));
    }

    /**
     * Opens a browser, loads a known page and reports its title.
     * @return liveness outcome, never null
     */
    SmokeResult smoke();
}
