package com.soldlistings.scraper;

/**
 * Parameters of one scrape call. Out-of-range values are clamped, never rejected:
 * {@code pages} to [1, 50] and {@code perPage} to [1, 200]. A non-positive exchange rate is stored as
 * {@link #UNSET_EXCHANGE_RATE} and replaced by the configured default through
 * {@link #withDefaultExchangeRate(double)} before the run starts.
 *
 * @param query        free-text search query
 * @param pages        number of results pages to walk
 * @param perPage      cap on items collected over the whole run
 * @param headless     run the browser without a window
 * @param exchangeRate base-to-display conversion rate (GBP to USD)
 * @param mobile       emulate a mobile device
 * @param smoke        run the liveness check instead of extraction
 * @param filters      optional search filters
 */
public record ScrapeRequest(
    String query,
    int pages,
    int perPage,
    boolean headless,
    double exchangeRate,
    boolean mobile,
    boolean smoke,
    SearchFilters filters
) {
    public static final int MIN_PAGES = 1;
    public static final int MAX_PAGES = 50;
    public static final int MIN_PER_PAGE = 1;
    public static final int MAX_PER_PAGE = 200;
    public static final double DEFAULT_EXCHANGE_RATE = 1.28;
    public static final double UNSET_EXCHANGE_RATE = 0.0;
    public static final String SMOKE_QUERY = "__SMOKE__";

    public ScrapeRequest {
        query = query == null ? "" : query.trim();
        pages = clamp(pages, MIN_PAGES, MAX_PAGES);
        perPage = clamp(perPage, MIN_PER_PAGE, MAX_PER_PAGE);
        if (!(exchangeRate > 0) || Double.isInfinite(exchangeRate)) {
            exchangeRate = UNSET_EXCHANGE_RATE;
        }
        filters = filters == null ? SearchFilters.NONE : filters;
    }

    public ScrapeRequest(String query, int pages, int perPage, boolean headless, double exchangeRate,
                         boolean mobile, boolean smoke) {
        this(query, pages, perPage, headless, exchangeRate, mobile, smoke, SearchFilters.NONE);
    }

    public static ScrapeRequest smokeCheck() {
        return new ScrapeRequest(SMOKE_QUERY, 1, 1, true, DEFAULT_EXCHANGE_RATE, false, true);
    }

    public boolean hasExchangeRate() {
        return exchangeRate > 0;
    }

    /**
     * @return this request if it carries a valid rate, otherwise a copy using {@code fallbackRate}
     */
    public ScrapeRequest withDefaultExchangeRate(double fallbackRate) {
        if (hasExchangeRate()) {
            return this;
        }
        return new ScrapeRequest(query, pages, perPage, headless, fallbackRate, mobile, smoke, filters);
    }

    /**
     * @return a copy with {@code perPage} lowered to {@code maxPerPage} and headless forced
     */
    public ScrapeRequest restrictedTo(int maxPerPage) {
        return new ScrapeRequest(query, pages, Math.min(perPage, maxPerPage), true, exchangeRate, mobile, smoke, filters);
    }

    private static int clamp(int value, int min, int max) {
        return Math.max(min, Math.min(value, max));
    }
}
