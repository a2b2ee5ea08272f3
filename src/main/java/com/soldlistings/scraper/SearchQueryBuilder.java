package com.soldlistings.scraper;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

/**
 * Builds the canonical results-page URL for a query.
 * <p>
 * Every URL carries the fixed filters (sold and completed listings only, sort order, page size)
 * plus the requested page index and, optionally, an item-condition filter.
 */
public final class SearchQueryBuilder {

    private final String baseUrl;
    private final int pageSize;
    private final int sortOrder;

    /**
     * @throws ConfigurationException if the base URL is malformed
     */
    public SearchQueryBuilder(ScraperConfig config) {
        this(config.baseUrl(), config.pageSize(), config.sortOrder());
    }

    /**
     * @throws ConfigurationException if the base URL is malformed or the page size is not positive
     */
    public SearchQueryBuilder(String baseUrl, int pageSize, int sortOrder) {
        ScraperConfig.requireHttpUrl("base URL", baseUrl);
        if (pageSize <= 0) {
            throw new ConfigurationException("Page size must be positive but was " + pageSize);
        }
        String trimmed = baseUrl.trim();
        this.baseUrl = trimmed.endsWith("/") ? trimmed.substring(0, trimmed.length() - 1) : trimmed;
        this.pageSize = pageSize;
        this.sortOrder = sortOrder;
    }

    /**
     * @param query free-text search query
     * @param pageIndex 1-based results page
     * @param filters optional filters (null means none)
     * @return absolute results-page URL
     */
    public String build(String query, int pageIndex, SearchFilters filters) {
        if (query == null || query.isBlank()) {
            throw new IllegalArgumentException("Query must not be blank");
        }
        if (pageIndex < 1) {
            throw new IllegalArgumentException("Page index must be at least 1 but was " + pageIndex);
        }
        StringBuilder url = new StringBuilder(baseUrl)
            .append("/sch/i.html?_nkw=").append(URLEncoder.encode(query.trim(), StandardCharsets.UTF_8))
            .append("&LH_Sold=1&LH_Complete=1")
            .append("&_sop=").append(sortOrder)
            .append("&_ipg=").append(pageSize)
            .append("&_pgn=").append(pageIndex);
        if (filters != null && filters.condition() != null) {
            url.append("&LH_ItemCondition=").append(filters.condition().code());
        }
        return url.toString();
    }
}
