package com.soldlistings.scraper;

/**
 * Lightweight summary of one result card, read before the detail page is visited.
 * Only {@code title} and {@code detailUrl} are guaranteed; the rest are fallbacks for the detail page.
 */
public record CandidateListing(
    String title,
    String detailUrl,
    String thumbnailImage,
    String priceTextRaw,
    String shippingTextRaw,
    String conditionTextRaw
) {}
