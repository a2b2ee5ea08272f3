package com.soldlistings.scraper;

/**
 * Fields read from a detail page. Every field is null when all of its tiers missed.
 *
 * @param priceAmount base-currency amount parsed from the page
 * @param priceText   the text the amount was parsed from
 */
public record ItemDetails(
    Double priceAmount,
    String priceText,
    String condition,
    String shipping,
    String soldInfo,
    String imageUrl
) {
}
