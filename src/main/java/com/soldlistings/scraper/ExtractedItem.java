package com.soldlistings.scraper;

import java.util.Objects;

/**
 * Immutable record for one accepted sale.
 * <p>
 * {@code priceAmountPrimary} is in the base currency (GBP); {@code priceAmountSecondary} is the same
 * amount converted with the run's exchange rate. Both are present or both are null.
 * {@code canonicalUrl} is absolute and carries no query string; it is unique within a run.
 */
public record ExtractedItem(
    String title,
    String priceText,
    Double priceAmountPrimary,
    Double priceAmountSecondary,
    String shippingText,
    String condition,
    String soldInfo,
    String canonicalUrl,
    String imageUrl
) {
    public ExtractedItem {
        Objects.requireNonNull(title, "title");
        Objects.requireNonNull(priceText, "priceText");
        Objects.requireNonNull(canonicalUrl, "canonicalUrl");
        if ((priceAmountPrimary == null) != (priceAmountSecondary == null)) {
            throw new IllegalArgumentException("Primary and secondary price amounts must be present together");
        }
    }

    /**
     * Builds an item whose secondary amount is derived from the primary one.
     */
    public static ExtractedItem of(String title, String priceText, Double priceAmountPrimary, double exchangeRate,
                                   String shippingText, String condition, String soldInfo,
                                   String canonicalUrl, String imageUrl) {
        return new ExtractedItem(title, priceText, priceAmountPrimary,
            PriceNormalizer.convert(priceAmountPrimary, exchangeRate),
            shippingText, condition, soldInfo, canonicalUrl, imageUrl);
    }
}
