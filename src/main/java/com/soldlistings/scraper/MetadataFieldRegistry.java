package com.soldlistings.scraper;

import java.util.List;

/**
 * Central registry of every selector list the extractors use.
 * <p>
 * Results pages come in two layouts (the newer {@code s-card} grid and the older {@code s-item} list,
 * which is also what phones get), so listing selectors are grouped per layout. Detail-page price
 * selectors are split into the current display and the legacy display because they are separate
 * fallback tiers. Markup changes are absorbed here without touching extraction logic.
 */
public final class MetadataFieldRegistry {
    private MetadataFieldRegistry() {}

    public static final String DETAIL_LINK_PATTERN = "/itm/";

    private static final List<MetadataField> FIELDS = List.of(
        // --- results page ---
        new MetadataField("listing.card.anchor", List.of(
            "li.s-card a.su-link[href*='/itm/']", "div.s-card a[href*='/itm/']"
        )),
        new MetadataField("listing.card.container", List.of(
            "li.s-card", "div.s-card"
        )),
        new MetadataField("listing.item.anchor", List.of(
            "a.s-item__link[href*='/itm/']"
        )),
        new MetadataField("listing.item.container", List.of(
            "li.s-item", "div.s-item__wrapper", "div.s-item"
        )),
        new MetadataField("listing.any.anchor", List.of(
            "a[href*='/itm/']"
        )),
        new MetadataField("listing.any.container", List.of(
            "li", "[class*='s-item']", "[class*='s-card']", "article"
        )),
        new MetadataField("listing.title", List.of(
            ".s-card__title .su-styled-text", ".s-card__title", ".s-item__title span[role='heading']",
            ".s-item__title", "h3", "[role='heading']"
        )),
        new MetadataField("listing.price", List.of(
            ".s-card__price", ".s-item__price"
        )),
        new MetadataField("listing.shipping", List.of(
            ".s-item__shipping", ".s-item__logisticsCost", ".s-card__shipping"
        )),
        new MetadataField("listing.condition", List.of(
            ".s-item__subtitle .SECONDARY_INFO", ".s-card__subtitle", ".s-item__subtitle"
        )),
        new MetadataField("listing.image", List.of(
            ".s-item__image-img", ".s-card__image", "img"
        )),
        // --- detail page ---
        new MetadataField("item.price.modern", List.of(
            ".x-price-primary span", "[data-testid='x-price-primary'] span",
            ".x-bin-price__content .ux-textspans", "span[itemprop='price']"
        )),
        new MetadataField("item.price.legacy", List.of(
            "#prcIsum", "#mm-saleDscPrc", "#prcIsum_bidPrice", ".vi-price .notranslate",
            ".mainPrice", ".display-price", ".vi-price"
        )),
        new MetadataField("item.labelledRow", List.of(
            ".ux-labels-values"
        )),
        new MetadataField("item.condition", List.of(
            ".x-item-condition-text .ux-textspans", "[data-testid='x-item-condition-text'] .ux-textspans",
            ".x-item-condition-value .ux-textspans", "#vi-itm-cond", ".vi-condition"
        )),
        new MetadataField("item.shipping", List.of(
            "#fshippingCost", "[data-testid='x-shipping-cost']", ".ux-labels-values--shipping .ux-labels-values__values .ux-textspans",
            ".vi-shipping", ".sh-price", ".frshippingCost"
        )),
        new MetadataField("item.sold", List.of(
            ".vi-tm-pos", ".vi-bboxrev-pos", ".vi-notify-new-bg-dBtm", ".x-item-ended-message"
        )),
        new MetadataField("item.soldBadge", List.of(
            ".ux-textspans"
        )),
        new MetadataField("item.image", List.of(
            "#icImg", "#mainImg", ".ux-image-carousel-item.active img", ".ux-image-carousel-item img",
            ".ux-image-filmstrip__item img", ".vi-image-gallery__main-image img", ".picture-panel img"
        )),
        new MetadataField("item.image.meta", List.of(
            "meta[property='og:image']"
        ))
    );

    /**
     * @return the field, or null if no field with that name is registered
     */
    public static MetadataField getField(String name) {
        for (MetadataField field : FIELDS) {
            if (field.fieldName.equals(name)) {
                return field;
            }
        }
        return null;
    }

    /**
     * @return the selectors of a registered field
     * @throws IllegalArgumentException if the field is unknown
     */
    public static List<String> selectors(String name) {
        MetadataField field = getField(name);
        if (field == null) {
            throw new IllegalArgumentException("Unknown metadata field: " + name);
        }
        return field.selectors;
    }
}
