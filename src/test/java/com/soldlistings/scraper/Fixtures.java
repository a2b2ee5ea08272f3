package com.soldlistings.scraper;

/**
 * Minimal results and detail pages in the marketplace's markup.
 */
final class Fixtures {
    private Fixtures() {}

    static final String BASE = "https://www.ebay.co.uk";

    /**
     * Legacy list layout with one card per item id; links carry tracking parameters.
     */
    static String listingPage(int... itemIds) {
        StringBuilder html = new StringBuilder("<html><body><ul class=\"srp-results\">");
        for (int id : itemIds) {
            html.append("<li class=\"s-item\">")
                .append("<a class=\"s-item__link\" href=\"").append(BASE).append("/itm/").append(id).append("?hash=item").append(id).append("\">")
                .append("<div class=\"s-item__title\"><span role=\"heading\">Item ").append(id)
                .append("<span class=\"clipped\">Opens in a new window or tab</span></span></div></a>")
                .append("<span class=\"s-item__price\">£").append(id).append(".00</span>")
                .append("<span class=\"s-item__shipping\">Free postage</span>")
                .append("<img class=\"s-item__image-img\" src=\"https://i.ebayimg.com/images/g/").append(id).append("/s-l225.jpg\">")
                .append("</li>");
        }
        return html.append("</ul></body></html>").toString();
    }

    static String detailPage(String priceText, String condition) {
        return "<html><head><title>Listing</title></head><body>"
            + (priceText == null ? "" : "<div class=\"x-price-primary\"><span class=\"ux-textspans\">" + priceText + "</span></div>")
            + (condition == null ? "" : "<div class=\"x-item-condition-text\"><span class=\"ux-textspans\">" + condition + "</span></div>")
            + "<div class=\"ux-labels-values\"><div class=\"ux-labels-values__labels\"><span>Ended:</span></div>"
            + "<div class=\"ux-labels-values__values\"><span>12 Oct, 2026 18:04:11 BST</span></div></div>"
            + "</body></html>";
    }

    static String detailUrl(int id) {
        return BASE + "/itm/" + id;
    }
}
