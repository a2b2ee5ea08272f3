package com.soldlistings.scraper;

/**
 * Optional search filters on top of the fixed sold/completed filters.
 *
 * @param condition item-condition filter, or null for any condition
 */
public record SearchFilters(ItemCondition condition) {

    public static final SearchFilters NONE = new SearchFilters(null);

    public enum ItemCondition {
        NEW("1000"),
        USED("3000");

        private final String code;

        ItemCondition(String code) {
            this.code = code;
        }

        /** Marketplace filter code for this condition. */
        public String code() {
            return code;
        }
    }
}
