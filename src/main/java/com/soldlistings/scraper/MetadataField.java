package com.soldlistings.scraper;

import java.util.List;

/**
 * A named, ordered list of CSS selectors for one piece of page data.
 * Earlier selectors are more specific and win over later ones.
 */
public class MetadataField {
    public final String fieldName;
    public final List<String> selectors;

    public MetadataField(String fieldName, List<String> selectors) {
        this.fieldName = fieldName;
        this.selectors = List.copyOf(selectors);
    }
}
