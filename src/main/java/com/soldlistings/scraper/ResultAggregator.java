package com.soldlistings.scraper;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Collects accepted items for one run, in acceptance order.
 * <p>
 * Never holds more than {@code limit} items and never two items with the same canonical URL.
 */
public final class ResultAggregator {

    private final int limit;
    private final List<ExtractedItem> items = new ArrayList<>();
    private final Set<String> urls = new HashSet<>();

    /**
     * @param limit maximum number of items, must be positive
     */
    public ResultAggregator(int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive but was " + limit);
        }
        this.limit = limit;
    }

    /**
     * @return true if the item was accepted; false when full or when its canonical URL is already present
     */
    public boolean add(ExtractedItem item) {
        if (isFull() || !urls.add(item.canonicalUrl())) {
            return false;
        }
        items.add(item);
        return true;
    }

    public boolean isFull() {
        return items.size() >= limit;
    }

    public int size() {
        return items.size();
    }

    public int limit() {
        return limit;
    }

    /**
     * @return an immutable snapshot of the accepted items
     */
    public List<ExtractedItem> items() {
        return List.copyOf(items);
    }
}
