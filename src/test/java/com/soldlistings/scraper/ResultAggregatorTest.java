package com.soldlistings.scraper;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ResultAggregatorTest {

    private static ExtractedItem item(String url) {
        return ExtractedItem.of("Title", "£1.00", 1.0, 1.28, null, null, null, url, null);
    }

    @Test
    void testStopsAtLimit() {
        ResultAggregator aggregator = new ResultAggregator(2);
        assertTrue(aggregator.add(item("https://www.ebay.co.uk/itm/1")));
        assertFalse(aggregator.isFull());
        assertTrue(aggregator.add(item("https://www.ebay.co.uk/itm/2")));
        assertTrue(aggregator.isFull());
        assertFalse(aggregator.add(item("https://www.ebay.co.uk/itm/3")));
        assertEquals(2, aggregator.size());
    }

    @Test
    void testRejectsDuplicateUrl() {
        ResultAggregator aggregator = new ResultAggregator(5);
        assertTrue(aggregator.add(item("https://www.ebay.co.uk/itm/1")));
        assertFalse(aggregator.add(item("https://www.ebay.co.uk/itm/1")));
        assertEquals(1, aggregator.items().size());
    }

    @Test
    void testItemsSnapshotIsImmutableAndOrdered() {
        ResultAggregator aggregator = new ResultAggregator(5);
        aggregator.add(item("https://www.ebay.co.uk/itm/2"));
        aggregator.add(item("https://www.ebay.co.uk/itm/1"));
        var items = aggregator.items();
        assertEquals("https://www.ebay.co.uk/itm/2", items.get(0).canonicalUrl());
        assertThrows(UnsupportedOperationException.class, () -> items.add(item("x")));
    }

    @Test
    void testLimitMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> new ResultAggregator(0));
    }
}
