package com.soldlistings.scraper;

import java.util.List;

/**
 * Something selectors can be run against: a whole rendered page or a single element within it.
 */
public interface ElementScope {

    /**
     * Finds all elements matching a CSS selector, in document order.
     * @param selector CSS selector
     * @return matching elements (empty if none)
     * @throws BrowserSessionException if the selector cannot be evaluated
     */
    List<PageElement> locate(String selector);

    /**
     * @return the HTML of this scope (full document for a page, outer HTML for an element)
     */
    String html();
}
