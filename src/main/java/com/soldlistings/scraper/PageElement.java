package com.soldlistings.scraper;

/**
 * Handle to one element of a rendered page.
 */
public interface PageElement extends ElementScope {

    /**
     * @return the element's text content, or null if unavailable
     */
    String text();

    /**
     * @param name attribute name
     * @return the attribute value, or null if absent
     */
    String attribute(String name);

    /**
     * Nearest ancestor (or this element itself) matching {@code selector}.
     * @return the matching element, or null if there is none
     */
    PageElement closest(String selector);
}
