package com.soldlistings.scraper;

import java.util.Set;

/**
 * The browser capability consumed by the scraper: one browser with a single active page.
 * <p>
 * A session is a scoped resource. It is opened by a {@link BrowserSessionFactory} at run start
 * and must be closed on every exit path, which is why it is {@link AutoCloseable}.
 * Selector queries ({@link #locate(String)}) and {@link #html()} operate on the active page.
 */
public interface BrowserSessionInterface extends ElementScope, AutoCloseable {

    /**
     * Navigates the active page.
     * @param url absolute URL
     * @param waitPolicy readiness condition
     * @param timeoutMs upper bound for the navigation
     * @return true if the page loaded, false on timeout or network failure
     */
    boolean navigate(String url, WaitPolicy waitPolicy, int timeoutMs);

    /**
     * @return the current page HTML
     */
    String getContent();

    /**
     * @return the current page title
     */
    String getTitle();

    /**
     * Evaluates a JavaScript expression or function in the page, for batch DOM extraction.
     * @param script JavaScript source
     * @return structured data (maps, lists, strings, numbers) or null
     */
    Object evaluate(String script);

    /**
     * Aborts sub-resource loads of the given types (for example "image", "media", "font", "stylesheet").
     */
    void blockResources(Set<String> resourceTypes);

    /**
     * Replaces the active page with a fresh one.
     */
    void newPage();

    /**
     * Closes the active page, if any.
     */
    void closePage();

    @Override
    default String html() {
        return getContent();
    }

    /**
     * Releases the page, context and browser. Never throws.
     */
    @Override
    void close();
}
