package com.soldlistings.scraper;

/**
 * Opens browser sessions. One session is opened per scrape attempt.
 */
@FunctionalInterface
public interface BrowserSessionFactory {

    /**
     * @param options launch and context options
     * @return an open session with an active page
     * @throws BrowserSessionException if the browser could not be started
     */
    BrowserSessionInterface open(SessionOptions options);
}
