package com.soldlistings.scraper;

/**
 * Failure of the underlying browser capability that cannot be expressed as a failed navigation,
 * for example a browser that did not launch or a page that crashed while being queried.
 */
public class BrowserSessionException extends RuntimeException {

    public BrowserSessionException(String message) {
        super(message);
    }

    public BrowserSessionException(String message, Throwable cause) {
        super(message, cause);
    }
}
