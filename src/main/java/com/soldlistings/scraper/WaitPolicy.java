package com.soldlistings.scraper;

/**
 * How long a navigation waits before the page is considered ready.
 */
public enum WaitPolicy {
    /** Return once the DOM has been parsed. */
    DOM_CONTENT_LOADED,
    /** Return once the load event fired. */
    LOAD,
    /** Wait for the DOM, then give the network a chance to go idle so client-side rendering can finish. */
    NETWORK_IDLE
}
