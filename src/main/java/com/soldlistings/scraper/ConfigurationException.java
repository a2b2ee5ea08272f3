package com.soldlistings.scraper;

/**
 * Raised when the scraper is configured with values it cannot work with
 * (malformed base URL, non-positive rates, inverted jitter range).
 * <p>
 * Configuration errors are fatal and are reported before any browser work starts; they are never retried.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
