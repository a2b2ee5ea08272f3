package com.soldlistings.scraper;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Outcome of the browser liveness check.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SmokeResult(boolean ok, String title, String error) {

    public static SmokeResult ok(String title) {
        return new SmokeResult(true, title == null ? "n/a" : title, null);
    }

    public static SmokeResult failed(String error) {
        return new SmokeResult(false, null, error);
    }
}
