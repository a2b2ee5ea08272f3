package com.soldlistings.scraper;

import java.time.Duration;

/**
 * Blocking wait, injectable so retry backoff and pacing can be observed in tests.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
