package com.soldlistings.scraper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Random;

/**
 * Human-like delays between page loads.
 * <p>
 * An interrupted pause restores the interrupt flag and returns early; callers check
 * {@link Thread#isInterrupted()} through their cancellation signal.
 */
public class Pacer {
    private static final Logger logger = LoggerFactory.getLogger(Pacer.class);

    static final Duration SCROLL_MIN = Duration.ofMillis(300);
    static final Duration SCROLL_MAX = Duration.ofMillis(800);

    private final Sleeper sleeper;
    private final Random random;
    private final Duration jitterMin;
    private final Duration jitterMax;

    public Pacer(Sleeper sleeper, Random random, Duration jitterMin, Duration jitterMax) {
        this.sleeper = sleeper;
        this.random = random;
        this.jitterMin = jitterMin;
        this.jitterMax = jitterMax;
    }

    public Pacer(Sleeper sleeper, Random random, ScraperConfig config) {
        this(sleeper, random, config.jitterMin(), config.jitterMax());
    }

    /**
     * Waits a random duration between the configured jitter bounds.
     */
    public void pause() {
        pause(between(jitterMin, jitterMax));
    }

    /**
     * Short random wait between scroll steps.
     */
    public void scrollPause() {
        pause(between(SCROLL_MIN, SCROLL_MAX));
    }

    public void pause(Duration duration) {
        if (duration.isZero() || duration.isNegative()) {
            return;
        }
        try {
            sleeper.sleep(duration);
        } catch (InterruptedException e) {
            logger.debug("Pause interrupted");
            Thread.currentThread().interrupt();
        }
    }

    Duration between(Duration min, Duration max) {
        long lo = min.toMillis();
        long hi = max.toMillis();
        if (hi <= lo) {
            return min;
        }
        return Duration.ofMillis(lo + (long) (random.nextDouble() * (hi - lo)));
    }
}
