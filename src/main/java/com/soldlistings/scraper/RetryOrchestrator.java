package com.soldlistings.scraper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Runs a scrape attempt up to a bounded number of times with exponential backoff.
 * <p>
 * A successful result, or one that is not retryable (for example a clean run that found nothing),
 * is returned as is. Failed attempts are retried after {@code backoffUnit × 2^(attempt-1)}.
 * When every attempt fails the result carries the last error. Never throws.
 */
public class RetryOrchestrator {
    private static final Logger logger = LoggerFactory.getLogger(RetryOrchestrator.class);

    /**
     * One scrape attempt.
     */
    @FunctionalInterface
    public interface Attempt {
        /**
         * @param attemptNumber 1-based attempt number
         */
        RunResult run(int attemptNumber) throws Exception;
    }

    private final Sleeper sleeper;
    private final Duration backoffUnit;

    public RetryOrchestrator(Sleeper sleeper, Duration backoffUnit) {
        this.sleeper = sleeper;
        this.backoffUnit = backoffUnit;
    }

    /**
     * @param request     request the results belong to
     * @param attempt     attempt to run
     * @param maxAttempts upper bound on attempts, at least 1
     * @return the first successful or terminal result, or a failure naming the last error
     */
    public RunResult attemptWithRetries(ScrapeRequest request, Attempt attempt, int maxAttempts) {
        int attempts = Math.max(1, maxAttempts);
        long started = System.nanoTime();
        String lastError = "no attempt ran";
        int ran = 0;
        for (int i = 1; i <= attempts; i++) {
            ran = i;
            try {
                RunResult result = attempt.run(i);
                if (result.success() || !result.retryable()) {
                    return result;
                }
                lastError = result.error();
                logger.warn("Attempt {}/{} failed: {}", i, attempts, lastError);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                lastError = "Interrupted";
                logger.warn("Attempt {}/{} interrupted", i, attempts);
                break;
            } catch (Exception e) {
                lastError = e.getClass().getSimpleName() + ": " + e.getMessage();
                logger.warn("Attempt {}/{} threw {}", i, attempts, lastError);
            }
            if (i < attempts) {
                Duration backoff = backoffFor(i);
                logger.info("Retrying in {} ms", backoff.toMillis());
                try {
                    sleeper.sleep(backoff);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    logger.warn("Backoff interrupted, giving up after {} attempts", i);
                    break;
                }
            }
        }
        double elapsed = Math.round((System.nanoTime() - started) / 1_000_000.0) / 1000.0;
        logger.error("All {} attempts failed. Last error: {}", ran, lastError);
        return RunResult.failed(request, "All " + ran + " attempts failed: " + lastError, elapsed);
    }

    Duration backoffFor(int attemptNumber) {
        return backoffUnit.multipliedBy(1L << (attemptNumber - 1));
    }
}
