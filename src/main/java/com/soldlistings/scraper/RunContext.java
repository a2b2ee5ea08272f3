package com.soldlistings.scraper;

import java.util.function.BooleanSupplier;

/**
 * Mutable state of one scrape attempt: the visited-URL registry, the collected items and the
 * cancellation signal. Created fresh per attempt and never shared between runs.
 */
final class RunContext {

    private final DedupRegistry dedup;
    private final ResultAggregator aggregator;
    private final BooleanSupplier cancellationSignal;

    RunContext(DedupRegistry dedup, ResultAggregator aggregator, BooleanSupplier cancellationSignal) {
        this.dedup = dedup;
        this.aggregator = aggregator;
        this.cancellationSignal = cancellationSignal;
    }

    DedupRegistry dedup() {
        return dedup;
    }

    ResultAggregator aggregator() {
        return aggregator;
    }

    /**
     * @return true if the caller asked to stop or the running thread was interrupted
     */
    boolean cancelled() {
        return cancellationSignal.getAsBoolean() || Thread.currentThread().isInterrupted();
    }

    /**
     * @return true when no more items should be collected
     */
    boolean done() {
        return aggregator.isFull() || cancelled();
    }
}
