package com.soldlistings.scraper;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * Structured outcome of one scrape run.
 * <p>
 * For extraction runs {@code success} is true exactly when at least one item was collected, and
 * {@code error} is populated exactly when {@code success} is false. {@code count} always equals the
 * number of items. Smoke runs carry the liveness page {@code title} instead of items.
 * <p>
 * {@link #outcome()} is internal bookkeeping for the retry policy and is not serialized.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"success", "error", "title", "query", "pagesRequested", "perPageRequested", "count", "items", "elapsedSeconds"})
public record RunResult(
    boolean success,
    String query,
    int pagesRequested,
    int perPageRequested,
    List<ExtractedItem> items,
    double elapsedSeconds,
    String error,
    String title,
    @JsonIgnore Outcome outcome
) {
    public static final String NO_ITEMS_ERROR = "No items collected";
    public static final String CANCELLED_ERROR = "Cancelled before any items were collected";

    public enum Outcome {
        /** At least one item collected. */
        COLLECTED,
        /** The run completed cleanly but found nothing; terminal, not retried. */
        NO_ITEMS,
        /** The caller cancelled or interrupted the run before anything was collected; not retried. */
        CANCELLED,
        /** The attempt failed during execution; eligible for retry. */
        FAILED,
        /** The request was rejected before any browser work (bad input or configuration). */
        REJECTED,
        /** Liveness check, no extraction. */
        SMOKE
    }

    public RunResult {
        items = items == null ? List.of() : List.copyOf(items);
        if (outcome == null) {
            throw new IllegalArgumentException("outcome is required");
        }
        if (outcome != Outcome.SMOKE && success == items.isEmpty()) {
            throw new IllegalArgumentException("success must be true exactly when items were collected");
        }
        if (success == (error != null)) {
            throw new IllegalArgumentException("error must be present exactly when success is false");
        }
    }

    public static RunResult collected(ScrapeRequest request, List<ExtractedItem> items, double elapsedSeconds) {
        return new RunResult(true, request.query(), request.pages(), request.perPage(), items, elapsedSeconds,
            null, null, Outcome.COLLECTED);
    }

    public static RunResult noItems(ScrapeRequest request, double elapsedSeconds) {
        return new RunResult(false, request.query(), request.pages(), request.perPage(), List.of(), elapsedSeconds,
            NO_ITEMS_ERROR, null, Outcome.NO_ITEMS);
    }

    public static RunResult cancelled(ScrapeRequest request, double elapsedSeconds) {
        return new RunResult(false, request.query(), request.pages(), request.perPage(), List.of(), elapsedSeconds,
            CANCELLED_ERROR, null, Outcome.CANCELLED);
    }

    public static RunResult failed(ScrapeRequest request, String error, double elapsedSeconds) {
        return new RunResult(false, request.query(), request.pages(), request.perPage(), List.of(), elapsedSeconds,
            error, null, Outcome.FAILED);
    }

    public static RunResult rejected(ScrapeRequest request, String error) {
        return new RunResult(false, request.query(), request.pages(), request.perPage(), List.of(), 0.0,
            error, null, Outcome.REJECTED);
    }

    public static RunResult smoke(ScrapeRequest request, SmokeResult smoke, double elapsedSeconds) {
        return new RunResult(smoke.ok(), request.query(), request.pages(), request.perPage(), List.of(), elapsedSeconds,
            smoke.ok() ? null : smoke.error(), smoke.title(), Outcome.SMOKE);
    }

    @JsonProperty("count")
    public int count() {
        return items.size();
    }

    /**
     * @return true if another attempt may produce a different result
     */
    @JsonIgnore
    public boolean retryable() {
        return outcome == Outcome.FAILED;
    }
}
