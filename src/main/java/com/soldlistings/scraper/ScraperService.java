package com.soldlistings.scraper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Random;
import java.util.function.BooleanSupplier;

/**
 * Scrapes sold listings for a search query using a headless browser.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Validates the request and builds the search URL before any browser work; bad input or
 *       configuration is reported as a rejected result.</li>
 *   <li>Runs each attempt through {@link RetryOrchestrator}. One attempt opens one browser session and
 *       always closes it, whatever happens.</li>
 *   <li>For each results page: navigate, scroll, read candidates with {@link ListingPageExtractor},
 *       then visit up to the per-page cap of unseen detail pages and read them with {@link ItemPageExtractor}.</li>
 *   <li>Per-page and per-item failures are logged and skipped. The run stops early once the item cap is
 *       reached or the cancellation signal fires.</li>
 *   <li>Detail-page fields win; the candidate's own price, shipping, condition and thumbnail fill the gaps.
 *       A card subtitle only counts as a condition when it passes the same keyword check as detail pages.</li>
 * </ul>
 * A clean run that finds nothing is terminal and is not retried, and so is a cancelled one. A run that aborted with nothing
 * collected is retried. A run that aborted after collecting items keeps them.
 *
 * @author Sold Listings Scraper Team
 * @since 1.0
 */
public class ScraperService implements ScraperServiceInterface {
    private static final Logger logger = LoggerFactory.getLogger(ScraperService.class);

    static final int PRODUCTION_MAX_PER_PAGE = 10;
    static final String NOT_AVAILABLE = "N/A";
    private static final String SCROLL_SCRIPT = "() => window.scrollBy(0, Math.floor(window.innerHeight * 0.8))";

    private final ScraperConfig config;
    private final BrowserSessionFactory sessionFactory;
    private final Pacer pacer;
    private final RetryOrchestrator retryOrchestrator;
    private final ListingPageExtractor listingExtractor;
    private final ItemPageExtractor itemExtractor;
    private final PriceNormalizer priceNormalizer;
    private volatile BooleanSupplier cancellationSignal = () -> false;

    public ScraperService(ScraperConfig config, BrowserSessionFactory sessionFactory, Sleeper sleeper, Random random) {
        this.config = config;
        this.sessionFactory = sessionFactory;
        this.pacer = new Pacer(sleeper, random, config);
        this.retryOrchestrator = new RetryOrchestrator(sleeper, config.backoffUnit());
        this.listingExtractor = new ListingPageExtractor();
        this.priceNormalizer = new PriceNormalizer(config);
        this.itemExtractor = new ItemPageExtractor(priceNormalizer);
    }

    public ScraperService(ScraperConfig config) {
        this(config, new PlaywrightSessionFactory(), Sleeper.SYSTEM, new Random());
    }

    public ScraperService() {
        this(ScraperConfig.fromEnvironment());
    }

    /**
     * Installs a signal polled between pages and between items; when it returns true the run stops
     * and returns what it has collected so far.
     */
    public void setCancellationSignal(BooleanSupplier cancellationSignal) {
        this.cancellationSignal = cancellationSignal == null ? () -> false : cancellationSignal;
    }

    @Override
    public RunResult scrape(ScrapeRequest request) {
        long started = System.nanoTime();
        if (request.smoke()) {
            SmokeResult smoke = smoke(request.headless(), request.mobile());
            return RunResult.smoke(request, smoke, elapsedSince(started));
        }
        ScrapeRequest rated = request.withDefaultExchangeRate(config.exchangeRate());
        ScrapeRequest effective = config.productionMode() ? rated.restrictedTo(PRODUCTION_MAX_PER_PAGE) : rated;
        if (effective != rated) {
            logger.info("Production mode: perPage capped at {} and headless forced", effective.perPage());
        }
        if (effective.query().isEmpty()) {
            logger.warn("Rejected scrape request with blank query");
            return RunResult.rejected(effective, "Query must not be blank");
        }
        SearchQueryBuilder queryBuilder;
        try {
            queryBuilder = new SearchQueryBuilder(config);
        } catch (ConfigurationException e) {
            logger.error("Invalid scraper configuration: {}", e.getMessage());
            return RunResult.rejected(effective, "Configuration error: " + e.getMessage());
        }
        logger.info("Scraping '{}': pages={}, perPage={}, headless={}, mobile={}",
            effective.query(), effective.pages(), effective.perPage(), effective.headless(), effective.mobile());
        RunResult result = retryOrchestrator.attemptWithRetries(effective,
            attempt -> runAttempt(effective, queryBuilder, attempt), config.maxAttempts());
        logger.info("Scrape of '{}' finished: success={}, count={}, elapsed={}s",
            effective.query(), result.success(), result.count(), result.elapsedSeconds());
        return result;
    }

    @Override
    public SmokeResult smoke() {
        return smoke(true, false);
    }

    private SmokeResult smoke(boolean headless, boolean mobile) {
        try (BrowserSessionInterface session = sessionFactory.open(SessionOptions.from(config, headless, mobile))) {
            if (!session.navigate(config.smokeUrl(), WaitPolicy.DOM_CONTENT_LOADED, config.listingTimeoutMs())) {
                return SmokeResult.failed("Navigation to " + config.smokeUrl() + " failed");
            }
            String title = session.getTitle();
            logger.info("Smoke check OK: {}", title);
            return SmokeResult.ok(title);
        } catch (RuntimeException e) {
            logger.error("Smoke check failed: {}", e.getMessage());
            return SmokeResult.failed(describe(e));
        }
    }

    RunResult runAttempt(ScrapeRequest request, SearchQueryBuilder queryBuilder, int attemptNumber) {
        long started = System.nanoTime();
        RunContext context = new RunContext(new DedupRegistry(config.baseUrl()),
            new ResultAggregator(request.perPage()), cancellationSignal);
        String fatal = null;
        logger.debug("Attempt {} for '{}'", attemptNumber, request.query());
        try (BrowserSessionInterface session = sessionFactory.open(SessionOptions.from(config, request.headless(), request.mobile()))) {
            walkPages(session, request, queryBuilder, context);
        } catch (RuntimeException e) {
            fatal = describe(e);
            logger.error("Attempt {} aborted after {} items: {}", attemptNumber, context.aggregator().size(), fatal, e);
        }
        List<ExtractedItem> items = context.aggregator().items();
        double elapsed = elapsedSince(started);
        if (!items.isEmpty()) {
            return RunResult.collected(request, items, elapsed);
        }
        if (context.cancelled()) {
            logger.info("Attempt {} cancelled with nothing collected", attemptNumber);
            return RunResult.cancelled(request, elapsed);
        }
        return fatal != null ? RunResult.failed(request, fatal, elapsed) : RunResult.noItems(request, elapsed);
    }

    private void walkPages(BrowserSessionInterface session, ScrapeRequest request, SearchQueryBuilder queryBuilder,
                           RunContext context) {
        for (int pageIndex = 1; pageIndex <= request.pages(); pageIndex++) {
            if (context.done()) {
                logger.info("Stopping before page {}: {}", pageIndex,
                    context.aggregator().isFull() ? "item cap reached" : "cancelled");
                return;
            }
            pacer.pause();
            String url = queryBuilder.build(request.query(), pageIndex, request.filters());
            logger.info("Loading results page {}/{}: {}", pageIndex, request.pages(), url);
            if (!session.navigate(url, WaitPolicy.NETWORK_IDLE, config.listingTimeoutMs())) {
                logger.warn("Results page {} did not load, skipping", pageIndex);
                continue;
            }
            scroll(session);
            List<CandidateListing> candidates = listingExtractor.extract(session);
            logger.info("Found {} candidates on page {}", candidates.size(), pageIndex);
            visitCandidates(session, request, candidates, context);
        }
    }

    private void visitCandidates(BrowserSessionInterface session, ScrapeRequest request,
                                 List<CandidateListing> candidates, RunContext context) {
        int visits = 0;
        for (CandidateListing candidate : candidates) {
            if (context.done() || visits >= config.perPageVisitCap()) {
                return;
            }
            String canonical = context.dedup().canonicalize(candidate.detailUrl());
            if (canonical == null || !context.dedup().record(canonical)) {
                logger.debug("Skipping already seen listing {}", candidate.detailUrl());
                continue;
            }
            visits++;
            pacer.pause(config.detailDelay());
            try {
                if (!session.navigate(canonical, WaitPolicy.NETWORK_IDLE, config.detailTimeoutMs())) {
                    logger.warn("Detail page did not load, skipping: {}", canonical);
                    continue;
                }
                ItemDetails details = itemExtractor.extract(session);
                ExtractedItem item = merge(candidate, details, canonical, request.exchangeRate());
                if (context.aggregator().add(item)) {
                    logger.info("Collected {}/{}: {} | {}", context.aggregator().size(), context.aggregator().limit(),
                        item.title(), item.priceText());
                }
            } catch (BrowserSessionException e) {
                logger.warn("Skipping {}: {}", canonical, e.getMessage());
            }
        }
    }

    private void scroll(BrowserSessionInterface session) {
        for (int i = 0; i < config.scrollSteps(); i++) {
            try {
                session.evaluate(SCROLL_SCRIPT);
            } catch (BrowserSessionException e) {
                logger.debug("Scroll step {} failed: {}", i, e.getMessage());
                return;
            }
            pacer.scrollPause();
        }
    }

    /**
     * Combines detail-page fields with the candidate's own values. Detail values win.
     */
    ExtractedItem merge(CandidateListing candidate, ItemDetails details, String canonicalUrl, double exchangeRate) {
        Double amount = details.priceAmount();
        if (amount == null) {
            amount = priceNormalizer.parsePrice(candidate.priceTextRaw());
        }
        String rawPrice = details.priceText() != null ? details.priceText() : candidate.priceTextRaw();
        String priceText;
        if (amount != null) {
            priceText = PriceNormalizer.format(amount);
        } else if (rawPrice != null) {
            priceText = rawPrice;
        } else {
            priceText = NOT_AVAILABLE;
        }
        return ExtractedItem.of(
            candidate.title(),
            priceText,
            amount,
            exchangeRate,
            firstNonNull(details.shipping(), candidate.shippingTextRaw()),
            firstNonNull(details.condition(), ItemPageExtractor.acceptCondition(candidate.conditionTextRaw()).orElse(null)),
            details.soldInfo(),
            canonicalUrl,
            firstNonNull(details.imageUrl(), candidate.thumbnailImage())
        );
    }

    private static String firstNonNull(String preferred, String fallback) {
        return preferred != null ? preferred : fallback;
    }

    private static String describe(Throwable e) {
        return e.getClass().getSimpleName() + ": " + e.getMessage();
    }

    private static double elapsedSince(long startedNanos) {
        return Math.round((System.nanoTime() - startedNanos) / 1_000_000.0) / 1000.0;
    }
}
