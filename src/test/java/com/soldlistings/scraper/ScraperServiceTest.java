package com.soldlistings.scraper;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class ScraperServiceTest {
    private static final double RATE = 1.28;

    private FakeSessionFactory factory;
    private List<Duration> sleeps;
    private ScraperConfig config;
    private SearchQueryBuilder queryBuilder;

    @BeforeEach
    void setUp() {
        factory = new FakeSessionFactory();
        sleeps = new ArrayList<>();
        config = ScraperConfig.defaults().toBuilder()
            .baseUrl(Fixtures.BASE)
            .maxAttempts(2)
            .backoffUnit(Duration.ofMillis(10))
            .jitter(Duration.ZERO, Duration.ZERO)
            .detailDelay(Duration.ZERO)
            .scrollSteps(0)
            .build();
        queryBuilder = new SearchQueryBuilder(config);
    }

    private ScraperService service() {
        return service(config);
    }

    private ScraperService service(ScraperConfig cfg) {
        return new ScraperService(cfg, factory, sleeps::add, new Random(7));
    }

    private String listingUrl(String query, int page) {
        return queryBuilder.build(query, page, SearchFilters.NONE);
    }

    private void addItem(int id, String priceText) {
        factory.pages.put(Fixtures.detailUrl(id), Fixtures.detailPage(priceText, "Used"));
    }

    @Test
    void testCollectsItemsWithConvertedPrices() {
        factory.pages.put(listingUrl("lego", 1), Fixtures.listingPage(5, 10, 15));
        addItem(5, "£5.00");
        addItem(10, "£10.00");
        addItem(15, "£15.00");

        RunResult result = service().scrape("lego", 1, 5, true, RATE, false, false);

        assertTrue(result.success());
        assertNull(result.error());
        assertEquals(3, result.count());
        List<Double> primary = result.items().stream().map(ExtractedItem::priceAmountPrimary).toList();
        assertEquals(List.of(5.0, 10.0, 15.0), primary);
        for (ExtractedItem item : result.items()) {
            assertEquals(PriceNormalizer.convert(item.priceAmountPrimary(), RATE), item.priceAmountSecondary());
            assertEquals(PriceNormalizer.format(item.priceAmountPrimary()), item.priceText());
            assertFalse(item.canonicalUrl().contains("?"));
            assertEquals("Used", item.condition());
            assertEquals("Free postage", item.shippingText());
            assertEquals("12 Oct, 2026 18:04:11 BST", item.soldInfo());
            assertTrue(item.imageUrl().endsWith("/s-l1600.jpg"), item.imageUrl());
        }
        assertEquals("Item 5", result.items().get(0).title());
        assertEquals(6.40, result.items().get(0).priceAmountSecondary());
        assertTrue(factory.sessions.get(0).closed);
    }

    @Test
    void testEmptyResultsReportNoItemsWithoutRetry() {
        factory.pages.put(listingUrl("zzqqxx", 1), "<html><body><p>No exact matches found</p></body></html>");

        RunResult result = service().scrape("zzqqxx", 1, 5, true, RATE, false, false);

        assertFalse(result.success());
        assertEquals(RunResult.NO_ITEMS_ERROR, result.error());
        assertEquals(0, result.count());
        assertEquals(1, factory.opens());
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void testDetailTimeoutsOnOnePageDoNotStopTheRun() {
        factory.pages.put(listingUrl("ipad", 1), Fixtures.listingPage(1, 2));
        factory.pages.put(listingUrl("ipad", 2), Fixtures.listingPage(3, 4));
        addItem(1, "£1.00");
        addItem(2, "£2.00");
        addItem(3, "£3.00");
        addItem(4, "£4.00");
        factory.timeouts.add(Fixtures.detailUrl(1));
        factory.timeouts.add(Fixtures.detailUrl(2));

        RunResult result = service().scrape("ipad", 2, 10, true, RATE, false, false);

        assertTrue(result.success());
        assertEquals(List.of(Fixtures.detailUrl(3), Fixtures.detailUrl(4)),
            result.items().stream().map(ExtractedItem::canonicalUrl).toList());
    }

    @Test
    void testListingTimeoutSkipsPage() {
        factory.pages.put(listingUrl("ipad", 2), Fixtures.listingPage(3));
        addItem(3, "£3.00");

        RunResult result = service().scrape("ipad", 2, 10, true, RATE, false, false);

        assertEquals(1, result.count());
        assertTrue(factory.navigations().contains(listingUrl("ipad", 1)));
    }

    @Test
    void testItemCapStopsCollection() {
        factory.pages.put(listingUrl("cards", 1), Fixtures.listingPage(1, 2, 3, 4, 5, 6, 7, 8));
        for (int id = 1; id <= 8; id++) {
            addItem(id, "£" + id + ".00");
        }
        factory.pages.put(listingUrl("cards", 2), Fixtures.listingPage(9));
        addItem(9, "£9.00");

        RunResult result = service().scrape("cards", 2, 5, true, RATE, false, false);

        assertEquals(5, result.count());
        assertEquals(5, result.perPageRequested());
        assertFalse(factory.navigations().contains(listingUrl("cards", 2)));
        assertFalse(factory.navigations().contains(Fixtures.detailUrl(6)));
    }

    @Test
    void testPerPageVisitCap() {
        factory.pages.put(listingUrl("cards", 1), Fixtures.listingPage(1, 2, 3, 4));
        for (int id = 1; id <= 4; id++) {
            addItem(id, "£" + id + ".00");
        }

        RunResult result = service(config.toBuilder().perPageVisitCap(2).build())
            .scrape("cards", 1, 50, true, RATE, false, false);

        assertEquals(2, result.count());
    }

    @Test
    void testSameListingOnTwoPagesIsCollectedOnce() {
        factory.pages.put(listingUrl("watch", 1), Fixtures.listingPage(1, 2));
        factory.pages.put(listingUrl("watch", 2), Fixtures.listingPage(2, 3));
        addItem(1, "£1.00");
        addItem(2, "£2.00");
        addItem(3, "£3.00");

        RunResult result = service().scrape("watch", 2, 50, true, RATE, false, false);

        assertEquals(3, result.count());
        Set<String> urls = new HashSet<>();
        result.items().forEach(item -> assertTrue(urls.add(item.canonicalUrl())));
        assertEquals(1, factory.navigations().stream().filter(Fixtures.detailUrl(2)::equals).count());
    }

    @Test
    void testCandidateValuesFillMissingDetailFields() {
        factory.pages.put(listingUrl("vinyl", 1), Fixtures.listingPage(7));
        factory.pages.put(Fixtures.detailUrl(7), "<html><body><p>Listing has ended</p></body></html>");

        RunResult result = service().scrape("vinyl", 1, 5, true, RATE, false, false);

        ExtractedItem item = result.items().get(0);
        assertEquals(7.0, item.priceAmountPrimary());
        assertEquals("£7.00", item.priceText());
        assertEquals("Free postage", item.shippingText());
        assertNull(item.condition());
    }

    @Test
    void testCardSubtitleOnlyFillsConditionWhenItNamesOne() {
        factory.pages.put(listingUrl("vinyl", 1), Fixtures.listingPage(7, 8)
            .replace("<span class=\"s-item__price\">£7.00</span>",
                "<span class=\"s-item__price\">£7.00</span><div class=\"s-item__subtitle\">Brand: Acme | 3 pieces</div>")
            .replace("<span class=\"s-item__price\">£8.00</span>",
                "<span class=\"s-item__price\">£8.00</span><div class=\"s-item__subtitle\">Pre-owned</div>"));
        factory.pages.put(Fixtures.detailUrl(7), Fixtures.detailPage("£7.00", null));
        factory.pages.put(Fixtures.detailUrl(8), Fixtures.detailPage("£8.00", null));

        RunResult result = service().scrape("vinyl", 1, 5, true, RATE, false, false);

        assertEquals(2, result.count());
        assertNull(result.items().get(0).condition());
        assertEquals("Pre-owned", result.items().get(1).condition());
    }

    @Test
    void testConfiguredExchangeRateAppliesWhenRequestHasNone() {
        factory.pages.put(listingUrl("lego", 1), Fixtures.listingPage(5));
        addItem(5, "£5.00");

        RunResult result = service(config.toBuilder().exchangeRate(2.0).build())
            .scrape("lego", 1, 5, true, -1, false, false);

        assertEquals(10.0, result.items().get(0).priceAmountSecondary());
    }

    @Test
    void testDetailPagesWaitForNetworkIdle() {
        factory.pages.put(listingUrl("lego", 1), Fixtures.listingPage(1));
        addItem(1, "£1.00");

        service().scrape("lego", 1, 5, true, RATE, false, false);

        assertEquals(WaitPolicy.NETWORK_IDLE, factory.sessions.get(0).waitPolicies.get(Fixtures.detailUrl(1)));
    }

    @Test
    void testMissingPriceEverywhereYieldsNotAvailable() {
        factory.pages.put(listingUrl("vinyl", 1),
            "<ul><li class=\"s-item\"><a class=\"s-item__link\" href=\"/itm/8\">"
                + "<div class=\"s-item__title\"><span role=\"heading\">Rare record</span></div></a></li></ul>");
        factory.pages.put(Fixtures.detailUrl(8), "<html><body></body></html>");

        RunResult result = service().scrape("vinyl", 1, 5, true, RATE, false, false);

        ExtractedItem item = result.items().get(0);
        assertEquals("N/A", item.priceText());
        assertNull(item.priceAmountPrimary());
        assertNull(item.priceAmountSecondary());
    }

    @Test
    void testFatalErrorIsRetriedAndSessionAlwaysClosed() {
        factory.failures.put(listingUrl("lego", 1), new IllegalStateException("Target closed"));

        RunResult result = service().scrape("lego", 1, 5, true, RATE, false, false);

        assertFalse(result.success());
        assertEquals("All 2 attempts failed: IllegalStateException: Target closed", result.error());
        assertEquals(2, factory.opens());
        assertTrue(factory.sessions.stream().allMatch(s -> s.closed));
        assertEquals(List.of(Duration.ofMillis(10)), sleeps);
    }

    @Test
    void testFatalErrorKeepsItemsAlreadyCollected() {
        factory.pages.put(listingUrl("lego", 1), Fixtures.listingPage(1));
        addItem(1, "£1.00");
        factory.failures.put(listingUrl("lego", 2), new BrowserSessionException("Browser disconnected"));

        RunResult result = service().scrape("lego", 2, 5, true, RATE, false, false);

        assertTrue(result.success());
        assertEquals(1, result.count());
        assertEquals(1, factory.opens());
    }

    @Test
    void testBrowserLaunchFailureIsReported() {
        factory.failOnOpen = new BrowserSessionException("Executable doesn't exist");

        RunResult result = service().scrape("lego", 1, 5, true, RATE, false, false);

        assertFalse(result.success());
        assertTrue(result.error().contains("Executable doesn't exist"), result.error());
        assertEquals(2, factory.opens());
    }

    @Test
    void testBlankQueryRejectedBeforeBrowserWork() {
        RunResult result = service().scrape("   ", 1, 5, true, RATE, false, false);

        assertFalse(result.success());
        assertEquals("Query must not be blank", result.error());
        assertEquals(0, factory.opens());
    }

    @Test
    void testCancellationStopsBeforeFirstPage() {
        ScraperService service = service();
        service.setCancellationSignal(() -> true);

        RunResult result = service.scrape("lego", 3, 5, true, RATE, false, false);

        assertEquals(RunResult.CANCELLED_ERROR, result.error());
        assertTrue(factory.navigations().isEmpty());
        assertTrue(factory.sessions.get(0).closed);
        assertEquals(1, factory.opens());
    }

    @Test
    void testParametersAreClamped() {
        RunResult result = service().scrape("   ", 0, 1000, true, -2, false, false);

        assertEquals(1, result.pagesRequested());
        assertEquals(200, result.perPageRequested());
    }

    @Test
    void testProductionModeCapsItemsAndForcesHeadless() {
        factory.pages.put(listingUrl("lego", 1), Fixtures.listingPage(1));
        addItem(1, "£1.00");

        RunResult result = service(config.toBuilder().productionMode(true).build())
            .scrape("lego", 1, 50, false, RATE, true, false);

        assertEquals(10, result.perPageRequested());
        assertTrue(factory.options.get(0).headless());
        assertTrue(factory.options.get(0).mobile());
    }

    @Test
    void testConditionFilterReachesSearchUrl() {
        ScrapeRequest request = new ScrapeRequest("ipad", 1, 5, true, RATE, false, false,
            new SearchFilters(SearchFilters.ItemCondition.NEW));

        service().scrape(request);

        assertTrue(factory.navigations().get(0).endsWith("&LH_ItemCondition=1000"), factory.navigations().get(0));
    }

    @Test
    void testSmokeFlagReturnsPageTitle() {
        factory.pages.put(config.smokeUrl(), "<html><head><title>Example Domain</title></head><body></body></html>");

        RunResult result = service().scrape("anything", 1, 5, true, RATE, false, true);

        assertTrue(result.success());
        assertEquals("Example Domain", result.title());
        assertEquals(0, result.count());
        assertTrue(factory.sessions.get(0).closed);
    }

    @Test
    void testSmokeReportsFailureWithoutThrowing() {
        factory.failOnOpen = new BrowserSessionException("no browser");

        SmokeResult smoke = service().smoke();

        assertFalse(smoke.ok());
        assertEquals("BrowserSessionException: no browser", smoke.error());
    }

    @Test
    void testSmokeNavigationFailure() {
        SmokeResult smoke = service().smoke();

        assertFalse(smoke.ok());
        assertTrue(smoke.error().startsWith("Navigation to "));
    }
}
