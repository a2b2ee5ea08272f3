package com.soldlistings.scraper;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class ListingPageExtractorTest {
    private final ListingPageExtractor extractor = new ListingPageExtractor();

    private static final String CARD_GRID = """
        <ul class="srp-results">
          <li class="s-card">
            <a class="su-link" href="https://www.ebay.co.uk/itm/111?hash=a"><img class="s-card__image" src="data:image/gif;base64,R0lG" data-src="https://i.ebayimg.com/g/111/s-l140.webp"></a>
            <a class="su-link" href="https://www.ebay.co.uk/itm/111?hash=b">
              <div class="s-card__title"><span class="su-styled-text">Nintendo Switch OLED</span></div>
            </a>
            <div class="s-card__subtitle">Pre-owned</div>
            <span class="s-card__price">£180.00</span>
          </li>
          <li class="s-card">
            <a class="su-link" href="https://www.ebay.co.uk/itm/222">
              <div class="s-card__title"><span class="su-styled-text">Shop on eBay</span></div>
            </a>
            <span class="s-card__price">£20.00</span>
          </li>
          <li class="s-card">
            <a class="su-link" href="https://www.ebay.co.uk/itm/333">
              <div class="s-card__title"><span class="su-styled-text">Nintendo Switch Lite</span></div>
            </a>
          </li>
        </ul>
        """;

    @Test
    void testCardGridLayout() {
        List<CandidateListing> candidates = extractor.extract(FakeBrowserSession.showing(CARD_GRID));

        assertEquals(2, candidates.size());
        CandidateListing first = candidates.get(0);
        assertEquals("Nintendo Switch OLED", first.title());
        assertEquals("https://www.ebay.co.uk/itm/111?hash=a", first.detailUrl());
        assertEquals("£180.00", first.priceTextRaw());
        assertEquals("Pre-owned", first.conditionTextRaw());
        assertEquals("https://i.ebayimg.com/g/111/s-l1600.webp", first.thumbnailImage());
        assertEquals("Nintendo Switch Lite", candidates.get(1).title());
        assertNull(candidates.get(1).priceTextRaw());
    }

    @Test
    void testItemListLayout() {
        List<CandidateListing> candidates = extractor.extract(FakeBrowserSession.showing(Fixtures.listingPage(1, 2)));

        assertEquals(2, candidates.size());
        assertEquals("Item 1", candidates.get(0).title());
        assertEquals("£1.00", candidates.get(0).priceTextRaw());
        assertEquals("Free postage", candidates.get(0).shippingTextRaw());
    }

    @Test
    void testGenericLinksAsLastResort() {
        String html = """
            <div>
              <article><a href="/itm/555"><h3>Vintage camera</h3></a><p>£45.00</p></article>
              <article><a href="/help/itm-faq">Help</a></article>
              <a href="/itm/666">Results matching fewer words</a>
            </div>
            """;

        List<CandidateListing> candidates = extractor.extract(FakeBrowserSession.showing(html));

        assertEquals(1, candidates.size());
        assertEquals("Vintage camera", candidates.get(0).title());
        assertEquals("/itm/555", candidates.get(0).detailUrl());
    }

    @Test
    void testFirstProductiveStrategyWins() {
        String html = CARD_GRID + Fixtures.listingPage(9);

        List<CandidateListing> candidates = extractor.extract(FakeBrowserSession.showing(html));

        assertTrue(candidates.stream().noneMatch(c -> c.title().equals("Item 9")));
    }

    @Test
    void testBatchScriptResultsTakePrecedence() {
        FakeBrowserSession session = FakeBrowserSession.showing(CARD_GRID);
        session.evaluator = script -> script.equals(ListingPageExtractor.BATCH_SCRIPT)
            ? List.of(
                Map.of("title", "Camera Opens in a new window or tab", "url", "/itm/1?x=1", "image", "https://i.ebayimg.com/g/1/s-l300.jpg",
                    "priceText", "£10.00", "shippingText", "", "conditionText", "Used"),
                Map.of("title", "Camera duplicate", "url", "/itm/1?x=2"),
                Map.of("title", "", "url", "/itm/2"))
            : null;

        List<CandidateListing> candidates = extractor.extract(session);

        assertEquals(1, candidates.size());
        CandidateListing candidate = candidates.get(0);
        assertEquals("Camera", candidate.title());
        assertEquals("https://i.ebayimg.com/g/1/s-l1600.jpg", candidate.thumbnailImage());
        assertNull(candidate.shippingTextRaw());
        assertEquals("Used", candidate.conditionTextRaw());
    }

    @Test
    void testFailingScriptFallsBackToSelectors() {
        FakeBrowserSession session = FakeBrowserSession.showing(Fixtures.listingPage(4));
        session.evaluator = script -> {
            throw new BrowserSessionException("Execution context was destroyed");
        };

        assertEquals(1, extractor.extract(session).size());
    }

    @Test
    void testEmptyPage() {
        assertTrue(extractor.extract(FakeBrowserSession.showing("<html><body></body></html>")).isEmpty());
    }

    @Test
    void testTitleFilter() {
        assertEquals("Lego set", ListingPageExtractor.acceptTitle("  Lego   set Opens in a new window or tab").orElseThrow());
        assertTrue(ListingPageExtractor.acceptTitle("Shop on eBay").isEmpty());
        assertTrue(ListingPageExtractor.acceptTitle("   ").isEmpty());
        assertTrue(ListingPageExtractor.acceptTitle(null).isEmpty());
    }

    @Test
    void testImageSource() {
        assertEquals("https://i.ebayimg.com/a/s-l1600.jpg", ListingPageExtractor.imageSource("https://i.ebayimg.com/a/s-l500.jpg", null));
        assertNull(ListingPageExtractor.imageSource("data:image/gif;base64,AA", null));
        assertNull(ListingPageExtractor.imageSource(null, ""));
    }
}
