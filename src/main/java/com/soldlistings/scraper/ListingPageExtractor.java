package com.soldlistings.scraper;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Reads candidate listings from a rendered results page.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Runs an ordered list of extraction strategies; the first one that yields a non-empty list wins
 *       and later strategies are not consulted (results are never unioned).</li>
 *   <li>The first strategy extracts everything in one in-page script round trip. The others walk
 *       detail-page anchors for the card grid, the item list and finally any detail link at all.</li>
 *   <li>For each anchor the nearest enclosing listing container supplies title, price, shipping,
 *       condition and image through {@link TierChain}s over {@link MetadataFieldRegistry} selectors.</li>
 *   <li>Listings with an empty or boilerplate title are dropped; duplicate links on one page are kept once.</li>
 * </ul>
 * An empty result is a normal outcome, not an error.
 *
 * @author Sold Listings Scraper Team
 * @since 1.0
 */
public class ListingPageExtractor {
    private static final Logger logger = LoggerFactory.getLogger(ListingPageExtractor.class);

    private static final List<String> BOILERPLATE_TITLES = List.of("shop on ebay", "results matching fewer words");

    private interface ListingStrategy {
        String name();

        List<CandidateListing> extract(BrowserSessionInterface page);
    }

    private record AnchorLayout(String name, String anchorField, String containerField) {}

    private static final List<AnchorLayout> LAYOUTS = List.of(
        new AnchorLayout("card grid", "listing.card.anchor", "listing.card.container"),
        new AnchorLayout("item list", "listing.item.anchor", "listing.item.container"),
        new AnchorLayout("any detail link", "listing.any.anchor", "listing.any.container")
    );

    static final String BATCH_SCRIPT = buildBatchScript();

    private final TierChain<String> titleChain = TierChain.<String>forField("listing.title")
        .locators("listing.title", 1, el -> acceptTitle(el.text()))
        .build();
    private final TierChain<String> priceChain = TierChain.<String>forField("listing.price")
        .locators("listing.price", 1, el -> Optional.ofNullable(Utils.normalizeWhitespace(el.text())))
        .build();
    private final TierChain<String> shippingChain = TierChain.<String>forField("listing.shipping")
        .locators("listing.shipping", 1, el -> Optional.ofNullable(Utils.normalizeWhitespace(el.text())))
        .build();
    private final TierChain<String> conditionChain = TierChain.<String>forField("listing.condition")
        .locators("listing.condition", 1, el -> Optional.ofNullable(Utils.normalizeWhitespace(el.text())))
        .build();
    private final TierChain<String> imageChain = TierChain.<String>forField("listing.image")
        .locators("listing.image", 1, el -> Optional.ofNullable(imageSource(el.attribute("src"), el.attribute("data-src"))))
        .build();

    private final List<ListingStrategy> strategies;

    public ListingPageExtractor() {
        List<ListingStrategy> ordered = new ArrayList<>();
        ordered.add(new ListingStrategy() {
            @Override
            public String name() {
                return "batch script";
            }

            @Override
            public List<CandidateListing> extract(BrowserSessionInterface page) {
                return extractWithScript(page);
            }
        });
        for (AnchorLayout layout : LAYOUTS) {
            ordered.add(new ListingStrategy() {
                @Override
                public String name() {
                    return layout.name();
                }

                @Override
                public List<CandidateListing> extract(BrowserSessionInterface page) {
                    return extractWithAnchors(page, layout);
                }
            });
        }
        this.strategies = List.copyOf(ordered);
    }

    /**
     * @param page session positioned on a rendered results page
     * @return candidates in page order (possibly empty)
     */
    public List<CandidateListing> extract(BrowserSessionInterface page) {
        for (ListingStrategy strategy : strategies) {
            List<CandidateListing> candidates;
            try {
                candidates = strategy.extract(page);
            } catch (BrowserSessionException e) {
                logger.warn("Listing strategy '{}' failed: {}", strategy.name(), e.getMessage());
                continue;
            }
            if (!candidates.isEmpty()) {
                logger.debug("Listing strategy '{}' produced {} candidates", strategy.name(), candidates.size());
                return candidates;
            }
            logger.debug("Listing strategy '{}' found nothing", strategy.name());
        }
        return List.of();
    }

    private List<CandidateListing> extractWithScript(BrowserSessionInterface page) {
        Object raw = page.evaluate(BATCH_SCRIPT);
        if (!(raw instanceof List<?> rows)) {
            return List.of();
        }
        List<CandidateListing> out = new ArrayList<>();
        Set<String> seenLinks = new HashSet<>();
        for (Object row : rows) {
            if (!(row instanceof Map<?, ?> map)) continue;
            String href = asString(map.get("url"));
            Optional<String> title = acceptTitle(asString(map.get("title")));
            if (!isDetailLink(href) || title.isEmpty() || !seenLinks.add(stripQuery(href))) continue;
            out.add(new CandidateListing(
                title.get(),
                href.trim(),
                imageSource(asString(map.get("image")), null),
                Utils.normalizeWhitespace(asString(map.get("priceText"))),
                Utils.normalizeWhitespace(asString(map.get("shippingText"))),
                Utils.normalizeWhitespace(asString(map.get("conditionText")))
            ));
        }
        return out;
    }

    private List<CandidateListing> extractWithAnchors(BrowserSessionInterface page, AnchorLayout layout) {
        List<PageElement> anchors = page.locate(Utils.joinSelectors(MetadataFieldRegistry.selectors(layout.anchorField())));
        List<String> containers = MetadataFieldRegistry.selectors(layout.containerField());
        List<CandidateListing> out = new ArrayList<>();
        Set<String> seenLinks = new HashSet<>();
        for (PageElement anchor : anchors) {
            try {
                String href = anchor.attribute("href");
                if (!isDetailLink(href) || seenLinks.contains(stripQuery(href))) continue;
                PageElement card = nearestContainer(anchor, containers);
                Optional<String> title = titleChain.firstMatch(card).or(() -> acceptTitle(anchor.text()));
                if (title.isEmpty()) {
                    logger.debug("Skipping listing without usable title: {}", href);
                    continue;
                }
                seenLinks.add(stripQuery(href));
                out.add(new CandidateListing(
                    title.get(),
                    href.trim(),
                    imageChain.firstMatch(card).orElse(null),
                    priceChain.firstMatch(card).orElse(null),
                    shippingChain.firstMatch(card).orElse(null),
                    conditionChain.firstMatch(card).orElse(null)
                ));
            } catch (BrowserSessionException e) {
                logger.debug("Skipping unreadable anchor in layout '{}': {}", layout.name(), e.getMessage());
            }
        }
        return out;
    }

    private static PageElement nearestContainer(PageElement anchor, List<String> containerSelectors) {
        for (String selector : containerSelectors) {
            PageElement container = anchor.closest(selector);
            if (container != null) {
                return container;
            }
        }
        return anchor;
    }

    static Optional<String> acceptTitle(String raw) {
        String title = Utils.cleanTitle(raw);
        if (title == null || Utils.containsAny(title, BOILERPLATE_TITLES)) {
            return Optional.empty();
        }
        return Optional.of(title);
    }

    static String imageSource(String src, String dataSrc) {
        String chosen = src == null || src.isBlank() || src.startsWith("data:") ? dataSrc : src;
        if (chosen == null || chosen.isBlank() || chosen.startsWith("data:")) {
            return null;
        }
        return Utils.upgradeImageResolution(chosen.trim());
    }

    private static boolean isDetailLink(String href) {
        return href != null && !href.isBlank() && href.contains(MetadataFieldRegistry.DETAIL_LINK_PATTERN);
    }

    private static String stripQuery(String href) {
        int q = href.indexOf('?');
        return q >= 0 ? href.substring(0, q) : href;
    }

    private static String asString(Object value) {
        return value == null ? null : value.toString();
    }

    private static String buildBatchScript() {
        ObjectMapper mapper = new ObjectMapper();
        try {
            return """
                () => {
                  const pick = (root, sels) => {
                    for (const s of sels) {
                      const el = root && root.querySelector(s);
                      const t = el && (el.textContent || '').trim();
                      if (t) return t;
                    }
                    return '';
                  };
                  const containers = %s;
                  const out = [];
                  const seen = new Set();
                  for (const a of document.querySelectorAll(%s)) {
                    const href = a.getAttribute('href') || '';
                    const key = href.split('?')[0];
                    if (!href || seen.has(key)) continue;
                    const card = a.closest(containers.join(', ')) || a.parentElement;
                    const img = card && card.querySelector('img');
                    out.push({
                      title: pick(card, %s) || (a.textContent || '').trim(),
                      url: href,
                      image: img ? (img.getAttribute('src') || img.getAttribute('data-src')) : null,
                      priceText: pick(card, %s),
                      shippingText: pick(card, %s),
                      conditionText: pick(card, %s)
                    });
                    seen.add(key);
                  }
                  return out;
                }
                """.formatted(
                mapper.writeValueAsString(containerSelectorsForScript()),
                mapper.writeValueAsString(Utils.joinSelectors(MetadataFieldRegistry.selectors("listing.any.anchor"))),
                mapper.writeValueAsString(MetadataFieldRegistry.selectors("listing.title")),
                mapper.writeValueAsString(MetadataFieldRegistry.selectors("listing.price")),
                mapper.writeValueAsString(MetadataFieldRegistry.selectors("listing.shipping")),
                mapper.writeValueAsString(MetadataFieldRegistry.selectors("listing.condition")));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to build listing extraction script", e);
        }
    }

    private static List<String> containerSelectorsForScript() {
        List<String> all = new ArrayList<>(MetadataFieldRegistry.selectors("listing.card.container"));
        all.addAll(MetadataFieldRegistry.selectors("listing.item.container"));
        all.add("li");
        return all;
    }
}
