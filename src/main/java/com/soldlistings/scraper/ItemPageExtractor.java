package com.soldlistings.scraper;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads price, condition, shipping, sold info and main image from a rendered detail page.
 * <p>
 * Each field is resolved by its own {@link TierChain}. Price tiers, in order:
 * <ol>
 *   <li>current price display</li>
 *   <li>legacy price display</li>
 *   <li>structured data (JSON-LD offers, then {@code itemprop=price} microdata)</li>
 *   <li>a currency-marked amount anywhere in the raw HTML</li>
 * </ol>
 * A field whose tiers all miss is null in the returned {@link ItemDetails}. Extraction never throws
 * for missing content.
 *
 * @author Sold Listings Scraper Team
 * @since 1.0
 */
public class ItemPageExtractor {
    private static final Logger logger = LoggerFactory.getLogger(ItemPageExtractor.class);

    private static final Pattern RAW_PRICE = Pattern.compile("[£$]\\s*\\d[\\d,]*(?:\\.\\d+)?");
    private static final Pattern SOLD_BADGE = Pattern.compile("^(Sold|Ended)\\b", Pattern.CASE_INSENSITIVE);
    private static final List<String> CONDITION_KEYWORDS = List.of(
        "new", "used", "pre-owned", "refurbished", "open box", "for parts", "not working", "good",
        "excellent", "mint", "like new", "acceptable", "damaged", "graded", "ungraded"
    );
    private static final int MAX_CONDITION_LENGTH = 120;
    private static final int MAX_SOLD_BADGE_LENGTH = 80;
    private static final int MAX_LABELLED_ROWS = 60;

    private record Price(Double amount, String text) {}

    private final PriceNormalizer normalizer;
    private final ObjectMapper objectMapper = new ObjectMapper();

    private final TierChain<Price> priceChain;
    private final TierChain<String> conditionChain;
    private final TierChain<String> shippingChain;
    private final TierChain<String> soldChain;
    private final TierChain<String> imageChain;

    public ItemPageExtractor(PriceNormalizer normalizer) {
        this.normalizer = normalizer;
        this.priceChain = TierChain.<Price>forField("price")
            .locators("item.price.modern", 3, el -> priceFromText(el.text()))
            .locators("item.price.legacy", 3, el -> priceFromText(el.text()))
            .tier("structured data", FieldTier.html(this::priceFromStructuredData))
            .tier("raw html", FieldTier.html(this::priceFromRawHtml))
            .build();
        this.conditionChain = TierChain.<String>forField("condition")
            .locators("item.condition", 1, el -> acceptCondition(el.text()))
            .tier("labelled row", labelledRow(List.of("Condition"), ItemPageExtractor::acceptCondition))
            .build();
        this.shippingChain = TierChain.<String>forField("shipping")
            .locators("item.shipping", 1, el -> Optional.ofNullable(Utils.normalizeWhitespace(el.text())))
            .tier("labelled row", labelledRow(List.of("Postage", "Shipping", "Delivery"),
                value -> Optional.ofNullable(Utils.normalizeWhitespace(value))))
            .build();
        this.soldChain = TierChain.<String>forField("soldInfo")
            .tier("labelled row", labelledRow(List.of("Ended"), value -> Optional.ofNullable(Utils.normalizeWhitespace(value))))
            .locators("item.sold", 1, el -> Optional.ofNullable(Utils.normalizeWhitespace(el.text())))
            .locators("item.soldBadge", 100, el -> acceptSoldBadge(el.text()))
            .build();
        this.imageChain = TierChain.<String>forField("image")
            .locators("item.image", 3, ItemPageExtractor::imageFromElement)
            .locators("item.image.meta", 1, el -> Optional.ofNullable(Utils.normalizeWhitespace(el.attribute("content"))))
            .build();
    }

    /**
     * @param page session positioned on a rendered detail page
     * @return the fields found; never null
     */
    public ItemDetails extract(BrowserSessionInterface page) {
        Optional<Price> price = priceChain.firstMatch(page);
        ItemDetails details = new ItemDetails(
            price.map(Price::amount).orElse(null),
            price.map(Price::text).orElse(null),
            conditionChain.firstMatch(page).orElse(null),
            shippingChain.firstMatch(page).orElse(null),
            soldChain.firstMatch(page).orElse(null),
            imageChain.firstMatch(page).orElse(null)
        );
        logger.debug("Detail page fields: price={}, condition={}, shipping={}, sold={}, image={}",
            details.priceAmount(), details.condition(), details.shipping(), details.soldInfo(), details.imageUrl() != null);
        return details;
    }

    private Optional<Price> priceFromText(String raw) {
        String text = Utils.normalizeWhitespace(raw);
        if (text == null) {
            return Optional.empty();
        }
        Double amount = normalizer.parsePrice(text);
        return amount == null ? Optional.empty() : Optional.of(new Price(amount, text));
    }

    private Optional<Price> priceFromStructuredData(String html) {
        Document document = Jsoup.parse(html);
        for (Element script : document.select("script[type=application/ld+json]")) {
            String payload = script.data();
            if (payload == null || payload.isBlank()) {
                continue;
            }
            try {
                Optional<Price> price = findOfferPrice(objectMapper.readTree(payload));
                if (price.isPresent()) {
                    return price;
                }
            } catch (JsonProcessingException e) {
                logger.debug("Skipping malformed JSON-LD block: {}", e.getOriginalMessage());
            }
        }
        Element itemprop = document.selectFirst("[itemprop=price]");
        if (itemprop != null) {
            String value = itemprop.hasAttr("content") ? itemprop.attr("content") : itemprop.text();
            Element currency = document.selectFirst("[itemprop=priceCurrency]");
            String code = currency == null ? null
                : currency.hasAttr("content") ? currency.attr("content") : currency.text();
            return structuredPrice(value, code);
        }
        return Optional.empty();
    }

    private Optional<Price> findOfferPrice(JsonNode node) {
        if (node == null || node.isNull()) {
            return Optional.empty();
        }
        if (node.isArray()) {
            for (JsonNode child : node) {
                Optional<Price> price = findOfferPrice(child);
                if (price.isPresent()) return price;
            }
            return Optional.empty();
        }
        if (!node.isObject()) {
            return Optional.empty();
        }
        JsonNode priceNode = node.get("price");
        if (priceNode != null && (priceNode.isNumber() || priceNode.isTextual())) {
            Optional<Price> price = structuredPrice(priceNode.asText(), node.path("priceCurrency").asText(null));
            if (price.isPresent()) return price;
        }
        for (String key : List.of("offers", "@graph", "mainEntity")) {
            Optional<Price> price = findOfferPrice(node.get(key));
            if (price.isPresent()) return price;
        }
        return Optional.empty();
    }

    private Optional<Price> structuredPrice(String value, String currency) {
        String amount = Utils.normalizeWhitespace(value);
        if (amount == null) {
            return Optional.empty();
        }
        String code = currency == null || currency.isBlank() ? "GBP" : currency.trim().toUpperCase(Locale.ROOT);
        if (!code.equals("GBP") && !code.equals("USD")) {
            logger.debug("Ignoring structured price in unsupported currency {}", code);
            return Optional.empty();
        }
        return priceFromText(code + " " + amount);
    }

    private Optional<Price> priceFromRawHtml(String html) {
        Matcher m = RAW_PRICE.matcher(html);
        while (m.find()) {
            Optional<Price> price = priceFromText(m.group());
            if (price.isPresent()) {
                return price;
            }
        }
        return Optional.empty();
    }

    /**
     * Tier over "label: value" rows, matching the label case-insensitively by prefix.
     */
    private static FieldTier<String> labelledRow(List<String> labels, Function<String, Optional<String>> mapper) {
        List<String> wanted = labels.stream().map(l -> l.toLowerCase(Locale.ROOT)).toList();
        return FieldTier.locators(MetadataFieldRegistry.selectors("item.labelledRow"), MAX_LABELLED_ROWS, row -> {
            String label = firstText(row, ".ux-labels-values__labels");
            if (label == null) return Optional.empty();
            String lower = label.toLowerCase(Locale.ROOT);
            if (wanted.stream().noneMatch(lower::startsWith)) return Optional.empty();
            return mapper.apply(firstText(row, ".ux-labels-values__values"));
        });
    }

    private static String firstText(ElementScope scope, String selector) {
        List<PageElement> found = scope.locate(selector);
        return found.isEmpty() ? null : Utils.normalizeWhitespace(found.get(0).text());
    }

    static Optional<String> acceptCondition(String raw) {
        String text = Utils.normalizeWhitespace(raw);
        if (text == null || text.length() > MAX_CONDITION_LENGTH || !Utils.containsAny(text, CONDITION_KEYWORDS)) {
            return Optional.empty();
        }
        return Optional.of(text);
    }

    static Optional<String> acceptSoldBadge(String raw) {
        String text = Utils.normalizeWhitespace(raw);
        if (text == null || text.length() > MAX_SOLD_BADGE_LENGTH || !SOLD_BADGE.matcher(text).find()) {
            return Optional.empty();
        }
        return Optional.of(text);
    }

    private static Optional<String> imageFromElement(PageElement img) {
        for (String attr : List.of("src", "data-zoom-src", "data-src")) {
            String url = img.attribute(attr);
            if (!Utils.isThumbnail(url, img.attribute("width"), img.attribute("height"))) {
                return Optional.of(Utils.upgradeImageResolution(url.trim()));
            }
        }
        return Optional.empty();
    }
}
