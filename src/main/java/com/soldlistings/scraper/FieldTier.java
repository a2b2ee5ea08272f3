package com.soldlistings.scraper;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * One fallback level of a {@link TierChain}: a strategy that either produces a value or misses.
 */
@FunctionalInterface
public interface FieldTier<T> {

    /**
     * @param scope page or element to read from
     * @return the value, or empty on a miss
     */
    Optional<T> attempt(ElementScope scope);

    /**
     * Tier that walks {@code selectors} in order and, for each, the first {@code maxElements} matches,
     * returning the first element the mapper accepts. A selector that fails to evaluate is skipped.
     */
    static <T> FieldTier<T> locators(List<String> selectors, int maxElements, Function<PageElement, Optional<T>> mapper) {
        List<String> ordered = List.copyOf(selectors);
        return scope -> {
            for (String selector : ordered) {
                List<PageElement> matches;
                try {
                    matches = scope.locate(selector);
                } catch (BrowserSessionException e) {
                    TierChain.logger.debug("Selector '{}' could not be evaluated: {}", selector, e.getMessage());
                    continue;
                }
                int limit = Math.min(matches.size(), maxElements);
                for (int i = 0; i < limit; i++) {
                    try {
                        Optional<T> value = mapper.apply(matches.get(i));
                        if (value.isPresent()) {
                            return value;
                        }
                    } catch (BrowserSessionException e) {
                        TierChain.logger.debug("Element {} of '{}' could not be read: {}", i, selector, e.getMessage());
                    }
                }
            }
            return Optional.empty();
        };
    }

    /**
     * Tier that reads the raw HTML of the scope.
     */
    static <T> FieldTier<T> html(Function<String, Optional<T>> mapper) {
        return scope -> {
            String html = scope.html();
            return html == null || html.isEmpty() ? Optional.empty() : mapper.apply(html);
        };
    }
}
