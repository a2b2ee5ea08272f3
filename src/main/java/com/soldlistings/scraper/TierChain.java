package com.soldlistings.scraper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Ordered, first-match-wins fallback chain for one field.
 * <p>
 * Tiers are tried strictly in declaration order and the first value produced wins; later tiers are
 * never consulted and results are never merged. A tier that throws counts as a miss, so a chain
 * never throws and yields empty when every tier misses.
 *
 * @param <T> value type
 */
public final class TierChain<T> {
    static final Logger logger = LoggerFactory.getLogger(TierChain.class);

    private record NamedTier<T>(String name, FieldTier<T> tier) {}

    private final String fieldName;
    private final List<NamedTier<T>> tiers;

    private TierChain(String fieldName, List<NamedTier<T>> tiers) {
        this.fieldName = fieldName;
        this.tiers = List.copyOf(tiers);
    }

    public static <T> Builder<T> forField(String fieldName) {
        return new Builder<>(fieldName);
    }

    /**
     * @param scope page or element to read from (may be null, which yields empty)
     * @return the first value any tier produced, or empty
     */
    public Optional<T> firstMatch(ElementScope scope) {
        if (scope == null) {
            logger.warn("firstMatch called with null scope for field '{}'.", fieldName);
            return Optional.empty();
        }
        for (NamedTier<T> named : tiers) {
            try {
                Optional<T> value = named.tier().attempt(scope);
                if (value != null && value.isPresent()) {
                    logger.debug("Field '{}' resolved by tier '{}'", fieldName, named.name());
                    return value;
                }
            } catch (RuntimeException e) {
                logger.debug("Tier '{}' for field '{}' failed: {}", named.name(), fieldName, e.getMessage());
            }
        }
        logger.debug("Field '{}' missed all {} tiers", fieldName, tiers.size());
        return Optional.empty();
    }

    public List<String> tierNames() {
        return tiers.stream().map(NamedTier::name).toList();
    }

    public static final class Builder<T> {
        private final String fieldName;
        private final List<NamedTier<T>> tiers = new ArrayList<>();

        private Builder(String fieldName) {
            this.fieldName = fieldName;
        }

        public Builder<T> tier(String name, FieldTier<T> tier) {
            tiers.add(new NamedTier<>(name, tier));
            return this;
        }

        /**
         * Adds a locator tier over the selectors of a registered {@link MetadataField}.
         */
        public Builder<T> locators(String registryField, int maxElements, Function<PageElement, Optional<T>> mapper) {
            return tier(registryField, FieldTier.locators(MetadataFieldRegistry.selectors(registryField), maxElements, mapper));
        }

        public TierChain<T> build() {
            if (tiers.isEmpty()) {
                throw new IllegalStateException("Tier chain for '" + fieldName + "' has no tiers");
            }
            return new TierChain<>(fieldName, tiers);
        }
    }
}
