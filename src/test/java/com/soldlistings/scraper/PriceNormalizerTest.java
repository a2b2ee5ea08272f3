package com.soldlistings.scraper;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class PriceNormalizerTest {
    private final PriceNormalizer normalizer = new PriceNormalizer(0.78);

    @Test
    void testBaseCurrencyPrefix() {
        assertEquals(12.50, normalizer.parsePrice("£12.50"));
        assertEquals(12.50, normalizer.parsePrice("GBP 12.50"));
        assertEquals(7.0, normalizer.parsePrice("£ 7"));
    }

    @Test
    void testBaseCurrencySuffix() {
        assertEquals(40.0, normalizer.parsePrice("40.00 GBP"));
        assertEquals(3.99, normalizer.parsePrice("3.99£"));
    }

    @Test
    void testSecondaryCurrencyIsConverted() {
        assertEquals(7.80, normalizer.parsePrice("$10.00"));
        assertEquals(7.80, normalizer.parsePrice("US $10.00"));
        assertEquals(7.80, normalizer.parsePrice("USD 10"));
        assertEquals(7.80, normalizer.parsePrice("10.00 USD"));
    }

    @Test
    void testThousandsSeparators() {
        assertEquals(1234.56, normalizer.parsePrice("£1,234.56"));
        assertEquals(1000000.0, normalizer.parsePrice("£1,000,000"));
    }

    @Test
    void testBareNumberIsBaseCurrency() {
        assertEquals(15.0, normalizer.parsePrice("15"));
        assertEquals(15.25, normalizer.parsePrice(" 15.25 "));
    }

    @Test
    void testBaseMarkerWinsOverSecondary() {
        assertEquals(20.0, normalizer.parsePrice("£20.00 (approx. US $25.60)"));
    }

    @Test
    void testUnparseableYieldsNull() {
        assertNull(normalizer.parsePrice(null));
        assertNull(normalizer.parsePrice(""));
        assertNull(normalizer.parsePrice("   "));
        assertNull(normalizer.parsePrice("Free postage"));
        assertNull(normalizer.parsePrice("See description"));
    }

    @Test
    void testMoreThanTwoDecimalsRejectedWithOrWithoutMarker() {
        assertNull(normalizer.parsePrice("£12.345"));
        assertNull(normalizer.parsePrice("12.345"));
        assertNull(normalizer.parsePrice("US $9.999"));
        assertEquals(12.0, normalizer.parsePrice("Was £12."));
    }

    @Test
    void testFormattedOutputParsesBackToSameAmount() {
        double amount = normalizer.parsePrice("£1,299.90");
        assertEquals(amount, normalizer.parsePrice(PriceNormalizer.format(amount)));
        assertEquals("£1299.90", PriceNormalizer.format(amount));
    }

    @Test
    void testConvert() {
        assertEquals(6.40, PriceNormalizer.convert(5.0, 1.28));
        assertEquals(12.80, PriceNormalizer.convert(10.0, 1.28));
        assertNull(PriceNormalizer.convert(null, 1.28));
    }

    @Test
    void testNonPositiveRateRejected() {
        assertThrows(ConfigurationException.class, () -> new PriceNormalizer(0));
        assertThrows(ConfigurationException.class, () -> new PriceNormalizer(-1.5));
    }
}
