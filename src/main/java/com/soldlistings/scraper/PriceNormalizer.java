package com.soldlistings.scraper;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns displayed price text into an amount in the base currency (GBP).
 * <p>
 * Resolution order:
 * <ol>
 *   <li>Base-currency markers ({@code £}, {@code GBP}) as prefix or suffix.</li>
 *   <li>Secondary-currency markers ({@code US $}, {@code $}, {@code USD}), converted with the configured
 *       approximate rate. The rate is a display estimate, not an authoritative conversion.</li>
 *   <li>A bare number, taken as already being in the base currency.</li>
 * </ol>
 * Thousands separators are ignored and decimals are optional. Unparseable text yields null.
 */
public final class PriceNormalizer {

    public static final String BASE_SYMBOL = "£";

    // At most two decimals; a longer decimal run is rejected, never truncated.
    private static final String AMOUNT = "(?<![0-9.,])([0-9][0-9,]*(?:\\.[0-9]{1,2})?)(?!\\.?[0-9])";

    private static final List<Pattern> BASE_PATTERNS = List.of(
        Pattern.compile("£\\s*" + AMOUNT, Pattern.CASE_INSENSITIVE),
        Pattern.compile("GBP\\s*" + AMOUNT, Pattern.CASE_INSENSITIVE),
        Pattern.compile(AMOUNT + "\\s*(?:£|GBP)", Pattern.CASE_INSENSITIVE)
    );

    private static final List<Pattern> SECONDARY_PATTERNS = List.of(
        Pattern.compile("US\\s*\\$\\s*" + AMOUNT, Pattern.CASE_INSENSITIVE),
        Pattern.compile("USD\\s*" + AMOUNT, Pattern.CASE_INSENSITIVE),
        Pattern.compile("\\$\\s*" + AMOUNT, Pattern.CASE_INSENSITIVE),
        Pattern.compile(AMOUNT + "\\s*(?:USD|\\$)", Pattern.CASE_INSENSITIVE)
    );

    private static final Pattern BARE_AMOUNT = Pattern.compile("^\\s*" + AMOUNT + "\\s*$");

    private final BigDecimal secondaryRate;

    /**
     * @param secondaryRate approximate secondary-to-base rate (USD to GBP), must be positive
     */
    public PriceNormalizer(double secondaryRate) {
        if (!(secondaryRate > 0) || Double.isInfinite(secondaryRate)) {
            throw new ConfigurationException("Secondary currency rate must be positive but was " + secondaryRate);
        }
        this.secondaryRate = BigDecimal.valueOf(secondaryRate);
    }

    public PriceNormalizer(ScraperConfig config) {
        this(config.secondaryRate());
    }

    /**
     * @param text displayed price text, may be null
     * @return amount in the base currency, or null if the text carries no recognizable price
     */
    public Double parsePrice(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        BigDecimal base = firstMatch(BASE_PATTERNS, text);
        if (base != null) {
            return base.doubleValue();
        }
        BigDecimal secondary = firstMatch(SECONDARY_PATTERNS, text);
        if (secondary != null) {
            return secondary.multiply(secondaryRate).setScale(2, RoundingMode.HALF_UP).doubleValue();
        }
        Matcher bare = BARE_AMOUNT.matcher(text);
        if (bare.matches()) {
            return toDecimal(bare.group(1)).doubleValue();
        }
        return null;
    }

    /**
     * @return {@code amount × rate} rounded to two decimals, or null if amount is null
     */
    public static Double convert(Double amount, double rate) {
        if (amount == null) {
            return null;
        }
        return BigDecimal.valueOf(amount)
            .multiply(BigDecimal.valueOf(rate))
            .setScale(2, RoundingMode.HALF_UP)
            .doubleValue();
    }

    /**
     * Canonical display form of a base-currency amount, e.g. {@code £12.50}.
     */
    public static String format(double amount) {
        return BASE_SYMBOL + String.format(Locale.ROOT, "%.2f", amount);
    }

    private static BigDecimal firstMatch(List<Pattern> patterns, String text) {
        for (Pattern pattern : patterns) {
            Matcher m = pattern.matcher(text);
            if (m.find()) {
                return toDecimal(m.group(1));
            }
        }
        return null;
    }

    private static BigDecimal toDecimal(String token) {
        return new BigDecimal(token.replace(",", ""));
    }
}
