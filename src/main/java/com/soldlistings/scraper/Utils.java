package com.soldlistings.scraper;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Utility class for text, selector and image-URL helpers shared by the extractors.
 *
 * @author Sold Listings Scraper Team
 * @since 1.0
 */
public final class Utils {
    private Utils() {}

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern LOW_RES_TOKEN = Pattern.compile("s-l(?:64|96|140|225|300|400|500)\\.");
    private static final Pattern THUMBNAIL_PATH = Pattern.compile("/thumbs?/", Pattern.CASE_INSENSITIVE);
    private static final String HIGH_RES_TOKEN = "s-l1600.";
    private static final int THUMBNAIL_MAX_PX = 100;
    private static final String NEW_WINDOW_SUFFIX = "Opens in a new window or tab";

    /**
     * Sanitizes a filename by replacing each special character and whitespace with an underscore.
     * @param name Input filename
     * @return Sanitized filename
     */
    public static String sanitizeFilename(String name) {
        return name == null ? "" : name.replaceAll("[*?\"<>|/:\\s]", "_");
    }

    /**
     * Collapses runs of whitespace and trims.
     * @return normalized text, or null if nothing but whitespace remains
     */
    public static String normalizeWhitespace(String text) {
        if (text == null) return null;
        String collapsed = WHITESPACE.matcher(text).replaceAll(" ").trim();
        return collapsed.isEmpty() ? null : collapsed;
    }

    /**
     * Removes the screen-reader "Opens in a new window or tab" suffix results cards append to titles.
     */
    public static String cleanTitle(String title) {
        if (title == null) return null;
        return normalizeWhitespace(title.replace(NEW_WINDOW_SUFFIX, ""));
    }

    /**
     * Rewrites known low-resolution size tokens (for example {@code s-l140.jpg}) to the high-resolution variant.
     */
    public static String upgradeImageResolution(String url) {
        if (url == null) return null;
        return LOW_RES_TOKEN.matcher(url).replaceAll(HIGH_RES_TOKEN);
    }

    /**
     * @param url image source
     * @param width width attribute, may be null
     * @param height height attribute, may be null
     * @return true for inline placeholders, thumbnail paths and images declared at thumbnail size
     */
    public static boolean isThumbnail(String url, String width, String height) {
        if (url == null || url.isBlank() || url.startsWith("data:")) return true;
        if (THUMBNAIL_PATH.matcher(url).find()) return true;
        return isSmall(width) || isSmall(height);
    }

    private static boolean isSmall(String dimension) {
        if (dimension == null) return false;
        try {
            return Integer.parseInt(dimension.trim().replace("px", "")) <= THUMBNAIL_MAX_PX;
        } catch (NumberFormatException e) {
            return false;
        }
    }

    /**
     * @return true if {@code text} contains any of the lower-case {@code needles}
     */
    public static boolean containsAny(String text, List<String> needles) {
        if (text == null) return false;
        String lower = text.toLowerCase(Locale.ROOT);
        for (String needle : needles) {
            if (lower.contains(needle)) return true;
        }
        return false;
    }

    public static String joinSelectors(List<String> arr) {
        return arr == null || arr.isEmpty() ? "" : String.join(", ", arr);
    }
}
