package com.soldlistings.scraper;

import com.opencsv.CSVWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Service for exporting collected items to CSV files using OpenCSV.
 * <p>
 * Columns follow {@link ExtractedItem} field order. Missing values are written as empty cells and
 * amounts with two decimals.
 *
 * @author Sold Listings Scraper Team
 * @since 1.0
 */
public class CsvService implements CsvServiceInterface {
    private static final Logger logger = LoggerFactory.getLogger(CsvService.class);

    // Central registry of exported columns
    static final List<MetadataField> CSV_FIELDS = List.of(
        new MetadataField("Title", List.of()),
        new MetadataField("PriceText", List.of()),
        new MetadataField("PriceGBP", List.of()),
        new MetadataField("PriceUSD", List.of()),
        new MetadataField("Shipping", List.of()),
        new MetadataField("Condition", List.of()),
        new MetadataField("SoldInfo", List.of()),
        new MetadataField("URL", List.of()),
        new MetadataField("ImageURL", List.of())
    );

    @Override
    public void writeItemsToCsv(List<ExtractedItem> items, Path file) throws IOException {
        if (items == null) {
            logger.warn("Attempted to write null item list to CSV: {}", file);
            throw new IllegalArgumentException("Item list cannot be null");
        }
        if (file == null) {
            throw new IllegalArgumentException("Output file cannot be null");
        }
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (Writer out = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
             CSVWriter writer = new CSVWriter(out)) {
            writer.writeNext(CSV_FIELDS.stream().map(f -> f.fieldName).toArray(String[]::new));
            for (ExtractedItem item : items) {
                writer.writeNext(new String[]{
                    safe(item.title()),
                    safe(item.priceText()),
                    amount(item.priceAmountPrimary()),
                    amount(item.priceAmountSecondary()),
                    safe(item.shippingText()),
                    safe(item.condition()),
                    safe(item.soldInfo()),
                    safe(item.canonicalUrl()),
                    safe(item.imageUrl())
                });
            }
        }
        logger.info("Wrote {} items to CSV file: {}", items.size(), file);
    }

    private static String amount(Double value) {
        return value == null ? "" : String.format(Locale.ROOT, "%.2f", value);
    }

    /**
     * Collapses line breaks so every item stays on one CSV row.
     */
    private static String safe(String s) {
        return s == null ? "" : s.replaceAll("[\\r\\n]+", " ").trim();
    }
}
