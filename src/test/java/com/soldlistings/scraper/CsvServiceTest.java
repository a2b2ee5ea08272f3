package com.soldlistings.scraper;

import com.opencsv.CSVReader;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class CsvServiceTest {
    @TempDir
    Path tempDir;

    @Test
    void testWritesHeaderAndRows() throws Exception {
        List<ExtractedItem> items = List.of(
            ExtractedItem.of("Lego, Star Wars \"X-Wing\"", "£12.50", 12.5, 1.28, "Free postage", "Used",
                "Ended 3 Oct", "https://www.ebay.co.uk/itm/1", null),
            ExtractedItem.of("Lego City", "N/A", null, 1.28, null, null, null, "https://www.ebay.co.uk/itm/2", null));
        Path out = tempDir.resolve("nested/lego.csv");

        new CsvService().writeItemsToCsv(items, out);

        List<String[]> rows;
        try (Reader reader = Files.newBufferedReader(out, StandardCharsets.UTF_8);
             CSVReader csv = new CSVReader(reader)) {
            rows = csv.readAll();
        }
        assertEquals(3, rows.size());
        assertArrayEquals(new String[]{"Title", "PriceText", "PriceGBP", "PriceUSD", "Shipping", "Condition", "SoldInfo", "URL", "ImageURL"},
            rows.get(0));
        assertEquals("Lego, Star Wars \"X-Wing\"", rows.get(1)[0]);
        assertEquals("12.50", rows.get(1)[2]);
        assertEquals("16.00", rows.get(1)[3]);
        assertEquals("", rows.get(2)[2]);
        assertEquals("N/A", rows.get(2)[1]);
    }

    @Test
    void testNullListRejected() {
        assertThrows(IllegalArgumentException.class,
            () -> new CsvService().writeItemsToCsv(null, tempDir.resolve("x.csv")));
    }
}
