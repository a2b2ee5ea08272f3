package com.soldlistings.scraper;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Interface for CSV export of collected items.
 */
public interface CsvServiceInterface {
    /**
     * Writes items to a CSV file with a header row. Parent directories are created as needed.
     * @param items items to export
     * @param file output file
     * @throws IOException if file writing fails
     */
    void writeItemsToCsv(List<ExtractedItem> items, Path file) throws IOException;
}
