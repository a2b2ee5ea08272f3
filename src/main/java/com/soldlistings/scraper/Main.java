package com.soldlistings.scraper;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Command-line entry point. Runs one scrape and prints the result as JSON on stdout.
 * <pre>
 * Usage: &lt;query&gt; [pages] [perPage] [--csv=name] [--mobile] [--headed] [--smoke] [--rate=1.28] [--condition=new|used]
 * </pre>
 * Without {@code --rate} the configured {@code SCRAPER_EXCHANGE_RATE} applies.
 * Exit status is 0 on success, 1 when the run failed and 2 on invalid arguments.
 *
 * @author Sold Listings Scraper Team
 * @since 1.0
 */
public class Main {
    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    static final String OUTPUT_DIR = "scraped-data";
    static final int DEFAULT_PAGES = 1;
    static final int DEFAULT_PER_PAGE = 10;
    static final String USAGE =
        "Usage: <query> [pages] [perPage] [--csv=name] [--mobile] [--headed] [--smoke] [--rate=1.28] [--condition=new|used]";

    /**
     * Parsed command line.
     * @param request scrape parameters
     * @param csvName CSV file name inside the output directory, or null for no export
     */
    record CommandLine(ScrapeRequest request, String csvName) {}

    /**
     * @throws IllegalArgumentException on an unknown flag, a malformed number or a missing query
     */
    static CommandLine parseArgs(String[] args) {
        List<String> positional = new ArrayList<>();
        boolean mobile = false;
        boolean headless = true;
        boolean smoke = false;
        double rate = ScrapeRequest.UNSET_EXCHANGE_RATE;
        SearchFilters filters = SearchFilters.NONE;
        String csvName = null;
        for (String arg : args == null ? new String[0] : args) {
            if (arg.equals("--mobile")) {
                mobile = true;
            } else if (arg.equals("--headed")) {
                headless = false;
            } else if (arg.equals("--smoke")) {
                smoke = true;
            } else if (arg.startsWith("--csv=")) {
                csvName = csvFileName(arg.substring("--csv=".length()));
            } else if (arg.startsWith("--rate=")) {
                rate = parseDouble("rate", arg.substring("--rate=".length()));
            } else if (arg.startsWith("--condition=")) {
                filters = new SearchFilters(parseCondition(arg.substring("--condition=".length())));
            } else if (arg.startsWith("--")) {
                throw new IllegalArgumentException("Unknown option: " + arg);
            } else {
                positional.add(arg);
            }
        }
        String query = positional.isEmpty() ? "" : positional.get(0);
        if (query.isBlank() && !smoke) {
            throw new IllegalArgumentException("A search query is required");
        }
        if (smoke && query.isBlank()) {
            query = ScrapeRequest.SMOKE_QUERY;
        }
        int pages = positional.size() > 1 ? parseInt("pages", positional.get(1)) : DEFAULT_PAGES;
        int perPage = positional.size() > 2 ? parseInt("perPage", positional.get(2)) : DEFAULT_PER_PAGE;
        ScrapeRequest request = new ScrapeRequest(query, pages, perPage, headless, rate, mobile, smoke, filters);
        return new CommandLine(request, csvName);
    }

    private static String csvFileName(String raw) {
        String name = Utils.sanitizeFilename(raw.trim());
        if (name.isEmpty()) {
            throw new IllegalArgumentException("--csv needs a file name");
        }
        return name.toLowerCase(Locale.ROOT).endsWith(".csv") ? name : name + ".csv";
    }

    private static SearchFilters.ItemCondition parseCondition(String raw) {
        try {
            return SearchFilters.ItemCondition.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown condition '" + raw + "', expected new or used", e);
        }
    }

    private static int parseInt(String name, String raw) {
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be a whole number but was '" + raw + "'", e);
        }
    }

    private static double parseDouble(String name, String raw) {
        try {
            return Double.parseDouble(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be a number but was '" + raw + "'", e);
        }
    }

    static String toJson(RunResult result) throws JsonProcessingException {
        return new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT).writeValueAsString(result);
    }

    /**
     * Main application entry point.
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        CommandLine commandLine;
        try {
            commandLine = parseArgs(args);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.err.println(USAGE);
            System.exit(2);
            return;
        }

        ScraperServiceInterface scraperService;
        try {
            scraperService = new ScraperService();
        } catch (ConfigurationException e) {
            logger.error("Invalid configuration: {}", e.getMessage());
            System.exit(2);
            return;
        }
        RunResult result = scraperService.scrape(commandLine.request());

        try {
            System.out.println(toJson(result));
        } catch (JsonProcessingException e) {
            logger.error("Failed to serialize result: {}", e.getMessage());
        }

        if (commandLine.csvName() != null && !result.items().isEmpty()) {
            Path out = Paths.get(OUTPUT_DIR).resolve(commandLine.csvName());
            try {
                new CsvService().writeItemsToCsv(result.items(), out);
            } catch (IOException e) {
                logger.error("Failed to write CSV '{}': {}", out, e.getMessage());
            }
        }
        System.exit(result.success() ? 0 : 1);
    }
}
