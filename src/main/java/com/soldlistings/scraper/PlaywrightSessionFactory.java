package com.soldlistings.scraper;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.options.Proxy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Set;

/**
 * Opens Chromium sessions through Playwright.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Launches headless (or headed) Chromium with memory-lean arguments, optionally through a proxy.</li>
 *   <li>Creates a desktop or mobile context pinned to en-GB / Europe/London so prices render in pounds.</li>
 *   <li>Installs the resource-blocking route when requested.</li>
 *   <li>Opens the first page and hands everything to a {@link PlaywrightBrowserSession}.</li>
 * </ul>
 * If any step fails, whatever was already started is closed before the failure is rethrown.
 *
 * @author Sold Listings Scraper Team
 * @since 1.0
 */
public class PlaywrightSessionFactory implements BrowserSessionFactory {
    private static final Logger logger = LoggerFactory.getLogger(PlaywrightSessionFactory.class);

    static final Set<String> BLOCKED_RESOURCE_TYPES = Set.of("image", "media", "font", "stylesheet");

    private static final List<String> CHROMIUM_ARGS = List.of(
        "--no-sandbox",
        "--disable-dev-shm-usage",
        "--disable-blink-features=AutomationControlled",
        "--disable-gpu",
        "--no-first-run",
        "--disable-extensions",
        "--disable-background-timer-throttling",
        "--disable-renderer-backgrounding",
        "--disable-backgrounding-occluded-windows"
    );

    private static final String DESKTOP_USER_AGENT =
        "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36";
    private static final String MOBILE_USER_AGENT =
        "Mozilla/5.0 (iPhone; CPU iPhone OS 17_0 like Mac OS X) AppleWebKit/605.1.15 (KHTML, like Gecko) Version/17.0 Mobile/15E148 Safari/604.1";

    @Override
    public BrowserSessionInterface open(SessionOptions options) {
        Playwright playwright;
        try {
            playwright = Playwright.create();
        } catch (Exception e) {
            throw new BrowserSessionException("Playwright initialization failed: " + e.getMessage(), e);
        }
        Browser browser = null;
        BrowserContext context = null;
        try {
            browser = playwright.chromium().launch(launchOptions(options));
            context = browser.newContext(contextOptions(options));
            context.setDefaultTimeout(options.defaultTimeoutMs());
            context.setDefaultNavigationTimeout(options.navigationTimeoutMs());
            Page page = context.newPage();
            PlaywrightBrowserSession session = new PlaywrightBrowserSession(playwright, browser, context, page);
            if (options.blockResources()) {
                session.blockResources(BLOCKED_RESOURCE_TYPES);
            }
            logger.info("Browser session opened (headless={}, mobile={}, proxy={}).",
                options.headless(), options.mobile(), options.proxyServer() != null);
            return session;
        } catch (Exception e) {
            logger.error("Error launching browser: {}", e.getMessage());
            closeQuietly(context, browser, playwright);
            throw new BrowserSessionException("Browser launch failed: " + e.getMessage(), e);
        }
    }

    private static BrowserType.LaunchOptions launchOptions(SessionOptions options) {
        BrowserType.LaunchOptions launch = new BrowserType.LaunchOptions()
            .setHeadless(options.headless())
            .setArgs(CHROMIUM_ARGS);
        if (options.proxyServer() != null) {
            launch.setProxy(new Proxy(options.proxyServer()));
        }
        return launch;
    }

    private static Browser.NewContextOptions contextOptions(SessionOptions options) {
        Browser.NewContextOptions context = new Browser.NewContextOptions()
            .setLocale("en-GB")
            .setTimezoneId("Europe/London");
        if (options.mobile()) {
            return context
                .setViewportSize(390, 844)
                .setUserAgent(MOBILE_USER_AGENT)
                .setIsMobile(true)
                .setHasTouch(true)
                .setDeviceScaleFactor(3);
        }
        return context
            .setViewportSize(1280, 720)
            .setUserAgent(DESKTOP_USER_AGENT);
    }

    private static void closeQuietly(BrowserContext context, Browser browser, Playwright playwright) {
        try {
            if (context != null) context.close();
        } catch (Exception e) {
            logger.warn("Failed to close browser context: {}", e.getMessage());
        }
        try {
            if (browser != null) browser.close();
        } catch (Exception e) {
            logger.warn("Failed to close browser: {}", e.getMessage());
        }
        try {
            playwright.close();
        } catch (Exception e) {
            logger.warn("Failed to close Playwright: {}", e.getMessage());
        }
    }
}
