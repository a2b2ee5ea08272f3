package com.soldlistings.scraper;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.ElementHandle;
import com.microsoft.playwright.JSHandle;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.TimeoutError;
import com.microsoft.playwright.options.LoadState;
import com.microsoft.playwright.options.WaitUntilState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * {@link BrowserSessionInterface} backed by a Playwright page.
 * <p>
 * Navigation timeouts and network errors are reported as {@code false} from {@link #navigate};
 * other Playwright failures surface as {@link BrowserSessionException}.
 */
public class PlaywrightBrowserSession implements BrowserSessionInterface {
    private static final Logger logger = LoggerFactory.getLogger(PlaywrightBrowserSession.class);

    private final Playwright playwright;
    private final Browser browser;
    private final BrowserContext context;
    private Page page;

    PlaywrightBrowserSession(Playwright playwright, Browser browser, BrowserContext context, Page page) {
        this.playwright = playwright;
        this.browser = browser;
        this.context = context;
        this.page = page;
    }

    @Override
    public boolean navigate(String url, WaitPolicy waitPolicy, int timeoutMs) {
        Page active = activePage();
        try {
            active.navigate(url, new Page.NavigateOptions()
                .setWaitUntil(waitPolicy == WaitPolicy.LOAD ? WaitUntilState.LOAD : WaitUntilState.DOMCONTENTLOADED)
                .setTimeout(timeoutMs));
        } catch (TimeoutError e) {
            logger.warn("Timeout after {}ms loading {}", timeoutMs, url);
            return false;
        } catch (PlaywrightException e) {
            logger.warn("Navigation to {} failed: {}", url, e.getMessage());
            return false;
        }
        if (waitPolicy == WaitPolicy.NETWORK_IDLE) {
            waitForNetworkIdle(active, timeoutMs);
        }
        return true;
    }

    // The DOM is already usable at this point; a page that never goes idle is still worth reading.
    private void waitForNetworkIdle(Page active, int timeoutMs) {
        try {
            active.waitForLoadState(LoadState.NETWORKIDLE, new Page.WaitForLoadStateOptions().setTimeout(timeoutMs));
        } catch (PlaywrightException e) {
            logger.debug("Network did not go idle within {}ms: {}", timeoutMs, e.getMessage());
        }
    }

    @Override
    public String getContent() {
        try {
            return activePage().content();
        } catch (PlaywrightException e) {
            throw new BrowserSessionException("Failed to read page content: " + e.getMessage(), e);
        }
    }

    @Override
    public String getTitle() {
        try {
            return activePage().title();
        } catch (PlaywrightException e) {
            throw new BrowserSessionException("Failed to read page title: " + e.getMessage(), e);
        }
    }

    @Override
    public List<PageElement> locate(String selector) {
        try {
            return wrap(activePage().querySelectorAll(selector));
        } catch (PlaywrightException e) {
            throw new BrowserSessionException("Selector '" + selector + "' failed: " + e.getMessage(), e);
        }
    }

    @Override
    public Object evaluate(String script) {
        try {
            return activePage().evaluate(script);
        } catch (PlaywrightException e) {
            throw new BrowserSessionException("Script evaluation failed: " + e.getMessage(), e);
        }
    }

    @Override
    public void blockResources(Set<String> resourceTypes) {
        Set<String> blocked = Set.copyOf(resourceTypes);
        context.route("**/*", route -> {
            if (blocked.contains(route.request().resourceType())) {
                route.abort();
            } else {
                route.resume();
            }
        });
        logger.debug("Blocking resource types: {}", blocked);
    }

    @Override
    public void newPage() {
        closePage();
        try {
            page = context.newPage();
        } catch (PlaywrightException e) {
            throw new BrowserSessionException("Failed to open page: " + e.getMessage(), e);
        }
    }

    @Override
    public void closePage() {
        if (page == null) return;
        try {
            page.close();
        } catch (PlaywrightException e) {
            logger.warn("Failed to close page: {}", e.getMessage());
        } finally {
            page = null;
        }
    }

    @Override
    public void close() {
        closePage();
        try {
            context.close();
        } catch (Exception e) {
            logger.warn("Failed to close browser context: {}", e.getMessage());
        }
        try {
            browser.close();
        } catch (Exception e) {
            logger.warn("Failed to close browser: {}", e.getMessage());
        }
        try {
            playwright.close();
        } catch (Exception e) {
            logger.warn("Failed to close Playwright: {}", e.getMessage());
        }
        logger.info("Browser session closed.");
    }

    private Page activePage() {
        if (page == null) {
            throw new BrowserSessionException("No active page; call newPage() first");
        }
        return page;
    }

    private static List<PageElement> wrap(List<ElementHandle> handles) {
        List<PageElement> elements = new ArrayList<>(handles.size());
        for (ElementHandle handle : handles) {
            elements.add(new HandleElement(handle));
        }
        return elements;
    }

    private static final class HandleElement implements PageElement {
        private final ElementHandle handle;

        private HandleElement(ElementHandle handle) {
            this.handle = handle;
        }

        @Override
        public String text() {
            try {
                return handle.textContent();
            } catch (PlaywrightException e) {
                throw new BrowserSessionException("Failed to read element text: " + e.getMessage(), e);
            }
        }

        @Override
        public String attribute(String name) {
            try {
                return handle.getAttribute(name);
            } catch (PlaywrightException e) {
                throw new BrowserSessionException("Failed to read attribute '" + name + "': " + e.getMessage(), e);
            }
        }

        @Override
        public PageElement closest(String selector) {
            try {
                JSHandle match = handle.evaluateHandle("(el, sel) => el.closest(sel)", selector);
                ElementHandle element = match.asElement();
                return element == null ? null : new HandleElement(element);
            } catch (PlaywrightException e) {
                throw new BrowserSessionException("closest('" + selector + "') failed: " + e.getMessage(), e);
            }
        }

        @Override
        public List<PageElement> locate(String selector) {
            try {
                return wrap(handle.querySelectorAll(selector));
            } catch (PlaywrightException e) {
                throw new BrowserSessionException("Selector '" + selector + "' failed: " + e.getMessage(), e);
            }
        }

        @Override
        public String html() {
            try {
                Object outer = handle.evaluate("el => el.outerHTML");
                return outer == null ? "" : outer.toString();
            } catch (PlaywrightException e) {
                throw new BrowserSessionException("Failed to read element HTML: " + e.getMessage(), e);
            }
        }
    }
}
