package com.profilescraper.scraper;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.Locator;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.options.LoadState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * {@link PageSession} over a single Playwright page.
 * <p>
 * Owns the whole Playwright stack it was opened with (driver, browser, context, page) and tears all of it
 * down on {@link #close()}. Element lookups follow the not-found-is-empty contract of {@link FieldReader}:
 * every locator call is guarded by a {@code count() > 0} check and lookup failures are logged at debug.
 *
 * @since 1.0
 */
public class PlaywrightPageSession implements PageSession {
    private static final Logger logger = LoggerFactory.getLogger(PlaywrightPageSession.class);
    private static final int NAVIGATION_ATTEMPTS = 3;

    private final Playwright playwright;
    private final Browser browser;
    private final BrowserContext context;
    private final Page page;
    private final Path storageStatePath;
    private final int timeoutMs;
    private final Sleeper sleeper;
    private final FieldReader reader;
    private boolean closed;

    public PlaywrightPageSession(Playwright playwright, Browser browser, BrowserContext context, Page page,
                                 Path storageStatePath, int timeoutMs, Sleeper sleeper) {
        this.playwright = playwright;
        this.browser = browser;
        this.context = context;
        this.page = page;
        this.storageStatePath = storageStatePath;
        this.timeoutMs = timeoutMs;
        this.sleeper = sleeper;
        this.reader = new LocatorReader(page::locator);
        page.setDefaultTimeout(timeoutMs);
        page.setDefaultNavigationTimeout(timeoutMs * 3.0);
    }

    @Override
    public void navigate(String url) throws SessionException {
        try {
            Utils.retry(() -> page.navigate(url), NAVIGATION_ATTEMPTS, "navigate to " + url, sleeper);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SessionException("Interrupted while navigating to " + url, e);
        } catch (Exception e) {
            throw new SessionException("Navigation to " + url + " failed: " + e.getMessage(), e);
        }
        waitForNetworkIdle();
    }

    @Override
    public String currentUrl() {
        return page.url();
    }

    @Override
    public boolean fill(String selector, String value) {
        try {
            Locator l = page.locator(selector);
            if (l.count() > 0) {
                l.first().fill(value);
                return true;
            }
        } catch (Exception e) {
            logger.debug("Failed to fill '{}': {}", selector, e.getMessage());
        }
        return false;
    }

    @Override
    public boolean revealMore() {
        long before = documentHeight();
        page.evaluate("() => window.scrollTo(0, document.body.scrollHeight)");
        waitForNetworkIdle();
        long after = documentHeight();
        logger.debug("Scrolled to bottom; document height {} -> {}", before, after);
        return after > before;
    }

    @Override
    public void scrollToTop() {
        page.evaluate("() => window.scrollTo(0, 0)");
    }

    @Override
    public void saveState() {
        if (storageStatePath == null) return;
        try {
            Path parent = storageStatePath.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            context.storageState(new BrowserContext.StorageStateOptions().setPath(storageStatePath));
            logger.info("Saved storage state to {}", storageStatePath);
        } catch (Exception e) {
            logger.warn("Failed to save storage state: {}", e.getMessage());
        }
    }

    @Override
    public String text(String selector) {
        return reader.text(selector);
    }

    @Override
    public List<String> texts(String selector) {
        return reader.texts(selector);
    }

    @Override
    public List<String> attributes(String selector, String attribute) {
        return reader.attributes(selector, attribute);
    }

    @Override
    public List<FieldReader> scopes(String selector) {
        return reader.scopes(selector);
    }

    @Override
    public boolean click(String selector) {
        return reader.click(selector);
    }

    @Override
    public void close() {
        if (closed) return;
        closed = true;
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
        logger.info("Browser session released.");
    }

    private long documentHeight() {
        Object h = page.evaluate("() => document.body.scrollHeight");
        return h instanceof Number n ? n.longValue() : 0L;
    }

    private void waitForNetworkIdle() {
        try {
            page.waitForLoadState(LoadState.NETWORKIDLE, new Page.WaitForLoadStateOptions().setTimeout(timeoutMs));
        } catch (Exception e) {
            logger.debug("Network did not go idle within {}ms: {}", timeoutMs, e.getMessage());
        }
    }

    /**
     * {@link FieldReader} over whatever a selector resolves to inside a root (the page or one element).
     */
    private static final class LocatorReader implements FieldReader {
        private final Function<String, Locator> root;

        LocatorReader(Function<String, Locator> root) {
            this.root = root;
        }

        @Override
        public String text(String selector) {
            try {
                Locator l = root.apply(selector);
                if (l.count() > 0) {
                    String s = l.first().innerText();
                    return s == null ? "" : s.trim();
                }
            } catch (Exception e) {
                logger.debug("Failed to get inner text for '{}': {}", selector, e.getMessage());
            }
            return "";
        }

        @Override
        public List<String> texts(String selector) {
            List<String> out = new ArrayList<>();
            try {
                for (String s : root.apply(selector).allInnerTexts()) {
                    if (s != null && !s.isBlank()) out.add(s.trim());
                }
            } catch (Exception e) {
                logger.debug("Failed to get inner texts for '{}': {}", selector, e.getMessage());
            }
            return out;
        }

        @Override
        public List<String> attributes(String selector, String attribute) {
            List<String> out = new ArrayList<>();
            try {
                Locator l = root.apply(selector);
                int count = l.count();
                for (int i = 0; i < count; i++) {
                    String s = l.nth(i).getAttribute(attribute);
                    if (s != null && !s.isBlank()) out.add(s.trim());
                }
            } catch (Exception e) {
                logger.debug("Failed to get attribute '{}' of '{}': {}", attribute, selector, e.getMessage());
            }
            return out;
        }

        @Override
        public List<FieldReader> scopes(String selector) {
            List<FieldReader> out = new ArrayList<>();
            try {
                Locator l = root.apply(selector);
                int count = l.count();
                for (int i = 0; i < count; i++) {
                    Locator item = l.nth(i);
                    out.add(new LocatorReader(item::locator));
                }
            } catch (Exception e) {
                logger.debug("Failed to resolve scopes for '{}': {}", selector, e.getMessage());
            }
            return out;
        }

        @Override
        public boolean click(String selector) {
            try {
                Locator l = root.apply(selector);
                if (l.count() > 0) {
                    l.first().scrollIntoViewIfNeeded();
                    l.first().click();
                    logger.debug("Clicked: {}", selector);
                    return true;
                }
            } catch (Exception e) {
                logger.debug("Failed to click '{}': {}", selector, e.getMessage());
            }
            return false;
        }
    }
}
