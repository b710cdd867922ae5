package com.profilescraper.scraper;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;

/**
 * Launches Chromium through Playwright and hands out a {@link PlaywrightPageSession}.
 * <p>
 * Session reuse: if {@code storage-state.json} exists in the data directory and looks like JSON it is loaded
 * into the new context, so a previous login can be resumed. A malformed file is moved aside to
 * {@code storage-state.json.invalid-<millis>} and a fresh context is created instead.
 *
 * @since 1.0
 */
public class PlaywrightSessionProvider implements SessionProvider {
    private static final Logger logger = LoggerFactory.getLogger(PlaywrightSessionProvider.class);
    private static final String USER_AGENT = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) "
        + "AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36";

    private final ScraperConfig config;
    private final Sleeper sleeper;

    public PlaywrightSessionProvider(ScraperConfig config, Sleeper sleeper) {
        this.config = config;
        this.sleeper = sleeper;
    }

    @Override
    public PageSession open() throws SessionException {
        Playwright playwright = null;
        Browser browser = null;
        try {
            playwright = Playwright.create();
            browser = playwright.chromium().launch(launchOptions());
            BrowserContext context = createOrRestoreContext(browser);
            Page page = context.newPage();
            logger.info("Browser session opened (headless={}).", config.headless());
            return new PlaywrightPageSession(playwright, browser, context, page,
                config.storageStatePath(), config.timeoutMs(), sleeper);
        } catch (Exception e) {
            if (browser != null) {
                try { browser.close(); } catch (Exception ce) { logger.warn("Failed to close browser after launch error: {}", ce.getMessage()); }
            }
            if (playwright != null) {
                try { playwright.close(); } catch (Exception ce) { logger.warn("Failed to close Playwright after launch error: {}", ce.getMessage()); }
            }
            throw new SessionException("Failed to launch browser: " + e.getMessage(), e);
        }
    }

    BrowserType.LaunchOptions launchOptions() {
        BrowserType.LaunchOptions options = new BrowserType.LaunchOptions();
        options.setHeadless(config.headless());
        options.setArgs(Arrays.asList(
            "--no-sandbox",
            "--disable-dev-shm-usage",
            "--window-size=1280,1696",
            "--lang=en-US"
        ));
        return options;
    }

    /**
     * Creates a context, restoring saved storage state when it is usable.
     */
    BrowserContext createOrRestoreContext(Browser browser) {
        Browser.NewContextOptions options = new Browser.NewContextOptions()
            .setViewportSize(1280, 900)
            .setUserAgent(USER_AGENT);
        Path storageFile = config.storageStatePath();
        boolean restoring = false;
        if (Files.exists(storageFile)) {
            if (looksLikeJson(storageFile)) {
                options.setStorageStatePath(storageFile);
                restoring = true;
                logger.info("Using existing storage state from {} to restore session.", storageFile);
            } else {
                backup(storageFile, "invalid");
            }
        } else {
            logger.info("No existing storage state found; starting a fresh context.");
        }
        try {
            return browser.newContext(options);
        } catch (RuntimeException e) {
            if (!restoring) throw e;
            logger.warn("Playwright could not restore storage state: {}. Starting a fresh context.", e.getMessage());
            backup(storageFile, "playwright-error");
            return browser.newContext(new Browser.NewContextOptions().setViewportSize(1280, 900).setUserAgent(USER_AGENT));
        }
    }

    private static boolean looksLikeJson(Path file) {
        try {
            String content = Files.readString(file).stripLeading();
            return content.startsWith("{") || content.startsWith("[");
        } catch (Exception e) {
            logger.warn("Failed to read storage state '{}': {}", file, e.getMessage());
            return false;
        }
    }

    private static void backup(Path file, String tag) {
        Path backup = Paths.get(file + "." + tag + "-" + System.currentTimeMillis());
        try {
            Files.move(file, backup);
            logger.warn("Moved unusable storage state to {}.", backup);
        } catch (Exception e) {
            logger.warn("Storage state {} is unusable and could not be moved aside: {}", file, e.getMessage());
        }
    }
}
