package com.profilescraper.scraper;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.PlaywrightException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PlaywrightSessionProviderTest {

    @TempDir
    Path dir;

    @Mock
    private Browser browser;
    @Mock
    private BrowserContext context;

    private ScraperConfig config;
    private PlaywrightSessionProvider provider;

    @BeforeEach
    void setUp() throws Exception {
        config = ScraperConfig.from(Map.of("SCRAPER_DATA_DIR", dir.toString(), "SCRAPER_HEADLESS", "true")::get);
        provider = new PlaywrightSessionProvider(config, new RecordingSleeper());
    }

    private long backups(String tag) throws Exception {
        try (Stream<Path> files = Files.list(dir)) {
            return files.filter(p -> p.getFileName().toString().startsWith("storage-state.json." + tag + "-")).count();
        }
    }

    @Test
    void testLaunchOptionsFollowConfig() {
        BrowserType.LaunchOptions options = provider.launchOptions();
        assertTrue(options.headless);
    }

    @Test
    void testFreshContextWithoutSavedState() throws Exception {
        when(browser.newContext(any(Browser.NewContextOptions.class))).thenReturn(context);

        assertSame(context, provider.createOrRestoreContext(browser));
        assertEquals(0, backups("invalid"));
    }

    @Test
    void testValidSavedStateIsKept() throws Exception {
        Files.writeString(config.storageStatePath(), "{\"cookies\": [], \"origins\": []}", StandardCharsets.UTF_8);
        when(browser.newContext(any(Browser.NewContextOptions.class))).thenReturn(context);

        provider.createOrRestoreContext(browser);

        assertTrue(Files.exists(config.storageStatePath()));
    }

    @Test
    void testInvalidSavedStateIsMovedAside() throws Exception {
        Files.writeString(config.storageStatePath(), "<html>not json</html>", StandardCharsets.UTF_8);
        when(browser.newContext(any(Browser.NewContextOptions.class))).thenReturn(context);

        provider.createOrRestoreContext(browser);

        assertFalse(Files.exists(config.storageStatePath()));
        assertEquals(1, backups("invalid"));
    }

    @Test
    void testStateRejectedByPlaywrightFallsBackToFreshContext() throws Exception {
        Files.writeString(config.storageStatePath(), "{\"cookies\": 42}", StandardCharsets.UTF_8);
        when(browser.newContext(any(Browser.NewContextOptions.class)))
            .thenThrow(new PlaywrightException("cookies: expected array"))
            .thenReturn(context);

        assertSame(context, provider.createOrRestoreContext(browser));
        assertEquals(1, backups("playwright-error"));
    }
}
