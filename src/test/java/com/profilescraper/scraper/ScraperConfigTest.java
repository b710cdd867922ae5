package com.profilescraper.scraper;

import org.junit.jupiter.api.Test;

import java.nio.file.Paths;
import java.time.DayOfWeek;
import java.time.Duration;
import java.time.LocalTime;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ScraperConfigTest {

    private static ScraperConfig load(Map<String, String> values) throws ConfigurationException {
        return ScraperConfig.from(values::get);
    }

    @Test
    void testDefaults() throws Exception {
        ScraperConfig config = load(Map.of());
        OperatingWindow window = config.operatingWindow();
        assertEquals(EnumSet.range(DayOfWeek.MONDAY, DayOfWeek.FRIDAY), window.days());
        assertEquals(LocalTime.of(9, 0), window.start());
        assertEquals(LocalTime.of(16, 30), window.end());
        assertEquals("America/New_York", window.zoneName());
        assertEquals(Duration.ofSeconds(60), config.minDelay());
        assertEquals(Duration.ofSeconds(600), config.maxDelay());
        assertFalse(config.headless());
        assertEquals(10000, config.timeoutMs());
        assertEquals(50, config.maxRecordsPerRun());
        assertEquals(3, config.discoveryBudget());
        assertEquals(Paths.get("scraped-data", "profiles.json"), config.jsonPath());
        assertEquals(Paths.get("scraped-data", "profiles.csv"), config.csvPath());
        assertEquals(Paths.get("scraped-data", "scraped_urls.txt"), config.ledgerPath());
        assertEquals("https://www.linkedin.com/login", config.loginUrl());
    }

    @Test
    void testOverrides() throws Exception {
        Map<String, String> env = new HashMap<>();
        env.put("SCRAPER_OPERATING_DAYS", "sat, sun");
        env.put("SCRAPER_OPERATING_START", "10:15");
        env.put("SCRAPER_OPERATING_END", "12:00");
        env.put("SCRAPER_TIMEZONE", "Europe/Berlin");
        env.put("SCRAPER_MIN_DELAY", "5");
        env.put("SCRAPER_MAX_DELAY", "10");
        env.put("SCRAPER_SHORT_DELAY_MIN", "0.5");
        env.put("SCRAPER_HEADLESS", "true");
        env.put("SCRAPER_DATA_DIR", "/tmp/profiles");
        env.put("SCRAPER_MAX_RECORDS", "7");
        env.put("SCRAPER_BASE_URL", "https://example.test/");
        env.put("SCRAPER_LOGIN_PATH", "signin");
        ScraperConfig config = load(env);

        assertEquals(EnumSet.of(DayOfWeek.SATURDAY, DayOfWeek.SUNDAY), config.operatingWindow().days());
        assertEquals(LocalTime.of(10, 15), config.operatingWindow().start());
        assertEquals(Duration.ofSeconds(5), config.minDelay());
        assertEquals(Duration.ofMillis(500), config.shortDelayMin());
        assertTrue(config.headless());
        assertEquals(Paths.get("/tmp/profiles", "profiles.json"), config.jsonPath());
        assertEquals(7, config.maxRecordsPerRun());
        assertEquals("https://example.test", config.baseUrl());
        assertEquals("https://example.test/signin", config.loginUrl());
    }

    @Test
    void testWeekdayIndicesStartAtMonday() throws Exception {
        assertEquals(EnumSet.of(DayOfWeek.MONDAY, DayOfWeek.TUESDAY, DayOfWeek.SUNDAY),
            ScraperConfig.parseDays("0,1,6"));
    }

    @Test
    void testInvalidValuesAreRejected() {
        assertThrows(ConfigurationException.class, () -> load(Map.of("SCRAPER_OPERATING_DAYS", "7")));
        assertThrows(ConfigurationException.class, () -> load(Map.of("SCRAPER_OPERATING_DAYS", "funday")));
        assertThrows(ConfigurationException.class, () -> load(Map.of("SCRAPER_OPERATING_START", "9am")));
        assertThrows(ConfigurationException.class, () -> load(Map.of("SCRAPER_MIN_DELAY", "-1")));
        assertThrows(ConfigurationException.class, () -> load(Map.of("SCRAPER_MAX_RECORDS", "0")));
        assertThrows(ConfigurationException.class, () -> load(Map.of("SCRAPER_TIMEOUT_MS", "soon")));
    }

    @Test
    void testStartAfterEndIsRejected() {
        ConfigurationException e = assertThrows(ConfigurationException.class,
            () -> load(Map.of("SCRAPER_OPERATING_START", "17:00", "SCRAPER_OPERATING_END", "09:00")));
        assertTrue(e.getMessage().contains("after end"));
    }

    @Test
    void testUnknownTimezoneIsAcceptedAndResolvedLater() throws Exception {
        ScraperConfig config = load(Map.of("SCRAPER_TIMEZONE", "Nowhere/Special"));
        assertEquals("Nowhere/Special", config.operatingWindow().zoneName());
    }

    @Test
    void testCredentialsResolution() throws Exception {
        Credentials credentials = CredentialsProvider.from(Map.of(
            CredentialsProvider.USERNAME_KEY, " jane@example.com ",
            CredentialsProvider.PASSWORD_KEY, "s3cret")::get).resolve();
        assertEquals("jane@example.com", credentials.username());
        assertFalse(credentials.toString().contains("s3cret"));
    }

    @Test
    void testMissingCredentialsAreAConfigurationError() {
        CredentialsProvider provider = CredentialsProvider.from(Map.of(CredentialsProvider.USERNAME_KEY, "jane")::get);
        ConfigurationException e = assertThrows(ConfigurationException.class, provider::resolve);
        assertTrue(e.getMessage().contains(CredentialsProvider.PASSWORD_KEY));
    }
}
