package com.profilescraper.scraper;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.DayOfWeek;
import java.time.Duration;
import java.time.LocalTime;
import java.time.format.DateTimeParseException;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;
import java.util.function.Function;

/**
 * Immutable runtime configuration, built once at process start and handed to every component's constructor.
 * <p>
 * Values are looked up by key in the environment first, then in JVM system properties, then fall back to
 * the defaults below. Nothing else in the scraper reads ambient configuration.
 * <ul>
 *   <li>Operating window: {@code SCRAPER_OPERATING_DAYS}, {@code SCRAPER_OPERATING_START}, {@code SCRAPER_OPERATING_END}, {@code SCRAPER_TIMEZONE}.</li>
 *   <li>Pacing: {@code SCRAPER_MIN_DELAY}/{@code SCRAPER_MAX_DELAY} (seconds between records),
 *       {@code SCRAPER_SHORT_DELAY_MIN}/{@code _MAX} and {@code SCRAPER_SCROLL_DELAY_MIN}/{@code _MAX} (seconds, decimals allowed).</li>
 *   <li>Browser: {@code SCRAPER_HEADLESS}, {@code SCRAPER_TIMEOUT_MS}, {@code SCRAPER_BASE_URL}, {@code SCRAPER_LOGIN_PATH}.</li>
 *   <li>Run: {@code SCRAPER_DATA_DIR}, {@code SCRAPER_MAX_RECORDS}, {@code SCRAPER_DISCOVERY_BUDGET}.</li>
 * </ul>
 * Credentials are not part of this record; see {@link CredentialsProvider}.
 *
 * @since 1.0
 */
public record ScraperConfig(
    OperatingWindow operatingWindow,
    Duration minDelay,
    Duration maxDelay,
    Duration shortDelayMin,
    Duration shortDelayMax,
    Duration scrollDelayMin,
    Duration scrollDelayMax,
    boolean headless,
    int timeoutMs,
    Path dataDir,
    int maxRecordsPerRun,
    int discoveryBudget,
    String baseUrl,
    String loginPath
) {
    public static final String JSON_FILE = "profiles.json";
    public static final String CSV_FILE = "profiles.csv";
    public static final String LEDGER_FILE = "scraped_urls.txt";
    public static final String STORAGE_STATE_FILE = "storage-state.json";

    static final String DEFAULT_DAYS = "MON,TUE,WED,THU,FRI";
    static final String DEFAULT_START = "09:00";
    static final String DEFAULT_END = "16:30";
    static final String DEFAULT_TIMEZONE = "America/New_York";

    public ScraperConfig {
        if (operatingWindow == null) throw new IllegalArgumentException("operatingWindow is required");
        if (dataDir == null) throw new IllegalArgumentException("dataDir is required");
        if (baseUrl == null || baseUrl.isBlank()) throw new IllegalArgumentException("baseUrl is required");
        baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        loginPath = loginPath == null || loginPath.isBlank() ? "/login" : loginPath;
    }

    /**
     * Builds the configuration from environment variables and system properties.
     * @return validated configuration
     * @throws ConfigurationException if any value is malformed or out of range
     */
    public static ScraperConfig fromEnvironment() throws ConfigurationException {
        return from(ScraperConfig::envOrProp);
    }

    /**
     * Builds the configuration from an arbitrary key lookup. A {@code null} result means "use the default".
     * @param lookup key to raw value function
     * @return validated configuration
     * @throws ConfigurationException if any value is malformed or out of range
     */
    public static ScraperConfig from(Function<String, String> lookup) throws ConfigurationException {
        Set<DayOfWeek> days = parseDays(value(lookup, "SCRAPER_OPERATING_DAYS", DEFAULT_DAYS));
        LocalTime start = parseTime("SCRAPER_OPERATING_START", value(lookup, "SCRAPER_OPERATING_START", DEFAULT_START));
        LocalTime end = parseTime("SCRAPER_OPERATING_END", value(lookup, "SCRAPER_OPERATING_END", DEFAULT_END));
        if (start.isAfter(end)) {
            throw new ConfigurationException("Operating window start " + start + " is after end " + end);
        }
        String zone = value(lookup, "SCRAPER_TIMEZONE", DEFAULT_TIMEZONE);

        Duration minDelay = seconds(lookup, "SCRAPER_MIN_DELAY", "60");
        Duration maxDelay = seconds(lookup, "SCRAPER_MAX_DELAY", "600");
        Duration shortMin = seconds(lookup, "SCRAPER_SHORT_DELAY_MIN", "2");
        Duration shortMax = seconds(lookup, "SCRAPER_SHORT_DELAY_MAX", "4");
        Duration scrollMin = seconds(lookup, "SCRAPER_SCROLL_DELAY_MIN", "1");
        Duration scrollMax = seconds(lookup, "SCRAPER_SCROLL_DELAY_MAX", "3");

        boolean headless = Boolean.parseBoolean(value(lookup, "SCRAPER_HEADLESS", "false"));
        int timeoutMs = positiveInt(lookup, "SCRAPER_TIMEOUT_MS", "10000");
        Path dataDir = Paths.get(value(lookup, "SCRAPER_DATA_DIR", "scraped-data"));
        int maxRecords = positiveInt(lookup, "SCRAPER_MAX_RECORDS", "50");
        int budget = positiveInt(lookup, "SCRAPER_DISCOVERY_BUDGET", "3");
        String baseUrl = value(lookup, "SCRAPER_BASE_URL", "https://www.linkedin.com");
        String loginPath = value(lookup, "SCRAPER_LOGIN_PATH", "/login");

        return new ScraperConfig(new OperatingWindow(days, start, end, zone),
            minDelay, maxDelay, shortMin, shortMax, scrollMin, scrollMax,
            headless, timeoutMs, dataDir, maxRecords, budget, baseUrl, loginPath);
    }

    public Path jsonPath() {
        return dataDir.resolve(JSON_FILE);
    }

    public Path csvPath() {
        return dataDir.resolve(CSV_FILE);
    }

    public Path ledgerPath() {
        return dataDir.resolve(LEDGER_FILE);
    }

    public Path storageStatePath() {
        return dataDir.resolve(STORAGE_STATE_FILE);
    }

    public String loginUrl() {
        return baseUrl + (loginPath.startsWith("/") ? loginPath : "/" + loginPath);
    }

    static String envOrProp(String key) {
        String ev = System.getenv(key);
        if (ev != null && !ev.isBlank()) return ev;
        return System.getProperty(key);
    }

    private static String value(Function<String, String> lookup, String key, String defaultVal) {
        String v = lookup.apply(key);
        return v == null || v.isBlank() ? defaultVal : v.trim();
    }

    static Set<DayOfWeek> parseDays(String raw) throws ConfigurationException {
        Set<DayOfWeek> days = EnumSet.noneOf(DayOfWeek.class);
        for (String token : raw.split("[,\\s]+")) {
            if (token.isEmpty()) continue;
            days.add(parseDay(token));
        }
        if (days.isEmpty()) {
            throw new ConfigurationException("SCRAPER_OPERATING_DAYS must name at least one day");
        }
        return days;
    }

    private static DayOfWeek parseDay(String token) throws ConfigurationException {
        if (token.chars().allMatch(Character::isDigit)) {
            int idx = Integer.parseInt(token);
            if (idx < 0 || idx > 6) {
                throw new ConfigurationException("Weekday index out of range 0-6: " + token);
            }
            // 0 = Monday
            return DayOfWeek.of(idx + 1);
        }
        String upper = token.toUpperCase(Locale.ROOT);
        for (DayOfWeek day : DayOfWeek.values()) {
            if (day.name().equals(upper) || day.name().startsWith(upper) && upper.length() >= 3) {
                return day;
            }
        }
        throw new ConfigurationException("Unknown weekday: " + token);
    }

    private static LocalTime parseTime(String key, String raw) throws ConfigurationException {
        try {
            return LocalTime.parse(raw);
        } catch (DateTimeParseException e) {
            throw new ConfigurationException(key + " is not a valid HH:mm time: " + raw, e);
        }
    }

    private static Duration seconds(Function<String, String> lookup, String key, String defaultVal) throws ConfigurationException {
        String raw = value(lookup, key, defaultVal);
        try {
            double secs = Double.parseDouble(raw);
            if (secs < 0 || Double.isNaN(secs) || Double.isInfinite(secs)) {
                throw new ConfigurationException(key + " must be a non-negative number of seconds: " + raw);
            }
            return Duration.ofMillis(Math.round(secs * 1000));
        } catch (NumberFormatException e) {
            throw new ConfigurationException(key + " is not a number: " + raw, e);
        }
    }

    private static int positiveInt(Function<String, String> lookup, String key, String defaultVal) throws ConfigurationException {
        String raw = value(lookup, key, defaultVal);
        try {
            int v = Integer.parseInt(raw);
            if (v <= 0) throw new ConfigurationException(key + " must be positive: " + raw);
            return v;
        } catch (NumberFormatException e) {
            throw new ConfigurationException(key + " is not an integer: " + raw, e);
        }
    }
}
