package com.profilescraper.scraper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.Locale;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Main entry point for the profile scraper.
 * Discovers profile links on a listing page, extracts each profile and appends it to the JSON and CSV stores
 * in the data directory, honouring the configured operating window and pacing.
 * <p>
 * Usage: {@code profile-scraper <listing-url> [max-records] [--yes]}
 *
 * @since 1.0
 */
public class Main {
    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    static final int EXIT_OK = 0;
    static final int EXIT_CONFIG = 1;
    static final int EXIT_FAILURE = 2;
    private static final long SHUTDOWN_GRACE_SECONDS = 30;

    /**
     * Parsed command line.
     *
     * @param location   listing URL to discover profiles on
     * @param maxRecords record budget, or {@code null} to use the configured default
     * @param confirmed  whether {@code --yes} was given
     */
    record Arguments(String location, Integer maxRecords, boolean confirmed) {}

    /**
     * Parses {@code <listing-url> [max-records] [--yes]}.
     * @param args raw arguments
     * @return parsed arguments
     * @throws IllegalArgumentException on a missing location, a non-positive count or extra arguments
     */
    static Arguments parseArgs(String[] args) {
        String location = null;
        Integer maxRecords = null;
        boolean confirmed = false;
        for (String arg : args == null ? new String[0] : args) {
            String a = arg.trim();
            if (a.isEmpty()) continue;
            if (a.equals("--yes") || a.equals("-y")) {
                confirmed = true;
            } else if (location == null) {
                location = a;
            } else if (maxRecords == null) {
                try {
                    maxRecords = Integer.parseInt(a);
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException("max-records must be an integer: " + a, e);
                }
                if (maxRecords <= 0) throw new IllegalArgumentException("max-records must be positive: " + a);
            } else {
                throw new IllegalArgumentException("Unexpected argument: " + a);
            }
        }
        if (location == null) throw new IllegalArgumentException("A listing URL is required");
        return new Arguments(location, maxRecords, confirmed);
    }

    /**
     * Asks the operator to confirm the run.
     * @return true if the answer starts with "y"
     */
    static boolean confirm(InputStream in, PrintStream out, String location, int maxRecords) {
        out.printf("About to scrape up to %d profiles from %s. Continue? (y/N): ", maxRecords, location);
        out.flush();
        try {
            String input = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8)).readLine();
            return input != null && input.trim().toLowerCase(Locale.ROOT).startsWith("y");
        } catch (IOException e) {
            logger.warn("Could not read confirmation: {}", e.getMessage());
            return false;
        }
    }

    /**
     * Wires the production components for one run.
     * @param config validated configuration
     * @return a fresh, single-use scraper
     * @throws ConfigurationException if the pacing bounds are invalid
     */
    static ScraperService createScraperService(ScraperConfig config) throws ConfigurationException {
        Sleeper sleeper = Sleeper.threadSleeper();
        PacingGenerator pacing = new PacingGenerator(config);
        WindowOracle windowOracle = new WindowOracle(config.operatingWindow());
        FileDedupLedger ledger = new FileDedupLedger(config.ledgerPath());
        PersistenceSink sink = new FilePersistenceSink(
            new JsonRecordStore(config.jsonPath()), new CsvService(config.csvPath()), ledger);
        return new ScraperService(
            CredentialsProvider.fromEnvironment(),
            new PlaywrightSessionProvider(config, sleeper),
            new AuthService(config, pacing, sleeper),
            new LinkDiscoveryService(ledger, pacing, sleeper, config.baseUrl()),
            new ProfileRecordExtractor(pacing, sleeper, Clock.systemUTC(), windowOracle.zone()),
            sink,
            ledger,
            windowOracle,
            pacing,
            sleeper,
            config.discoveryBudget());
    }

    /**
     * Runs the CLI and returns the process exit code.
     */
    static int run(String[] args, InputStream in, PrintStream out) {
        Arguments arguments;
        try {
            arguments = parseArgs(args);
        } catch (IllegalArgumentException e) {
            out.println("Error: " + e.getMessage());
            out.println("Usage: profile-scraper <listing-url> [max-records] [--yes]");
            return EXIT_CONFIG;
        }

        ScraperConfig config;
        ScraperService scraper;
        try {
            config = ScraperConfig.fromEnvironment();
            scraper = createScraperService(config);
        } catch (ConfigurationException e) {
            logger.error("Configuration error: {}", e.getMessage());
            return EXIT_CONFIG;
        }

        int maxRecords = arguments.maxRecords() != null ? arguments.maxRecords() : config.maxRecordsPerRun();
        WindowDecision window = new WindowOracle(config.operatingWindow()).evaluateNow();
        out.println("Operating window: " + window.reason());
        out.println("Data directory: " + config.dataDir().toAbsolutePath());
        if (!arguments.confirmed() && !confirm(in, out, arguments.location(), maxRecords)) {
            out.println("Aborted.");
            return EXIT_OK;
        }

        CountDownLatch finished = new CountDownLatch(1);
        Thread hook = new Thread(() -> {
            scraper.requestStop();
            try {
                if (!finished.await(SHUTDOWN_GRACE_SECONDS, TimeUnit.SECONDS)) {
                    logger.warn("Run did not drain within {} seconds of shutdown.", SHUTDOWN_GRACE_SECONDS);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "profile-scraper-shutdown");
        Runtime.getRuntime().addShutdownHook(hook);

        try {
            RunSummary summary = scraper.run(arguments.location(), maxRecords);
            out.println("Scraping complete: " + summary.describe());
            if (!summary.detail().isEmpty()) out.println(summary.detail());
            out.println("Results saved to " + config.jsonPath() + " and " + config.csvPath());
            return EXIT_OK;
        } catch (ConfigurationException e) {
            logger.error("Configuration error: {}", e.getMessage());
            return EXIT_CONFIG;
        } catch (SessionException e) {
            logger.error("Session failure: {}", e.getMessage(), e);
            out.println("Scraping failed: " + StopReason.FAILED.description());
            return EXIT_FAILURE;
        } catch (RuntimeException e) {
            logger.error("Fatal error: {}", e.getMessage(), e);
            out.println("Scraping failed: " + StopReason.FAILED.description());
            return EXIT_FAILURE;
        } finally {
            finished.countDown();
            try {
                Runtime.getRuntime().removeShutdownHook(hook);
            } catch (IllegalStateException e) {
                logger.debug("Shutdown already in progress; hook stays registered.");
            }
        }
    }

    /**
     * Main application entry point.
     * @param args Command-line arguments
     */
    public static void main(String[] args) {
        System.exit(run(args, System.in, System.out));
    }
}
