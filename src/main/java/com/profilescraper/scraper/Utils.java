package com.profilescraper.scraper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Callable;

/**
 * Small helpers shared by the browser-facing services.
 *
 * @since 1.0
 */
public final class Utils {
    private static final Logger logger = LoggerFactory.getLogger(Utils.class);

    private Utils() {}

    /**
     * Runs an action up to {@code maxAttempts} times with exponential backoff (1s, 2s, 4s, ...).
     * @param action     action to execute
     * @param maxAttempts total attempts, at least 1
     * @param actionDesc description for logging
     * @param sleeper    suspension used between attempts
     * @param <T>        result type
     * @return result of the first successful attempt
     * @throws Exception the last failure once all attempts are used
     * @throws InterruptedException if interrupted while backing off
     */
    public static <T> T retry(Callable<T> action, int maxAttempts, String actionDesc, Sleeper sleeper) throws Exception {
        int attempts = Math.max(1, maxAttempts);
        Exception last = null;
        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                return action.call();
            } catch (InterruptedException e) {
                throw e;
            } catch (Exception e) {
                last = e;
                logger.warn("Failed {} (attempt {}/{}): {}", actionDesc, attempt, attempts, e.getMessage());
                if (attempt < attempts) {
                    sleeper.sleep(Duration.ofSeconds(1L << (attempt - 1)));
                }
            }
        }
        logger.error("Giving up on {} after {} attempts.", actionDesc, attempts);
        throw last;
    }

    /**
     * Collapses runs of whitespace, including newlines, into single spaces.
     */
    public static String normalizeWhitespace(String s) {
        return s == null ? "" : s.replaceAll("\\s+", " ").trim();
    }
}
