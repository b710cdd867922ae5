package com.profilescraper.scraper;

/**
 * Outcome of a {@link WindowOracle} evaluation.
 *
 * @param permitted whether scraping may proceed
 * @param status    which rule decided
 * @param reason    human-readable explanation, stable for a given input
 */
public record WindowDecision(boolean permitted, Status status, String reason) {

    public enum Status {
        OPEN,
        WRONG_DAY,
        BEFORE_WINDOW,
        AFTER_WINDOW
    }
}
