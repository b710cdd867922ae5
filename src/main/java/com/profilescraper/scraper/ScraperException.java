package com.profilescraper.scraper;

/**
 * Base type for every failure the scraper classifies.
 * <p>
 * Subclasses carry the propagation policy: {@link ConfigurationException} and {@link SessionException}
 * end a run, the remaining ones are absorbed by {@link ScraperService} at the loop level.
 *
 * @since 1.0
 */
public abstract class ScraperException extends Exception {
    protected ScraperException(String message) {
        super(message);
    }

    protected ScraperException(String message, Throwable cause) {
        super(message, cause);
    }
}
