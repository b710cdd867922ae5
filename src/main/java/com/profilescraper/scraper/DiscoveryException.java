package com.profilescraper.scraper;

/**
 * Recoverable failure while collecting candidate links; the run ends with zero candidates.
 */
public class DiscoveryException extends ScraperException {
    public DiscoveryException(String message) {
        super(message);
    }

    public DiscoveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
