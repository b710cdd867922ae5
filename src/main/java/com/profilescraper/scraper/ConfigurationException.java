package com.profilescraper.scraper;

/**
 * Invalid or missing configuration (credentials, pacing bounds, window). Fatal before any browser session is opened.
 */
public class ConfigurationException extends ScraperException {
    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
