package com.profilescraper.scraper;

/**
 * Per-record failure while reading a profile page. The candidate is skipped and stays eligible for a later run.
 */
public class ExtractionException extends ScraperException {
    public ExtractionException(String message) {
        super(message);
    }

    public ExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
