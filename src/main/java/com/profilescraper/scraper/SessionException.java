package com.profilescraper.scraper;

/**
 * Authentication or navigation failure on the browser session. Fatal for a run when raised outside the per-record loop.
 */
public class SessionException extends ScraperException {
    public SessionException(String message) {
        super(message);
    }

    public SessionException(String message, Throwable cause) {
        super(message, cause);
    }
}
