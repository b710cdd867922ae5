package com.profilescraper.scraper;

/**
 * Unrecoverable I/O on one of the record stores. The ledger is never appended when this is raised.
 */
public class PersistenceException extends ScraperException {
    public PersistenceException(String message) {
        super(message);
    }

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
