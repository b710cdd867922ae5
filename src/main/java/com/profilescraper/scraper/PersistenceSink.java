package com.profilescraper.scraper;

/**
 * Durable, all-or-nothing (from the caller's view) storage of one record.
 */
public interface PersistenceSink {
    /**
     * Writes both projections, then appends the record's identifier to the ledger.
     * @throws PersistenceException if any write fails; the ledger is then left untouched
     */
    void persist(ScrapedRecord record) throws PersistenceException;
}
