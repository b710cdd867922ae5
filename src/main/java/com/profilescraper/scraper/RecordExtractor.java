package com.profilescraper.scraper;

/**
 * Reads one record from the page of a given identifier.
 * <p>
 * Implementations navigate and perform any revealing interaction themselves. Missing fields or sections
 * produce empty values, never an exception; only session-level failures are raised.
 */
public interface RecordExtractor {
    /**
     * @param session session to drive
     * @param id      record to read
     * @return the record, possibly with every field empty
     * @throws ExtractionException if the page could not be reached or the session died
     */
    ScrapedRecord extract(PageSession session, RecordIdentifier id) throws ExtractionException;
}
