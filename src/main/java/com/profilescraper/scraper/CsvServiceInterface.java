package com.profilescraper.scraper;

import java.util.List;

/**
 * Tabular projection of scraped records.
 */
public interface CsvServiceInterface {
    /**
     * Fixed column order of the tabular store.
     */
    List<String> columns();

    /**
     * Flattens a record into one row matching {@link #columns()}.
     */
    String[] toRow(ScrapedRecord record);

    /**
     * Appends one row, writing the header first if the file is new or empty.
     * @throws PersistenceException if writing fails
     */
    void appendRecord(ScrapedRecord record) throws PersistenceException;
}
