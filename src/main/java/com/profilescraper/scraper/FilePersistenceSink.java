package com.profilescraper.scraper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link PersistenceSink} over the JSON store, the CSV store and the ledger, written in that order.
 * <p>
 * The ledger append is strictly last. A failure in either projection prevents it, so the record stays
 * eligible for the next run; a crash between the projections and the ledger yields at most a duplicate
 * record on retry, which {@link JsonRecordStore#readLatestPerProfile()} collapses on read.
 *
 * @since 1.0
 */
public class FilePersistenceSink implements PersistenceSink {
    private static final Logger logger = LoggerFactory.getLogger(FilePersistenceSink.class);

    private final JsonRecordStore jsonStore;
    private final CsvServiceInterface csvService;
    private final DedupLedger ledger;

    public FilePersistenceSink(JsonRecordStore jsonStore, CsvServiceInterface csvService, DedupLedger ledger) {
        this.jsonStore = jsonStore;
        this.csvService = csvService;
        this.ledger = ledger;
    }

    @Override
    public void persist(ScrapedRecord record) throws PersistenceException {
        RecordIdentifier id;
        try {
            id = record.identifier();
        } catch (IllegalArgumentException e) {
            throw new PersistenceException("Record has no usable profile_url: '" + record.profileUrl() + "'", e);
        }
        jsonStore.append(record);
        csvService.appendRecord(record);
        ledger.append(id);
        logger.info("Persisted {}", id);
    }
}
