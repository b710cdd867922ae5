package com.profilescraper.scraper;

import java.util.Set;

/**
 * Persistent set of identifiers that have been fully processed.
 * <p>
 * The ledger is the only retry boundary: anything not in it is eligible for processing on the next run.
 * It is append-only; implementations never rewrite the store wholesale.
 */
public interface DedupLedger {
    /**
     * Reads the persisted set, replacing the in-memory view. A missing store is an empty set; an
     * unreadable one is logged and treated as empty.
     * @return snapshot of the loaded identifiers
     */
    Set<RecordIdentifier> load();

    /**
     * O(1) membership against the loaded set plus everything appended by this process.
     */
    boolean contains(RecordIdentifier id);

    /**
     * Durably records an identifier before returning. Appending an identifier already present is a no-op.
     * @throws PersistenceException if the write or sync fails
     */
    void append(RecordIdentifier id) throws PersistenceException;

    /**
     * Number of distinct identifiers currently known.
     */
    int size();
}
