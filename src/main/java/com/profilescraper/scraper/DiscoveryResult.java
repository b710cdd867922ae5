package com.profilescraper.scraper;

import java.util.List;

/**
 * Candidates found by one discovery pass, in first-seen order, already filtered against the ledger.
 *
 * @param candidates  identifiers to process
 * @param rawCount    distinct identifiers seen before ledger filtering
 * @param attempts    reveal attempts actually made
 * @param failure     set when navigation to the listing failed; candidates is then empty
 */
public record DiscoveryResult(List<RecordIdentifier> candidates, int rawCount, int attempts, DiscoveryException failure) {
    public DiscoveryResult {
        candidates = candidates == null ? List.of() : List.copyOf(candidates);
    }

    public static DiscoveryResult failed(DiscoveryException failure) {
        return new DiscoveryResult(List.of(), 0, 0, failure);
    }

    public boolean isFailed() {
        return failure != null;
    }
}
