package com.profilescraper.scraper;

/**
 * Top-level scraping run: authenticate, discover, then extract and persist candidates one by one.
 */
public interface ScraperServiceInterface {
    /**
     * Runs once. Per-record failures and voluntary stops are reported in the summary, not thrown.
     * @param location   listing URL to discover candidates from
     * @param maxRecords maximum records to persist in this run
     * @return summary with the stop reason
     * @throws ConfigurationException if credentials cannot be resolved; no session is opened
     * @throws SessionException       if the session cannot be opened or authenticated; it is still released
     */
    RunSummary run(String location, int maxRecords) throws ConfigurationException, SessionException;

    /**
     * Asks a running loop to stop at its next iteration boundary. Safe to call from another thread;
     * a pending inter-record delay is cut short.
     */
    void requestStop();

    RunState getState();
}
