package com.profilescraper.scraper;

/**
 * Collects candidate record identifiers from a listing or search page.
 */
public interface LinkDiscoveryInterface {
    /**
     * @param session  authenticated session; navigated to {@code location}
     * @param location absolute listing URL
     * @param budget   maximum number of reveal (scroll) attempts
     * @return deduplicated candidates not yet in the ledger; a failed result instead of an exception on navigation failure
     */
    DiscoveryResult discover(PageSession session, String location, int budget);
}
