package com.profilescraper.scraper;

/**
 * Lifecycle of one {@link ScraperService} run. {@link #CLOSED} and {@link #FAILED} are terminal.
 */
public enum RunState {
    IDLE,
    AUTHENTICATING,
    DISCOVERING,
    PROCESSING,
    DRAINING,
    CLOSED,
    FAILED
}
