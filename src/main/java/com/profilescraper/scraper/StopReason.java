package com.profilescraper.scraper;

/**
 * Why a run ended; each reason has a distinct user-facing description.
 */
public enum StopReason {
    COMPLETED("completed normally"),
    BUDGET_REACHED("max-record budget reached"),
    WINDOW_CLOSED("outside operating window"),
    NO_CANDIDATES("no candidates found"),
    DISCOVERY_FAILED("discovery failed"),
    INTERRUPTED("stop requested"),
    FAILED("fatal error");

    private final String description;

    StopReason(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }
}
