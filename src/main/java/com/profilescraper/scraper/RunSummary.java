package com.profilescraper.scraper;

/**
 * Final report of a run.
 *
 * @param processed  records extracted and persisted
 * @param failed     candidates whose extraction or persistence failed
 * @param skipped    candidates already in the ledger when reached
 * @param candidates candidates returned by discovery
 * @param stopReason why the run ended
 * @param detail     extra context for the stop (window reason, failure message), may be empty
 */
public record RunSummary(int processed, int failed, int skipped, int candidates, StopReason stopReason, String detail) {
    public RunSummary {
        detail = detail == null ? "" : detail;
    }

    /**
     * One-line description, e.g. {@code "3 processed, completed normally"}.
     */
    public String describe() {
        StringBuilder sb = new StringBuilder();
        sb.append(processed).append(" processed, ").append(stopReason.description());
        if (failed > 0 || skipped > 0) {
            sb.append(" (").append(failed).append(" failed, ").append(skipped).append(" skipped)");
        }
        return sb.toString();
    }
}
