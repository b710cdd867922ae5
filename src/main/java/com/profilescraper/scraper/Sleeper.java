package com.profilescraper.scraper;

import java.time.Duration;

/**
 * The scraper's only suspension primitive. Components ask {@link PacingGenerator} for a duration and
 * hand it to a sleeper; tests substitute one that records instead of blocking.
 */
@FunctionalInterface
public interface Sleeper {
    void sleep(Duration duration) throws InterruptedException;

    static Sleeper threadSleeper() {
        return duration -> {
            if (!duration.isNegative() && !duration.isZero()) {
                Thread.sleep(duration.toMillis());
            }
        };
    }
}
