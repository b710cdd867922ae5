package com.profilescraper.scraper;

import java.time.Duration;
import java.util.Random;

/**
 * Produces randomized delays for human-plausible pacing. It never blocks; callers decide whether
 * and when to suspend on the returned duration (see {@link Sleeper}).
 * <ul>
 *   <li>{@link #longDelay()}: whole seconds drawn uniformly from the inter-record range, both ends inclusive.</li>
 *   <li>{@link #shortDelay()} / {@link #scrollDelay()}: millisecond-resolution draws for intra-page interactions.</li>
 * </ul>
 * Bounds are checked once at construction.
 *
 * @since 1.0
 */
public class PacingGenerator {
    private final long longMinSeconds;
    private final long longMaxSeconds;
    private final Duration shortMin;
    private final Duration shortMax;
    private final Duration scrollMin;
    private final Duration scrollMax;
    private final Random random;

    public PacingGenerator(ScraperConfig config) throws ConfigurationException {
        this(config.minDelay(), config.maxDelay(), config.shortDelayMin(), config.shortDelayMax(),
            config.scrollDelayMin(), config.scrollDelayMax(), new Random());
    }

    public PacingGenerator(Duration longMin, Duration longMax, Duration shortMin, Duration shortMax,
                           Duration scrollMin, Duration scrollMax, Random random) throws ConfigurationException {
        requireOrdered("inter-record delay", longMin, longMax);
        requireOrdered("interaction delay", shortMin, shortMax);
        requireOrdered("scroll delay", scrollMin, scrollMax);
        this.longMinSeconds = Math.floorDiv(longMin.toMillis() + 999, 1000);
        this.longMaxSeconds = Math.floorDiv(longMax.toMillis(), 1000);
        if (longMinSeconds > longMaxSeconds) {
            throw new ConfigurationException("inter-record delay range " + longMin + ".." + longMax
                + " contains no whole second");
        }
        this.shortMin = shortMin;
        this.shortMax = shortMax;
        this.scrollMin = scrollMin;
        this.scrollMax = scrollMax;
        this.random = random == null ? new Random() : random;
    }

    /**
     * Delay between two records, in whole seconds within the configured range.
     * Fractional bounds are narrowed to the whole seconds they contain.
     */
    public Duration longDelay() {
        long span = longMaxSeconds - longMinSeconds + 1;
        return Duration.ofSeconds(longMinSeconds + (long) (random.nextDouble() * span));
    }

    public Duration shortDelay() {
        return uniform(shortMin, shortMax);
    }

    /**
     * Interaction delay with caller-supplied bounds; a reversed or negative pair falls back to the configured range.
     */
    public Duration shortDelay(Duration min, Duration max) {
        if (min == null || max == null || min.isNegative() || min.compareTo(max) > 0) {
            return shortDelay();
        }
        return uniform(min, max);
    }

    public Duration scrollDelay() {
        return uniform(scrollMin, scrollMax);
    }

    private Duration uniform(Duration min, Duration max) {
        long lo = min.toMillis();
        long hi = max.toMillis();
        if (hi == lo) return Duration.ofMillis(lo);
        return Duration.ofMillis(lo + (long) (random.nextDouble() * (hi - lo + 1)));
    }

    private static void requireOrdered(String what, Duration min, Duration max) throws ConfigurationException {
        if (min == null || max == null) {
            throw new ConfigurationException(what + " bounds are required");
        }
        if (min.isNegative()) {
            throw new ConfigurationException(what + " minimum must not be negative: " + min);
        }
        if (min.compareTo(max) > 0) {
            throw new ConfigurationException(what + " minimum " + min + " exceeds maximum " + max);
        }
    }
}
