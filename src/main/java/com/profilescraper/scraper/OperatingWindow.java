package com.profilescraper.scraper;

import java.time.DayOfWeek;
import java.time.LocalTime;
import java.util.Set;

/**
 * Weekly operating window: permitted weekdays plus an inclusive start/end time of day,
 * interpreted in the named timezone. Minute granularity; seconds are ignored on evaluation.
 *
 * @param days     permitted weekdays
 * @param start    first permitted minute
 * @param end      last permitted minute
 * @param zoneName IANA timezone name; resolved (with fallback) by {@link WindowOracle}
 */
public record OperatingWindow(Set<DayOfWeek> days, LocalTime start, LocalTime end, String zoneName) {
    public OperatingWindow {
        if (days == null || days.isEmpty()) throw new IllegalArgumentException("days must not be empty");
        if (start == null || end == null) throw new IllegalArgumentException("start and end are required");
        days = Set.copyOf(days);
        start = start.withSecond(0).withNano(0);
        end = end.withSecond(0).withNano(0);
    }
}
