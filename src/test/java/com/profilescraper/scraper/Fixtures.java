package com.profilescraper.scraper;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.LocalTime;
import java.util.EnumSet;
import java.util.List;
import java.util.Random;

final class Fixtures {
    static final String BASE_URL = "https://www.linkedin.com";
    static final String NEW_YORK = "America/New_York";

    private Fixtures() {}

    static OperatingWindow weekdayWindow() {
        return new OperatingWindow(EnumSet.range(DayOfWeek.MONDAY, DayOfWeek.FRIDAY),
            LocalTime.of(9, 0), LocalTime.of(16, 30), NEW_YORK);
    }

    /**
     * Production-like long delays (60-600s) and zero-length interaction delays.
     */
    static PacingGenerator pacing() {
        try {
            return new PacingGenerator(Duration.ofSeconds(60), Duration.ofSeconds(600),
                Duration.ZERO, Duration.ZERO, Duration.ZERO, Duration.ZERO, new Random(42));
        } catch (ConfigurationException e) {
            throw new IllegalStateException(e);
        }
    }

    static RecordIdentifier profile(String slug) {
        return RecordIdentifier.of(BASE_URL + "/in/" + slug);
    }

    static ScrapedRecord record(String slug, String scrapedAt) {
        return new ScrapedRecord(profile(slug).value(), scrapedAt, "Name " + slug, "Engineer", "New York", "",
            List.of(new ExperienceEntry("Engineer", "Acme", "2020 - Present", "", "")),
            List.of(), List.of("Java"), List.of(), List.of());
    }

    /**
     * A record carrying only its identity, as read from a page with none of the profile sections.
     */
    static ScrapedRecord emptyRecord(RecordIdentifier id, String scrapedAt) {
        return new ScrapedRecord(id.value(), scrapedAt, "", "", "", "", List.of(), List.of(), List.of(), List.of(), List.of());
    }
}
