package com.profilescraper.scraper;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One work-history entry. Every field is optional and defaults to an empty string.
 */
public record ExperienceEntry(
    @JsonProperty("title") String title,
    @JsonProperty("company") String company,
    @JsonProperty("dates") String dates,
    @JsonProperty("location") String location,
    @JsonProperty("description") String description
) {
    public ExperienceEntry {
        title = ScrapedRecord.orEmpty(title);
        company = ScrapedRecord.orEmpty(company);
        dates = ScrapedRecord.orEmpty(dates);
        location = ScrapedRecord.orEmpty(location);
        description = ScrapedRecord.orEmpty(description);
    }
}
