package com.profilescraper.scraper;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One education entry; empty strings for missing sub-fields.
 */
public record EducationEntry(
    @JsonProperty("school") String school,
    @JsonProperty("degree") String degree,
    @JsonProperty("dates") String dates
) {
    public EducationEntry {
        school = ScrapedRecord.orEmpty(school);
        degree = ScrapedRecord.orEmpty(degree);
        dates = ScrapedRecord.orEmpty(dates);
    }
}
