package com.profilescraper.scraper;

import com.fasterxml.jackson.annotation.JsonProperty;

public record CertificationEntry(
    @JsonProperty("name") String name,
    @JsonProperty("issuer") String issuer,
    @JsonProperty("date") String date
) {
    public CertificationEntry {
        name = ScrapedRecord.orEmpty(name);
        issuer = ScrapedRecord.orEmpty(issuer);
        date = ScrapedRecord.orEmpty(date);
    }
}
