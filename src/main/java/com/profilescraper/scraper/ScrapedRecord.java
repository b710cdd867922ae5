package com.profilescraper.scraper;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Objects;

/**
 * Immutable profile record produced by a {@link RecordExtractor} and stored by a {@link PersistenceSink}.
 * <p>
 * Shape:
 * <ul>
 *   <li>Identity: {@code profile_url} (canonical identifier) and {@code scraped_at} ({@link #TIMESTAMP_FORMAT}).</li>
 *   <li>Scalars: name, headline, location, about. Missing values are stored as empty strings.</li>
 *   <li>Repeated: experience, education, skills, certifications, languages. Missing sections are empty lists.</li>
 * </ul>
 * A record whose every field is empty is still valid and is persisted like any other.
 * <p>
 * Field names are the on-disk JSON names; {@link CsvService} flattens the same record into one row.
 *
 * @since 1.0
 */
@JsonPropertyOrder({"profile_url", "scraped_at", "name", "headline", "location", "about",
    "experience", "education", "skills", "certifications", "languages"})
public record ScrapedRecord(
    @JsonProperty("profile_url") String profileUrl,
    @JsonProperty("scraped_at") String scrapedAt,
    @JsonProperty("name") String name,
    @JsonProperty("headline") String headline,
    @JsonProperty("location") String location,
    @JsonProperty("about") String about,
    @JsonProperty("experience") List<ExperienceEntry> experience,
    @JsonProperty("education") List<EducationEntry> education,
    @JsonProperty("skills") List<String> skills,
    @JsonProperty("certifications") List<CertificationEntry> certifications,
    @JsonProperty("languages") List<String> languages
) {
    /**
     * Fixed capture timestamp format, in the operating window's timezone.
     */
    public static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    public ScrapedRecord {
        profileUrl = orEmpty(profileUrl);
        scrapedAt = orEmpty(scrapedAt);
        name = orEmpty(name);
        headline = orEmpty(headline);
        location = orEmpty(location);
        about = orEmpty(about);
        experience = copyOf(experience);
        education = copyOf(education);
        skills = copyOf(skills);
        certifications = copyOf(certifications);
        languages = copyOf(languages);
    }

    @JsonIgnore
    public RecordIdentifier identifier() {
        return RecordIdentifier.of(profileUrl);
    }

    static String orEmpty(String s) {
        return s == null ? "" : s.trim();
    }

    private static <T> List<T> copyOf(List<T> list) {
        return list == null ? List.of() : list.stream().filter(Objects::nonNull).toList();
    }
}
