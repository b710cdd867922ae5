package com.profilescraper.scraper;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;

import static com.profilescraper.scraper.ProfileFieldRegistry.*;
import static org.junit.jupiter.api.Assertions.*;

class ProfileRecordExtractorTest {
    private static final RecordIdentifier JANE = Fixtures.profile("jane-doe");

    private ProfileRecordExtractor extractor;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2024-03-05T15:04:05Z"), ZoneOffset.UTC);
        extractor = new ProfileRecordExtractor(Fixtures.pacing(), new RecordingSleeper(), clock, ZoneId.of(Fixtures.NEW_YORK));
    }

    private static String primary(String field) {
        return selectors(field).get(0);
    }

    @Test
    void testReadsEveryField() throws Exception {
        FakePageSession page = new FakePageSession();
        page.withText(primary(NAME), "Jane\n Doe")
            .withText(primary(HEADLINE), "Staff Engineer at Acme")
            .withText(primary(LOCATION), "New York, NY")
            .withText(primary(ABOUT), "Builds things.")
            .withClickable(primary(ABOUT_EXPAND))
            .withClickable(primary(EXPERIENCE_SHOW_ALL))
            .withScopes(primary(EXPERIENCE_ITEM),
                new FakeFieldReader()
                    .withText(primary(EXPERIENCE_TITLE), "Staff Engineer")
                    .withText(primary(EXPERIENCE_COMPANY), "Acme")
                    .withText(primary(EXPERIENCE_DATES), "2021 - Present")
                    .withText(primary(EXPERIENCE_LOCATION), "Remote")
                    .withText(primary(EXPERIENCE_DESCRIPTION), "Platform team"),
                new FakeFieldReader().withText(primary(EXPERIENCE_DATES), "2019"))
            .withScopes(primary(EDUCATION_ITEM),
                new FakeFieldReader()
                    .withText(primary(EDUCATION_SCHOOL), "State University")
                    .withText(primary(EDUCATION_DEGREE), "BSc Computer Science")
                    .withText(primary(EDUCATION_DATES), "2010 - 2014"))
            .withTexts(primary(SKILL), "Java", "Kotlin", "Java")
            .withScopes(primary(CERTIFICATION_ITEM),
                new FakeFieldReader()
                    .withText(primary(CERTIFICATION_NAME), "Cloud Architect")
                    .withText(primary(CERTIFICATION_ISSUER), "Cloud Co")
                    .withText(primary(CERTIFICATION_DATE), "Issued Jan 2023"))
            .withTexts(primary(LANGUAGE), "English", "Spanish");

        ScrapedRecord record = extractor.extract(page, JANE);

        assertEquals(JANE.value(), record.profileUrl());
        assertEquals("Jane Doe", record.name());
        assertEquals("Staff Engineer at Acme", record.headline());
        assertEquals("New York, NY", record.location());
        assertEquals("Builds things.", record.about());
        assertEquals(List.of(new ExperienceEntry("Staff Engineer", "Acme", "2021 - Present", "Remote", "Platform team")),
            record.experience());
        assertEquals(List.of(new EducationEntry("State University", "BSc Computer Science", "2010 - 2014")), record.education());
        assertEquals(List.of("Java", "Kotlin"), record.skills());
        assertEquals(List.of(new CertificationEntry("Cloud Architect", "Cloud Co", "Issued Jan 2023")), record.certifications());
        assertEquals(List.of("English", "Spanish"), record.languages());
        assertTrue(page.clicks.containsAll(List.of(primary(ABOUT_EXPAND), primary(EXPERIENCE_SHOW_ALL))));
        assertEquals(List.of(JANE.value()), page.navigations);
    }

    @Test
    void testMissingFieldsReadAsEmpty() throws Exception {
        ScrapedRecord record = extractor.extract(new FakePageSession(), JANE);

        assertEquals(Fixtures.emptyRecord(JANE, "2024-03-05 10:04:05"), record);
    }

    @Test
    void testFallbackSelectorIsUsedWhenPrimaryIsAbsent() throws Exception {
        FakePageSession page = new FakePageSession();
        page.withText(selectors(NAME).get(1), "Fallback Name");

        assertEquals("Fallback Name", extractor.extract(page, JANE).name());
    }

    @Test
    void testRevealScrollingIsBounded() throws Exception {
        FakePageSession page = new FakePageSession();
        page.alwaysGrows = true;

        extractor.extract(page, JANE);

        assertEquals(ProfileRecordExtractor.MAX_REVEAL_SCROLLS, page.revealCalls);
        assertEquals(1, page.scrollToTopCalls);
    }

    @Test
    void testNavigationFailureIsAnExtractionFailure() {
        FakePageSession page = new FakePageSession();
        page.failingUrls.add(JANE.value());

        ExtractionException e = assertThrows(ExtractionException.class, () -> extractor.extract(page, JANE));
        assertInstanceOf(SessionException.class, e.getCause());
    }

    @Test
    void testDriverFailureIsAnExtractionFailure() {
        FakePageSession page = new FakePageSession() {
            @Override
            public boolean revealMore() {
                throw new IllegalStateException("Target page, context or browser has been closed");
            }
        };

        assertThrows(ExtractionException.class, () -> extractor.extract(page, JANE));
    }
}
