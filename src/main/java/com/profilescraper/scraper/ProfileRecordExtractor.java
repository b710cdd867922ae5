package com.profilescraper.scraper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static com.profilescraper.scraper.ProfileFieldRegistry.*;

/**
 * {@link RecordExtractor} for profile pages, driven entirely by {@link ProfileFieldRegistry} selectors.
 * <p>
 * Per record: navigate, scroll until the page stops growing (bounded), return to the top, expand
 * collapsed sections ("see more" on about, "show all" on experience and skills), then read every field
 * through the {@link FieldReader} contract. Each interaction is followed by a short randomized pause.
 * An interrupt during a pause does not abort the read; the flag is restored for the caller to observe.
 *
 * @since 1.0
 */
public class ProfileRecordExtractor implements RecordExtractor {
    private static final Logger logger = LoggerFactory.getLogger(ProfileRecordExtractor.class);
    static final int MAX_REVEAL_SCROLLS = 15;

    private final PacingGenerator pacing;
    private final Sleeper sleeper;
    private final Clock clock;
    private final ZoneId zone;

    public ProfileRecordExtractor(PacingGenerator pacing, Sleeper sleeper, Clock clock, ZoneId zone) {
        this.pacing = pacing;
        this.sleeper = sleeper;
        this.clock = clock;
        this.zone = zone;
    }

    @Override
    public ScrapedRecord extract(PageSession session, RecordIdentifier id) throws ExtractionException {
        logger.info("Extracting profile data from: {}", id);
        try {
            session.navigate(id.value());
        } catch (SessionException e) {
            throw new ExtractionException("Could not open " + id + ": " + e.getMessage(), e);
        }
        try {
            pause(pacing.shortDelay(Duration.ofSeconds(3), Duration.ofSeconds(5)));
            revealWholePage(session);
            ScrapedRecord record = read(session, id);
            logger.info("Extracted profile for: {} ({} experience, {} education, {} skills)",
                record.name().isEmpty() ? "Unknown" : record.name(),
                record.experience().size(), record.education().size(), record.skills().size());
            return record;
        } catch (RuntimeException e) {
            // driver-level failure (closed page, crashed browser)
            throw new ExtractionException("Session failure while reading " + id + ": " + e.getMessage(), e);
        }
    }

    private void revealWholePage(PageSession session) {
        for (int i = 0; i < MAX_REVEAL_SCROLLS; i++) {
            boolean grew = session.revealMore();
            pause(pacing.scrollDelay());
            if (!grew) break;
        }
        session.scrollToTop();
        pause(pacing.scrollDelay());
    }

    ScrapedRecord read(PageSession session, RecordIdentifier id) {
        String name = Utils.normalizeWhitespace(session.firstText(selectors(NAME)));
        String headline = Utils.normalizeWhitespace(session.firstText(selectors(HEADLINE)));
        String location = Utils.normalizeWhitespace(session.firstText(selectors(LOCATION)));

        expand(session, ABOUT_EXPAND);
        String about = session.firstText(selectors(ABOUT));

        expand(session, EXPERIENCE_SHOW_ALL);
        List<ExperienceEntry> experience = new ArrayList<>();
        for (FieldReader item : session.firstScopes(selectors(EXPERIENCE_ITEM))) {
            ExperienceEntry entry = new ExperienceEntry(
                item.firstText(selectors(EXPERIENCE_TITLE)),
                item.firstText(selectors(EXPERIENCE_COMPANY)),
                item.firstText(selectors(EXPERIENCE_DATES)),
                item.firstText(selectors(EXPERIENCE_LOCATION)),
                item.firstText(selectors(EXPERIENCE_DESCRIPTION)));
            if (!entry.title().isEmpty() || !entry.company().isEmpty()) experience.add(entry);
        }

        List<EducationEntry> education = new ArrayList<>();
        for (FieldReader item : session.firstScopes(selectors(EDUCATION_ITEM))) {
            EducationEntry entry = new EducationEntry(
                item.firstText(selectors(EDUCATION_SCHOOL)),
                item.firstText(selectors(EDUCATION_DEGREE)),
                item.firstText(selectors(EDUCATION_DATES)));
            if (!entry.school().isEmpty()) education.add(entry);
        }

        expand(session, SKILLS_SHOW_ALL);
        List<String> skills = distinctTexts(session, SKILL);

        List<CertificationEntry> certifications = new ArrayList<>();
        for (FieldReader item : session.firstScopes(selectors(CERTIFICATION_ITEM))) {
            CertificationEntry entry = new CertificationEntry(
                item.firstText(selectors(CERTIFICATION_NAME)),
                item.firstText(selectors(CERTIFICATION_ISSUER)),
                item.firstText(selectors(CERTIFICATION_DATE)));
            if (!entry.name().isEmpty()) certifications.add(entry);
        }

        List<String> languages = distinctTexts(session, LANGUAGE);

        return new ScrapedRecord(id.value(), ZonedDateTime.now(clock.withZone(zone)).format(ScrapedRecord.TIMESTAMP_FORMAT),
            name, headline, location, about, experience, education, skills, certifications, languages);
    }

    private void expand(PageSession session, String field) {
        for (String selector : selectors(field)) {
            if (session.click(selector)) {
                pause(pacing.shortDelay());
                return;
            }
        }
    }

    private static List<String> distinctTexts(FieldReader reader, String field) {
        Set<String> out = new LinkedHashSet<>();
        for (String selector : selectors(field)) {
            out.addAll(reader.texts(selector));
            if (!out.isEmpty()) break;
        }
        return new ArrayList<>(out);
    }

    private void pause(Duration d) {
        try {
            sleeper.sleep(d);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
