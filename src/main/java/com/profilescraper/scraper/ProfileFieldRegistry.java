package com.profilescraper.scraper;

import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Central registry of every selector the scraper uses, for discovery, page interaction and field extraction.
 * Site markup changes are absorbed here; extraction and discovery code only refer to field names.
 * <p>
 * Sub-field selectors (e.g. {@link #EXPERIENCE_TITLE}) are evaluated relative to their item scope.
 */
public final class ProfileFieldRegistry {
    private ProfileFieldRegistry() {}

    public static final String PROFILE_LINK = "profileLink";
    public static final String NAME = "name";
    public static final String HEADLINE = "headline";
    public static final String LOCATION = "location";
    public static final String ABOUT_EXPAND = "aboutExpand";
    public static final String ABOUT = "about";
    public static final String EXPERIENCE_SHOW_ALL = "experienceShowAll";
    public static final String EXPERIENCE_ITEM = "experienceItem";
    public static final String EXPERIENCE_TITLE = "experienceTitle";
    public static final String EXPERIENCE_COMPANY = "experienceCompany";
    public static final String EXPERIENCE_DATES = "experienceDates";
    public static final String EXPERIENCE_LOCATION = "experienceLocation";
    public static final String EXPERIENCE_DESCRIPTION = "experienceDescription";
    public static final String EDUCATION_ITEM = "educationItem";
    public static final String EDUCATION_SCHOOL = "educationSchool";
    public static final String EDUCATION_DEGREE = "educationDegree";
    public static final String EDUCATION_DATES = "educationDates";
    public static final String SKILLS_SHOW_ALL = "skillsShowAll";
    public static final String SKILL = "skill";
    public static final String CERTIFICATION_ITEM = "certificationItem";
    public static final String CERTIFICATION_NAME = "certificationName";
    public static final String CERTIFICATION_ISSUER = "certificationIssuer";
    public static final String CERTIFICATION_DATE = "certificationDate";
    public static final String LANGUAGE = "language";
    public static final String LOGIN_USERNAME = "loginUsername";
    public static final String LOGIN_PASSWORD = "loginPassword";
    public static final String LOGIN_SUBMIT = "loginSubmit";

    private static final String ITEM_PRIMARY = "div.display-flex span[aria-hidden='true']";
    private static final String ITEM_SECONDARY = "span.t-14.t-normal span[aria-hidden='true']";
    private static final String ITEM_MUTED = "span.t-14.t-normal.t-black--light span[aria-hidden='true']";

    private static final List<ProfileField> FIELDS = List.of(
        new ProfileField(PROFILE_LINK, List.of("a[href*='/in/']")),
        new ProfileField(NAME, List.of("h1.text-heading-xlarge", "main h1", "h1")),
        new ProfileField(HEADLINE, List.of("div.text-body-medium", "[data-field='headline']")),
        new ProfileField(LOCATION, List.of("span.text-body-small.inline.t-black--light", "span.text-body-small")),
        new ProfileField(ABOUT_EXPAND, List.of("button[aria-label*='more about']", "section[data-section='summary'] button.inline-show-more-text__button")),
        new ProfileField(ABOUT, List.of("section[data-section='summary'] div.display-flex.ph5.pv3", "#about ~ div div.inline-show-more-text span[aria-hidden='true']")),
        new ProfileField(EXPERIENCE_SHOW_ALL, List.of("section[data-section='experience'] button[aria-label*='Show all']")),
        new ProfileField(EXPERIENCE_ITEM, List.of("section[data-section='experience'] li.artdeco-list__item", "#experience ~ div li.artdeco-list__item")),
        new ProfileField(EXPERIENCE_TITLE, List.of(ITEM_PRIMARY)),
        new ProfileField(EXPERIENCE_COMPANY, List.of(ITEM_SECONDARY)),
        new ProfileField(EXPERIENCE_DATES, List.of(ITEM_MUTED)),
        new ProfileField(EXPERIENCE_LOCATION, List.of("span.t-14.t-normal.t-black--light + span.t-14.t-normal.t-black--light span[aria-hidden='true']")),
        new ProfileField(EXPERIENCE_DESCRIPTION, List.of("div.inline-show-more-text span[aria-hidden='true']", "div.pv-shared-text-with-see-more span[aria-hidden='true']")),
        new ProfileField(EDUCATION_ITEM, List.of("section[data-section='education'] li.artdeco-list__item", "#education ~ div li.artdeco-list__item")),
        new ProfileField(EDUCATION_SCHOOL, List.of(ITEM_PRIMARY)),
        new ProfileField(EDUCATION_DEGREE, List.of(ITEM_SECONDARY)),
        new ProfileField(EDUCATION_DATES, List.of(ITEM_MUTED)),
        new ProfileField(SKILLS_SHOW_ALL, List.of("section[data-section='skills'] button[aria-label*='Show all']")),
        new ProfileField(SKILL, List.of("section[data-section='skills'] span[aria-hidden='true']", "#skills ~ div " + ITEM_PRIMARY)),
        new ProfileField(CERTIFICATION_ITEM, List.of("section[data-section='certifications'] li.artdeco-list__item", "#licenses_and_certifications ~ div li.artdeco-list__item")),
        new ProfileField(CERTIFICATION_NAME, List.of(ITEM_PRIMARY)),
        new ProfileField(CERTIFICATION_ISSUER, List.of(ITEM_SECONDARY)),
        new ProfileField(CERTIFICATION_DATE, List.of(ITEM_MUTED)),
        new ProfileField(LANGUAGE, List.of("section[data-section='languages'] li.artdeco-list__item " + ITEM_PRIMARY, "#languages ~ div " + ITEM_PRIMARY)),
        new ProfileField(LOGIN_USERNAME, List.of("#username", "input[name='session_key']")),
        new ProfileField(LOGIN_PASSWORD, List.of("#password", "input[name='session_password']")),
        new ProfileField(LOGIN_SUBMIT, List.of("button[type='submit']"))
    );

    private static final Map<String, ProfileField> BY_NAME = FIELDS.stream()
        .collect(Collectors.toUnmodifiableMap(ProfileField::fieldName, Function.identity()));

    /**
     * Selectors for a name; empty for unknown names.
     */
    public static List<String> selectors(String name) {
        ProfileField field = BY_NAME.get(name);
        return field == null ? List.of() : field.selectors();
    }

    /**
     * All selectors for a name joined into one CSS selector list.
     */
    public static String joined(String name) {
        return String.join(", ", selectors(name));
    }
}
