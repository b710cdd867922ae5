package com.profilescraper.scraper;

import java.util.List;

/**
 * Uniform read access to a rendered page or to one element within it.
 * <p>
 * Contract: "not found" is never an error. Absent elements read as an empty string, an empty list or
 * {@code false}; implementations swallow element-level lookup failures and log them at debug level.
 * Only session-level problems surface, as unchecked exceptions from the underlying driver.
 */
public interface FieldReader {
    /**
     * Trimmed inner text of the first match, or "" if nothing matches.
     */
    String text(String selector);

    /**
     * Trimmed inner text of every match, in document order, blanks removed.
     */
    List<String> texts(String selector);

    /**
     * Attribute of every match that has it, in document order.
     */
    List<String> attributes(String selector, String attribute);

    /**
     * One reader per matching element, each scoped to that element.
     */
    List<FieldReader> scopes(String selector);

    /**
     * Clicks the first match if present.
     * @return whether a click happened
     */
    boolean click(String selector);

    /**
     * Returns the first non-empty text across fallback selectors, or "".
     */
    default String firstText(List<String> selectors) {
        for (String selector : selectors) {
            String value = text(selector);
            if (!value.isEmpty()) return value;
        }
        return "";
    }

    /**
     * Scopes for the first fallback selector that matches anything.
     */
    default List<FieldReader> firstScopes(List<String> selectors) {
        for (String selector : selectors) {
            List<FieldReader> found = scopes(selector);
            if (!found.isEmpty()) return found;
        }
        return List.of();
    }
}
