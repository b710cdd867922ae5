package com.profilescraper.scraper;

import java.util.List;

/**
 * A named profile field and the CSS selectors that may locate it, in priority order.
 * The first selector that yields a non-empty value wins.
 *
 * @param fieldName registry key
 * @param selectors fallback selectors, most specific first
 */
public record ProfileField(String fieldName, List<String> selectors) {
    public ProfileField {
        selectors = selectors == null ? List.of() : List.copyOf(selectors);
    }
}
