package com.profilescraper.scraper;

/**
 * Acquires a fresh {@link PageSession}. The caller owns the result and must close it.
 */
@FunctionalInterface
public interface SessionProvider {
    PageSession open() throws SessionException;
}
