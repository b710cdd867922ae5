package com.profilescraper.scraper;

/**
 * An authenticated browser tab, exclusively owned by one run.
 * <p>
 * All calls are sequential; nothing in the scraper touches a session from two threads. {@link #close()}
 * releases every underlying browser resource and is safe to call more than once.
 */
public interface PageSession extends FieldReader, AutoCloseable {

    /**
     * Navigates to an absolute URL and waits for the load to settle.
     * @throws SessionException on timeout or a dead session
     */
    void navigate(String url) throws SessionException;

    String currentUrl();

    /**
     * Fills a form input.
     * @return false if the input does not exist
     */
    boolean fill(String selector, String value);

    /**
     * Scrolls to the bottom to trigger incremental loading.
     * @return true if the document grew as a result
     */
    boolean revealMore();

    void scrollToTop();

    /**
     * Persists cookies/local storage so a later run can skip the login form. No-op by default.
     */
    default void saveState() {
    }

    @Override
    void close();
}
