package com.profilescraper.scraper;

/**
 * Login handshake against the target site.
 */
public interface AuthServiceInterface {
    /**
     * Brings the session into a signed-in state, reusing a restored session when possible.
     * <p>
     * An unexpected post-login location is logged as a warning and otherwise treated as success.
     * @param session    session to authenticate; positioned on an arbitrary page afterwards
     * @param credentials resolved credentials
     * @throws SessionException if the login page cannot be reached or its form is missing
     */
    void authenticate(PageSession session, Credentials credentials) throws SessionException;

    /**
     * Heuristic signed-in check on the session's current page.
     */
    boolean isAuthenticated(PageSession session);
}
