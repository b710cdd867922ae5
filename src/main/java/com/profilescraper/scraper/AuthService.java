package com.profilescraper.scraper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;

/**
 * Form-based login for the target site.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Check the signed-in landing page first; a restored storage state often makes the form unnecessary.</li>
 *   <li>Otherwise open the login page, fill username and password and submit, pausing between steps.</li>
 *   <li>Judge the outcome by the post-login URL ({@code feed} or {@code mynetwork}); anything else is a warning only.</li>
 *   <li>Save the browser storage state after a confirmed login.</li>
 * </ul>
 *
 * @since 1.0
 */
public final class AuthService implements AuthServiceInterface {
    private static final Logger logger = LoggerFactory.getLogger(AuthService.class);
    private static final List<String> SIGNED_IN_MARKERS = List.of("/feed", "/mynetwork");

    private final ScraperConfig config;
    private final PacingGenerator pacing;
    private final Sleeper sleeper;

    public AuthService(ScraperConfig config, PacingGenerator pacing, Sleeper sleeper) {
        this.config = config;
        this.pacing = pacing;
        this.sleeper = sleeper;
    }

    @Override
    public void authenticate(PageSession session, Credentials credentials) throws SessionException {
        if (session == null) throw new IllegalArgumentException("session must not be null");
        if (resumedSession(session)) {
            logger.info("Restored session is already signed in; skipping login form.");
            return;
        }

        logger.info("Logging in as {}", credentials.username());
        session.navigate(config.loginUrl());
        pause(Duration.ofSeconds(2), Duration.ofSeconds(4));

        if (!fillFirst(session, ProfileFieldRegistry.LOGIN_USERNAME, credentials.username())) {
            throw new SessionException("Login form not found at " + session.currentUrl() + " (no username input)");
        }
        pause(Duration.ofMillis(500), Duration.ofMillis(1500));
        if (!fillFirst(session, ProfileFieldRegistry.LOGIN_PASSWORD, credentials.password())) {
            throw new SessionException("Login form not found at " + session.currentUrl() + " (no password input)");
        }
        pause(Duration.ofMillis(500), Duration.ofMillis(1500));
        if (!session.click(ProfileFieldRegistry.joined(ProfileFieldRegistry.LOGIN_SUBMIT))) {
            throw new SessionException("Login submit control not found at " + session.currentUrl());
        }
        pause(Duration.ofSeconds(3), Duration.ofSeconds(5));

        if (isAuthenticated(session)) {
            logger.info("Successfully logged in.");
            session.saveState();
        } else {
            logger.warn("Login may have failed - unexpected URL after login: {}. Continuing.", session.currentUrl());
        }
    }

    @Override
    public boolean isAuthenticated(PageSession session) {
        String url = session.currentUrl();
        if (url == null) return false;
        return SIGNED_IN_MARKERS.stream().anyMatch(url::contains);
    }

    private boolean resumedSession(PageSession session) {
        try {
            session.navigate(config.baseUrl() + "/feed/");
        } catch (SessionException e) {
            logger.debug("Signed-in check failed: {}", e.getMessage());
            return false;
        }
        return isAuthenticated(session)
            && session.scopes(ProfileFieldRegistry.joined(ProfileFieldRegistry.LOGIN_USERNAME)).isEmpty();
    }

    private static boolean fillFirst(PageSession session, String field, String value) {
        for (String selector : ProfileFieldRegistry.selectors(field)) {
            if (session.fill(selector, value)) return true;
        }
        return false;
    }

    private void pause(Duration min, Duration max) throws SessionException {
        try {
            sleeper.sleep(pacing.shortDelay(min, max));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SessionException("Interrupted during login", e);
        }
    }
}
