package com.profilescraper.scraper;

import java.util.function.Function;

/**
 * Resolves login credentials before any browser is launched.
 */
@FunctionalInterface
public interface CredentialsProvider {
    String USERNAME_KEY = "SCRAPER_LOGIN_EMAIL";
    String PASSWORD_KEY = "SCRAPER_LOGIN_PASSWORD";

    /**
     * @return credentials
     * @throws ConfigurationException if they are missing
     */
    Credentials resolve() throws ConfigurationException;

    /**
     * Environment variables first, then system properties.
     */
    static CredentialsProvider fromEnvironment() {
        return from(ScraperConfig::envOrProp);
    }

    static CredentialsProvider from(Function<String, String> lookup) {
        return () -> {
            String username = lookup.apply(USERNAME_KEY);
            String password = lookup.apply(PASSWORD_KEY);
            if (username == null || username.isBlank() || password == null || password.isEmpty()) {
                throw new ConfigurationException("Login credentials not provided. Set "
                    + USERNAME_KEY + " and " + PASSWORD_KEY + " in the environment or as system properties.");
            }
            return new Credentials(username.trim(), password);
        };
    }
}
