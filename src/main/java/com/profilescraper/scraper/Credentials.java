package com.profilescraper.scraper;

/**
 * Login credentials. {@link #toString()} never reveals the password.
 */
public record Credentials(String username, String password) {
    public Credentials {
        if (username == null || username.isBlank()) throw new IllegalArgumentException("username is required");
        if (password == null || password.isEmpty()) throw new IllegalArgumentException("password is required");
    }

    @Override
    public String toString() {
        return "Credentials[username=" + username + ", password=***]";
    }
}
