package com.profilescraper.scraper;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Optional;

/**
 * Canonical key for one scraped record, derived from its source URL.
 * <p>
 * Canonical form: absolute {@code scheme://host/path}, scheme and host lower-cased, query and fragment
 * dropped, trailing slashes removed. Two URLs that differ only in tracking parameters or a trailing slash
 * therefore map to equal identifiers.
 *
 * @param value canonical URL string
 */
public record RecordIdentifier(String value) {

    public RecordIdentifier {
        if (value == null || value.isBlank()) throw new IllegalArgumentException("identifier must not be blank");
    }

    /**
     * Canonicalizes an absolute URL.
     * @param url absolute http(s) URL
     * @return identifier
     * @throws IllegalArgumentException if the URL cannot be parsed or is not absolute
     */
    public static RecordIdentifier of(String url) {
        return parse(url, null).orElseThrow(() -> new IllegalArgumentException("Not an absolute record URL: " + url));
    }

    /**
     * Canonicalizes a possibly relative href against a base URL.
     * @param href    raw href as found on the page
     * @param baseUrl site root used for relative hrefs (may be null)
     * @return identifier, or empty if the href is unusable
     */
    public static Optional<RecordIdentifier> parse(String href, String baseUrl) {
        if (href == null || href.isBlank()) return Optional.empty();
        try {
            URI uri = new URI(href.trim());
            if (!uri.isAbsolute() && baseUrl != null && !baseUrl.isBlank()) {
                uri = new URI(baseUrl.trim()).resolve(uri);
            }
            String scheme = uri.getScheme();
            String host = uri.getHost();
            if (scheme == null || host == null) return Optional.empty();
            scheme = scheme.toLowerCase(Locale.ROOT);
            if (!scheme.equals("http") && !scheme.equals("https")) return Optional.empty();
            String path = uri.getRawPath() == null ? "" : uri.getRawPath();
            while (path.endsWith("/")) {
                path = path.substring(0, path.length() - 1);
            }
            String port = uri.getPort() > 0 ? ":" + uri.getPort() : "";
            return Optional.of(new RecordIdentifier(scheme + "://" + host.toLowerCase(Locale.ROOT) + port + path));
        } catch (URISyntaxException | IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    /**
     * Path portion of the canonical URL, e.g. {@code /in/jane-doe}.
     */
    public String path() {
        return URI.create(value).getRawPath();
    }

    @Override
    public String toString() {
        return value;
    }
}
