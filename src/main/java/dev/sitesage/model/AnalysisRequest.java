package dev.sitesage.model;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Set;

/**
 * A single validated page URL, ready to enter the analysis pipeline.
 */
public record AnalysisRequest(URI uri) {

    private static final Set<String> ALLOWED_SCHEMES = Set.of("http", "https");

    /**
     * Validate raw user input and build a request.
     *
     * @param rawUrl URL as submitted by the caller
     * @return the validated request
     * @throws ValidationException if the URL is not an absolute http(s) URL with a host
     */
    public static AnalysisRequest of(String rawUrl) {
        if (rawUrl == null || rawUrl.isBlank()) {
            throw new ValidationException("URL must not be empty");
        }

        String trimmed = rawUrl.trim();
        URI uri;
        try {
            uri = new URI(trimmed);
        } catch (URISyntaxException e) {
            throw new ValidationException("Malformed URL: " + trimmed, e);
        }

        if (!uri.isAbsolute() || uri.getScheme() == null) {
            throw new ValidationException("URL must be absolute: " + trimmed);
        }
        if (!ALLOWED_SCHEMES.contains(uri.getScheme().toLowerCase(Locale.ROOT))) {
            throw new ValidationException("URL scheme must be http or https: " + trimmed);
        }
        if (uri.getHost() == null || uri.getHost().isBlank()) {
            throw new ValidationException("URL must contain a host: " + trimmed);
        }
        return new AnalysisRequest(uri);
    }

    public String url() {
        return uri.toString();
    }
}
