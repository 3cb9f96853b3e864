package dev.sitesage.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Page fetch settings.
 * Loaded from application.yml under 'analyzer.fetch' prefix.
 */
@ConfigurationProperties(prefix = "analyzer.fetch")
public record FetchConfig(
        Duration timeout,
        Integer maxBytes,
        String userAgent,
        Boolean followRedirects) {

    public static final String DEFAULT_USER_AGENT = "SiteSage/1.0 SEO Analyzer";

    public FetchConfig {
        timeout = timeout != null ? timeout : Duration.ofSeconds(10);
        maxBytes = maxBytes != null ? maxBytes : 5 * 1024 * 1024;
        userAgent = userAgent != null && !userAgent.isBlank() ? userAgent : DEFAULT_USER_AGENT;
        followRedirects = followRedirects != null ? followRedirects : Boolean.TRUE;
    }

    public static FetchConfig defaults() {
        return new FetchConfig(null, null, null, null);
    }
}
