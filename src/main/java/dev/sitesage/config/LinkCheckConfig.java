package dev.sitesage.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * External link probing settings.
 * Loaded from application.yml under 'analyzer.link-check' prefix.
 */
@ConfigurationProperties(prefix = "analyzer.link-check")
public record LinkCheckConfig(
        Boolean enabled,
        Integer sampleSize,
        Duration probeTimeout,
        Duration totalTimeout,
        Integer concurrency) {

    public LinkCheckConfig {
        enabled = enabled != null ? enabled : Boolean.TRUE;
        sampleSize = sampleSize != null ? Math.max(0, sampleSize) : 20;
        probeTimeout = probeTimeout != null ? probeTimeout : Duration.ofSeconds(5);
        totalTimeout = totalTimeout != null ? totalTimeout : Duration.ofSeconds(8);
        concurrency = concurrency != null ? Math.max(1, concurrency) : 5;
    }

    public static LinkCheckConfig defaults() {
        return new LinkCheckConfig(null, null, null, null, null);
    }

    public static LinkCheckConfig disabled() {
        return new LinkCheckConfig(false, null, null, null, null);
    }
}
